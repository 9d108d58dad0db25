package org.dxworks.fortranframe.preprocessor;

import java.util.Collections;
import java.util.List;

/**
 * One statement after comment, blank-line and continuation processing, with the span of
 * physical lines it came from.
 */
public final class LogicalLine {
    public final int startLine;
    public final int endLine;
    public final String text;
    public final List<String> comments;

    public LogicalLine(int startLine, int endLine, String text, List<String> comments) {
        if (startLine > endLine) {
            throw new IllegalArgumentException("startLine " + startLine + " > endLine " + endLine);
        }
        this.startLine = startLine;
        this.endLine = endLine;
        this.text = text;
        this.comments = Collections.unmodifiableList(comments);
    }

    public boolean isDirective() {
        return text.startsWith("#");
    }

    @Override
    public String toString() {
        return startLine == endLine
                ? startLine + ": " + text
                : startLine + "-" + endLine + ": " + text;
    }
}
