package org.dxworks.fortranframe.preprocessor;

import org.dxworks.fortranframe.parser.FortranParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns physical source lines into logical statements:
 * - pure comment lines ({@code !} as first non-space character, or {@code *} or a
 *   blank-separated {@code C} in column 1) are folded into the previous statement, or the next one at the top of the file
 * - inline {@code !} comments outside string literals are split off; a literal left open
 *   by a trailing {@code &} stays open on the next line
 * - blank lines are dropped without breaking a continuation
 * - a leading {@code &} continues the previous statement, a trailing {@code &} pulls the next
 *   line into the current one
 */
public class LogicalLineAssembler {

    private static final char COMMENT_MARKER = '!';
    private static final char FIXED_FORM_COMMENT_MARKER = '*';
    private static final char FIXED_FORM_COMMENT_LETTER = 'c';
    private static final char CONTINUATION_MARKER = '&';
    private static final String BOM = "\uFEFF";

    private final Logger logger;

    public LogicalLineAssembler(Logger logger) {
        this.logger = logger;
    }

    public List<LogicalLine> assemble(String source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        if (source.startsWith(BOM)) {
            source = source.substring(1);
        }
        return assemble(Arrays.asList(source.split("\r?\n")));
    }

    public List<LogicalLine> assemble(List<String> physicalLines) {
        List<Builder> statements = new ArrayList<>();
        List<String> pendingComments = new ArrayList<>();
        boolean continuesNext = false;
        char openQuote = 0;
        int lineNumber = 0;

        for (String raw : physicalLines) {
            lineNumber++;
            String line = raw == null ? "" : raw;

            if (openQuote == 0 && isPureComment(line)) {
                String comment = pureCommentPayload(line);
                if (statements.isEmpty()) {
                    pendingComments.add(comment);
                } else {
                    last(statements).comments.add(comment);
                }
                continue;
            }
            if (line.isBlank()) continue;

            char quoteAtStart = continuesNext ? openQuote : 0;
            int commentStart = inlineCommentStart(line, quoteAtStart);
            String code = (commentStart < 0 ? line : line.substring(0, commentStart)).trim();
            String inlineComment = commentStart < 0 ? null : line.substring(commentStart + 1).trim();

            boolean leading = !code.isEmpty() && code.charAt(0) == CONTINUATION_MARKER;
            if (leading) {
                code = code.substring(1).trim();
            }
            boolean trailing = !code.isEmpty() && code.charAt(code.length() - 1) == CONTINUATION_MARKER;
            if (trailing) {
                code = code.substring(0, code.length() - 1).trim();
            }

            Builder target;
            if (leading || continuesNext) {
                if (statements.isEmpty()) {
                    throw FortranParseException.continuation(lineNumber);
                }
                target = last(statements);
                target.extend(lineNumber, code);
            } else {
                target = new Builder(lineNumber, code);
                target.comments.addAll(pendingComments);
                pendingComments.clear();
                statements.add(target);
            }
            if (inlineComment != null) {
                target.comments.add(inlineComment);
            }
            continuesNext = trailing;
            openQuote = trailing ? openQuoteAtEnd(line, quoteAtStart) : 0;
        }

        if (!pendingComments.isEmpty()) {
            logger.fine(() -> "Dropping " + pendingComments.size() + " comment line(s) with no statement to attach to");
        }

        List<LogicalLine> result = new ArrayList<>(statements.size());
        for (Builder builder : statements) {
            result.add(builder.build());
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Assembled " + result.size() + " logical lines from " + lineNumber + " physical lines");
        }
        return result;
    }

    static boolean isPureComment(String line) {
        if (!line.isEmpty() && line.charAt(0) == FIXED_FORM_COMMENT_MARKER) {
            return true;
        }
        if (isFixedFormLetterComment(line)) {
            return true;
        }
        String stripped = line.stripLeading();
        return !stripped.isEmpty() && stripped.charAt(0) == COMMENT_MARKER;
    }

    // "C" in column 1 then a blank, unless the line reads as an assignment to a variable named c
    private static boolean isFixedFormLetterComment(String line) {
        if (line.isEmpty() || Character.toLowerCase(line.charAt(0)) != FIXED_FORM_COMMENT_LETTER) {
            return false;
        }
        if (line.length() == 1) {
            return true;
        }
        if (!Character.isWhitespace(line.charAt(1))) {
            return false;
        }
        String rest = line.substring(1).trim();
        return !(rest.startsWith("=") || rest.startsWith("("));
    }

    private static String pureCommentPayload(String line) {
        String stripped = line.stripLeading();
        return stripped.substring(1).trim();
    }

    /** Index of the first comment marker outside a string literal, or -1. */
    static int inlineCommentStart(String line) {
        return inlineCommentStart(line, (char) 0);
    }

    /** Same scan, starting inside a literal opened by {@code quote} on an earlier line. */
    static int inlineCommentStart(String line, char quote) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                // a doubled quote closes and immediately reopens the literal
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == COMMENT_MARKER) {
                return i;
            }
        }
        return -1;
    }

    /** The quote character of a literal still open at the end of the line, or 0. */
    static char openQuoteAtEnd(String line, char quote) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == COMMENT_MARKER) {
                return 0;
            }
        }
        return quote;
    }

    private static Builder last(List<Builder> statements) {
        return statements.get(statements.size() - 1);
    }

    private static final class Builder {
        private final int startLine;
        private int endLine;
        private final StringBuilder text = new StringBuilder();
        private final List<String> comments = new ArrayList<>();

        Builder(int startLine, String code) {
            this.startLine = startLine;
            this.endLine = startLine;
            text.append(code);
        }

        void extend(int lineNumber, String code) {
            endLine = lineNumber;
            if (code.isEmpty()) return;
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(code);
        }

        LogicalLine build() {
            return new LogicalLine(startLine, endLine, text.toString().trim(), new ArrayList<>(comments));
        }
    }
}
