package org.dxworks.fortranframe.preprocessor;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Drops the statically dead {@code #else} branch of an {@code #if 1} block.
 * Only always-true openers are understood. Outside a dead branch the directive lines are
 * kept so later stages still see them; inside it everything up to {@code #endif} is dropped,
 * directives included. Nested directives are not tracked.
 */
public class ConditionalCompilationFilter {

    public static final Pattern TRUE_OPEN = Pattern.compile("^#\\s*if\\s+(?:1|\\.true\\.)\\s*$", Pattern.CASE_INSENSITIVE);
    public static final Pattern ELSE = Pattern.compile("^#\\s*else\\s*$", Pattern.CASE_INSENSITIVE);
    public static final Pattern END = Pattern.compile("^#\\s*endif\\b.*$", Pattern.CASE_INSENSITIVE);

    enum State {
        DISCHARGED,
        CHARGED, // inside the live branch of an always-true #if
        ABLAZE   // inside its dead #else branch
    }

    private final Logger logger;

    public ConditionalCompilationFilter(Logger logger) {
        this.logger = logger;
    }

    public List<LogicalLine> filter(List<LogicalLine> lines) {
        List<LogicalLine> kept = new ArrayList<>(lines.size());
        State state = State.DISCHARGED;

        for (LogicalLine line : lines) {
            if (state == State.ABLAZE && !END.matcher(line.text).matches()) {
                logger.fine(() -> "Dropping line " + line.startLine + " in dead #else branch: " + line.text);
                continue;
            }
            if (line.isDirective()) {
                state = transition(state, line.text);
            }
            kept.add(line);
        }
        return kept;
    }

    static State transition(State state, String directive) {
        if (TRUE_OPEN.matcher(directive).matches()) {
            return State.CHARGED;
        }
        if (ELSE.matcher(directive).matches()) {
            return state == State.CHARGED ? State.ABLAZE : state;
        }
        if (END.matcher(directive).matches()) {
            return State.DISCHARGED;
        }
        return state;
    }
}
