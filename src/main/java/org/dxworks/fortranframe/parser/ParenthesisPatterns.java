package org.dxworks.fortranframe.parser;

/**
 * Regex fragments approximating balanced parentheses by bounded unrolling.
 *
 * <p>Java patterns cannot express arbitrary nesting, so a balanced group is expanded
 * {@link #MAX_NESTING_DEPTH} times. Below that depth the innermost alternative is an opaque
 * lazy {@code (...)} match: deeper expressions still match, but only approximately.
 */
public final class ParenthesisPatterns {

    public static final int MAX_NESTING_DEPTH = 4;

    private static final String OPAQUE = "\\(.*?\\)";

    /** A balanced parenthesized expression; contains no capturing groups. */
    public static final String BALANCED = unroll(MAX_NESTING_DEPTH);

    private ParenthesisPatterns() {}

    static String unroll(int depth) {
        String fragment = OPAQUE;
        for (int i = 0; i < depth; i++) {
            fragment = "\\((?:[^()]++|" + fragment + ")*\\)";
        }
        return fragment;
    }

    /** Deepest parenthesis nesting in the text, ignoring parentheses inside string literals. */
    public static int nestingDepth(String text) {
        int depth = 0;
        int max = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
                max = Math.max(max, depth);
            } else if (c == ')' && depth > 0) {
                depth--;
            }
        }
        return max;
    }
}
