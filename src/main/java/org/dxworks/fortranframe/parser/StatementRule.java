package org.dxworks.fortranframe.parser;

import org.dxworks.fortranframe.model.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One row of the classification table: a statement pattern, the node kind and role it maps
 * to, and secondary patterns extracting the symbolic tag (group 1 of the first that finds).
 * A pattern with a {@code trailing} named group captures an inline clause.
 */
public final class StatementRule {

    private static final String TRAILING_GROUP = "trailing";

    private final String name;
    private final Pattern pattern;
    private final NodeKind kind;
    private final StatementRole role;
    private final List<Pattern> tagPatterns;
    private final boolean capturesTrailing;

    private StatementRule(String name, String regex, NodeKind kind, StatementRole role, List<Pattern> tagPatterns) {
        this.name = name;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.kind = kind;
        this.role = role;
        this.tagPatterns = List.copyOf(tagPatterns);
        this.capturesTrailing = regex.contains("(?<" + TRAILING_GROUP + ">");
    }

    public static Builder rule(String name, String regex, NodeKind kind, StatementRole role) {
        return new Builder(name, regex, kind, role);
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    public StatementRole getRole() {
        return role;
    }

    /** Matches the whole statement; null when the rule does not apply. */
    Matcher match(String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.matches() ? matcher : null;
    }

    String trailingClause(Matcher matcher) {
        if (!capturesTrailing) {
            return null;
        }
        String trailing = matcher.group(TRAILING_GROUP);
        return trailing == null || trailing.isBlank() ? null : trailing.trim();
    }

    String extractTag(String text) {
        for (Pattern tagPattern : tagPatterns) {
            Matcher matcher = tagPattern.matcher(text);
            if (matcher.find()) {
                return matcher.group(1).trim();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name + " -> " + kind + "/" + role;
    }

    public static final class Builder {
        private final String name;
        private final String regex;
        private final NodeKind kind;
        private final StatementRole role;
        private final List<Pattern> tagPatterns = new ArrayList<>();

        private Builder(String name, String regex, NodeKind kind, StatementRole role) {
            this.name = name;
            this.regex = regex;
            this.kind = kind;
            this.role = role;
        }

        public Builder tag(String... regexes) {
            for (String tagRegex : regexes) {
                tagPatterns.add(Pattern.compile(tagRegex, Pattern.CASE_INSENSITIVE));
            }
            return this;
        }

        public StatementRule build() {
            return new StatementRule(name, regex, kind, role, tagPatterns);
        }
    }
}
