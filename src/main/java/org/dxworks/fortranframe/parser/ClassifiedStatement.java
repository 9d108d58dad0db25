package org.dxworks.fortranframe.parser;

import org.dxworks.fortranframe.model.NodeKind;
import org.dxworks.fortranframe.model.Origin;

import java.util.List;

/**
 * Result of classifying one statement. For {@link StatementRole#CASE} the tag holds the
 * case condition; {@code trailingClause} is set only for single-line {@code if}/{@code where}.
 */
public final class ClassifiedStatement {
    public final NodeKind kind;
    public final StatementRole role;
    public final String text;
    public final String tag;
    public final Origin origin;
    public final List<String> comments;
    public final String trailingClause;
    public final String ruleName;

    ClassifiedStatement(StatementRule rule, String text, String tag, Origin origin, List<String> comments,
                        String trailingClause) {
        this.kind = rule.getKind();
        this.role = rule.getRole();
        this.text = text;
        this.tag = tag;
        this.origin = origin;
        this.comments = List.copyOf(comments);
        this.trailingClause = trailingClause;
        this.ruleName = rule.getName();
    }

    @Override
    public String toString() {
        return ruleName + " @" + origin + ": " + text;
    }
}
