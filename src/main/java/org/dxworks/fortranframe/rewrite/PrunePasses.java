package org.dxworks.fortranframe.rewrite;

import org.dxworks.fortranframe.model.Node;
import org.dxworks.fortranframe.model.NodeKind;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/** Standard predicates for {@link TreePruner}. */
public final class PrunePasses {

    private PrunePasses() {}

    public static Predicate<Node> usingStatements() {
        return node -> node.kind == NodeKind.USING;
    }

    /** Assignments whose left-hand side matches the regex in full, case-insensitively. */
    public static Predicate<Node> assignmentsTo(String targetRegex) {
        Pattern pattern = Pattern.compile(targetRegex, Pattern.CASE_INSENSITIVE);
        return node -> node.kind == NodeKind.ASSIGNMENT
                && node.tag != null
                && pattern.matcher(node.tag).matches();
    }

    /** Loops with no statements. Evaluated pre-order, so a loop holding only an empty loop survives one pass. */
    public static Predicate<Node> emptyLoops() {
        return node -> node.kind.isLoop() && isEmpty(node);
    }

    private static boolean isEmpty(Node node) {
        for (List<Node> sequence : node.childSequences()) {
            if (!sequence.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
