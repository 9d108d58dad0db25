package org.dxworks.fortranframe.export;

import org.dxworks.fortranframe.model.BranchPayload;
import org.dxworks.fortranframe.model.Node;
import org.dxworks.fortranframe.model.NodeKind;
import org.dxworks.fortranframe.model.SelectionCase;

import java.util.List;

/**
 * Plain hierarchical dump, one node per line: {@code kind [tag] @origin: raw text}, indented two
 * spaces per level relative to the dumped node. Else and case headers sit at their block's
 * indent, followed by the branch statements.
 */
public final class TreeTextDumper {

    private static final String INDENT = "  ";

    private TreeTextDumper() {}

    public static String dump(Node node) {
        StringBuilder sb = new StringBuilder();
        appendNode(sb, node, node.depth);
        return sb.toString();
    }

    private static void appendNode(StringBuilder sb, Node node, int baseDepth) {
        int level = node.depth - baseDepth;
        line(sb, level, header(node));
        appendAll(sb, node.children, baseDepth);

        switch (node.kind) {
            case CONDITIONAL:
            case WHERE_LOOP: {
                BranchPayload branch = node.branches();
                if (branch.isInElse()) {
                    line(sb, level, node.kind == NodeKind.WHERE_LOOP ? "elsewhere" : "else");
                    appendAll(sb, branch.elseChildren, baseDepth);
                }
                break;
            }
            case SELECTION:
                for (SelectionCase selectionCase : node.selection().cases) {
                    line(sb, level, "case " + selectionCase.condition);
                    appendAll(sb, selectionCase.statements, baseDepth);
                }
                break;
            default:
                break;
        }
    }

    private static void appendAll(StringBuilder sb, List<Node> nodes, int baseDepth) {
        for (Node child : nodes) {
            appendNode(sb, child, baseDepth);
        }
    }

    static String header(Node node) {
        StringBuilder header = new StringBuilder(node.kind.getLabel());
        if (node.tag != null) {
            header.append(' ').append(node.tag);
        }
        if (node.kind != NodeKind.ROOT) {
            header.append(" @").append(node.origin);
            if (node.rawText != null && !node.rawText.isEmpty()) {
                header.append(": ").append(node.rawText);
            }
        }
        return header.toString();
    }

    private static void line(StringBuilder sb, int level, String text) {
        sb.append(INDENT.repeat(Math.max(level, 0))).append(text).append('\n');
    }
}
