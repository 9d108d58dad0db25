package org.dxworks.fortranframe.export;

import org.dxworks.fortranframe.model.BranchPayload;
import org.dxworks.fortranframe.model.Node;
import org.dxworks.fortranframe.model.SelectionCase;

import java.util.List;

public final class TreeGraphBuilder {

    static final String CHILD = "child";
    static final String ELSE = "else";
    static final String CASE_PREFIX = "case ";

    private TreeGraphBuilder() {}

    public static TreeGraph build(Node root) {
        TreeGraph graph = new TreeGraph();
        addVertex(graph, root);
        return graph;
    }

    private static String addVertex(TreeGraph graph, Node node) {
        TreeGraph.Vertex vertex = new TreeGraph.Vertex();
        vertex.id = "n" + graph.vertices.size();
        vertex.kind = node.kind.getLabel();
        vertex.tag = node.tag;
        vertex.origin = node.origin.toString();
        vertex.text = node.rawText;
        graph.vertices.add(vertex);

        addEdges(graph, vertex.id, node.children, CHILD);
        switch (node.kind) {
            case CONDITIONAL:
            case WHERE_LOOP: {
                BranchPayload branch = node.branches();
                if (branch.isInElse()) {
                    addEdges(graph, vertex.id, branch.elseChildren, ELSE);
                }
                break;
            }
            case SELECTION:
                for (SelectionCase selectionCase : node.selection().cases) {
                    addEdges(graph, vertex.id, selectionCase.statements, CASE_PREFIX + selectionCase.condition);
                }
                break;
            default:
                break;
        }
        return vertex.id;
    }

    private static void addEdges(TreeGraph graph, String parentId, List<Node> children, String label) {
        for (Node child : children) {
            // parent edge first: edges follow the same pre-order as vertices
            TreeGraph.Edge edge = new TreeGraph.Edge();
            edge.from = parentId;
            edge.label = label;
            graph.edges.add(edge);
            edge.to = addVertex(graph, child);
        }
    }
}
