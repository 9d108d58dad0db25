package org.dxworks.fortranframe.export;

/** Renders a {@link TreeGraph} as Graphviz DOT text. */
public final class GraphvizRenderer {

    private GraphvizRenderer() {}

    public static String render(TreeGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ast {\n");
        sb.append("  node [shape=box];\n");
        for (TreeGraph.Vertex vertex : graph.vertices) {
            sb.append("  ").append(vertex.id).append(" [label=\"").append(escape(label(vertex))).append("\"];\n");
        }
        for (TreeGraph.Edge edge : graph.edges) {
            sb.append("  ").append(edge.from).append(" -> ").append(edge.to);
            if (!TreeGraphBuilder.CHILD.equals(edge.label)) {
                sb.append(" [label=\"").append(escape(edge.label)).append("\"]");
            }
            sb.append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String label(TreeGraph.Vertex vertex) {
        String head = vertex.tag == null ? vertex.kind : vertex.kind + " " + vertex.tag;
        if (vertex.text == null || vertex.text.isEmpty()) {
            return head;
        }
        return head + "\n" + vertex.text;
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
