package org.dxworks.fortranframe.export;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.fortranframe.TestUtils;
import org.dxworks.fortranframe.model.Node;
import org.dxworks.fortranframe.parser.FortranParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeExporterTest {

    private final FortranParser parser = new FortranParser(TestUtils.quietLogger());

    @Test
    void textDumpIndentsByDepthAndShowsBranchHeaders() throws Exception {
        Node root = parse(
                "if (a) then",
                "x = 1 ! one",
                "else",
                "y = 2",
                "end if");

        String expected = "root\n"
                + "  conditional @1: if (a) then\n"
                + "    assignment x @2: x = 1\n"
                + "  else\n"
                + "    assignment y @4: y = 2\n";
        assertEquals(expected, TreeExporter.export(root, OutputFormat.TEXT));
    }

    @Test
    void textDumpOfSubtreeStartsAtColumnZero() {
        Node root = parse(
                "select case (k)",
                "case (1)",
                "x = 1",
                "case default",
                "x = 0",
                "end select");

        String expected = "selection k @1: select case (k)\n"
                + "case (1)\n"
                + "  assignment x @3: x = 1\n"
                + "case default\n"
                + "  assignment x @5: x = 0\n";
        assertEquals(expected, TreeTextDumper.dump(root.children.get(0)));
    }

    @Test
    void graphListsVerticesAndEdgesInPreOrder() {
        Node root = parse(
                "where (m)",
                "a = 1",
                "elsewhere",
                "a = 0",
                "end where",
                "b = 2");

        TreeGraph graph = TreeGraphBuilder.build(root);

        assertEquals(List.of("n0", "n1", "n2", "n3", "n4"), ids(graph));
        assertEquals("where-loop", graph.vertices.get(1).kind);
        assertEquals("1", graph.vertices.get(1).origin);
        assertEquals(List.of("n0->n1 child", "n1->n2 child", "n1->n3 else", "n0->n4 child"), edges(graph));
    }

    @Test
    void dotOutputLabelsNonChildEdges() throws Exception {
        Node root = parse(
                "select case (k)",
                "case (1)",
                "call go(\"x\")",
                "end select");

        String dot = TreeExporter.export(root, OutputFormat.DOT);

        String expected = "digraph ast {\n"
                + "  node [shape=box];\n"
                + "  n0 [label=\"root\"];\n"
                + "  n1 [label=\"selection k\\nselect case (k)\"];\n"
                + "  n2 [label=\"call go\\ncall go(\\\"x\\\")\"];\n"
                + "  n0 -> n1;\n"
                + "  n1 -> n2 [label=\"case (1)\"];\n"
                + "}\n";
        assertEquals(expected, dot);
    }

    @Test
    void jsonCarriesPayloadsAndOrigins() throws Exception {
        Node root = parse(
                "do 10 i = 1, n",
                "if (i > 2) x = i",
                "10 continue");

        JsonNode json = TestUtils.APPROVAL_MAPPER.readTree(TreeExporter.export(root, OutputFormat.JSON));

        assertEquals("root", json.get("kind").asText());
        JsonNode loop = json.get("children").get(0);
        assertEquals("archaic-labeled-loop", loop.get("kind").asText());
        assertEquals(10, loop.get("payload").get("label").asInt());
        assertEquals(1, loop.get("origin").get("physicalLine").asInt());
        assertFalse(loop.get("origin").has("syntheticOrdinal"));

        JsonNode conditional = loop.get("children").get(0);
        assertFalse(conditional.get("payload").get("chained").asBoolean());
        JsonNode clause = conditional.get("children").get(0);
        assertEquals(1, clause.get("origin").get("syntheticOrdinal").asInt());
        assertEquals("x", clause.get("tag").asText());
    }

    @Test
    void graphJsonHasVerticesAndEdges() throws Exception {
        JsonNode json = TestUtils.APPROVAL_MAPPER.readTree(TreeExporter.export(parse("x = 1"), OutputFormat.GRAPH));

        assertEquals(2, json.get("vertices").size());
        assertEquals("child", json.get("edges").get(0).get("label").asText());
    }

    @Test
    void formatNamesAreCaseInsensitive() {
        assertEquals(OutputFormat.DOT, OutputFormat.fromName(" Dot ").orElseThrow());
        assertTrue(OutputFormat.fromName("xml").isEmpty());
        assertTrue(OutputFormat.fromName(null).isEmpty());
    }

    private Node parse(String... lines) {
        return parser.parse(String.join("\n", lines));
    }

    private static List<String> ids(TreeGraph graph) {
        List<String> ids = new ArrayList<>();
        for (TreeGraph.Vertex vertex : graph.vertices) {
            ids.add(vertex.id);
        }
        return ids;
    }

    private static List<String> edges(TreeGraph graph) {
        List<String> edges = new ArrayList<>();
        for (TreeGraph.Edge edge : graph.edges) {
            edges.add(edge.from + "->" + edge.to + " " + edge.label);
        }
        return edges;
    }
}
