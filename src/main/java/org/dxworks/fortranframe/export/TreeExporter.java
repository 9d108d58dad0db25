package org.dxworks.fortranframe.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.fortranframe.model.Node;

public final class TreeExporter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private TreeExporter() {}

    public static String export(Node node, OutputFormat format) throws JsonProcessingException {
        return switch (format) {
            case TEXT -> TreeTextDumper.dump(node);
            case JSON -> MAPPER.writeValueAsString(node) + System.lineSeparator();
            case GRAPH -> MAPPER.writeValueAsString(TreeGraphBuilder.build(node)) + System.lineSeparator();
            case DOT -> GraphvizRenderer.render(TreeGraphBuilder.build(node));
        };
    }
}
