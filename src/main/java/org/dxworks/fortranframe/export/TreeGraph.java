package org.dxworks.fortranframe.export;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/** Flattened view of a tree: every node a vertex, every structural relation an edge. */
public class TreeGraph {
    public List<Vertex> vertices = new ArrayList<>();
    public List<Edge> edges = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Vertex {
        public String id;
        public String kind;
        public String tag;    // nullable
        public String origin;
        public String text;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Edge {
        public String from;
        public String to;
        public String label; // "child", "else" or "case <condition>"
    }
}
