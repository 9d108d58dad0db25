package org.dxworks.fortranframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sequence of (kind, tag) steps locating a node below some ancestor. A step without a tag
 * matches any node of its kind; tags compare case-insensitively.
 */
public final class NodePath {

    private final List<Step> steps;

    private NodePath(List<Step> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static NodePath of(List<Step> steps) {
        return new NodePath(steps);
    }

    public static NodePath empty() {
        return new NodePath(List.of());
    }

    /**
     * Parses steps of the form {@code kind} or {@code kind:tag}, e.g. {@code module:heat},
     * {@code subroutine:step}, {@code loop}.
     */
    public static NodePath parse(List<String> rawSteps) {
        List<Step> steps = new ArrayList<>();
        for (String raw : rawSteps) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String text = raw.trim();
            int colon = text.indexOf(':');
            String kindLabel = colon < 0 ? text : text.substring(0, colon);
            String tag = colon < 0 ? null : text.substring(colon + 1).trim();
            NodeKind kind = NodeKind.fromLabel(kindLabel)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown node kind in path: " + raw));
            steps.add(new Step(kind, tag == null || tag.isEmpty() ? null : tag));
        }
        return new NodePath(steps);
    }

    /** Parses a slash separated path, e.g. {@code module:heat/subroutine:step}. */
    public static NodePath parse(String path) {
        return parse(List.of(path.split("/")));
    }

    public List<Step> steps() {
        return steps;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (Step step : steps) {
            parts.add(step.toString());
        }
        return String.join("/", parts);
    }

    public static final class Step {
        public final NodeKind kind;
        public final String tag;

        public Step(NodeKind kind, String tag) {
            this.kind = kind;
            this.tag = tag;
        }

        boolean matches(Node node) {
            return node.kind == kind && (tag == null || tag.equalsIgnoreCase(node.tag));
        }

        @Override
        public String toString() {
            return tag == null ? kind.getLabel() : kind.getLabel() + ":" + tag;
        }
    }
}
