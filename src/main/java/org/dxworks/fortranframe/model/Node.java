package org.dxworks.fortranframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One statement or block of the parsed source. Blocks own their children; children are only
 * ever appended while parsing and only removed afterwards by the pruner.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind", "origin", "depth", "tag", "rawText", "comments", "children", "payload"})
public class Node {

    private static final Pattern LOOP_LABEL = Pattern.compile(
            "^(?:\\d+\\s+)?(?:[a-z]\\w*\\s*:\\s*)?do\\s*(\\d+)", Pattern.CASE_INSENSITIVE);

    public final NodeKind kind;
    public final Origin origin;
    public final int depth;
    public final String rawText;
    public final String tag;
    public final List<String> comments = new ArrayList<>();
    public final List<Node> children = new ArrayList<>();
    public final NodePayload payload;

    private Node(NodeKind kind, Origin origin, int depth, String rawText, String tag, NodePayload payload) {
        this.kind = kind;
        this.origin = origin;
        this.depth = depth;
        this.rawText = rawText;
        this.tag = tag;
        this.payload = payload;
    }

    public static Node root() {
        return new Node(NodeKind.ROOT, Origin.line(0), 0, "", null, null);
    }

    public static Node create(NodeKind kind, Origin origin, int depth, String rawText, String tag,
                              List<String> comments) {
        Node node = new Node(kind, origin, depth, rawText, tag, payloadFor(kind, rawText, false));
        node.comments.addAll(comments);
        return node;
    }

    /** A conditional synthesized for {@code else if}; one {@code end if} closes it and its parent. */
    public static Node chainedConditional(Origin origin, int depth, String rawText, List<String> comments) {
        Node node = new Node(NodeKind.CONDITIONAL, origin, depth, rawText, null,
                payloadFor(NodeKind.CONDITIONAL, rawText, true));
        node.comments.addAll(comments);
        return node;
    }

    private static NodePayload payloadFor(NodeKind kind, String rawText, boolean chained) {
        switch (kind) {
            case CONDITIONAL:
            case WHERE_LOOP:
                return new BranchPayload(chained);
            case SELECTION:
                return new SelectionPayload();
            case ARCHAIC_LABELED_LOOP:
                return new LabeledLoopPayload(extractLoopLabel(rawText));
            default:
                return null;
        }
    }

    private static int extractLoopLabel(String rawText) {
        Matcher matcher = LOOP_LABEL.matcher(rawText == null ? "" : rawText.trim());
        if (!matcher.find()) {
            throw new IllegalArgumentException("No loop label in: " + rawText);
        }
        return Integer.parseInt(matcher.group(1));
    }

    /** Appends to whichever sequence currently receives statements. */
    public void append(Node child) {
        activeChildren().add(child);
    }

    private List<Node> activeChildren() {
        switch (kind) {
            case CONDITIONAL:
            case WHERE_LOOP: {
                BranchPayload branch = (BranchPayload) payload;
                return branch.isInElse() ? branch.elseChildren : children;
            }
            case SELECTION: {
                SelectionCase current = ((SelectionPayload) payload).currentCase();
                return current == null ? children : current.statements;
            }
            default:
                return children;
        }
    }

    public void enterElse() {
        BranchPayload branch = branches();
        if (branch == null) {
            throw new IllegalStateException(kind + " has no else branch");
        }
        if (branch.isInElse()) {
            throw new IllegalStateException(kind + " already entered its else branch");
        }
        branch.enterElse();
    }

    public void openCase(String condition) {
        SelectionPayload selection = selection();
        if (selection == null) {
            throw new IllegalStateException(kind + " has no cases");
        }
        selection.openCase(condition);
    }

    public void attachComments(List<String> closingComments) {
        comments.addAll(closingComments);
    }

    @JsonIgnore
    public BranchPayload branches() {
        return payload instanceof BranchPayload ? (BranchPayload) payload : null;
    }

    @JsonIgnore
    public SelectionPayload selection() {
        return payload instanceof SelectionPayload ? (SelectionPayload) payload : null;
    }

    @JsonIgnore
    public LabeledLoopPayload labeledLoop() {
        return payload instanceof LabeledLoopPayload ? (LabeledLoopPayload) payload : null;
    }

    @JsonIgnore
    public boolean isChained() {
        BranchPayload branch = branches();
        return branch != null && branch.chained;
    }

    /**
     * Every sequence of direct descendants in order: primary children, then the else branch,
     * then each case's statements.
     */
    @JsonIgnore
    public List<List<Node>> childSequences() {
        List<List<Node>> sequences = new ArrayList<>();
        sequences.add(children);
        switch (kind) {
            case CONDITIONAL:
            case WHERE_LOOP: {
                BranchPayload branch = (BranchPayload) payload;
                if (branch.isInElse()) {
                    sequences.add(branch.elseChildren);
                }
                break;
            }
            case SELECTION:
                for (SelectionCase selectionCase : ((SelectionPayload) payload).cases) {
                    sequences.add(selectionCase.statements);
                }
                break;
            default:
                break;
        }
        return sequences;
    }

    public Optional<Node> find(NodePath path) {
        Node current = this;
        for (NodePath.Step step : path.steps()) {
            current = current.firstChildMatching(step);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private Node firstChildMatching(NodePath.Step step) {
        for (List<Node> sequence : childSequences()) {
            for (Node child : sequence) {
                if (step.matches(child)) {
                    return child;
                }
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return kind + (tag != null ? " " + tag : "") + " @" + origin;
    }
}
