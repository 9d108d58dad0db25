package org.dxworks.fortranframe.parser;

import org.dxworks.fortranframe.model.Node;
import org.dxworks.fortranframe.model.NodeKind;
import org.dxworks.fortranframe.model.Origin;
import org.dxworks.fortranframe.preprocessor.LogicalLine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Folds classified statements into a tree, keeping the currently open blocks on a stack with
 * the root at the bottom. Owns the tree until {@link #finish()} hands it over.
 */
public class BlockStackAutomaton {

    private final StatementClassifier classifier;
    private final Logger logger;
    private final Node root = Node.root();
    private final Deque<Node> stack = new ArrayDeque<>();
    private int pushes;
    private int pops;

    public BlockStackAutomaton(StatementClassifier classifier, Logger logger) {
        this.classifier = classifier;
        this.logger = logger;
        stack.push(root);
    }

    public void accept(LogicalLine line) {
        classifier.classify(line).ifPresent(this::apply);
    }

    public void apply(ClassifiedStatement statement) {
        switch (statement.role) {
            case OPEN:
                open(statement);
                break;
            case CLOSE:
                close(statement);
                break;
            case CLOSE_UNIT:
                closeProgramUnit(statement);
                break;
            case ELSE:
                enterElse(statement);
                break;
            case ELSE_IF:
                enterElseIf(statement);
                break;
            case CASE:
                openCase(statement);
                break;
            case SIMPLE:
                simple(statement);
                break;
        }
    }

    /**
     * @return the completed tree
     * @throws FortranParseException if any block besides the root is still open
     */
    public Node finish() {
        if (stack.size() != 1) {
            throw FortranParseException.unterminated(top());
        }
        logger.fine(() -> "Parsed tree with " + pushes + " blocks");
        return root;
    }

    /** Number of blocks currently open, not counting the root. */
    public int openBlocks() {
        return stack.size() - 1;
    }

    private void open(ClassifiedStatement statement) {
        Node node = Node.create(statement.kind, statement.origin, top().depth + 1, statement.text,
                statement.tag, statement.comments);
        top().append(node);
        push(node);

        if (statement.trailingClause != null) {
            applyTrailingClause(node, statement.trailingClause, statement.origin.nextSynthetic());
        }
    }

    // single-line "if (c) stmt": the clause is the whole body, closed right away
    private void applyTrailingClause(Node owner, String clause, Origin origin) {
        classifier.classify(clause, origin, List.of()).ifPresent(this::apply);
        if (top() != owner) {
            throw FortranParseException.blockMismatch(origin, owner.kind.getLabel(), top(), clause);
        }
        pop();
    }

    private void close(ClassifiedStatement statement) {
        Node closed = top();
        if (closed.kind != statement.kind) {
            throw FortranParseException.blockMismatch(statement.origin, statement.kind.getLabel(), closed, statement.text);
        }
        closed.attachComments(statement.comments);
        pop();
        // one "end if" closes an else-if chain back to its first conditional
        while (closed.isChained()) {
            closed = top();
            pop();
        }
    }

    private void closeProgramUnit(ClassifiedStatement statement) {
        Node closed = top();
        if (!closed.kind.isProgramUnit()) {
            throw FortranParseException.blockMismatch(statement.origin, "program unit", closed, statement.text);
        }
        closed.attachComments(statement.comments);
        pop();
    }

    private void enterElse(ClassifiedStatement statement) {
        Node current = top();
        if (current.kind != statement.kind || current.branches().isInElse()) {
            throw FortranParseException.blockMismatch(statement.origin, statement.kind.getLabel(), current, statement.text);
        }
        current.enterElse();
        current.attachComments(statement.comments);
    }

    private void enterElseIf(ClassifiedStatement statement) {
        Node current = top();
        if (current.kind != NodeKind.CONDITIONAL || current.branches().isInElse()) {
            throw FortranParseException.blockMismatch(statement.origin, NodeKind.CONDITIONAL.getLabel(), current, statement.text);
        }
        current.enterElse();
        Node chained = Node.chainedConditional(statement.origin, current.depth + 1, statement.text, statement.comments);
        current.append(chained);
        push(chained);
    }

    private void openCase(ClassifiedStatement statement) {
        Node current = top();
        if (current.kind != NodeKind.SELECTION) {
            throw FortranParseException.blockMismatch(statement.origin, NodeKind.SELECTION.getLabel(), current, statement.text);
        }
        current.openCase(statement.tag == null ? "default" : statement.tag);
        current.attachComments(statement.comments);
    }

    private void simple(ClassifiedStatement statement) {
        if (statement.kind == NodeKind.CONTINUE && closesLabeledLoop(statement)) {
            return;
        }
        Node node = Node.create(statement.kind, statement.origin, top().depth + 1, statement.text,
                statement.tag, statement.comments);
        top().append(node);
    }

    /**
     * "N continue" ends the innermost loop only when that loop was opened with label N; any
     * enclosing loops sharing the label end with it. Otherwise it is an ordinary statement.
     */
    private boolean closesLabeledLoop(ClassifiedStatement statement) {
        if (!endsLabeledLoop(top(), statement.tag)) {
            return false;
        }
        top().attachComments(statement.comments);
        pop();
        while (endsLabeledLoop(top(), statement.tag)) {
            pop();
        }
        return true;
    }

    private static boolean endsLabeledLoop(Node node, String label) {
        return node.kind == NodeKind.ARCHAIC_LABELED_LOOP && node.labeledLoop().closesOn(label);
    }

    private Node top() {
        return stack.peek();
    }

    private void push(Node node) {
        stack.push(node);
        pushes++;
        logger.finer(() -> "open " + node);
    }

    private void pop() {
        Node node = stack.pop();
        pops++;
        logger.finer(() -> "close " + node + " (" + pops + "/" + pushes + ")");
    }
}
