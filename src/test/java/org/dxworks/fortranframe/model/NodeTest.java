package org.dxworks.fortranframe.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    @Test
    void payloadFollowsKind() {
        assertNotNull(node(NodeKind.CONDITIONAL, "if (a) then").branches());
        assertNotNull(node(NodeKind.WHERE_LOOP, "where (m)").branches());
        assertNotNull(node(NodeKind.SELECTION, "select case (k)").selection());
        assertEquals(30, node(NodeKind.ARCHAIC_LABELED_LOOP, "outer: do 30 i = 1, n").labeledLoop().label);
        assertEquals(40, node(NodeKind.ARCHAIC_LABELED_LOOP, "5 do 40 i = 1, n").labeledLoop().label);
        assertNull(node(NodeKind.LOOP, "do i = 1, n").payload);
    }

    @Test
    void appendFollowsTheActiveBranch() {
        Node conditional = node(NodeKind.CONDITIONAL, "if (a) then");
        Node thenStatement = node(NodeKind.ASSIGNMENT, "x = 1");
        Node elseStatement = node(NodeKind.ASSIGNMENT, "x = 2");

        conditional.append(thenStatement);
        conditional.enterElse();
        conditional.append(elseStatement);

        assertEquals(List.of(thenStatement), conditional.children);
        assertEquals(List.of(elseStatement), conditional.branches().elseChildren);
        assertEquals(List.of(List.of(thenStatement), List.of(elseStatement)), conditional.childSequences());
    }

    @Test
    void enterElseTwiceFails() {
        Node conditional = node(NodeKind.CONDITIONAL, "if (a) then");
        conditional.enterElse();

        assertThrows(IllegalStateException.class, conditional::enterElse);
        assertThrows(IllegalStateException.class, () -> node(NodeKind.LOOP, "do").enterElse());
    }

    @Test
    void casesCollectStatementsUntilTheNextCase() {
        Node selection = node(NodeKind.SELECTION, "select case (k)");
        Node beforeAnyCase = node(NodeKind.ASSIGNMENT, "x = 0");
        Node first = node(NodeKind.ASSIGNMENT, "x = 1");
        Node second = node(NodeKind.ASSIGNMENT, "x = 2");

        selection.append(beforeAnyCase);
        selection.openCase("(1)");
        selection.append(first);
        selection.openCase("default");
        selection.append(second);

        assertEquals(List.of(beforeAnyCase), selection.children);
        assertEquals(List.of(first), selection.selection().cases.get(0).statements);
        assertEquals(List.of(second), selection.selection().cases.get(1).statements);
        assertEquals(3, selection.childSequences().size());
        assertThrows(IllegalStateException.class, () -> node(NodeKind.LOOP, "do").openCase("(1)"));
    }

    @Test
    void chainedConditionalIsMarked() {
        Node chained = Node.chainedConditional(Origin.line(3), 2, "else if (b) then", List.of("note"));

        assertTrue(chained.isChained());
        assertFalse(node(NodeKind.CONDITIONAL, "if (a) then").isChained());
        assertEquals(List.of("note"), chained.comments);
    }

    @Test
    void findWalksKindAndTagSteps() {
        Node root = Node.root();
        Node module = Node.create(NodeKind.MODULE, Origin.line(1), 1, "module heat", "heat", List.of());
        Node first = Node.create(NodeKind.SUBROUTINE, Origin.line(2), 2, "subroutine init", "init", List.of());
        Node second = Node.create(NodeKind.SUBROUTINE, Origin.line(5), 2, "subroutine step", "step", List.of());
        root.append(module);
        module.append(first);
        module.append(second);

        assertSame(second, root.find(NodePath.parse("module:HEAT/subroutine:step")).orElseThrow());
        assertSame(first, root.find(NodePath.parse("module/subroutine")).orElseThrow());
        assertTrue(root.find(NodePath.parse("module:heat/function")).isEmpty());
        assertSame(root, root.find(NodePath.empty()).orElseThrow());
    }

    @Test
    void originOrdersSyntheticAfterPhysical() {
        Origin line = Origin.line(12);
        Origin clause = line.nextSynthetic();

        assertEquals("12", line.toString());
        assertEquals("12.1", clause.toString());
        assertEquals("12.2", clause.nextSynthetic().toString());
        assertTrue(line.compareTo(clause) < 0);
        assertTrue(clause.compareTo(Origin.line(13)) < 0);
        assertEquals(Origin.synthetic(12, 1), clause);
        assertNotEquals(line, clause);
    }

    @Test
    void kindLabels() {
        assertEquals("archaic-labeled-loop", NodeKind.ARCHAIC_LABELED_LOOP.toString());
        assertEquals(NodeKind.WHERE_LOOP, NodeKind.fromLabel("where_loop").orElseThrow());
        assertTrue(NodeKind.fromLabel("nonsense").isEmpty());
        assertTrue(NodeKind.FUNCTION.isProgramUnit());
        assertFalse(NodeKind.LOOP.isProgramUnit());
        assertTrue(NodeKind.WHERE_LOOP.isLoop());
    }

    private static Node node(NodeKind kind, String rawText) {
        return Node.create(kind, Origin.line(1), 1, rawText, null, List.of());
    }
}
