package com.vtb.attacktree.models;

import com.vtb.attacktree.exceptions.DanglingReferenceException;
import com.vtb.attacktree.exceptions.DuplicateIdException;
import com.vtb.attacktree.exceptions.NodeReferenceException;
import com.vtb.attacktree.exceptions.RangeException;
import com.vtb.attacktree.exceptions.StructuralException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты инвариантов AttackTree
 */
class AttackTreeTest {

    @Test
    void testWorkedExampleIsValidTree() {
        AttackTree tree = SampleTrees.workedExample();

        assertEquals("loss_event", tree.getRootId());
        assertEquals(7, tree.size());
        assertEquals(4, tree.getLeaves().size());
        assertEquals(NodeType.OR, tree.getRoot().getType());
    }

    @Test
    void testUnsetValuesAreDistinctFromZero() {
        AttackNode unset = AttackNode.leaf("a", "A", null, null);
        AttackNode zero = AttackNode.leaf("a", "A", 0.0, 0.0);

        assertTrue(unset.getProbability().isEmpty());
        assertTrue(unset.getImpact().isEmpty());
        assertEquals(0.0, zero.getProbability().getAsDouble());
        assertNotEquals(unset, zero);
    }

    @Test
    void testMissingRootIsDangling() {
        assertThrows(DanglingReferenceException.class, () -> new AttackTree("nope", List.of(
            AttackNode.leaf("a", "A", 0.1, 1.0))));
    }

    @Test
    void testDanglingChildReportsParentAndChild() {
        DanglingReferenceException e = assertThrows(DanglingReferenceException.class, () ->
            new AttackTree("r", List.of(AttackNode.and("r", "Root", "a", "ghost"),
                AttackNode.leaf("a", "A", 0.1, 1.0))));

        assertEquals("r", e.getParentId());
        assertEquals("ghost", e.getMissingChildId());
    }

    @Test
    void testDuplicateIds() {
        assertThrows(DuplicateIdException.class, () -> new AttackTree("r", List.of(
            AttackNode.or("r", "Root", "a"),
            AttackNode.leaf("a", "A", 0.1, 1.0),
            AttackNode.leaf("a", "A again", 0.2, 1.0))));
    }

    @Test
    void testCycleIsStructuralError() {
        StructuralException e = assertThrows(StructuralException.class, () -> new AttackTree("r", List.of(
            AttackNode.or("r", "Root", "g"),
            AttackNode.and("g", "Gate", "h"),
            AttackNode.or("h", "Back edge", "g"))));

        assertTrue(e.getNodeIds().contains("g"));
        assertTrue(e.getNodeIds().contains("h"));
    }

    @Test
    void testCycleThroughRoot() {
        assertThrows(StructuralException.class, () -> new AttackTree("r", List.of(
            AttackNode.or("r", "Root", "g"),
            AttackNode.and("g", "Gate", "r"))));
    }

    @Test
    void testSharedChildIsStructuralError() {
        StructuralException e = assertThrows(StructuralException.class, () -> new AttackTree("r", List.of(
            AttackNode.or("r", "Root", "g1", "g2"),
            AttackNode.and("g1", "Gate 1", "shared"),
            AttackNode.and("g2", "Gate 2", "shared"),
            AttackNode.leaf("shared", "Shared leaf", 0.1, 1.0))));

        assertEquals(List.of("shared", "g1", "g2"), e.getNodeIds());
    }

    @Test
    void testSameChildListedTwice() {
        assertThrows(StructuralException.class, () -> new AttackTree("r", List.of(
            AttackNode.or("r", "Root", "a", "a"),
            AttackNode.leaf("a", "A", 0.1, 1.0))));
    }

    @Test
    void testUnreachableNode() {
        StructuralException e = assertThrows(StructuralException.class, () -> new AttackTree("r", List.of(
            AttackNode.or("r", "Root", "a"),
            AttackNode.leaf("a", "A", 0.1, 1.0),
            AttackNode.leaf("orphan", "Orphan", 0.1, 1.0))));

        assertEquals(List.of("orphan"), e.getNodeIds());
    }

    @Test
    void testGateWithoutChildren() {
        assertThrows(StructuralException.class, () -> new AttackTree("r", List.of(
            AttackNode.gate("r", "Root", NodeType.AND, List.of()))));
    }

    @Test
    void testRangeChecksOnConstruction() {
        assertThrows(RangeException.class, () -> AttackNode.leaf("a", "A", 1.5, 1.0));
        assertThrows(RangeException.class, () -> AttackNode.leaf("a", "A", -0.1, 1.0));
        assertThrows(RangeException.class, () -> AttackNode.leaf("a", "A", 0.5, -1.0));
        assertThrows(RangeException.class, () -> AttackNode.leaf("a", "A", Double.NaN, 1.0));
        assertDoesNotThrow(() -> AttackNode.leaf("a", "A", 0.0, 0.0));
        assertDoesNotThrow(() -> AttackNode.leaf("a", "A", 1.0, 0.0));
    }

    @Test
    void testUpdateLeafIsAtomic() {
        AttackTree tree = SampleTrees.workedExample();

        assertThrows(RangeException.class, () -> tree.updateLeaf("power_out", 0.9, -5.0));

        AttackNode leaf = tree.getLeaf("power_out");
        assertEquals(0.30, leaf.getProbability().getAsDouble());
        assertEquals(8000.0, leaf.getImpact().getAsDouble());
    }

    @Test
    void testUpdateLeafCanUnsetValues() {
        AttackTree tree = SampleTrees.workedExample();

        tree.updateLeaf("power_out", null, 9000.0);

        assertTrue(tree.getLeaf("power_out").getProbability().isEmpty());
        assertEquals(9000.0, tree.getLeaf("power_out").getImpact().getAsDouble());
    }

    @Test
    void testUpdateOnGateOrUnknownNode() {
        AttackTree tree = SampleTrees.workedExample();

        assertThrows(NodeReferenceException.class, () -> tree.updateLeaf("cyber", 0.1, 1.0));
        assertThrows(NodeReferenceException.class, () -> tree.updateLeaf("missing", 0.1, 1.0));
    }

    @Test
    void testCopyIsIndependent() {
        AttackTree tree = SampleTrees.workedExample();
        AttackTree copy = tree.copy();

        assertEquals(tree, copy);
        copy.setLeafProbability("weak_cfg", 0.9);

        assertEquals(0.60, tree.getLeaf("weak_cfg").getProbability().getAsDouble());
        assertNotEquals(tree, copy);
    }

    @Test
    void testSetLeafProbabilityKeepsImpact() {
        AttackTree tree = SampleTrees.workedExample();

        tree.setLeafProbability("fd_ransom", 0.75);

        assertEquals(0.75, tree.getLeaf("fd_ransom").getProbability().getAsDouble());
        assertEquals(180000.0, tree.getLeaf("fd_ransom").getImpact().getAsDouble());
    }
}
