package com.vtb.attacktree.analysis;

import com.vtb.attacktree.exceptions.IncompleteDataException;
import com.vtb.attacktree.exceptions.NodeReferenceException;
import com.vtb.attacktree.exceptions.RangeException;
import com.vtb.attacktree.models.AnalysisMetrics;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.SampleTrees;
import com.vtb.attacktree.models.SensitivityPreview;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для SensitivityAnalyzer
 */
class SensitivityAnalyzerTest {

    private final AggregationEngine engine = new AggregationEngine(3);
    private final SensitivityAnalyzer analyzer = new SensitivityAnalyzer(engine);

    @Test
    void testPreviewDoesNotMutateLiveTree() {
        AttackTree tree = SampleTrees.workedExample();
        AttackTree snapshot = tree.copy();
        AnalysisMetrics before = engine.aggregate(tree);

        SensitivityPreview preview = analyzer.previewSensitivity(tree, "weak_cfg", 0.5);

        assertEquals(snapshot, tree);
        assertEquals(before, engine.aggregate(tree));
        assertNotSame(tree, preview.getPreviewTree());
        assertEquals(0.30, preview.getPreviewTree().getLeaf("weak_cfg").getProbability().getAsDouble(), 1e-12);
    }

    @Test
    void testPreviewMetrics() {
        AttackTree tree = SampleTrees.workedExample();

        SensitivityPreview preview = analyzer.previewSensitivity(tree, "fd_ransom", 0.5);

        // cyber = 1 - 0.75 * 0.4 = 0.7; top = 1 - 0.997 * 0.3 = 0.7009
        assertEquals(0.50, preview.getOriginalProbability(), 0.0);
        assertEquals(0.25, preview.getNewProbability(), 0.0);
        assertEquals(0.7009, preview.getTopProbability(), 1e-12);
        assertEquals(128520.0 - 45000.0, preview.getExpectedLoss(), 1e-6);
        assertEquals("fd_ransom", preview.getMetrics().getTopContributors().get(0).getLeafId());
        assertEquals(45000.0, preview.getMetrics().getTopContributors().get(0).getContribution(), 1e-6);
    }

    @Test
    void testApplyChangesOnlyTargetLeaf() {
        AttackTree tree = SampleTrees.workedExample();
        AttackTree original = tree.copy();

        AttackTree result = analyzer.applySensitivity(tree, "hdd_fail", 4.0);

        assertSame(tree, result);
        assertEquals(0.04, tree.getLeaf("hdd_fail").getProbability().getAsDouble(), 1e-15);
        assertEquals(12000.0, tree.getLeaf("hdd_fail").getImpact().getAsDouble(), 0.0);
        for (AttackNode node : original.getNodes()) {
            if (!node.getId().equals("hdd_fail")) {
                assertEquals(node, tree.getNode(node.getId()), "Узел " + node.getId() + " не должен меняться");
            }
        }
        assertEquals(0.012, engine.probabilityOf(tree, "op_risk"), 1e-12);
    }

    @Test
    void testSaturationAtOne() {
        AttackTree tree = SampleTrees.workedExample();

        analyzer.applySensitivity(tree, "weak_cfg", 3.0);

        assertEquals(1.0, tree.getLeaf("weak_cfg").getProbability().getAsDouble(), 0.0);
        assertEquals(1.0, engine.aggregate(tree).getTopProbability(), 0.0);
    }

    @Test
    void testPreviewSaturation() {
        SensitivityPreview preview = analyzer.previewSensitivity(SampleTrees.workedExample(), "weak_cfg", 3.0);

        assertEquals(1.0, preview.getNewProbability(), 0.0);
    }

    @Test
    void testPreviewThenApplyGiveSameMetrics() {
        AttackTree tree = SampleTrees.workedExample();

        SensitivityPreview preview = analyzer.previewSensitivity(tree, "power_out", 2.0);
        analyzer.applySensitivity(tree, "power_out", 2.0);

        assertEquals(preview.getMetrics(), engine.aggregate(tree));
        assertEquals(preview.getPreviewTree(), tree);
    }

    @Test
    void testNonPositiveMultiplier() {
        AttackTree tree = SampleTrees.workedExample();

        assertThrows(RangeException.class, () -> analyzer.previewSensitivity(tree, "weak_cfg", 0.0));
        assertThrows(RangeException.class, () -> analyzer.previewSensitivity(tree, "weak_cfg", -2.0));
        assertThrows(RangeException.class, () -> analyzer.applySensitivity(tree, "weak_cfg", Double.NaN));
        assertThrows(RangeException.class,
            () -> analyzer.applySensitivity(tree, "weak_cfg", Double.POSITIVE_INFINITY));
        assertEquals(0.60, tree.getLeaf("weak_cfg").getProbability().getAsDouble(), 0.0);
    }

    @Test
    void testUnknownOrGateNode() {
        AttackTree tree = SampleTrees.workedExample();

        assertThrows(NodeReferenceException.class, () -> analyzer.previewSensitivity(tree, "nope", 2.0));
        assertThrows(NodeReferenceException.class, () -> analyzer.applySensitivity(tree, "cyber", 2.0));
    }

    @Test
    void testLeafWithoutProbability() {
        AttackTree tree = SampleTrees.workedExample();
        tree.updateLeaf("power_out", null, 8000.0);

        IncompleteDataException e = assertThrows(IncompleteDataException.class,
            () -> analyzer.applySensitivity(tree, "power_out", 2.0));

        assertEquals(List.of("power_out"), e.getMissingProbability());
    }

    @Test
    void testScaledProbability() {
        assertEquals(1.0, SensitivityAnalyzer.scaledProbability(0.6, 3.0), 0.0);
        assertEquals(0.3, SensitivityAnalyzer.scaledProbability(0.6, 0.5), 0.0);
        assertEquals(1.0, SensitivityAnalyzer.scaledProbability(1.0, 1.0), 0.0);
    }
}
