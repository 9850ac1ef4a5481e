package com.vtb.attacktree.core;

import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.SampleTrees;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для SpecExporter: выгрузка и повторная нормализация
 */
class SpecExporterTest {

    private final SpecExporter exporter = new SpecExporter();
    private final SpecNormalizer normalizer = new SpecNormalizer();

    @ParameterizedTest
    @EnumSource(SpecFormat.class)
    void testRoundTrip(SpecFormat format) {
        AttackTree tree = SampleTrees.workedExample();

        AttackTree restored = normalizer.normalize(exporter.exportBytes(tree, format), format);

        assertEquals(tree, restored);
    }

    @ParameterizedTest
    @EnumSource(SpecFormat.class)
    void testRoundTripKeepsUnsetValues(SpecFormat format) {
        AttackTree tree = new AttackTree("r", List.of(
            AttackNode.and("r", "Top", "a", "b"),
            AttackNode.leaf("a", "Not estimated", null, null),
            AttackNode.leaf("b", "Zero", 0.0, 0.0)));

        AttackTree restored = normalizer.normalize(exporter.exportBytes(tree, format), format);

        assertEquals(tree, restored);
        assertTrue(restored.getLeaf("a").getProbability().isEmpty());
        assertEquals(0.0, restored.getLeaf("b").getProbability().getAsDouble());
    }

    @Test
    void testRoundTripAfterLeafEdit() {
        AttackTree tree = SampleTrees.workedExample();
        tree.updateLeaf("hdd_fail", 0.02, 15000.0);

        AttackTree restored = normalizer.normalize(exporter.export(tree, SpecFormat.YAML), SpecFormat.YAML);

        assertEquals(0.02, restored.getLeaf("hdd_fail").getProbability().getAsDouble());
        assertEquals(15000.0, restored.getLeaf("hdd_fail").getImpact().getAsDouble());
    }

    @Test
    void testCanonicalMapShape() {
        Map<String, Object> spec = exporter.toCanonicalMap(SampleTrees.workedExample());

        assertEquals("loss_event", spec.get("id"));
        assertEquals("OR", spec.get("type"));
        assertEquals(List.of("op_risk", "cyber"), spec.get("children"));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> nodes = (List<Map<String, Object>>) spec.get("nodes");
        assertEquals(6, nodes.size(), "Корень не должен дублироваться в nodes");
        Map<String, Object> leaf = nodes.get(1);
        assertEquals("power_out", leaf.get("id"));
        assertEquals(0.30, leaf.get("prob"));
        assertFalse(leaf.containsKey("children"));
    }

    @Test
    void testUnsetValuesAreOmitted() {
        AttackTree tree = new AttackTree("r", List.of(
            AttackNode.or("r", "Top", "a"),
            AttackNode.leaf("a", "A", null, 100.0)));

        String json = exporter.export(tree, SpecFormat.JSON);

        assertFalse(json.contains("\"prob\""));
        assertTrue(json.contains("\"impact\""));
    }

    @Test
    void testXmlUsesWrappedElements() {
        String xml = exporter.export(SampleTrees.workedExample(), SpecFormat.XML);

        assertTrue(xml.startsWith("<spec>"));
        assertTrue(xml.contains("<child>op_risk</child>"));
        assertTrue(xml.contains("<node>"));
    }

    @Test
    void testExportToFile(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("updated_spec.yaml");

        exporter.exportToFile(SampleTrees.workedExample(), SpecFormat.YAML, target);

        assertTrue(Files.size(target) > 0);
        assertEquals(SampleTrees.workedExample(), normalizer.normalizeFile(target));
    }
}
