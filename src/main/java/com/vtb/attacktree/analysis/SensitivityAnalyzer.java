package com.vtb.attacktree.analysis;

import com.vtb.attacktree.exceptions.IncompleteDataException;
import com.vtb.attacktree.exceptions.RangeException;
import com.vtb.attacktree.models.AnalysisMetrics;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.SensitivityPreview;
import lombok.extern.slf4j.Slf4j;

/**
 * Анализ чувствительности: вероятность одного листа умножается на множитель
 * (с насыщением в 1.0), остальные значения не меняются. Ущерб не масштабируется.
 *
 * previewSensitivity считает на копии дерева, applySensitivity меняет переданное дерево.
 */
@Slf4j
public class SensitivityAnalyzer {

    private final AggregationEngine engine;

    public SensitivityAnalyzer() {
        this(new AggregationEngine());
    }

    public SensitivityAnalyzer(AggregationEngine engine) {
        this.engine = engine;
    }

    public SensitivityPreview previewSensitivity(AttackTree tree, String leafId, double multiplier) {
        double original = currentProbability(tree, leafId, multiplier);
        double scaled = scaledProbability(original, multiplier);

        AttackTree previewTree = tree.copy();
        previewTree.setLeafProbability(leafId, scaled);
        AnalysisMetrics metrics = engine.aggregate(previewTree);

        log.info("Пробный пересчёт: лист '{}' x{} ({} -> {}), P(top)={}, ожидаемый ущерб={}",
            leafId, multiplier, original, scaled, metrics.getTopProbability(), metrics.getExpectedLoss());
        return SensitivityPreview.builder()
            .previewTree(previewTree)
            .leafId(leafId)
            .multiplier(multiplier)
            .originalProbability(original)
            .newProbability(scaled)
            .metrics(metrics)
            .build();
    }

    /**
     * Применить множитель к листу живого дерева. Прежняя вероятность заменяется
     * безвозвратно; метрики вызывающий пересчитывает сам.
     */
    public AttackTree applySensitivity(AttackTree tree, String leafId, double multiplier) {
        double original = currentProbability(tree, leafId, multiplier);
        double scaled = scaledProbability(original, multiplier);
        tree.setLeafProbability(leafId, scaled);
        log.info("Применён множитель x{} к листу '{}': {} -> {}", multiplier, leafId, original, scaled);
        return tree;
    }

    static double scaledProbability(double probability, double multiplier) {
        return Math.min(1.0, multiplier * probability);
    }

    private double currentProbability(AttackTree tree, String leafId, double multiplier) {
        if (tree == null) {
            throw new IllegalArgumentException("Дерево не может быть null");
        }
        if (Double.isNaN(multiplier) || Double.isInfinite(multiplier) || multiplier <= 0.0) {
            throw new RangeException("Множитель должен быть положительным конечным числом, получено " + multiplier);
        }
        AttackNode leaf = tree.getLeaf(leafId);
        if (leaf.getProbability().isEmpty()) {
            throw IncompleteDataException.missingProbability(leafId);
        }
        return leaf.getProbability().getAsDouble();
    }
}
