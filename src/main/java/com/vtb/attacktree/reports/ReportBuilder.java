package com.vtb.attacktree.reports;

import com.vtb.attacktree.analysis.AggregationEngine;
import com.vtb.attacktree.exceptions.IncompleteDataException;
import com.vtb.attacktree.models.AnalysisReport;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.LeafSummary;
import com.vtb.attacktree.models.SensitivityPreview;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Сборка отчёта по живому дереву. Нехватка данных не считается ошибкой отчёта:
 * метрики опускаются, недостающие листья перечисляются.
 */
public final class ReportBuilder {

    private ReportBuilder() {}

    public static AnalysisReport build(AttackTree tree, AggregationEngine engine, SensitivityPreview sensitivity) {
        AnalysisReport.AnalysisReportBuilder builder = AnalysisReport.builder()
            .rootId(tree.getRootId())
            .rootLabel(tree.getRoot().getLabel())
            .nodeCount(tree.size())
            .leaves(leafSummaries(tree))
            .sensitivity(sensitivity);

        try {
            builder.metrics(engine.aggregate(tree))
                .nodeProbabilities(engine.nodeProbabilities(tree))
                .resultsAvailable(true);
        } catch (IncompleteDataException e) {
            builder.resultsAvailable(false)
                .missingProbability(new ArrayList<>(e.getMissingProbability()))
                .missingImpact(new ArrayList<>(e.getMissingImpact()));
        }
        return builder.build();
    }

    private static List<LeafSummary> leafSummaries(AttackTree tree) {
        List<LeafSummary> leaves = new ArrayList<>();
        for (AttackNode leaf : tree.getLeaves()) {
            Double probability = leaf.getProbability().isPresent() ? leaf.getProbability().getAsDouble() : null;
            Double impact = leaf.getImpact().isPresent() ? leaf.getImpact().getAsDouble() : null;
            leaves.add(LeafSummary.builder()
                .id(leaf.getId())
                .label(leaf.getLabel())
                .probability(probability)
                .impact(impact)
                .contribution(probability != null && impact != null ? probability * impact : null)
                .build());
        }
        leaves.sort(Comparator.comparing(LeafSummary::getId));
        return leaves;
    }
}
