package com.vtb.attacktree.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

/**
 * Результат пробного пересчёта: метрики, посчитанные на копии дерева
 * с изменённой вероятностью одного листа. Исходное дерево не меняется.
 */
@Data
@Builder
public class SensitivityPreview {
    @JsonIgnore
    private AttackTree previewTree;
    private String leafId;
    private double multiplier;
    private double originalProbability;
    private double newProbability;
    private AnalysisMetrics metrics;

    public double getTopProbability() {
        return metrics.getTopProbability();
    }

    public double getExpectedLoss() {
        return metrics.getExpectedLoss();
    }
}
