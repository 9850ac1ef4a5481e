package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Итоговые метрики дерева атак
 */
@Data
@Builder
public class AnalysisMetrics {
    private double topProbability;
    private double expectedLoss;
    @Builder.Default
    private List<Contributor> topContributors = new ArrayList<>();
}
