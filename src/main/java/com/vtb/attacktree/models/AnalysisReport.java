package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Отчёт по анализу дерева атак.
 * Если данных не хватает, metrics == null, а недостающие листья перечислены отдельно.
 */
@Data
@Builder
public class AnalysisReport {
    @Builder.Default
    private LocalDateTime generatedAt = LocalDateTime.now();
    private String rootId;
    private String rootLabel;
    private int nodeCount;
    private boolean resultsAvailable;
    private AnalysisMetrics metrics;
    @Builder.Default
    private Map<String, Double> nodeProbabilities = new LinkedHashMap<>();
    @Builder.Default
    private List<LeafSummary> leaves = new ArrayList<>();
    @Builder.Default
    private List<String> missingProbability = new ArrayList<>();
    @Builder.Default
    private List<String> missingImpact = new ArrayList<>();
    private SensitivityPreview sensitivity;
}
