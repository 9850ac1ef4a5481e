package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

/**
 * Значения листа для отчёта; null - значение не задано
 */
@Data
@Builder
public class LeafSummary {
    private String id;
    private String label;
    private Double probability;
    private Double impact;
    private Double contribution;
}
