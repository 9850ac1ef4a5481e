package com.vtb.attacktree.web;

import lombok.Data;

/**
 * Новые значения листа; null сбрасывает значение
 */
@Data
public class LeafUpdateRequest {
    private Double prob;
    private Double impact;
}
