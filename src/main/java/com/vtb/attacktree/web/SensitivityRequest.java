package com.vtb.attacktree.web;

import lombok.Data;

@Data
public class SensitivityRequest {
    private String leafId;
    private Double multiplier;
}
