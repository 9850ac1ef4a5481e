package com.vtb.attacktree.models;

import java.util.Locale;

/**
 * Вид узла дерева атак
 */
public enum NodeType {
    AND("Все потомки"),
    OR("Любой потомок"),
    LEAF("Элементарное событие");

    private final String description;

    NodeType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isGate() {
        return this != LEAF;
    }

    /**
     * Разбор метки вида без учёта регистра. Возвращает null для неизвестной метки.
     */
    public static NodeType fromLabel(String label) {
        if (label == null) {
            return null;
        }
        try {
            return NodeType.valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
