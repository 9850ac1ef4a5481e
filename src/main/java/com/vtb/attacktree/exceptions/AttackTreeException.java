package com.vtb.attacktree.exceptions;

import java.util.Collection;
import java.util.List;

/**
 * Базовая ошибка анализа дерева атак.
 * Все ошибки несут список идентификаторов узлов, к которым они относятся.
 */
public abstract class AttackTreeException extends RuntimeException {

    private final List<String> nodeIds;

    protected AttackTreeException(String message, Collection<String> nodeIds) {
        super(message);
        this.nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
    }

    protected AttackTreeException(String message, Collection<String> nodeIds, Throwable cause) {
        super(message, cause);
        this.nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
    }

    public List<String> getNodeIds() {
        return nodeIds;
    }
}
