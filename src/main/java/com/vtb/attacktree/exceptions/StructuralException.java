package com.vtb.attacktree.exceptions;

import java.util.Collection;

/**
 * Граф потомков не является деревом: цикл, общий потомок, недостижимый узел
 * или неверная форма узла (лист с потомками, AND/OR без потомков).
 */
public class StructuralException extends AttackTreeException {

    public StructuralException(String message, Collection<String> nodeIds) {
        super(message, nodeIds);
    }
}
