package com.vtb.attacktree.exceptions;

import java.util.Collection;
import java.util.List;

/**
 * Числовое значение вне допустимого диапазона (вероятность, ущерб, множитель).
 */
public class RangeException extends AttackTreeException {

    public RangeException(String message) {
        super(message, List.of());
    }

    public RangeException(String message, Collection<String> nodeIds) {
        super(message, nodeIds);
    }
}
