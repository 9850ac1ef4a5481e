package com.vtb.attacktree.exceptions;

import java.util.List;

/**
 * Узел ссылается на потомка, которого нет в спецификации.
 */
public class DanglingReferenceException extends AttackTreeException {

    private final String parentId;
    private final String missingChildId;

    public DanglingReferenceException(String parentId, String missingChildId) {
        super("Узел '" + parentId + "' ссылается на неизвестного потомка '" + missingChildId + "'",
            List.of(parentId, missingChildId));
        this.parentId = parentId;
        this.missingChildId = missingChildId;
    }

    public String getParentId() {
        return parentId;
    }

    public String getMissingChildId() {
        return missingChildId;
    }
}
