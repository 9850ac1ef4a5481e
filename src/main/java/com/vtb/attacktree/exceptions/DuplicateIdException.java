package com.vtb.attacktree.exceptions;

import java.util.List;

/**
 * Два узла спецификации объявлены с одним идентификатором.
 */
public class DuplicateIdException extends AttackTreeException {

    public DuplicateIdException(String nodeId) {
        super("Узел '" + nodeId + "' объявлен более одного раза", List.of(nodeId));
    }
}
