package com.vtb.attacktree.exceptions;

import java.util.List;

/**
 * Операция ссылается на несуществующий узел или на узел не того вида.
 */
public class NodeReferenceException extends AttackTreeException {

    public NodeReferenceException(String message, String nodeId) {
        super(message, nodeId != null ? List.of(nodeId) : List.of());
    }
}
