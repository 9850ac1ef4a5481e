package com.vtb.attacktree.exceptions;

import java.util.Collection;
import java.util.List;

/**
 * Спецификация не читается или в ней нет обязательных полей.
 */
public class MalformedSpecException extends AttackTreeException {

    public MalformedSpecException(String message) {
        super(message, List.of());
    }

    public MalformedSpecException(String message, Collection<String> nodeIds) {
        super(message, nodeIds);
    }

    public MalformedSpecException(String message, Throwable cause) {
        super(message, List.of(), cause);
    }
}
