package com.kpi.drivertree.exception;

import lombok.Getter;

/**
 * Raised by a node store when another writer already owns the label being created.
 * Recovered locally by the node registry.
 */
@Getter
public class NodeLabelConflictException extends DriverTreeException {

    private final String label;

    public NodeLabelConflictException(String label) {
        super(ErrorKind.CONFLICT, "Node label already taken by a concurrent writer: " + label);
        this.label = label;
    }
}
