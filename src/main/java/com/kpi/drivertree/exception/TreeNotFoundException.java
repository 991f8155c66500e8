package com.kpi.drivertree.exception;

public class TreeNotFoundException extends DriverTreeException {

    public TreeNotFoundException(Long id) {
        super(ErrorKind.NOT_FOUND, "Driver tree not found: " + id);
    }
}
