package com.kpi.drivertree.exception;

/**
 * The forest is not internally consistent: a cycle, an unknown child or an unrecoverable label race.
 */
public class TreeConsistencyException extends DriverTreeException {

    public TreeConsistencyException(String message) {
        super(ErrorKind.CONSISTENCY, message);
    }

    public TreeConsistencyException(String message, String formula, Integer formulaIndex) {
        super(ErrorKind.CONSISTENCY, message, formula, formulaIndex, null);
    }

    public TreeConsistencyException(String message, String formula, Integer formulaIndex, Throwable cause) {
        super(ErrorKind.CONSISTENCY, message, formula, formulaIndex, cause);
    }
}
