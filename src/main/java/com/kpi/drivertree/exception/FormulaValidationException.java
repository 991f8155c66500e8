package com.kpi.drivertree.exception;

/**
 * A formula parsed but carries an unsupported operator or an unusable label.
 */
public class FormulaValidationException extends DriverTreeException {

    public FormulaValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public FormulaValidationException(String message, String formula, Integer formulaIndex) {
        super(ErrorKind.VALIDATION, message, formula, formulaIndex, null);
    }

    public FormulaValidationException(String message, String formula, Integer formulaIndex, Throwable cause) {
        super(ErrorKind.VALIDATION, message, formula, formulaIndex, cause);
    }
}
