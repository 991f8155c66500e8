package com.kpi.drivertree.exception;

/**
 * A formula could not be split into a root label and an expression.
 */
public class FormulaParseException extends DriverTreeException {

    public FormulaParseException(String message) {
        super(ErrorKind.PARSE, message);
    }

    public FormulaParseException(String message, String formula, Integer formulaIndex) {
        super(ErrorKind.PARSE, message, formula, formulaIndex, null);
    }

    public FormulaParseException(String message, String formula, Integer formulaIndex, Throwable cause) {
        super(ErrorKind.PARSE, message, formula, formulaIndex, cause);
    }
}
