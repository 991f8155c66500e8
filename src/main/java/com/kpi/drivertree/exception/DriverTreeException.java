package com.kpi.drivertree.exception;

import lombok.Getter;

/**
 * Base class for every failure raised while generating driver trees.
 * Carries the offending formula and its zero-based position in the batch when known.
 */
@Getter
public abstract class DriverTreeException extends RuntimeException {

    private final ErrorKind kind;
    private final String formula;
    private final Integer formulaIndex;

    protected DriverTreeException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    protected DriverTreeException(ErrorKind kind, String message, String formula, Integer formulaIndex,
                                  Throwable cause) {
        super(describe(message, formula, formulaIndex), cause);
        this.kind = kind;
        this.formula = formula;
        this.formulaIndex = formulaIndex;
    }

    /**
     * True when this failure already names the formula it was raised for.
     */
    public boolean hasFormula() {
        return formula != null;
    }

    private static String describe(String message, String formula, Integer formulaIndex) {
        if (formula == null) {
            return message;
        }
        if (formulaIndex == null) {
            return String.format("%s [formula: '%s']", message, formula);
        }
        return String.format("%s [formula #%d: '%s']", message, formulaIndex, formula);
    }
}
