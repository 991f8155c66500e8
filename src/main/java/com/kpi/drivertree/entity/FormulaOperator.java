package com.kpi.drivertree.entity;

import com.kpi.drivertree.exception.FormulaValidationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The operators a decomposition formula may join its operands with.
 */
@Getter
@RequiredArgsConstructor
public enum FormulaOperator {
    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/'),
    MODULO('%');

    private final char symbol;

    /**
     * Returns the operator for a symbol character.
     * @throws FormulaValidationException if the character is not a supported operator
     */
    public static FormulaOperator fromSymbol(char symbol) {
        return switch (symbol) {
            case '+' -> ADD;
            case '-' -> SUBTRACT;
            case '*' -> MULTIPLY;
            case '/' -> DIVIDE;
            case '%' -> MODULO;
            default -> throw new FormulaValidationException("Unsupported operator: '" + symbol + "'");
        };
    }

    public static boolean isOperatorSymbol(char c) {
        return c == '+' || c == '-' || c == '*' || c == '/' || c == '%';
    }

    public String symbolString() {
        return String.valueOf(symbol);
    }
}
