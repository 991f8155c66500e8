package com.kpi.drivertree.service;

import com.kpi.drivertree.entity.FormulaOperator;
import com.kpi.drivertree.exception.FormulaParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits decomposition formulas such as "profit = revenue - cost".
 * Only one operator per expression is interpreted: the first operator character found
 * decides the split, and any other operator character stays inside the operand text.
 */
@Service
@Slf4j
public class ExpressionParser {

    /**
     * Parses a whole formula into its root label and expression.
     * @param formula e.g. "profit = revenue - cost"
     * @param index zero-based position of the formula in its batch, used in error reports
     * @throws FormulaParseException if there is no '=' or the right-hand side is blank
     */
    public ParsedFormula parseFormula(String formula, int index) {
        if (formula == null || formula.indexOf('=') < 0) {
            throw new FormulaParseException("Formula has no '=' separator", formula, index);
        }

        int separator = formula.indexOf('=');
        String rootLabel = formula.substring(0, separator).trim();
        String rhs = formula.substring(separator + 1);

        ParsedExpression expression;
        try {
            expression = parse(rhs);
        } catch (FormulaParseException e) {
            throw new FormulaParseException(e.getMessage(), formula, index, e);
        }

        return ParsedFormula.builder()
                .index(index)
                .formula(formula)
                .rootLabel(rootLabel)
                .expression(expression)
                .build();
    }

    /**
     * Parses the right-hand side of a formula.
     * @param expression e.g. "revenue - cost"
     * @return operands in written order and the operator, absent for a bare alias
     * @throws FormulaParseException if the expression is blank
     */
    public ParsedExpression parse(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new FormulaParseException("Expression is empty");
        }

        int operatorAt = firstOperatorIndex(expression);
        if (operatorAt < 0) {
            return new ParsedExpression(List.of(expression.trim()), null);
        }

        char symbol = expression.charAt(operatorAt);
        FormulaOperator operator = FormulaOperator.fromSymbol(symbol);

        List<String> operands = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < expression.length(); i++) {
            if (expression.charAt(i) == symbol) {
                operands.add(expression.substring(start, i).trim());
                start = i + 1;
            }
        }
        operands.add(expression.substring(start).trim());

        log.debug("Parsed '{}' into {} operands joined by '{}'", expression, operands.size(), symbol);
        return new ParsedExpression(List.copyOf(operands), operator);
    }

    private static int firstOperatorIndex(String expression) {
        for (int i = 0; i < expression.length(); i++) {
            if (FormulaOperator.isOperatorSymbol(expression.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
