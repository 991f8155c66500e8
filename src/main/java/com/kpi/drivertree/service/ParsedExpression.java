package com.kpi.drivertree.service;

import com.kpi.drivertree.entity.FormulaOperator;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Right-hand side of a formula: operand labels in written order and the operator joining them.
 */
@Data
@AllArgsConstructor
public class ParsedExpression {

    private final List<String> operands;

    /**
     * Null when the expression is a bare alias.
     */
    private final FormulaOperator operator;
}
