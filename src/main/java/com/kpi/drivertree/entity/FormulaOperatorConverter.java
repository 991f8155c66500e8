package com.kpi.drivertree.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link FormulaOperator} as its symbol so the column reads like the formula.
 */
@Converter(autoApply = true)
public class FormulaOperatorConverter implements AttributeConverter<FormulaOperator, String> {

    @Override
    public String convertToDatabaseColumn(FormulaOperator operator) {
        return operator == null ? null : operator.symbolString();
    }

    @Override
    public FormulaOperator convertToEntityAttribute(String column) {
        if (column == null || column.isEmpty()) {
            return null;
        }
        return FormulaOperator.fromSymbol(column.charAt(0));
    }
}
