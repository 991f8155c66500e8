package com.kpi.drivertree.service;

import com.kpi.drivertree.entity.FormulaOperator;
import com.kpi.drivertree.exception.ErrorKind;
import com.kpi.drivertree.exception.FormulaParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    private ExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = new ExpressionParser();
    }

    @Test
    void testParseSubtraction() {
        ParsedExpression result = parser.parse("B - C");

        assertEquals(List.of("B", "C"), result.getOperands());
        assertEquals(FormulaOperator.SUBTRACT, result.getOperator());
    }

    @Test
    void testParseBareAlias() {
        ParsedExpression result = parser.parse("B");

        assertEquals(List.of("B"), result.getOperands());
        assertNull(result.getOperator());
    }

    @Test
    void testParseEmptyExpressionFails() {
        assertThrows(FormulaParseException.class, () -> parser.parse(""));
        assertThrows(FormulaParseException.class, () -> parser.parse("   "));
    }

    @Test
    void testParseEveryOperator() {
        assertEquals(FormulaOperator.ADD, parser.parse("a + b").getOperator());
        assertEquals(FormulaOperator.SUBTRACT, parser.parse("a - b").getOperator());
        assertEquals(FormulaOperator.MULTIPLY, parser.parse("a * b").getOperator());
        assertEquals(FormulaOperator.DIVIDE, parser.parse("a / b").getOperator());
        assertEquals(FormulaOperator.MODULO, parser.parse("a % b").getOperator());
    }

    @Test
    void testParseSplitsOnEveryOccurrenceAndTrims() {
        ParsedExpression result = parser.parse("  fixed cost +variable cost+  other  ");

        assertEquals(List.of("fixed cost", "variable cost", "other"), result.getOperands());
        assertEquals(FormulaOperator.ADD, result.getOperator());
    }

    @Test
    void testParseMixedOperatorsSplitsOnFirstOnly() {
        ParsedExpression result = parser.parse("a + b - c");

        assertEquals(List.of("a", "b - c"), result.getOperands());
        assertEquals(FormulaOperator.ADD, result.getOperator());
    }

    @Test
    void testParseTrailingOperatorYieldsEmptyOperand() {
        ParsedExpression result = parser.parse("a *");

        assertEquals(List.of("a", ""), result.getOperands());
    }

    @Test
    void testParseFormula() {
        ParsedFormula formula = parser.parseFormula("profit = revenue - cost", 3);

        assertEquals("profit", formula.getRootLabel());
        assertEquals(3, formula.getIndex());
        assertEquals("profit = revenue - cost", formula.getFormula());
        assertEquals(List.of("revenue", "cost"), formula.getExpression().getOperands());
    }

    @Test
    void testParseFormulaSplitsOnFirstEquals() {
        ParsedFormula formula = parser.parseFormula("a = b = c", 0);

        assertEquals("a", formula.getRootLabel());
        assertEquals(List.of("b = c"), formula.getExpression().getOperands());
    }

    @Test
    void testParseFormulaWithoutSeparatorFails() {
        FormulaParseException e = assertThrows(FormulaParseException.class,
                () -> parser.parseFormula("profit revenue - cost", 2));

        assertEquals(ErrorKind.PARSE, e.getKind());
        assertEquals("profit revenue - cost", e.getFormula());
        assertEquals(2, e.getFormulaIndex());
    }

    @Test
    void testParseFormulaWithEmptyRightHandSideNamesFormula() {
        FormulaParseException e = assertThrows(FormulaParseException.class,
                () -> parser.parseFormula("profit =   ", 5));

        assertEquals("profit =   ", e.getFormula());
        assertEquals(5, e.getFormulaIndex());
        assertTrue(e.getMessage().contains("#5"));
    }
}
