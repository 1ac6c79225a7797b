package com.questrail.expectations.expr;

import com.questrail.expectations.api.EnvironmentDescriptor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ExpressionEvaluator}.
 */
final class ExpressionEvaluatorTest
{
    private static final ExpressionEvaluator EVALUATOR = ExpressionEvaluator.INSTANCE;

    private final EnvironmentDescriptor linuxDebug = EnvironmentDescriptor.builder()
            .with("os", "linux")
            .with("debug", true)
            .with("bits", 64)
            .build();

    @Test
    void equalityOnStringProperty()
    {
        Expression isLinux = BinaryExpression.equalTo(new Variable("os"), new StringLiteral("linux"));
        Expression isWin = BinaryExpression.equalTo(new Variable("os"), new StringLiteral("win"));

        assertTrue(EVALUATOR.test(isLinux, linuxDebug));
        assertFalse(EVALUATOR.test(isWin, linuxDebug));
    }

    @Test
    void numbersCompareByValue()
    {
        Expression bits = BinaryExpression.equalTo(new Variable("bits"), new NumberLiteral("64.0"));
        assertTrue(EVALUATOR.test(bits, linuxDebug));
    }

    @Test
    void numberNeverEqualsItsStringForm()
    {
        Expression bits = BinaryExpression.equalTo(new Variable("bits"), new StringLiteral("64"));
        assertFalse(EVALUATOR.test(bits, linuxDebug));
    }

    @Test
    void bareVariableUsesTruthiness()
    {
        assertTrue(EVALUATOR.test(new Variable("debug"), linuxDebug));
        assertFalse(EVALUATOR.test(UnaryExpression.not(new Variable("debug")), linuxDebug));
    }

    @Test
    void unboundPropertyIsFalsy()
    {
        assertFalse(EVALUATOR.test(new Variable("asan"), linuxDebug));
        assertNull(EVALUATOR.evaluate(new Variable("asan"), linuxDebug));

        Expression notEqual = new BinaryExpression(BinaryOperator.NOT_EQUALS,
                new Variable("asan"), new StringLiteral("x"));
        assertTrue(EVALUATOR.test(notEqual, linuxDebug));
    }

    @Test
    void logicalOperators()
    {
        Expression isWin = BinaryExpression.equalTo(new Variable("os"), new StringLiteral("win"));

        assertTrue(EVALUATOR.test(new BinaryExpression(BinaryOperator.OR, isWin, new Variable("debug")), linuxDebug));
        assertFalse(EVALUATOR.test(BinaryExpression.and(new Variable("debug"), isWin), linuxDebug));
    }

    @Test
    void emptyDescriptorMatchesOnlyNegations()
    {
        EnvironmentDescriptor empty = EnvironmentDescriptor.empty();

        assertFalse(EVALUATOR.test(new Variable("debug"), empty));
        assertTrue(EVALUATOR.test(UnaryExpression.not(new Variable("debug")), empty));
    }
}
