package com.questrail.expectations.codec.impl;

import com.questrail.expectations.expr.BinaryExpression;
import com.questrail.expectations.expr.BinaryOperator;
import com.questrail.expectations.expr.Expression;
import com.questrail.expectations.expr.NumberLiteral;
import com.questrail.expectations.expr.StringLiteral;
import com.questrail.expectations.expr.UnaryExpression;
import com.questrail.expectations.expr.Variable;

/**
 * Writes condition expressions in table syntax, adding parentheses only
 * where precedence or associativity requires them.
 */
public final class ConditionFormatter
{
    private static final int OR = 1;
    private static final int AND = 2;
    private static final int NOT = 3;
    private static final int COMPARISON = 4;
    private static final int ATOM = 5;

    private ConditionFormatter() {}

    public static String format(Expression expression) {
        StringBuilder out = new StringBuilder();
        write(expression, out);
        return out.toString();
    }

    private static void write(Expression expression, StringBuilder out) {
        if (expression instanceof Variable v) {
            out.append(v.name());
        } else if (expression instanceof StringLiteral s) {
            ManifestText.appendQuoted(s.value(), out);
        } else if (expression instanceof NumberLiteral n) {
            out.append(n.text());
        } else if (expression instanceof UnaryExpression u) {
            out.append(u.operator().symbol()).append(' ');
            writeOperand(u.operand(), NOT, out);
        } else {
            BinaryExpression b = (BinaryExpression) expression;
            int precedence = precedenceOf(b);
            if (b.operator().isLogical()) {
                // Right-associative: the left operand needs parentheses at equal precedence.
                writeOperand(b.left(), precedence + 1, out);
                out.append(' ').append(b.operator().symbol()).append(' ');
                writeOperand(b.right(), precedence, out);
            } else {
                writeOperand(b.left(), ATOM, out);
                out.append(' ').append(b.operator().symbol()).append(' ');
                writeOperand(b.right(), ATOM, out);
            }
        }
    }

    private static void writeOperand(Expression operand, int minimumPrecedence, StringBuilder out) {
        if (precedenceOf(operand) < minimumPrecedence) {
            out.append('(');
            write(operand, out);
            out.append(')');
        } else {
            write(operand, out);
        }
    }

    private static int precedenceOf(Expression expression) {
        if (expression instanceof BinaryExpression b) {
            if (b.operator() == BinaryOperator.OR) {
                return OR;
            }
            if (b.operator() == BinaryOperator.AND) {
                return AND;
            }
            return COMPARISON;
        }
        if (expression instanceof UnaryExpression) {
            return NOT;
        }
        return ATOM;
    }
}
