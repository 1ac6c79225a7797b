package com.questrail.expectations.codec.impl;

import com.questrail.expectations.codec.ManifestParseException;
import com.questrail.expectations.expr.BinaryExpression;
import com.questrail.expectations.expr.BinaryOperator;
import com.questrail.expectations.expr.Expression;
import com.questrail.expectations.expr.NumberLiteral;
import com.questrail.expectations.expr.StringLiteral;
import com.questrail.expectations.expr.UnaryExpression;
import com.questrail.expectations.expr.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * ConditionParser
 * -----------------------------------------------------------------------------
 * Recursive-descent parser for the condition of an {@code if} line.
 *
 * <pre>
 *   or         := and ( "or" or )?
 *   and        := not ( "and" and )?
 *   not        := "not" not | comparison
 *   comparison := atom ( ("==" | "!=") atom )?
 *   atom       := "(" or ")" | NUMBER | STRING | IDENTIFIER
 * </pre>
 *
 * <p>{@code and} and {@code or} chains associate to the right, which is the
 * shape the condition synthesizer builds, so a written condition reads back
 * as an equal tree.</p>
 */
public final class ConditionParser
{
    private static final Set<String> KEYWORDS = Set.of("and", "or", "not");

    private enum Kind { IDENTIFIER, STRING, NUMBER, LPAREN, RPAREN, EQ, NE, END }

    private record Token(Kind kind, String text, int column) {}

    private final List<Token> tokens;
    private final int line;
    private int pos;

    private ConditionParser(List<Token> tokens, int line) {
        this.tokens = tokens;
        this.line = line;
    }

    /**
     * Parses a condition.
     *
     * @param text condition text, without the leading {@code if} and trailing colon
     * @param line line number for error messages, or {@code 0}
     * @throws ManifestParseException if the text is not a valid condition
     */
    public static Expression parse(String text, int line) {
        ConditionParser parser = new ConditionParser(tokenize(text, line), line);
        Expression expression = parser.parseOr();
        Token trailing = parser.peek();
        if (trailing.kind() != Kind.END) {
            throw parser.error("Unexpected '" + trailing.text() + "' in condition", trailing);
        }
        return expression;
    }

    // ---------------------------------------------------------------------
    // Grammar
    // ---------------------------------------------------------------------

    private Expression parseOr() {
        Expression left = parseAnd();
        if (acceptKeyword("or")) {
            return new BinaryExpression(BinaryOperator.OR, left, parseOr());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        if (acceptKeyword("and")) {
            return new BinaryExpression(BinaryOperator.AND, left, parseAnd());
        }
        return left;
    }

    private Expression parseNot() {
        if (acceptKeyword("not")) {
            return UnaryExpression.not(parseNot());
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parseAtom();
        Token next = peek();
        if (next.kind() == Kind.EQ || next.kind() == Kind.NE) {
            pos++;
            BinaryOperator op = next.kind() == Kind.EQ ? BinaryOperator.EQUALS : BinaryOperator.NOT_EQUALS;
            return new BinaryExpression(op, left, parseAtom());
        }
        return left;
    }

    private Expression parseAtom() {
        Token token = next();
        switch (token.kind()) {
            case LPAREN -> {
                Expression inner = parseOr();
                Token close = next();
                if (close.kind() != Kind.RPAREN) {
                    throw error("Expected ')'", close);
                }
                return inner;
            }
            case NUMBER -> {
                return new NumberLiteral(token.text());
            }
            case STRING -> {
                return new StringLiteral(token.text());
            }
            case IDENTIFIER -> {
                if (KEYWORDS.contains(token.text())) {
                    throw error("Unexpected keyword '" + token.text() + "'", token);
                }
                return new Variable(token.text());
            }
            case END -> throw error("Unexpected end of condition", token);
            default -> throw error("Unexpected '" + token.text() + "'", token);
        }
    }

    private boolean acceptKeyword(String keyword) {
        Token token = peek();
        if (token.kind() == Kind.IDENTIFIER && token.text().equals(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token token = tokens.get(pos);
        if (token.kind() != Kind.END) {
            pos++;
        }
        return token;
    }

    private ManifestParseException error(String message, Token at) {
        return new ManifestParseException(message + " at column " + (at.column() + 1), line);
    }

    // ---------------------------------------------------------------------
    // Tokenizer
    // ---------------------------------------------------------------------

    private static List<Token> tokenize(String text, int line) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == ' ') {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")", i++));
            } else if (text.startsWith("==", i)) {
                tokens.add(new Token(Kind.EQ, "==", i));
                i += 2;
            } else if (text.startsWith("!=", i)) {
                tokens.add(new Token(Kind.NE, "!=", i));
                i += 2;
            } else if (c == '"') {
                int start = i;
                StringBuilder value = new StringBuilder();
                i = ManifestText.readQuoted(text, i, value, line);
                tokens.add(new Token(Kind.STRING, value.toString(), start));
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1)))) {
                int start = i++;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                String number = text.substring(start, i);
                try {
                    tokens.add(new Token(Kind.NUMBER, new NumberLiteral(number).text(), start));
                } catch (IllegalArgumentException e) {
                    throw new ManifestParseException("Malformed number '" + number + "'", line, e);
                }
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < text.length()
                        && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(Kind.IDENTIFIER, text.substring(start, i), start));
            } else {
                throw new ManifestParseException(
                        "Unexpected character '" + c + "' in condition at column " + (i + 1), line);
            }
        }
        tokens.add(new Token(Kind.END, "", text.length()));
        return tokens;
    }
}
