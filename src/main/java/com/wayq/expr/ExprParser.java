package com.wayq.expr;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Precedence-climbing parser for filter expressions.
 *
 * <p>Binary operators, lowest precedence first:
 * <ul>
 *   <li>{@code or ||}</li>
 *   <li>{@code and &&}</li>
 *   <li>{@code == != < <= > >= in not-in matches contains startsWith endsWith}</li>
 *   <li>{@code ..}</li>
 *   <li>{@code + -}</li>
 *   <li>{@code * / %}</li>
 *   <li>{@code **} (right associative)</li>
 * </ul>
 * The ternary {@code c ? a : b} sits below all of them. Unary {@code not} and {@code !} parse their
 * operand at precedence 50, unary {@code -} and {@code +} at 90.
 */
public class ExprParser {
    private static final ImmutableMap<String, Integer> BINARY_PRECEDENCE = Maps.mutable.<String, Integer>empty()
            .withKeyValue("or", 10).withKeyValue("||", 10)
            .withKeyValue("and", 15).withKeyValue("&&", 15)
            .withKeyValue("==", 20).withKeyValue("!=", 20)
            .withKeyValue("<", 20).withKeyValue("<=", 20)
            .withKeyValue(">", 20).withKeyValue(">=", 20)
            .withKeyValue("in", 20).withKeyValue("not in", 20)
            .withKeyValue("matches", 20).withKeyValue("contains", 20)
            .withKeyValue("startsWith", 20).withKeyValue("endsWith", 20)
            .withKeyValue("..", 25)
            .withKeyValue("+", 30).withKeyValue("-", 30)
            .withKeyValue("*", 60).withKeyValue("/", 60).withKeyValue("%", 60)
            .withKeyValue("**", 100)
            .toImmutable();

    private static final int NOT_PRECEDENCE = 50;
    private static final int SIGN_PRECEDENCE = 90;

    private MutableList<Token> tokens;
    private int index;

    public ExprNode parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExprParseException("empty expression", 0);
        }
        tokens = new ExprLexer(expression).tokenize();
        index = 0;

        ExprNode node = parseTernary();
        Token trailing = peek();
        if (trailing.type() != Token.Type.EOF) {
            throw new ExprParseException("unexpected " + trailing.describe(), trailing.position());
        }
        return node;
    }

    private ExprNode parseTernary() {
        ExprNode condition = parseBinary(0);
        if (!peek().isOperator("?")) {
            return condition;
        }
        advance();
        ExprNode whenTrue = parseTernary();
        expectOperator(":");
        ExprNode whenFalse = parseTernary();
        return new ExprNode.ConditionalOp(condition, whenTrue, whenFalse);
    }

    private ExprNode parseBinary(int minPrecedence) {
        ExprNode left = parseUnary();
        while (true) {
            String operator = peekBinaryOperator();
            if (operator == null) {
                return left;
            }
            int precedence = BINARY_PRECEDENCE.get(operator);
            if (precedence < minPrecedence) {
                return left;
            }
            // "not in" spans two tokens
            advance();
            if (operator.equals("not in")) {
                advance();
            }
            int nextMin = operator.equals("**") ? precedence : precedence + 1;
            ExprNode right = parseBinary(nextMin);
            left = binary(operator, left, right);
        }
    }

    private static ExprNode binary(String operator, ExprNode left, ExprNode right) {
        return switch (operator) {
            case "matches" -> new ExprNode.MatchesOp(left, right);
            case ".." -> new ExprNode.RangeLiteral(left, right);
            default -> new ExprNode.BinaryOp(operator, left, right);
        };
    }

    private String peekBinaryOperator() {
        Token token = peek();
        if (token.type() != Token.Type.OPERATOR) {
            return null;
        }
        if (token.text().equals("not")) {
            return peekAt(1).isOperator("in") ? "not in" : null;
        }
        return BINARY_PRECEDENCE.containsKey(token.text()) ? token.text() : null;
    }

    private ExprNode parseUnary() {
        Token token = peek();
        if (token.isOperator("not") || token.isOperator("!")) {
            advance();
            return new ExprNode.UnaryOp(token.text(), parseBinary(NOT_PRECEDENCE));
        }
        if (token.isOperator("-") || token.isOperator("+")) {
            advance();
            return new ExprNode.UnaryOp(token.text(), parseBinary(SIGN_PRECEDENCE));
        }
        return parsePostfix(parsePrimary());
    }

    private ExprNode parsePostfix(ExprNode node) {
        while (peek().isOperator(".")) {
            advance();
            Token property = advance();
            if (property.type() != Token.Type.IDENTIFIER && property.type() != Token.Type.OPERATOR) {
                throw new ExprParseException("expected property name but found " + property.describe(),
                        property.position());
            }
            node = new ExprNode.MemberAccess(node, property.text());
        }
        return node;
    }

    private ExprNode parsePrimary() {
        Token token = advance();
        switch (token.type()) {
            case INTEGER:
                try {
                    return new ExprNode.IntegerLiteral(Long.parseLong(token.text()));
                } catch (NumberFormatException e) {
                    throw new ExprParseException("integer out of range '" + token.text() + "'", token.position());
                }
            case FLOAT:
                return new ExprNode.FloatLiteral(Double.parseDouble(token.text()));
            case STRING:
                return new ExprNode.StringLiteral(token.text());
            case IDENTIFIER:
                return identifierOrCall(token);
            case PUNCTUATION:
                if (token.text().equals("(")) {
                    ExprNode inner = parseTernary();
                    expectPunctuation(")");
                    return inner;
                }
                if (token.text().equals("[")) {
                    return new ExprNode.ArrayLiteral(parseList("]").toImmutable());
                }
                break;
            default:
                break;
        }
        throw new ExprParseException("unexpected " + token.describe(), token.position());
    }

    private ExprNode identifierOrCall(Token token) {
        switch (token.text()) {
            case "true":
                return new ExprNode.BoolLiteral(true);
            case "false":
                return new ExprNode.BoolLiteral(false);
            case "nil":
                return new ExprNode.NilLiteral();
            default:
                break;
        }
        if (peek().isPunctuation("(")) {
            advance();
            return new ExprNode.FunctionCall(token.text(), parseList(")").toImmutable());
        }
        return new ExprNode.Identifier(token.text());
    }

    private MutableList<ExprNode> parseList(String closing) {
        MutableList<ExprNode> elements = Lists.mutable.empty();
        if (peek().isPunctuation(closing)) {
            advance();
            return elements;
        }
        while (true) {
            elements.add(parseTernary());
            Token token = advance();
            if (token.isPunctuation(closing)) {
                return elements;
            }
            if (!token.isPunctuation(",")) {
                throw new ExprParseException("expected ',' or '" + closing + "' but found " + token.describe(),
                        token.position());
            }
        }
    }

    private void expectOperator(String text) {
        Token token = advance();
        if (!token.isOperator(text)) {
            throw new ExprParseException("expected '" + text + "' but found " + token.describe(), token.position());
        }
    }

    private void expectPunctuation(String text) {
        Token token = advance();
        if (!token.isPunctuation(text)) {
            throw new ExprParseException("expected '" + text + "' but found " + token.describe(), token.position());
        }
    }

    private Token peek() {
        return peekAt(0);
    }

    private Token peekAt(int offset) {
        int i = Math.min(index + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != Token.Type.EOF) {
            index++;
        }
        return token;
    }
}
