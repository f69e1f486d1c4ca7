package com.wayq.expr;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Splits filter text into tokens. Word operators ({@code and}, {@code in}, {@code contains}, ...) are
 * reported as {@link Token.Type#OPERATOR}; {@code true}, {@code false} and {@code nil} stay identifiers.
 */
public class ExprLexer {
    private static final ImmutableSet<String> WORD_OPERATORS = Sets.immutable.with(
            "and", "or", "not", "in", "matches", "contains", "startsWith", "endsWith");

    // Longest first
    private static final String[] SYMBOL_OPERATORS = {
            "**", "==", "!=", "<=", ">=", "&&", "||", "..",
            "<", ">", "!", "+", "-", "*", "/", "%", "?", ":", "."
    };

    private final String input;
    private int pos;

    public ExprLexer(String input) {
        this.input = input;
    }

    public MutableList<Token> tokenize() {
        MutableList<Token> tokens = Lists.mutable.empty();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(Token.Type.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = input.charAt(pos);
        if (Character.isDigit(c) || (c == '.' && isDigitAt(pos + 1))) {
            return number();
        }
        if (isIdentifierStart(c)) {
            return word();
        }
        if (c == '\'' || c == '"') {
            return string(c);
        }
        if (c == '(' || c == ')' || c == '[' || c == ']' || c == ',') {
            return new Token(Token.Type.PUNCTUATION, String.valueOf(c), pos++);
        }
        for (String op : SYMBOL_OPERATORS) {
            if (input.startsWith(op, pos)) {
                Token token = new Token(Token.Type.OPERATOR, op, pos);
                pos += op.length();
                return token;
            }
        }
        throw new ExprParseException("unexpected character '" + c + "'", pos);
    }

    private Token number() {
        int start = pos;
        boolean isFloat = false;
        while (isDigitAt(pos)) {
            pos++;
        }
        // a '.' followed by another '.' starts a range, not a fraction
        if (pos < input.length() && input.charAt(pos) == '.' && !input.startsWith("..", pos)) {
            isFloat = true;
            pos++;
            while (isDigitAt(pos)) {
                pos++;
            }
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int exponent = pos + 1;
            if (exponent < input.length() && (input.charAt(exponent) == '+' || input.charAt(exponent) == '-')) {
                exponent++;
            }
            if (!isDigitAt(exponent)) {
                throw new ExprParseException("malformed number '" + input.substring(start, exponent) + "'", start);
            }
            isFloat = true;
            pos = exponent;
            while (isDigitAt(pos)) {
                pos++;
            }
        }
        return new Token(isFloat ? Token.Type.FLOAT : Token.Type.INTEGER, input.substring(start, pos), start);
    }

    private Token word() {
        int start = pos;
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            pos++;
        }
        String text = input.substring(start, pos);
        Token.Type type = WORD_OPERATORS.contains(text) ? Token.Type.OPERATOR : Token.Type.IDENTIFIER;
        return new Token(type, text, start);
    }

    private Token string(char quote) {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote) {
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (pos >= input.length()) {
                break;
            }
            char escaped = input.charAt(pos++);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '\\', '\'', '"' -> sb.append(escaped);
                default -> throw new ExprParseException("invalid escape '\\" + escaped + "'", pos - 2);
            }
        }
        throw new ExprParseException("unterminated string", start);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private boolean isDigitAt(int index) {
        return index < input.length() && Character.isDigit(input.charAt(index));
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c);
    }
}
