package com.example.automatacurve;

import java.math.BigInteger;

/**
 * Recursive-descent parser for integer expressions over one identifier.
 * <p>
 * Precedence, loosest first: {@code |}, {@code ^}, {@code &},
 * {@code << >>}, {@code + -}, {@code * / // %}, unary {@code - !},
 * {@code **}. Power is right-associative and binds tighter than a unary
 * minus on its left, so {@code -x**2} is {@code -(x**2)}.
 */
class ExpressionParser {

    private final String text;
    private int pos;

    ExpressionParser(String text) {
        this.text = text;
    }

    ExpressionNode parse() throws ExpressionException {
        skipBlanks();
        if (pos == text.length()) {
            throw new ExpressionException(ExpressionException.Kind.SYNTAX, "Expression is empty");
        }
        ExpressionNode node = parseOr();
        skipBlanks();
        if (pos < text.length()) {
            throw unexpected();
        }
        return node;
    }

    private ExpressionNode parseOr() throws ExpressionException {
        ExpressionNode node = parseXor();
        while (accept("|")) {
            node = new ExpressionNode.Binary(Operator.OR, node, parseXor());
        }
        return node;
    }

    private ExpressionNode parseXor() throws ExpressionException {
        ExpressionNode node = parseAnd();
        while (accept("^")) {
            node = new ExpressionNode.Binary(Operator.XOR, node, parseAnd());
        }
        return node;
    }

    private ExpressionNode parseAnd() throws ExpressionException {
        ExpressionNode node = parseShift();
        while (accept("&")) {
            node = new ExpressionNode.Binary(Operator.AND, node, parseShift());
        }
        return node;
    }

    private ExpressionNode parseShift() throws ExpressionException {
        ExpressionNode node = parseSum();
        while (true) {
            if (accept("<<")) {
                node = new ExpressionNode.Binary(Operator.SHL, node, parseSum());
            } else if (accept(">>")) {
                node = new ExpressionNode.Binary(Operator.SHR, node, parseSum());
            } else {
                return node;
            }
        }
    }

    private ExpressionNode parseSum() throws ExpressionException {
        ExpressionNode node = parseTerm();
        while (true) {
            if (accept("+")) {
                node = new ExpressionNode.Binary(Operator.ADD, node, parseTerm());
            } else if (accept("-")) {
                node = new ExpressionNode.Binary(Operator.SUB, node, parseTerm());
            } else {
                return node;
            }
        }
    }

    private ExpressionNode parseTerm() throws ExpressionException {
        ExpressionNode node = parseUnary();
        while (true) {
            if (accept("//")) {
                node = new ExpressionNode.Binary(Operator.FLOOR_DIV, node, parseUnary());
            } else if (accept("/")) {
                node = new ExpressionNode.Binary(Operator.DIV, node, parseUnary());
            } else if (accept("%")) {
                node = new ExpressionNode.Binary(Operator.MOD, node, parseUnary());
            } else if (peek("*") && !peek("**")) {
                accept("*");
                node = new ExpressionNode.Binary(Operator.MUL, node, parseUnary());
            } else {
                return node;
            }
        }
    }

    private ExpressionNode parseUnary() throws ExpressionException {
        if (accept("-")) {
            return new ExpressionNode.Unary(Operator.NEG, parseUnary());
        }
        if (accept("!")) {
            return new ExpressionNode.Unary(Operator.NOT, parseUnary());
        }
        if (peek("+") || peek("~")) {
            throw new ExpressionException(ExpressionException.Kind.UNSUPPORTED_OPERATOR,
                    "Incorrect operation: unary " + text.charAt(pos));
        }
        return parsePower();
    }

    private ExpressionNode parsePower() throws ExpressionException {
        ExpressionNode base = parsePrimary();
        if (accept("**")) {
            return new ExpressionNode.Binary(Operator.POW, base, parseUnary());
        }
        return base;
    }

    private ExpressionNode parsePrimary() throws ExpressionException {
        skipBlanks();
        if (pos == text.length()) {
            throw new ExpressionException(ExpressionException.Kind.SYNTAX, "Unexpected end of expression");
        }
        char c = text.charAt(pos);
        if (c == '(') {
            pos++;
            ExpressionNode inner = parseOr();
            if (!accept(")")) {
                throw new ExpressionException(ExpressionException.Kind.SYNTAX,
                        "Missing ')' at position " + pos);
            }
            return inner;
        }
        if (Character.isDigit(c)) {
            int start = pos;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            return new ExpressionNode.Literal(new BigInteger(text.substring(start, pos)));
        }
        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            while (pos < text.length()
                    && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            return new ExpressionNode.Variable(text.substring(start, pos));
        }
        throw unexpected();
    }

    private ExpressionException unexpected() {
        char c = text.charAt(pos);
        if (Character.isLetterOrDigit(c) || c == '(' || c == ')' || c == '_') {
            return new ExpressionException(ExpressionException.Kind.SYNTAX,
                    "Unexpected '" + c + "' at position " + pos);
        }
        return new ExpressionException(ExpressionException.Kind.UNSUPPORTED_OPERATOR,
                "Incorrect operation: '" + c + "' at position " + pos);
    }

    private boolean peek(String token) {
        skipBlanks();
        return text.startsWith(token, pos);
    }

    private boolean accept(String token) {
        if (peek(token)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private void skipBlanks() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }
}
