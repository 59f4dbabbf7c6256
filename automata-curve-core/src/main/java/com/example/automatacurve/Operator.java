package com.example.automatacurve;

import java.math.BigInteger;

/**
 * Operators accepted in curve expressions, with integer semantics that
 * round toward negative infinity.
 */
public enum Operator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    NEG("-"),
    AND("&"),
    OR("|"),
    XOR("^"),
    NOT("!"),
    MOD("%"),
    FLOOR_DIV("//"),
    POW("**"),
    SHL("<<"),
    SHR(">>");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public BigInteger apply(BigInteger a) {
        switch (this) {
            case NEG:
                return a.negate();
            case NOT:
                return a.signum() == 0 ? BigInteger.ONE : BigInteger.ZERO;
            default:
                throw new IllegalStateException(this + " is not unary");
        }
    }

    /** @throws ArithmeticException on division by zero, a negative exponent or an oversized shift */
    public BigInteger apply(BigInteger a, BigInteger b) {
        switch (this) {
            case ADD:
                return a.add(b);
            case SUB:
                return a.subtract(b);
            case MUL:
                return a.multiply(b);
            case AND:
                return a.and(b);
            case OR:
                return a.or(b);
            case XOR:
                return a.xor(b);
            case MOD:
                return NumericEncoder.floorDivMod(a, b)[1];
            case FLOOR_DIV:
                return NumericEncoder.floorDivMod(a, b)[0];
            case POW:
                if (b.signum() < 0) {
                    throw new ArithmeticException("Negative exponent " + b);
                }
                return a.pow(b.intValueExact());
            case SHL:
                return a.shiftLeft(b.intValueExact());
            case SHR:
                return a.shiftRight(b.intValueExact());
            case DIV:
                throw new IllegalStateException("Division must be compiled away before evaluation");
            default:
                throw new IllegalStateException(this + " is not binary");
        }
    }
}
