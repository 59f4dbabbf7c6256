package com.example.automatacurve;

import java.math.BigInteger;
import java.util.function.UnaryOperator;

/** A validated single-variable integer function produced by {@link ExpressionCompiler}. */
public class CompiledExpression implements UnaryOperator<BigInteger> {

    private final ExpressionNode root;
    private final String variable;
    private final int base;

    CompiledExpression(ExpressionNode root, String variable, int base) {
        this.root = root;
        this.variable = variable;
        this.base = base;
    }

    @Override
    public BigInteger apply(BigInteger x) {
        return root.evaluate(x);
    }

    public BigInteger apply(long x) {
        return apply(BigInteger.valueOf(x));
    }

    /** Fully parenthesised text; divisions appear as multiplications by a base-{@code base} reciprocal. */
    public String text() {
        return root.toText();
    }

    public String getVariable() { return variable; }

    public int getBase() { return base; }

    @Override
    public String toString() {
        return "lambda " + variable + ": " + text();
    }
}
