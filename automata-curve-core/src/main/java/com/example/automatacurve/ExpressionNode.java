package com.example.automatacurve;

import java.math.BigInteger;

/** Parsed expression tree. */
public abstract class ExpressionNode {

    /** @param x value bound to the variable, unused by variable-free trees */
    public abstract BigInteger evaluate(BigInteger x);

    public abstract boolean hasVariable();

    /** Fully parenthesised text of the tree. */
    public abstract String toText();

    @Override
    public String toString() {
        return toText();
    }

    public static class Literal extends ExpressionNode {
        private final BigInteger value;

        public Literal(BigInteger value) {
            this.value = value;
        }

        public BigInteger getValue() { return value; }

        @Override
        public BigInteger evaluate(BigInteger x) { return value; }

        @Override
        public boolean hasVariable() { return false; }

        @Override
        public String toText() { return value.toString(); }
    }

    public static class Variable extends ExpressionNode {
        private final String name;

        public Variable(String name) {
            this.name = name;
        }

        public String getName() { return name; }

        @Override
        public BigInteger evaluate(BigInteger x) {
            if (x == null) {
                throw new IllegalStateException("Variable " + name + " is unbound");
            }
            return x;
        }

        @Override
        public boolean hasVariable() { return true; }

        @Override
        public String toText() { return name; }
    }

    public static class Unary extends ExpressionNode {
        private final Operator op;
        private final ExpressionNode operand;

        public Unary(Operator op, ExpressionNode operand) {
            this.op = op;
            this.operand = operand;
        }

        public Operator getOperator() { return op; }
        public ExpressionNode getOperand() { return operand; }

        @Override
        public BigInteger evaluate(BigInteger x) { return op.apply(operand.evaluate(x)); }

        @Override
        public boolean hasVariable() { return operand.hasVariable(); }

        @Override
        public String toText() { return "(" + op.getSymbol() + operand.toText() + ")"; }
    }

    public static class Binary extends ExpressionNode {
        private final Operator op;
        private final ExpressionNode left;
        private final ExpressionNode right;

        public Binary(Operator op, ExpressionNode left, ExpressionNode right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        public Operator getOperator() { return op; }
        public ExpressionNode getLeft() { return left; }
        public ExpressionNode getRight() { return right; }

        @Override
        public BigInteger evaluate(BigInteger x) {
            return op.apply(left.evaluate(x), right.evaluate(x));
        }

        @Override
        public boolean hasVariable() { return left.hasVariable() || right.hasVariable(); }

        @Override
        public String toText() {
            return "(" + left.toText() + " " + op.getSymbol() + " " + right.toText() + ")";
        }
    }
}
