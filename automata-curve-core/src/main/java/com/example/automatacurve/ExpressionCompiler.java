package com.example.automatacurve;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles curve expressions such as {@code 3*x + 1} or {@code x ^ (x << 1)}
 * into functions that respect the base-{@code base} numeral system.
 * <p>
 * Division is only allowed by a constant that is not a multiple of the base
 * and is rewritten into multiplication by the base-adic expansion of the
 * reciprocal. Shifts are only allowed by the constant 1. These two rules are
 * the only restrictions applied; nothing else about the resulting function is
 * checked.
 */
public final class ExpressionCompiler {

    private static final Logger logger = Logger.getLogger("com.example.automatacurve");
    private static final Level level = Level.FINE;

    public static final String DEFAULT_VARIABLE = "x";

    /** Digits kept in a reciprocal expansion. */
    public static final int MIN_PADIC_DIGITS = 32;

    private ExpressionCompiler() {
    }

    public static List<String> allowedOperations() {
        List<String> ops = new ArrayList<>();
        for (Operator op : Operator.values()) {
            ops.add(op.getSymbol());
        }
        return ops;
    }

    public static String parseExpression(String expression, int base) throws ExpressionException {
        return parseExpression(expression, base, DEFAULT_VARIABLE);
    }

    /** @return the compiled expression text */
    public static String parseExpression(String expression, int base, String variable) throws ExpressionException {
        return compile(expression, base, variable).text();
    }

    public static CompiledExpression compile(String expression, int base) throws ExpressionException {
        return compile(expression, base, DEFAULT_VARIABLE);
    }

    public static CompiledExpression compile(String expression, int base, String variable) throws ExpressionException {
        if (base < 2) {
            throw new IllegalArgumentException("Base must be at least 2, got " + base);
        }
        ExpressionNode tree = new ExpressionParser(expression).parse();
        ExpressionNode compiled = rewrite(tree, base, variable);
        logger.log(level, "compiled '" + expression + "' in base " + base + " to " + compiled.toText());
        return new CompiledExpression(compiled, variable, base);
    }

    private static ExpressionNode rewrite(ExpressionNode node, int base, String variable) throws ExpressionException {
        if (node instanceof ExpressionNode.Literal) {
            return node;
        }
        if (node instanceof ExpressionNode.Variable) {
            String name = ((ExpressionNode.Variable) node).getName();
            if (!name.equals(variable)) {
                throw new ExpressionException(ExpressionException.Kind.UNKNOWN_VARIABLE, "Unknown variable: " + name);
            }
            return node;
        }
        if (node instanceof ExpressionNode.Unary) {
            ExpressionNode.Unary u = (ExpressionNode.Unary) node;
            return new ExpressionNode.Unary(u.getOperator(), rewrite(u.getOperand(), base, variable));
        }

        ExpressionNode.Binary b = (ExpressionNode.Binary) node;
        ExpressionNode left = fold(rewrite(b.getLeft(), base, variable));
        ExpressionNode right = fold(rewrite(b.getRight(), base, variable));
        Operator op = b.getOperator();

        if (op == Operator.DIV) {
            BigInteger divisor = right instanceof ExpressionNode.Literal
                    ? ((ExpressionNode.Literal) right).getValue() : null;
            if (divisor == null || divisor.mod(BigInteger.valueOf(base)).signum() == 0) {
                throw new ExpressionException(ExpressionException.Kind.ILLEGAL_DIVISION,
                        "Incorrect division: " + base + " is divisor of " + right.toText());
            }
            BigInteger reciprocal = fracToPadic(BigInteger.ONE, divisor, base, MIN_PADIC_DIGITS);
            return new ExpressionNode.Binary(Operator.MUL, left, new ExpressionNode.Literal(reciprocal));
        }
        if (op == Operator.SHL || op == Operator.SHR) {
            if (!(right instanceof ExpressionNode.Literal)
                    || !((ExpressionNode.Literal) right).getValue().equals(BigInteger.ONE)) {
                throw new ExpressionException(ExpressionException.Kind.ILLEGAL_SHIFT,
                        "Incorrect shift: only shifts by 1 are allowed, got " + right.toText());
            }
        }
        return new ExpressionNode.Binary(op, left, right);
    }

    /** Replaces a variable-free subtree by its value. */
    private static ExpressionNode fold(ExpressionNode node) throws ExpressionException {
        if (node.hasVariable() || node instanceof ExpressionNode.Literal) {
            return node;
        }
        try {
            return new ExpressionNode.Literal(node.evaluate(null));
        } catch (ArithmeticException e) {
            throw new ExpressionException(ExpressionException.Kind.INVALID_CONSTANT,
                    "Cannot evaluate " + node.toText() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Base-{@code base} expansion of {@code numer / denom}, returned as the
     * integer Σ a_i·base^i.
     * <p>
     * Digits are produced until a remainder repeats or {@code minDigits}
     * digits exist, whichever comes first. A detected period is then repeated
     * up to {@code minDigits} digits, so the result always has exactly
     * {@code minDigits} digits and is exact modulo base^minDigits.
     *
     * @throws ExpressionException if the fraction has no expansion in this base
     */
    public static BigInteger fracToPadic(BigInteger numer, BigInteger denom, int base, int minDigits)
            throws ExpressionException {
        BigInteger b = BigInteger.valueOf(base);
        Map<BigInteger, Integer> seen = new HashMap<>();
        List<Integer> digits = new ArrayList<>();
        BigInteger r = numer;
        if (minDigits < 1) {
            throw new IllegalArgumentException("At least one digit is required, got " + minDigits);
        }
        while (!seen.containsKey(r) && digits.size() < minDigits) {
            seen.put(r, digits.size());
            int digit = -1;
            for (int a = 0; a < base; a++) {
                if (r.subtract(denom.multiply(BigInteger.valueOf(a))).mod(b).signum() == 0) {
                    digit = a;
                    break;
                }
            }
            if (digit < 0) {
                throw new ExpressionException(ExpressionException.Kind.ILLEGAL_DIVISION,
                        "Incorrect division: " + numer + "/" + denom + " has no expansion in base " + base);
            }
            digits.add(digit);
            r = r.subtract(denom.multiply(BigInteger.valueOf(digit))).divide(b);
        }

        Integer periodStart = seen.get(r);
        if (periodStart != null) {
            int period = digits.size() - periodStart;
            while (digits.size() < minDigits) {
                digits.add(digits.get(periodStart + (digits.size() - periodStart) % period));
            }
        }

        BigInteger value = BigInteger.ZERO;
        for (int i = digits.size() - 1; i >= 0; i--) {
            value = value.multiply(b).add(BigInteger.valueOf(digits.get(i)));
        }
        return value;
    }
}
