package com.example.automatacurve;

import java.math.BigInteger;

/**
 * Positional encodings that embed words and integers into the real line.
 * <p>
 * Precision is bounded by the number of symbols or digits consumed; nothing
 * here is exact beyond {@code double}.
 */
public final class NumericEncoder {

    private NumericEncoder() {
    }

    /**
     * Σ ranks[i-1] / base^i for i = 1..n.
     * <p>
     * {@link TransducerModel#toNumber(String)} calls this with base k (the
     * alphabet size), the automaton curve mode with base k + 1.
     */
    public static double wordToNumber(int[] ranks, int base) {
        double value = 0;
        double scale = 1;
        for (int rank : ranks) {
            scale /= base;
            value += rank * scale;
        }
        return value;
    }

    public static boolean isPowerOfTwo(int base) {
        return base >= 2 && (base & (base - 1)) == 0;
    }

    /**
     * Splits {@code num} into {@code n} base-{@code base} digits.
     * <p>
     * For a power-of-two base the binary form of |num| is left-filled to
     * {@code n * log2(base)} bits (with ones when num is negative, zeros
     * otherwise), or cut down to its low bits when longer, then grouped into
     * digits most significant first. Any other base uses floor division and
     * yields digits least significant first.
     */
    public static int[] padicDigits(BigInteger num, int n, int base) {
        if (base < 2) {
            throw new IllegalArgumentException("Base must be at least 2, got " + base);
        }
        int[] digits = new int[Math.max(n, 0)];
        if (isPowerOfTwo(base)) {
            int digitLen = Integer.numberOfTrailingZeros(base);
            int bits = n * digitLen;
            String str = num.abs().toString(2);
            char filling = num.signum() < 0 ? '1' : '0';
            if (str.length() < bits) {
                StringBuilder sb = new StringBuilder(bits);
                for (int i = str.length(); i < bits; i++) {
                    sb.append(filling);
                }
                str = sb.append(str).toString();
            } else if (str.length() > bits) {
                str = str.substring(str.length() - bits);
            }
            for (int i = 0; i < n; i++) {
                digits[i] = Integer.parseInt(str.substring(i * digitLen, (i + 1) * digitLen), 2);
            }
        } else {
            BigInteger b = BigInteger.valueOf(base);
            for (int i = 0; i < n; i++) {
                if (num.signum() == 0) {
                    break;
                }
                BigInteger[] qr = floorDivMod(num, b);
                digits[i] = qr[1].intValue();
                num = qr[0];
            }
        }
        return digits;
    }

    public static double padicToGeom(long num, int n, int base) {
        return padicToGeom(BigInteger.valueOf(num), n, base);
    }

    /** Σ (digit[n-i-1] + 1) / (base+1)^i for i = 0..n-1, digits from {@link #padicDigits}. */
    public static double padicToGeom(BigInteger num, int n, int base) {
        return geom(padicDigits(num, n, base), base);
    }

    static double geom(int[] digits, int base) {
        int n = digits.length;
        double res = 0;
        double scale = 1;
        for (int i = 0; i < n; i++) {
            res += (digits[n - i - 1] + 1) * scale;
            scale /= base + 1;
        }
        return res;
    }

    /** Reassembles digits produced by {@link #padicDigits}, honouring the digit order of each base kind. */
    public static BigInteger digitsToInteger(int[] digits, int base) {
        BigInteger b = BigInteger.valueOf(base);
        BigInteger value = BigInteger.ZERO;
        if (isPowerOfTwo(base)) {
            for (int d : digits) {
                value = value.multiply(b).add(BigInteger.valueOf(d));
            }
        } else {
            for (int i = digits.length - 1; i >= 0; i--) {
                value = value.multiply(b).add(BigInteger.valueOf(digits[i]));
            }
        }
        return value;
    }

    /** Quotient and remainder rounded toward negative infinity. */
    static BigInteger[] floorDivMod(BigInteger a, BigInteger b) {
        BigInteger[] qr = a.divideAndRemainder(b);
        if (qr[1].signum() != 0 && qr[1].signum() != b.signum()) {
            qr[0] = qr[0].subtract(BigInteger.ONE);
            qr[1] = qr[1].add(b);
        }
        return qr;
    }
}
