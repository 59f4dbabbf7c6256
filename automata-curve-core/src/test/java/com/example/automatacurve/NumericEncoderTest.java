package com.example.automatacurve;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class NumericEncoderTest {

    private static final double EPS = 1e-12;

    @Test
    void wordToNumberScalesRanksByBase() {
        assertEquals(1.0, NumericEncoder.wordToNumber(new int[] {1, 2}, 2), EPS);
        assertEquals(5.0 / 9, NumericEncoder.wordToNumber(new int[] {1, 2}, 3), EPS);
        assertEquals(0.0, NumericEncoder.wordToNumber(new int[0], 3), EPS);
    }

    @Test
    void transducerUsesAlphabetSizeAsBase() {
        TransducerModel model = SampleTransducers.twoState();
        // ranks 2, 1 over base 2
        assertEquals(2.0 / 2 + 1.0 / 4, model.toNumber("10"), EPS);
    }

    @Test
    void curveCoordinatesUseAlphabetSizePlusOne() {
        TransducerModel model = SampleTransducers.twoState();
        // ranks 2, 1 over base 3
        assertEquals(2.0 / 3 + 1.0 / 9, CurveComputation.inputNumber(model, "10"), EPS);
        assertEquals(1.0 / 3, CurveComputation.outputNumber(model, "0"), EPS);
    }

    @Test
    void binaryDigitsRoundTrip() {
        int[] digits = NumericEncoder.padicDigits(BigInteger.valueOf(5), 3, 2);
        assertArrayEquals(new int[] {1, 0, 1}, digits);
        BigInteger back = NumericEncoder.digitsToInteger(digits, 2);
        assertEquals(BigInteger.valueOf(5), back);
        assertArrayEquals(digits, NumericEncoder.padicDigits(back, 3, 2));
        assertEquals(2 + 1.0 / 3 + 2.0 / 9, NumericEncoder.padicToGeom(5, 3, 2), EPS);
    }

    @Test
    void longBinaryFormIsTruncatedToLowDigits() {
        assertArrayEquals(new int[] {0, 1}, NumericEncoder.padicDigits(BigInteger.valueOf(13), 2, 2));
        assertArrayEquals(new int[] {0, 1}, NumericEncoder.padicDigits(BigInteger.valueOf(-13), 2, 2));
    }

    @Test
    void negativeNumbersAreFilledWithOnes() {
        assertArrayEquals(new int[] {1, 1, 0, 1}, NumericEncoder.padicDigits(BigInteger.valueOf(-5), 4, 2));
        assertArrayEquals(new int[] {0, 1, 0, 1}, NumericEncoder.padicDigits(BigInteger.valueOf(5), 4, 2));
    }

    @Test
    void wideDigitsGroupBits() {
        int[] digits = NumericEncoder.padicDigits(BigInteger.valueOf(6), 2, 4);
        assertArrayEquals(new int[] {1, 2}, digits);
        assertEquals(BigInteger.valueOf(6), NumericEncoder.digitsToInteger(digits, 4));
        assertEquals((2 + 1) + (1 + 1) / 5.0, NumericEncoder.padicToGeom(6, 2, 4), EPS);
    }

    @Test
    void otherBasesUseRepeatedDivision() {
        int[] digits = NumericEncoder.padicDigits(BigInteger.valueOf(5), 3, 3);
        assertArrayEquals(new int[] {2, 1, 0}, digits);
        BigInteger back = NumericEncoder.digitsToInteger(digits, 3);
        assertEquals(BigInteger.valueOf(5), back);
        assertArrayEquals(digits, NumericEncoder.padicDigits(back, 3, 3));
    }

    @Test
    void negativeInOddBaseGivesAdicDigits() {
        assertArrayEquals(new int[] {2, 2, 2}, NumericEncoder.padicDigits(BigInteger.valueOf(-1), 3, 3));
        assertEquals(3 + 3 / 4.0 + 3 / 16.0, NumericEncoder.padicToGeom(-1, 3, 3), EPS);
    }

    @Test
    void noDigitsEncodeToZero() {
        assertEquals(0.0, NumericEncoder.padicToGeom(7, 0, 2), EPS);
        assertEquals(0.0, NumericEncoder.padicToGeom(7, 0, 3), EPS);
    }

    @Test
    void baseBelowTwoIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> NumericEncoder.padicToGeom(1, 2, 1));
    }
}
