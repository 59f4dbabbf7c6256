package com.example.automatacurve;

/** Thrown when a word contains a character outside the input alphabet. */
public class AlphabetMismatchException extends TransducerException {
    public AlphabetMismatchException(String message) { super(message); }
}
