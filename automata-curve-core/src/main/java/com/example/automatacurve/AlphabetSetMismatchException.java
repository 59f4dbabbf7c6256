package com.example.automatacurve;

/** Thrown when a new rank order is not a permutation of the alphabet. */
public class AlphabetSetMismatchException extends TransducerException {
    public AlphabetSetMismatchException(String message) { super(message); }
}
