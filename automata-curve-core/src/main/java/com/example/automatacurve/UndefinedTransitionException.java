package com.example.automatacurve;

/** Thrown when a (state, symbol) cell was never set. */
public class UndefinedTransitionException extends TransducerException {
    public UndefinedTransitionException(String message) { super(message); }
}
