package com.example.automatacurve;

/** Thrown when simulation was requested before an initial state was set. */
public class NoInitialStateException extends TransducerException {
    public NoInitialStateException(String message) { super(message); }
}
