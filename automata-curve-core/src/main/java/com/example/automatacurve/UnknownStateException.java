package com.example.automatacurve;

/** Thrown when a state name is not declared in the model. */
public class UnknownStateException extends TransducerException {
    public UnknownStateException(String message) { super(message); }
}
