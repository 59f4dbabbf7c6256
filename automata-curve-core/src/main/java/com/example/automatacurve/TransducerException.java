package com.example.automatacurve;

/**
 * Raised when a transducer is used against its preconditions: undeclared
 * symbols or states, missing table entries, no initial state.
 */
public class TransducerException extends RuntimeException {
    public TransducerException(String message) { super(message); }
    public TransducerException(String message, Throwable cause) { super(message, cause); }
}
