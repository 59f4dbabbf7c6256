package com.example.automatacurve;

/** Thrown when a symbol or state handed to the model is not declared. */
public class InvalidSymbolOrStateException extends TransducerException {
    public InvalidSymbolOrStateException(String message) { super(message); }
}
