package com.example.automatacurve;

/**
 * A problem in a user-supplied expression. Recoverable: the caller is
 * expected to show the message and let the user correct the text.
 */
public class ExpressionException extends Exception {

    public enum Kind {
        SYNTAX,
        UNKNOWN_VARIABLE,
        UNSUPPORTED_OPERATOR,
        ILLEGAL_DIVISION,
        ILLEGAL_SHIFT,
        INVALID_CONSTANT
    }

    private final Kind kind;

    public ExpressionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExpressionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
