package com.unocalc;

import java.util.Objects;

/**
 * Raised by {@link Calculator} when an operation cannot produce a result.
 * The message is the text shown to the user.
 */
public class CalculationException extends ArithmeticException {

    private final ErrorKind kind;

    public CalculationException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
