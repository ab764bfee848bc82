package com.unocalc;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * The result of a calculation: either a value or an {@link ErrorKind} with its message.
 *
 * @param <T> type of the successful value
 */
public final class Outcome<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String message;

    private Outcome(T value, ErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> Outcome<T> failure(ErrorKind kind, String message) {
        return new Outcome<>(null, Objects.requireNonNull(kind, "kind"), message);
    }

    /**
     * Runs {@code calculation}, turning a {@link CalculationException} into a failed outcome.
     */
    public static <T> Outcome<T> of(Supplier<T> calculation) {
        try {
            return success(calculation.get());
        } catch (CalculationException e) {
            return failure(e.getKind(), e.getMessage());
        }
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * @throws IllegalStateException if this outcome is a failure
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value for failed outcome: " + errorKind);
        }
        return value;
    }

    /** Returns the failure kind, or {@code null} on success. */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome(" + value + ")" : "Outcome(" + errorKind + ": " + message + ")";
    }
}
