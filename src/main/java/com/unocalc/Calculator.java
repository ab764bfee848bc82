package com.unocalc;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Arithmetic operations behind the calculator keys.
 *
 * <p>The class holds no state, so a single instance can be shared freely.
 * Failures are reported as {@link CalculationException}.
 */
public class Calculator {

    /** Largest magnitude {@link #checkOverflow(double)} accepts. */
    public static final double MAX_MAGNITUDE = 1e100;

    private static final BigDecimal MAX_MAGNITUDE_EXACT = new BigDecimal(MAX_MAGNITUDE);

    public double add(double a, double b) {
        return a + b;
    }

    public double subtract(double a, double b) {
        return a - b;
    }

    public double multiply(double a, double b) {
        return a * b;
    }

    public double divide(double a, double b) {
        if (b == 0) {
            throw new CalculationException(ErrorKind.DIVISION_BY_ZERO,
                    "Error: Cannot divide by zero. Please enter a valid denominator.");
        }
        return a / b;
    }

    public double power(double base, double exponent) {
        return Math.pow(base, exponent);
    }

    /**
     * Computes n! exactly.
     *
     * @param n a non-negative whole number no larger than {@link Integer#MAX_VALUE}
     * @return the factorial of {@code n}
     * @throws CalculationException with {@link ErrorKind#INVALID_INPUT} if {@code n}
     *         is negative, fractional or not finite
     */
    public BigInteger factorial(double n) {
        if (Double.isNaN(n) || Double.isInfinite(n)) {
            throw new CalculationException(ErrorKind.INVALID_INPUT,
                    "Error: Invalid input. Please enter a numeric value.");
        }
        if (n < 0) {
            throw new CalculationException(ErrorKind.INVALID_INPUT,
                    "Error: Cannot compute the factorial of a negative number.");
        }
        if (n != Math.rint(n)) {
            throw new CalculationException(ErrorKind.INVALID_INPUT,
                    "Error: Cannot compute the factorial of a non-integer number.");
        }
        if (n > Integer.MAX_VALUE) {
            throw new CalculationException(ErrorKind.INVALID_INPUT,
                    "Error: Factorial input is too large.");
        }
        int limit = (int) n;
        BigInteger result = BigInteger.ONE;
        for (int i = 2; i <= limit; i++) {
            result = result.multiply(BigInteger.valueOf(i));
        }
        return result;
    }

    public double naturalLog(double a) {
        if (a <= 0) {
            throw new CalculationException(ErrorKind.INVALID_INPUT,
                    "Error: Cannot calculate the natural logarithm of a non-positive number.");
        }
        return Math.log(a);
    }

    public double squareRoot(double a) {
        if (a < 0) {
            throw new CalculationException(ErrorKind.INVALID_INPUT,
                    "Error: Cannot calculate the square root of a negative number.");
        }
        return Math.sqrt(a);
    }

    public double exp(double a) {
        return Math.exp(a);
    }

    /**
     * Checks that every value is a non-null {@link Number}.
     *
     * @throws CalculationException with {@link ErrorKind#INVALID_INPUT} otherwise
     */
    public void validateInput(Object... values) {
        if (values == null) {
            throw invalidInput();
        }
        for (Object value : values) {
            if (!(value instanceof Number)) {
                throw invalidInput();
            }
        }
    }

    /**
     * @throws CalculationException with {@link ErrorKind#OVERFLOW} if
     *         {@code |value| > MAX_MAGNITUDE}
     */
    public void checkOverflow(double value) {
        if (Math.abs(value) > MAX_MAGNITUDE) {
            throw overflow();
        }
    }

    public void checkOverflow(BigInteger value) {
        if (new BigDecimal(value.abs()).compareTo(MAX_MAGNITUDE_EXACT) > 0) {
            throw overflow();
        }
    }

    private static CalculationException invalidInput() {
        return new CalculationException(ErrorKind.INVALID_INPUT,
                "Error: Invalid input. Please enter a numeric value.");
    }

    private static CalculationException overflow() {
        return new CalculationException(ErrorKind.OVERFLOW,
                "Error: Calculation result exceeds the maximum limit.");
    }
}
