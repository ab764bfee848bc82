package com.unocalc;

import org.junit.Test;
import static org.junit.Assert.*;

public class OutcomeTest {

    @Test
    public void testSuccessfulCalculation() {
        Outcome<Double> outcome = Outcome.of(() -> new Calculator().add(2, 2));
        assertTrue(outcome.isSuccess());
        assertEquals(4.0, outcome.getValue(), 0.0);
        assertNull(outcome.getErrorKind());
        assertNull(outcome.getMessage());
    }

    @Test
    public void testFailedCalculationCarriesKindAndMessage() {
        Outcome<Double> outcome = Outcome.of(() -> new Calculator().divide(1, 0));
        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.DIVISION_BY_ZERO, outcome.getErrorKind());
        assertEquals("Error: Cannot divide by zero. Please enter a valid denominator.", outcome.getMessage());
    }

    @Test(expected = IllegalStateException.class)
    public void testValueOfFailureIsUnavailable() {
        Outcome.failure(ErrorKind.OVERFLOW, "too big").getValue();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOtherExceptionsPropagate() {
        Outcome.of(() -> {
            throw new IllegalArgumentException("bug");
        });
    }
}
