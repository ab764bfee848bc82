package com.unocalc;

import java.util.Properties;

import org.junit.Test;
import static org.junit.Assert.*;

public class CalculatorSettingsTest {

    @Test
    public void testDefaults() {
        CalculatorSettings settings = CalculatorSettings.defaults();
        assertEquals("UNO Calculator", settings.getTitle());
        assertFalse(settings.isOverflowCheck());
        assertEquals(1000, settings.getFactorialMaxInput());
    }

    @Test
    public void testLoadFromClasspath() {
        CalculatorSettings settings = CalculatorSettings.load();
        assertEquals("UNO Calculator", settings.getTitle());
        assertEquals(1000, settings.getFactorialMaxInput());
    }

    @Test
    public void testOverridesWinOverFile() {
        Properties file = new Properties();
        file.setProperty(CalculatorSettings.TITLE_KEY, "From file");
        file.setProperty(CalculatorSettings.OVERFLOW_CHECK_KEY, "false");
        file.setProperty(CalculatorSettings.FACTORIAL_MAX_INPUT_KEY, "50");
        Properties overrides = new Properties();
        overrides.setProperty(CalculatorSettings.OVERFLOW_CHECK_KEY, " TRUE ");

        CalculatorSettings settings = CalculatorSettings.fromProperties(file, overrides);
        assertEquals("From file", settings.getTitle());
        assertTrue(settings.isOverflowCheck());
        assertEquals(50, settings.getFactorialMaxInput());
    }

    @Test
    public void testMalformedValueNamesKey() {
        Properties file = new Properties();
        file.setProperty(CalculatorSettings.FACTORIAL_MAX_INPUT_KEY, "lots");
        try {
            CalculatorSettings.fromProperties(file, new Properties());
            fail("Expected malformed integer");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains(CalculatorSettings.FACTORIAL_MAX_INPUT_KEY));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedBoolean() {
        Properties file = new Properties();
        file.setProperty(CalculatorSettings.OVERFLOW_CHECK_KEY, "yes");
        CalculatorSettings.fromProperties(file, new Properties());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeFactorialLimit() {
        CalculatorSettings.builder().factorialMaxInput(-1);
    }
}
