package com.unocalc.controller;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Utility methods for the calculator's display text.
 */
public class DisplayText {

    public static final char DECIMAL_POINT = '.';

    private DisplayText() {
    }

    /**
     * Renders a value for the display. Whole finite doubles drop their fractional part.
     */
    public static String format(double value) {
        if (Double.isFinite(value) && value == Math.rint(value)) {
            return new BigDecimal(value).toBigInteger().toString();
        }
        return Double.toString(value);
    }

    public static String format(Number value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigInteger) {
            return value.toString();
        }
        return format(value.doubleValue());
    }

    public static boolean isEmpty(String text) {
        return text == null || text.isEmpty();
    }

    public static boolean hasDecimalPoint(String text) {
        return text != null && text.indexOf(DECIMAL_POINT) >= 0;
    }

    public static String dropLast(String text) {
        if (isEmpty(text)) {
            return "";
        }
        return text.substring(0, text.length() - 1);
    }
}
