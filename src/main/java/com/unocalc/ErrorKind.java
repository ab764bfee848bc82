package com.unocalc;

/**
 * The kinds of failure a calculation can report.
 */
public enum ErrorKind {
    /** Non-numeric argument, or an argument outside the operation's domain. */
    INVALID_INPUT,
    /** Division with a zero denominator. */
    DIVISION_BY_ZERO,
    /** A result whose magnitude exceeds {@link Calculator#MAX_MAGNITUDE}. */
    OVERFLOW
}
