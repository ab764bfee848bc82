package com.unocalc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Runtime settings, read from {@code calculator.properties} on the classpath.
 * A system property with the same key overrides the file.
 */
public final class CalculatorSettings {

    public static final String RESOURCE = "calculator.properties";

    public static final String TITLE_KEY = "calculator.title";
    public static final String OVERFLOW_CHECK_KEY = "calculator.overflow-check";
    public static final String FACTORIAL_MAX_INPUT_KEY = "calculator.factorial.max-input";

    private final String title;
    private final boolean overflowCheck;
    private final int factorialMaxInput;

    private CalculatorSettings(Builder builder) {
        this.title = builder.title;
        this.overflowCheck = builder.overflowCheck;
        this.factorialMaxInput = builder.factorialMaxInput;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CalculatorSettings defaults() {
        return builder().build();
    }

    /**
     * Loads {@link #RESOURCE} from the classpath, falling back to the defaults when it is absent.
     */
    public static CalculatorSettings load() {
        Properties properties = new Properties();
        try (InputStream in = CalculatorSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return fromProperties(properties, System.getProperties());
    }

    static CalculatorSettings fromProperties(Properties file, Properties overrides) {
        Builder builder = builder();
        String title = lookup(TITLE_KEY, file, overrides);
        if (title != null) {
            builder.title(title);
        }
        String overflowCheck = lookup(OVERFLOW_CHECK_KEY, file, overrides);
        if (overflowCheck != null) {
            builder.overflowCheck(parseBoolean(OVERFLOW_CHECK_KEY, overflowCheck));
        }
        String maxInput = lookup(FACTORIAL_MAX_INPUT_KEY, file, overrides);
        if (maxInput != null) {
            builder.factorialMaxInput(parseInt(FACTORIAL_MAX_INPUT_KEY, maxInput));
        }
        return builder.build();
    }

    private static String lookup(String key, Properties file, Properties overrides) {
        String value = overrides.getProperty(key);
        if (value == null) {
            value = file.getProperty(key);
        }
        return value == null ? null : value.trim();
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public String getTitle() {
        return title;
    }

    /** Whether results are passed through {@link Calculator#checkOverflow(double)}. */
    public boolean isOverflowCheck() {
        return overflowCheck;
    }

    /** Largest argument the calculator keys pass to {@link Calculator#factorial(double)}. */
    public int getFactorialMaxInput() {
        return factorialMaxInput;
    }

    @Override
    public String toString() {
        return "CalculatorSettings(title=" + title + ", overflowCheck=" + overflowCheck
                + ", factorialMaxInput=" + factorialMaxInput + ")";
    }

    public static class Builder {
        private String title = "UNO Calculator";
        private boolean overflowCheck = false;
        private int factorialMaxInput = 1000;

        public Builder title(String title) {
            if (title == null || title.isEmpty()) {
                throw new IllegalArgumentException("title must not be empty");
            }
            this.title = title;
            return this;
        }

        public Builder overflowCheck(boolean overflowCheck) {
            this.overflowCheck = overflowCheck;
            return this;
        }

        public Builder factorialMaxInput(int factorialMaxInput) {
            if (factorialMaxInput < 0) {
                throw new IllegalArgumentException("factorialMaxInput must be >= 0: " + factorialMaxInput);
            }
            this.factorialMaxInput = factorialMaxInput;
            return this;
        }

        public CalculatorSettings build() {
            return new CalculatorSettings(this);
        }
    }
}
