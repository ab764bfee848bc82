package com.unocalc.controller;

import com.unocalc.CalculationException;
import com.unocalc.Calculator;
import com.unocalc.CalculatorSettings;
import com.unocalc.ErrorKind;

/**
 * Functions applied straight away to the displayed value.
 */
public enum UnaryFunction {
    FACTORIAL {
        @Override
        public Number apply(Calculator calculator, CalculatorSettings settings, double x) {
            if (x > settings.getFactorialMaxInput()) {
                throw new CalculationException(ErrorKind.INVALID_INPUT,
                        "Error: Factorial input exceeds the limit of " + settings.getFactorialMaxInput() + ".");
            }
            return calculator.factorial(x);
        }
    },
    SQUARE {
        @Override
        public Number apply(Calculator calculator, CalculatorSettings settings, double x) {
            return calculator.power(x, 2);
        }
    },
    NATURAL_LOG {
        @Override
        public Number apply(Calculator calculator, CalculatorSettings settings, double x) {
            return calculator.naturalLog(x);
        }
    },
    SQUARE_ROOT {
        @Override
        public Number apply(Calculator calculator, CalculatorSettings settings, double x) {
            return calculator.squareRoot(x);
        }
    },
    EXP {
        @Override
        public Number apply(Calculator calculator, CalculatorSettings settings, double x) {
            return calculator.exp(x);
        }
    };

    /**
     * @return a {@link Double}, or a {@link java.math.BigInteger} for {@link #FACTORIAL}
     */
    public abstract Number apply(Calculator calculator, CalculatorSettings settings, double x);
}
