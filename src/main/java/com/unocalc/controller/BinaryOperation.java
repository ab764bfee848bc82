package com.unocalc.controller;

import com.unocalc.Calculator;

/**
 * Operators that wait for a second operand before they are resolved.
 */
public enum BinaryOperation {
    ADD {
        @Override
        public double apply(Calculator calculator, double a, double b) {
            return calculator.add(a, b);
        }
    },
    SUBTRACT {
        @Override
        public double apply(Calculator calculator, double a, double b) {
            return calculator.subtract(a, b);
        }
    },
    MULTIPLY {
        @Override
        public double apply(Calculator calculator, double a, double b) {
            return calculator.multiply(a, b);
        }
    },
    DIVIDE {
        @Override
        public double apply(Calculator calculator, double a, double b) {
            return calculator.divide(a, b);
        }
    },
    POWER {
        @Override
        public double apply(Calculator calculator, double a, double b) {
            return calculator.power(a, b);
        }
    };

    public abstract double apply(Calculator calculator, double a, double b);
}
