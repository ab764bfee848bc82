package com.unocalc.controller;

import java.math.BigInteger;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.unocalc.CalculationException;
import com.unocalc.Calculator;
import com.unocalc.CalculatorSettings;
import com.unocalc.ErrorKind;
import com.unocalc.Outcome;

/**
 * Turns key presses into calculator operations and keeps the displayed text.
 *
 * <p>Errors never escape {@link #press(Action)}: they are handed to the {@link ErrorListener}
 * and the session is left as it was before the failing key. Not thread-safe; the front end
 * calls it from a single thread.
 */
public class InteractionController {

    private static final Logger log = LoggerFactory.getLogger(InteractionController.class);

    private final Calculator calculator;
    private final CalculatorSettings settings;
    private final ErrorListener errorListener;
    private final SessionState state = new SessionState();
    private String display = "";

    public InteractionController(Calculator calculator, CalculatorSettings settings, ErrorListener errorListener) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.errorListener = Objects.requireNonNull(errorListener, "errorListener");
    }

    public String getDisplay() {
        return display;
    }

    public SessionState getState() {
        return state;
    }

    public void press(Action action) {
        Objects.requireNonNull(action, "action");
        log.debug("Key {} on display '{}'", action.getLabel(), display);
        switch (action.getKind()) {
            case INPUT:
                enter(action.getSymbol());
                break;
            case BINARY_OPERATOR:
                chooseOperator(action.getBinaryOperation());
                break;
            case UNARY_FUNCTION:
                applyFunction(action.getUnaryFunction());
                break;
            case SIGN_TOGGLE:
                toggleSign();
                break;
            case CLEAR:
                clear();
                break;
            case DELETE:
                display = DisplayText.dropLast(display);
                break;
            case EQUALS:
                equals();
                break;
            default:
                throw new IllegalArgumentException("Unhandled action kind: " + action.getKind());
        }
    }

    private void enter(char symbol) {
        if (state.isResultFinalized()) {
            display = "";
            state.setResultFinalized(false);
            state.forgetRepeat();
        }
        if (symbol == DisplayText.DECIMAL_POINT && DisplayText.hasDecimalPoint(display)) {
            return;
        }
        if (state.isAwaitingFreshInput()) {
            display = "";
            state.setAwaitingFreshInput(false);
        }
        display = display + symbol;
    }

    private void chooseOperator(BinaryOperation operator) {
        if (state.hasPendingOperator()) {
            if (!resolve(state.getPendingOperator(), state.getFirstOperand())) {
                return;
            }
            state.setPending(operator, state.getLastResult());
        } else {
            Outcome<Double> current = Outcome.of(this::readDisplay);
            if (!current.isSuccess()) {
                report(current);
                return;
            }
            state.setPending(operator, current.getValue());
            state.setLastResult(current.getValue());
        }
        state.forgetRepeat();
        state.setAwaitingFreshInput(true);
        state.setResultFinalized(false);
    }

    private void equals() {
        if (state.hasPendingOperator()) {
            resolve(state.getPendingOperator(), state.getFirstOperand());
            return;
        }
        if (state.getRepeatOperator() != null) {
            resolve(state.getRepeatOperator(), state.getRepeatOperand());
            return;
        }
        Outcome<Double> second = Outcome.of(this::readDisplay);
        if (!second.isSuccess()) {
            report(second);
            return;
        }
        double result = second.getValue() != 0 ? second.getValue() : firstOperandOrZero();
        display = DisplayText.format(result);
        state.setLastResult(result);
    }

    /**
     * Applies {@code operator} to {@code first} and the displayed value.
     *
     * @return whether the operation succeeded
     */
    private boolean resolve(BinaryOperation operator, double first) {
        Outcome<Double> outcome = Outcome.of(() -> {
            double second = readDisplay();
            calculator.validateInput(first, second);
            double result = operator.apply(calculator, first, second);
            if (settings.isOverflowCheck()) {
                calculator.checkOverflow(result);
            }
            return result;
        });
        if (!outcome.isSuccess()) {
            report(outcome);
            return false;
        }
        double result = outcome.getValue();
        log.debug("{} {} -> {}", operator, first, result);
        state.setLastResult(result);
        display = DisplayText.format(result);
        state.clearPending();
        state.rememberRepeat(operator, first);
        state.setAwaitingFreshInput(true);
        state.setResultFinalized(true);
        return true;
    }

    private void applyFunction(UnaryFunction function) {
        if (DisplayText.isEmpty(display)) {
            return;
        }
        Outcome<Number> outcome = Outcome.of(() -> {
            double x = readDisplay();
            calculator.validateInput(x);
            Number result = function.apply(calculator, settings, x);
            if (settings.isOverflowCheck()) {
                if (result instanceof BigInteger) {
                    calculator.checkOverflow((BigInteger) result);
                } else {
                    calculator.checkOverflow(result.doubleValue());
                }
            }
            return result;
        });
        if (!outcome.isSuccess()) {
            report(outcome);
            return;
        }
        display = DisplayText.format(outcome.getValue());
        state.setLastResult(outcome.getValue().doubleValue());
        state.setResultFinalized(true);
    }

    private void toggleSign() {
        if (DisplayText.isEmpty(display)) {
            return;
        }
        Outcome<Double> current = Outcome.of(this::readDisplay);
        if (!current.isSuccess()) {
            report(current);
            return;
        }
        display = DisplayText.format(-current.getValue());
    }

    private void clear() {
        display = "";
        state.reset();
    }

    private double firstOperandOrZero() {
        Double first = state.getFirstOperand();
        return first == null ? 0 : first;
    }

    /** Reads the display as an operand; an empty display reads as zero. */
    private double readDisplay() {
        if (DisplayText.isEmpty(display)) {
            return 0;
        }
        try {
            return Double.parseDouble(display);
        } catch (NumberFormatException e) {
            throw new CalculationException(ErrorKind.INVALID_INPUT,
                    "Error: Invalid input. Please enter a numeric value.");
        }
    }

    private void report(Outcome<?> failure) {
        log.warn("{} on display '{}': {}", failure.getErrorKind(), display, failure.getMessage());
        errorListener.onError(failure.getErrorKind(), failure.getMessage());
    }
}
