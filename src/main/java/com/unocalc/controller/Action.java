package com.unocalc.controller;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every key the calculator understands, labelled as it appears on the keypad.
 */
public enum Action {
    DIGIT_0("0", Kind.INPUT),
    DIGIT_1("1", Kind.INPUT),
    DIGIT_2("2", Kind.INPUT),
    DIGIT_3("3", Kind.INPUT),
    DIGIT_4("4", Kind.INPUT),
    DIGIT_5("5", Kind.INPUT),
    DIGIT_6("6", Kind.INPUT),
    DIGIT_7("7", Kind.INPUT),
    DIGIT_8("8", Kind.INPUT),
    DIGIT_9("9", Kind.INPUT),
    DECIMAL_POINT(".", Kind.INPUT),

    ADD("+", BinaryOperation.ADD),
    SUBTRACT("-", BinaryOperation.SUBTRACT),
    MULTIPLY("*", BinaryOperation.MULTIPLY),
    DIVIDE("/", BinaryOperation.DIVIDE),
    POWER("x^y", BinaryOperation.POWER),

    FACTORIAL("!", UnaryFunction.FACTORIAL),
    SQUARE("x^2", UnaryFunction.SQUARE),
    NATURAL_LOG("ln", UnaryFunction.NATURAL_LOG),
    SQUARE_ROOT("sqrt", UnaryFunction.SQUARE_ROOT),
    EXP("e^x", UnaryFunction.EXP),

    SIGN_TOGGLE("+/-", Kind.SIGN_TOGGLE),
    CLEAR("C", Kind.CLEAR),
    DELETE("Del", Kind.DELETE),
    EQUALS("=", Kind.EQUALS);

    /** How the controller treats an action. */
    public enum Kind {
        INPUT,
        BINARY_OPERATOR,
        UNARY_FUNCTION,
        SIGN_TOGGLE,
        CLEAR,
        DELETE,
        EQUALS
    }

    private static final Map<String, Action> BY_LABEL = new HashMap<>();

    static {
        for (Action action : values()) {
            BY_LABEL.put(action.label, action);
        }
    }

    private final String label;
    private final Kind kind;
    private final BinaryOperation binaryOperation;
    private final UnaryFunction unaryFunction;

    Action(String label, Kind kind) {
        this(label, kind, null, null);
    }

    Action(String label, BinaryOperation operation) {
        this(label, Kind.BINARY_OPERATOR, operation, null);
    }

    Action(String label, UnaryFunction function) {
        this(label, Kind.UNARY_FUNCTION, null, function);
    }

    Action(String label, Kind kind, BinaryOperation binaryOperation, UnaryFunction unaryFunction) {
        this.label = label;
        this.kind = kind;
        this.binaryOperation = binaryOperation;
        this.unaryFunction = unaryFunction;
    }

    public String getLabel() {
        return label;
    }

    public Kind getKind() {
        return kind;
    }

    /** The operator of a {@link Kind#BINARY_OPERATOR} action, otherwise {@code null}. */
    public BinaryOperation getBinaryOperation() {
        return binaryOperation;
    }

    /** The function of a {@link Kind#UNARY_FUNCTION} action, otherwise {@code null}. */
    public UnaryFunction getUnaryFunction() {
        return unaryFunction;
    }

    /** The symbol an {@link Kind#INPUT} action appends to the display. */
    public char getSymbol() {
        if (kind != Kind.INPUT) {
            throw new IllegalStateException(name() + " does not enter a symbol");
        }
        return label.charAt(0);
    }

    public static Optional<Action> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    public static Action digit(int value) {
        if (value < 0 || value > 9) {
            throw new IllegalArgumentException("Not a digit: " + value);
        }
        return values()[DIGIT_0.ordinal() + value];
    }
}
