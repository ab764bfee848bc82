package com.unocalc.controller;

/**
 * Mutable state of one calculator session.
 *
 * <p>{@code firstOperand} is set exactly when {@code pendingOperator} is. The repeat pair
 * remembers the last resolved operation so that pressing equals again re-applies it.
 */
public class SessionState {

    private BinaryOperation pendingOperator;
    private Double firstOperand;
    private Double lastResult;
    private boolean awaitingFreshInput;
    private boolean resultFinalized;
    private BinaryOperation repeatOperator;
    private double repeatOperand;

    public SessionState() {
        reset();
    }

    public void reset() {
        pendingOperator = null;
        firstOperand = null;
        lastResult = null;
        awaitingFreshInput = true;
        resultFinalized = false;
        forgetRepeat();
    }

    public BinaryOperation getPendingOperator() {
        return pendingOperator;
    }

    public Double getFirstOperand() {
        return firstOperand;
    }

    public boolean hasPendingOperator() {
        return pendingOperator != null;
    }

    public void setPending(BinaryOperation operator, double firstOperand) {
        this.pendingOperator = operator;
        this.firstOperand = firstOperand;
    }

    public void clearPending() {
        this.pendingOperator = null;
        this.firstOperand = null;
    }

    public Double getLastResult() {
        return lastResult;
    }

    public void setLastResult(Double lastResult) {
        this.lastResult = lastResult;
    }

    public boolean isAwaitingFreshInput() {
        return awaitingFreshInput;
    }

    public void setAwaitingFreshInput(boolean awaitingFreshInput) {
        this.awaitingFreshInput = awaitingFreshInput;
    }

    public boolean isResultFinalized() {
        return resultFinalized;
    }

    public void setResultFinalized(boolean resultFinalized) {
        this.resultFinalized = resultFinalized;
    }

    public BinaryOperation getRepeatOperator() {
        return repeatOperator;
    }

    public double getRepeatOperand() {
        return repeatOperand;
    }

    public void rememberRepeat(BinaryOperation operator, double operand) {
        this.repeatOperator = operator;
        this.repeatOperand = operand;
    }

    public void forgetRepeat() {
        this.repeatOperator = null;
        this.repeatOperand = 0;
    }

    @Override
    public String toString() {
        return "SessionState(pending=" + pendingOperator + ", first=" + firstOperand
                + ", last=" + lastResult + ", fresh=" + awaitingFreshInput
                + ", finalized=" + resultFinalized + ", repeat=" + repeatOperator + ")";
    }
}
