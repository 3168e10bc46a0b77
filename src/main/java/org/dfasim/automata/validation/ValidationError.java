package org.dfasim.automata.validation;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 一条校验错误，指明出错的具体字段或迁移表格单元格，便于界面就地高亮。
 * 此类是不可变的。
 */
public final class ValidationError {

    public enum Kind {
        NO_STATES,
        NO_SYMBOLS,
        DUPLICATE_STATE,
        DUPLICATE_SYMBOL,
        INVALID_SYMBOL,
        MISSING_START,
        UNKNOWN_START,
        UNKNOWN_ACCEPTING_STATE,
        INCOMPLETE_TRANSITION_ROW,
        UNKNOWN_TRANSITION_SOURCE,
        UNKNOWN_TRANSITION_SYMBOL,
        UNKNOWN_TRANSITION_TARGET,
        CONFLICTING_TRANSITION,
        MISSING_TRANSITION
    }

    @Getter
    private final Kind kind;
    @Getter
    private final String message;
    private final String state;
    private final String symbol;
    private final String target;
    private final Integer row;

    private ValidationError(Kind kind, String state, String symbol, String target, Integer row, String message) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.state = state;
        this.symbol = symbol;
        this.target = target;
        this.row = row;
        this.message = message;
    }

    static ValidationError noStates() {
        return new ValidationError(Kind.NO_STATES, null, null, null, null, "At least one state is required.");
    }

    static ValidationError noSymbols() {
        return new ValidationError(Kind.NO_SYMBOLS, null, null, null, null, "At least one alphabet symbol is required.");
    }

    static ValidationError duplicateState(String state) {
        return new ValidationError(Kind.DUPLICATE_STATE, state, null, null, null,
                "State '" + state + "' is declared more than once.");
    }

    static ValidationError duplicateSymbol(String symbol) {
        return new ValidationError(Kind.DUPLICATE_SYMBOL, null, symbol, null, null,
                "Symbol '" + symbol + "' is declared more than once.");
    }

    static ValidationError invalidSymbol(String symbol) {
        return new ValidationError(Kind.INVALID_SYMBOL, null, symbol, null, null,
                "Symbol '" + symbol + "' must be exactly one character.");
    }

    static ValidationError missingStart() {
        return new ValidationError(Kind.MISSING_START, null, null, null, null, "No start state given.");
    }

    static ValidationError unknownStart(String state) {
        return new ValidationError(Kind.UNKNOWN_START, state, null, null, null,
                "Start state '" + state + "' is not one of the declared states.");
    }

    static ValidationError unknownAcceptingState(String state) {
        return new ValidationError(Kind.UNKNOWN_ACCEPTING_STATE, state, null, null, null,
                "Accepting state '" + state + "' is not one of the declared states.");
    }

    static ValidationError incompleteRow(int row, String state, String symbol, String target) {
        return new ValidationError(Kind.INCOMPLETE_TRANSITION_ROW, state, symbol, target, row,
                "Transition row " + (row + 1) + " has empty cells.");
    }

    static ValidationError unknownSource(int row, String state, String symbol, String target) {
        return new ValidationError(Kind.UNKNOWN_TRANSITION_SOURCE, state, symbol, target, row,
                "Transition row " + (row + 1) + " starts from unknown state '" + state + "'.");
    }

    static ValidationError unknownSymbol(int row, String state, String symbol, String target) {
        return new ValidationError(Kind.UNKNOWN_TRANSITION_SYMBOL, state, symbol, target, row,
                "Transition row " + (row + 1) + " reads symbol '" + symbol + "' which is not in the alphabet.");
    }

    static ValidationError unknownTarget(int row, String state, String symbol, String target) {
        return new ValidationError(Kind.UNKNOWN_TRANSITION_TARGET, state, symbol, target, row,
                "Transition row " + (row + 1) + " goes to unknown state '" + target + "'.");
    }

    static ValidationError conflictingTransition(int row, String state, String symbol, String target, String existing) {
        return new ValidationError(Kind.CONFLICTING_TRANSITION, state, symbol, target, row,
                "Transition row " + (row + 1) + " sends (" + state + ", " + symbol + ") to '" + target
                        + "' but an earlier row already sends it to '" + existing + "'.");
    }

    static ValidationError missingTransition(String state, String symbol) {
        return new ValidationError(Kind.MISSING_TRANSITION, state, symbol, null, null,
                "No transition defined for state '" + state + "' on symbol '" + symbol + "'.");
    }

    public Optional<String> getState() {
        return Optional.ofNullable(state);
    }

    public Optional<String> getSymbol() {
        return Optional.ofNullable(symbol);
    }

    public Optional<String> getTarget() {
        return Optional.ofNullable(target);
    }

    /**
     * 出错的迁移表格行号（0 起始），与迁移行无关的错误返回空。
     */
    public OptionalInt getRow() {
        return row == null ? OptionalInt.empty() : OptionalInt.of(row);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValidationError that = (ValidationError) o;
        return kind == that.kind &&
                Objects.equals(state, that.state) &&
                Objects.equals(symbol, that.symbol) &&
                Objects.equals(target, that.target) &&
                Objects.equals(row, that.row);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, state, symbol, target, row);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
