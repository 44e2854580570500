package com.alertsentinel.core.model;

import com.alertsentinel.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparator of an {@link AlertRule}. Equality and inequality tolerate
 * floating-point noise of {@value #EPSILON}.
 *
 * @since 1.0.0
 */
public enum ComparisonOperator {

    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    public static final double EPSILON = 1e-3;

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @param value     observed value
     * @param threshold rule threshold
     * @return whether {@code value <op> threshold} holds
     */
    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case LESS_THAN -> value < threshold;
            case GREATER_OR_EQUAL -> value >= threshold;
            case LESS_OR_EQUAL -> value <= threshold;
            case EQUAL -> Math.abs(value - threshold) < EPSILON;
            case NOT_EQUAL -> Math.abs(value - threshold) >= EPSILON;
        };
    }

    /**
     * @return {@code true} for {@code >} and {@code >=}
     */
    public boolean isUpperBound() {
        return this == GREATER_THAN || this == GREATER_OR_EQUAL;
    }

    /**
     * @return {@code true} for {@code <} and {@code <=}
     */
    public boolean isLowerBound() {
        return this == LESS_THAN || this == LESS_OR_EQUAL;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /**
     * Resolve a comparator from its symbol.
     *
     * @param symbol one of {@code > < >= <= == !=}
     * @return the comparator
     * @throws ValidationException if the symbol is unknown
     */
    @JsonCreator
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol != null) {
            String trimmed = symbol.trim();
            for (ComparisonOperator op : values()) {
                if (op.symbol.equals(trimmed)) {
                    return op;
                }
            }
        }
        throw new ValidationException("Unknown comparator: '" + symbol
                + "'. Supported: >, <, >=, <=, ==, !=");
    }
}
