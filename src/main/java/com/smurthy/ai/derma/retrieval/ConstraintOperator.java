package com.smurthy.ai.derma.retrieval;

public enum ConstraintOperator {
    /** Numeric upper bound, inclusive. */
    AT_MOST("≤"),
    /** Numeric lower bound, inclusive. */
    AT_LEAST("≥"),
    /** Scalar attribute equals one of the given values. */
    ONE_OF("∈"),
    /** Multi-valued attribute shares at least one value with the given set. */
    CONTAINS_ANY("∋"),
    /** Scalar attribute equals the given value, ignoring case. */
    EQUALS("=");

    private final String symbol;

    ConstraintOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isNumeric() {
        return this == AT_MOST || this == AT_LEAST;
    }
}
