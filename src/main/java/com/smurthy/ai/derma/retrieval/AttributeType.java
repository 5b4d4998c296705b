package com.smurthy.ai.derma.retrieval;

import java.util.EnumSet;
import java.util.Set;

/**
 * Value type of a source attribute, which decides the operators a constraint on it may use.
 */
public enum AttributeType {
    NUMBER(EnumSet.of(ConstraintOperator.AT_MOST, ConstraintOperator.AT_LEAST)),
    ENUM(EnumSet.of(ConstraintOperator.ONE_OF, ConstraintOperator.EQUALS)),
    TEXT(EnumSet.of(ConstraintOperator.ONE_OF, ConstraintOperator.EQUALS)),
    TAG_SET(EnumSet.of(ConstraintOperator.CONTAINS_ANY));

    private final Set<ConstraintOperator> operators;

    AttributeType(Set<ConstraintOperator> operators) {
        this.operators = operators;
    }

    public boolean supports(ConstraintOperator operator) {
        return operators.contains(operator);
    }
}
