package com.smurthy.ai.derma.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A structured predicate over one attribute of a retrieval source, e.g. {@code price ≤ 1200}
 * or {@code skin_type ∋ {oily}}.
 *
 * Numeric values are normalized to {@link Double}; set values to an unmodifiable, lower-cased,
 * insertion-ordered set. Several constraints may target the same attribute (a price range is two
 * constraints) and a list of constraints is always AND-combined.
 */
public record Constraint(String attribute, ConstraintOperator operator, Object value) {

    public Constraint {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
        attribute = attribute.trim().toLowerCase(Locale.ROOT);
        if (value instanceof Number number) {
            value = number.doubleValue();
        } else if (value instanceof Collection<?> collection) {
            value = normalize(collection);
        } else if (value instanceof String text && !operator.isNumeric()) {
            value = operator == ConstraintOperator.EQUALS
                    ? text.trim().toLowerCase(Locale.ROOT)
                    : normalize(Set.of(text));
        }
    }

    public static Constraint atMost(String attribute, double bound) {
        return new Constraint(attribute, ConstraintOperator.AT_MOST, bound);
    }

    public static Constraint atLeast(String attribute, double bound) {
        return new Constraint(attribute, ConstraintOperator.AT_LEAST, bound);
    }

    public static Constraint oneOf(String attribute, Collection<String> values) {
        return new Constraint(attribute, ConstraintOperator.ONE_OF, values);
    }

    public static Constraint containsAny(String attribute, Collection<String> values) {
        return new Constraint(attribute, ConstraintOperator.CONTAINS_ANY, values);
    }

    public static Constraint equalTo(String attribute, String value) {
        return new Constraint(attribute, ConstraintOperator.EQUALS, value);
    }

    /**
     * @return the numeric bound, or {@code null} when the value is not a number
     */
    @JsonIgnore
    public Double numericValue() {
        return value instanceof Double number ? number : null;
    }

    /**
     * @return the value as a set of strings; scalar values become a singleton set
     */
    @SuppressWarnings("unchecked")
    @JsonIgnore
    public Set<String> values() {
        if (value instanceof Set<?> set) {
            return (Set<String>) set;
        }
        return Set.of(String.valueOf(value).toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        String rendered = value instanceof Double number && number == Math.rint(number)
                ? String.valueOf(number.longValue())
                : String.valueOf(value);
        return attribute + " " + operator.symbol() + " " + rendered;
    }

    private static Set<String> normalize(Collection<?> raw) {
        LinkedHashSet<String> normalized = raw.stream()
                .filter(Objects::nonNull)
                .map(v -> String.valueOf(v).trim().toLowerCase(Locale.ROOT))
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return Collections.unmodifiableSet(normalized);
    }
}
