package com.smurthy.ai.derma.retrieval;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * In-process evaluation of constraints against record metadata, used for post-filtering
 * candidates whose attributes the backing store cannot filter at query time.
 *
 * A record missing the constrained attribute never matches. Set values compare by exact
 * (normalized) equality, so {@code non-oily} never satisfies {@code oily}. Ingredient lists are
 * free text ("niacinamide 10%", "vitamin c (ascorbic acid)") and match on whole words instead.
 */
public final class ConstraintMatcher {

    private static final Set<String> PHRASE_MATCHED = Set.of(SourceSchema.KEY_INGREDIENTS);

    private ConstraintMatcher() {
    }

    public static boolean matchesAll(List<Constraint> constraints, Map<String, Object> metadata) {
        for (Constraint constraint : constraints) {
            if (!matches(constraint, metadata)) {
                return false;
            }
        }
        return true;
    }

    public static boolean matches(Constraint constraint, Map<String, Object> metadata) {
        Object actual = metadata.get(constraint.attribute());
        if (actual == null) {
            return false;
        }
        return switch (constraint.operator()) {
            case AT_MOST -> withinBound(actual, constraint, true);
            case AT_LEAST -> withinBound(actual, constraint, false);
            case ONE_OF -> constraint.values().contains(normalize(actual));
            case EQUALS -> constraint.values().contains(normalize(actual));
            case CONTAINS_ANY -> containsAny(asValueSet(actual), constraint.values(),
                    PHRASE_MATCHED.contains(constraint.attribute()));
        };
    }

    private static boolean withinBound(Object actual, Constraint constraint, boolean upper) {
        Double number = asNumber(actual);
        Double bound = constraint.numericValue();
        if (number == null || bound == null) {
            return false;
        }
        return upper ? number <= bound : number >= bound;
    }

    private static Double asNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().replace(",", "").trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean containsAny(Set<String> actual, Set<String> wanted, boolean phrases) {
        for (String candidate : actual) {
            for (String value : wanted) {
                if (candidate.equals(value) || (phrases && containsPhrase(candidate, value))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Whole-word phrase search: the phrase may not be glued to a letter or digit on either side,
     * nor preceded by a hyphen ("non-oily" does not contain "oily").
     */
    public static boolean containsPhrase(String text, String phrase) {
        return Pattern.compile("(?<![\\p{L}\\d-])" + Pattern.quote(phrase) + "(?![\\p{L}\\d])")
                .matcher(text)
                .find();
    }

    /**
     * Multi-valued metadata arrives either as a collection or as a comma-separated string.
     */
    static Set<String> asValueSet(Object value) {
        Set<String> out = new LinkedHashSet<>();
        if (value instanceof Collection<?> collection) {
            collection.forEach(v -> out.add(normalize(v)));
        } else {
            for (String part : value.toString().split(",")) {
                String normalized = normalize(part);
                if (!normalized.isEmpty()) {
                    out.add(normalized);
                }
            }
        }
        return out;
    }

    private static String normalize(Object value) {
        return String.valueOf(value).trim().toLowerCase(Locale.ROOT);
    }
}
