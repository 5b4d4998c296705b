package com.smurthy.ai.derma.agents;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Classified purpose of a query. Closed set; every query maps to exactly one value, with
 * {@link #GENERAL_KNOWLEDGE} as the default.
 */
public enum Intent {
    CATALOG_LOOKUP("catalog-lookup"),
    DOCUMENT_LOOKUP("document-lookup"),
    GENERAL_KNOWLEDGE("general-knowledge");

    private final String label;

    Intent(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Lenient lookup by label or constant name ({@code "catalog-lookup"}, {@code "CATALOG_LOOKUP"}).
     */
    public static Optional<Intent> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(intent -> intent.label.equals(normalized))
                .findFirst();
    }
}
