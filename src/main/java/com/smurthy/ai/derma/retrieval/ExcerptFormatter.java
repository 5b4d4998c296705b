package com.smurthy.ai.derma.retrieval;

import java.util.Map;

/**
 * Renders one retrieved record into the excerpt shown to the response generator.
 */
@FunctionalInterface
public interface ExcerptFormatter {

    String format(String text, Map<String, Object> metadata);
}
