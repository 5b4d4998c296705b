package com.smurthy.ai.derma.retrieval;

import java.util.Set;

/**
 * One attribute of a source schema.
 *
 * @param name                   metadata key the attribute is stored under
 * @param type                   value type
 * @param allowedValues          closed vocabulary for {@link AttributeType#ENUM} and
 *                               {@link AttributeType#TAG_SET} attributes; empty means open
 * @param filterableAtQueryTime  whether the backing store can evaluate the attribute inside the
 *                               similarity query
 */
public record AttributeSpec(
        String name,
        AttributeType type,
        Set<String> allowedValues,
        boolean filterableAtQueryTime
) {
    public AttributeSpec {
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
    }

    public static AttributeSpec number(String name, boolean filterableAtQueryTime) {
        return new AttributeSpec(name, AttributeType.NUMBER, Set.of(), filterableAtQueryTime);
    }

    public static AttributeSpec enumerated(String name, Set<String> allowedValues, boolean filterableAtQueryTime) {
        return new AttributeSpec(name, AttributeType.ENUM, allowedValues, filterableAtQueryTime);
    }

    /**
     * Free-text values keep whatever case they were ingested with, while constraints are
     * lower-cased, so a text attribute should only be pushed down when the store is known to hold
     * normalized values.
     */
    public static AttributeSpec text(String name, boolean filterableAtQueryTime) {
        return new AttributeSpec(name, AttributeType.TEXT, Set.of(), filterableAtQueryTime);
    }

    public static AttributeSpec tags(String name, Set<String> allowedValues) {
        // Set-valued metadata is never pushed down: vector store filter languages compare scalars.
        return new AttributeSpec(name, AttributeType.TAG_SET, allowedValues, false);
    }
}
