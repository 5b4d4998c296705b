package com.smurthy.ai.derma.retrieval;

import java.util.List;

/**
 * Catalog product categories and the phrases users say for them.
 */
public enum ProductCategory {
    MOISTURIZER("moisturizer", List.of("moisturizer", "moisturiser", "moisturizing cream", "moisturising cream", "lotion")),
    CLEANSER("cleanser", List.of("cleanser", "face wash", "facewash", "cleansing gel")),
    SUNSCREEN("sunscreen", List.of("sunscreen", "sunblock", "sun screen", "spf")),
    SERUM("serum", List.of("serum", "serums")),
    TONER("toner", List.of("toner", "toners")),
    MASK("mask", List.of("face mask", "sheet mask", "mask", "masks")),
    FACE_OIL("face-oil", List.of("face oil", "facial oil")),
    EXFOLIANT("exfoliant", List.of("exfoliant", "exfoliator", "scrub", "peel")),
    EYE_CREAM("eye-cream", List.of("eye cream", "under eye cream")),
    LIP_CARE("lip-care", List.of("lip balm", "lip care", "lip mask"));

    private final String schemaValue;
    private final List<String> phrases;

    ProductCategory(String schemaValue, List<String> phrases) {
        this.schemaValue = schemaValue;
        this.phrases = phrases;
    }

    /** Value stored in the catalog's {@code category} metadata. */
    public String schemaValue() {
        return schemaValue;
    }

    public List<String> phrases() {
        return phrases;
    }
}
