package com.smurthy.ai.derma.retrieval;

import java.util.List;

public enum SkinType {
    OILY("oily", List.of("oily skin", "oily", "greasy skin")),
    DRY("dry", List.of("dry skin", "dry", "flaky skin")),
    COMBINATION("combination", List.of("combination skin", "combination")),
    SENSITIVE("sensitive", List.of("sensitive skin", "sensitive")),
    NORMAL("normal", List.of("normal skin")),
    ACNE_PRONE("acne-prone", List.of("acne-prone", "acne prone"));

    private final String schemaValue;
    private final List<String> phrases;

    SkinType(String schemaValue, List<String> phrases) {
        this.schemaValue = schemaValue;
        this.phrases = phrases;
    }

    public String schemaValue() {
        return schemaValue;
    }

    public List<String> phrases() {
        return phrases;
    }
}
