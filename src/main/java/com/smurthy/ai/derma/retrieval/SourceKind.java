package com.smurthy.ai.derma.retrieval;

/**
 * The closed set of backing stores a retrieval adapter can wrap.
 */
public enum SourceKind {
    CATALOG("catalog"),
    DOCUMENT("document"),
    WEB("web");

    private final String label;

    SourceKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
