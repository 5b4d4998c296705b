package com.smurthy.ai.derma.agents;

import java.util.List;

/**
 * @param grounded false only for the fixed no-evidence answer, which is produced without the model
 */
public record SynthesisResult(String answer, List<Citation> citations, boolean grounded) {

    public SynthesisResult {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
