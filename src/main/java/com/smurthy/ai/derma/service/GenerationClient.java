package com.smurthy.ai.derma.service;

import com.smurthy.ai.derma.retrieval.EvidenceItem;

import java.util.List;

/**
 * Text generation grounded on numbered evidence.
 *
 * Implementations present {@code contextItems} to the model numbered {@code [1]..[n]} in list order.
 */
public interface GenerationClient {

    /**
     * @throws GenerationException when the model fails or does not answer in time
     */
    String generate(String prompt, List<EvidenceItem> contextItems);
}
