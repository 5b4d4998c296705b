package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.retrieval.EvidenceItem;
import com.smurthy.ai.derma.retrieval.SourceKind;
import com.smurthy.ai.derma.service.GenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Response Synthesizer
 *
 * Turns an evidence bundle into the final answer. The evidence is numbered for the model, which
 * must cite with {@code [n]} markers; the returned citations are exactly the items the answer
 * references, deduplicated by source id in order of first mention. An empty bundle gets a fixed
 * answer without calling the model.
 */
public class ResponseSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseSynthesizer.class);

    public static final String NO_EVIDENCE_ANSWER =
            "I couldn't find any information on that in our product catalog, skincare articles or on the web. "
                    + "Could you rephrase your question or add a few details (skin type, budget, concern)?";

    /** Matches {@code [3]} and grouped markers like {@code [1, 4]}. */
    private static final Pattern CITATION_MARKER = Pattern.compile("\\[(\\d+(?:\\s*,\\s*\\d+)*)]");

    static final String SYSTEM_PROMPT = """
            You are DermaGPT, a friendly and knowledgeable skincare assistant.

            RULES:
            - Answer ONLY from the numbered EVIDENCE provided with the question
            - Cite every fact with the number of its evidence item in square brackets, e.g. [1] or [2]
            - Never cite a number that is not in the EVIDENCE list
            - If the evidence does not answer the question, say so honestly
            - Always encourage users to consult a dermatologist for serious or persistent concerns
            - Be concise, structured and practical (bullet points or numbered lists when helpful)
            """;

    private final GenerationClient generationClient;

    public ResponseSynthesizer(GenerationClient generationClient) {
        this.generationClient = generationClient;
    }

    public SynthesisResult synthesize(String query, EvidenceBundle bundle) {
        if (bundle.isEmpty()) {
            log.info("[ResponseSynthesizer] No evidence from {}, returning fixed answer", bundle.agentName());
            return new SynthesisResult(NO_EVIDENCE_ANSWER, List.of(), false);
        }

        String answer;
        try {
            answer = generationClient.generate(buildPrompt(query, bundle), bundle.items());
        } catch (RuntimeException e) {
            log.error("[ResponseSynthesizer] Generation failed for {} evidence items", bundle.size(), e);
            throw new SynthesisFailureException("Could not generate an answer: " + e.getMessage(), e);
        }
        if (answer == null || answer.isBlank()) {
            throw new SynthesisFailureException("Model returned an empty answer");
        }

        List<Citation> citations = extractCitations(answer, bundle.items());
        if (citations.isEmpty()) {
            log.warn("[ResponseSynthesizer] Answer cites none of the {} evidence items", bundle.size());
        }
        log.info("[ResponseSynthesizer] Synthesized answer with {}/{} items cited", citations.size(), bundle.size());
        return new SynthesisResult(answer.trim(), citations, true);
    }

    String buildPrompt(String query, EvidenceBundle bundle) {
        StringBuilder guidance = new StringBuilder();
        List<SourceKind> kinds = bundle.items().stream().map(EvidenceItem::sourceKind).distinct().collect(Collectors.toList());
        if (kinds.contains(SourceKind.CATALOG)) {
            guidance.append("""
                    - For products give name, brand, price in INR (₹) and rating, recommend 3-5 options
                      and explain why each suits the user's needs
                    """);
        }
        if (kinds.contains(SourceKind.DOCUMENT)) {
            guidance.append("""
                    - Mention the article titles you draw from; if several articles agree, cite all of them
                    """);
        }
        if (kinds.contains(SourceKind.WEB)) {
            guidance.append("""
                    - The evidence comes from a web search; present it as general information, not medical advice
                    """);
        }
        if (bundle.degraded()) {
            guidance.append("""
                    - Some of our own sources were unavailable for this question; say briefly that the answer
                      may be incomplete
                    """);
        }
        if (!bundle.appliedConstraints().isEmpty()) {
            guidance.append("- The evidence was filtered by: ").append(bundle.appliedConstraints()).append("\n");
        }

        return String.format("""
                %s

                ANSWERING GUIDELINES:
                %s
                QUESTION:
                "%s"
                """, SYSTEM_PROMPT, guidance, query);
    }

    /**
     * Resolves {@code [n]} markers against the 1-based evidence list. Out-of-range markers are ignored.
     */
    static List<Citation> extractCitations(String answer, List<EvidenceItem> items) {
        Map<String, Citation> cited = new LinkedHashMap<>();
        Matcher matcher = CITATION_MARKER.matcher(answer);
        while (matcher.find()) {
            for (String number : matcher.group(1).split(",")) {
                int index = parseIndex(number.trim());
                if (index >= 1 && index <= items.size()) {
                    EvidenceItem item = items.get(index - 1);
                    cited.putIfAbsent(item.sourceId(), Citation.of(item));
                }
            }
        }
        return new ArrayList<>(cited.values());
    }

    private static int parseIndex(String number) {
        // Digits only by construction; overflow on absurd markers is the only failure
        try {
            return Integer.parseInt(number);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
