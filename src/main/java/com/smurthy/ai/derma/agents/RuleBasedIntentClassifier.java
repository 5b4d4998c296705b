package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.history.Turn;
import com.smurthy.ai.derma.retrieval.Constraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword-scoring intent classifier.
 *
 * Each intent has a keyword list; a query's score for an intent is the number of distinct
 * keywords it contains (whole words, case-insensitive). An intent wins outright when its score
 * reaches {@code minScore} and is strictly higher than every other score. Otherwise the decision
 * is ambiguous and resolved in this order:
 * <ol>
 *   <li>follow-up phrasing with history present: inherit the latest turn's intent and any of its
 *       constraints on attributes the new query does not mention</li>
 *   <li>tie-break patterns ("recommend", "buy", "price"... favour catalog; "how", "what",
 *       "why", "explain" favour documents)</li>
 *   <li>{@link Intent#GENERAL_KNOWLEDGE}</li>
 * </ol>
 * Pure function of its input: no randomness, no clock, no I/O.
 */
public class RuleBasedIntentClassifier implements IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedIntentClassifier.class);

    public static final int DEFAULT_MIN_SCORE = 1;

    static final List<String> CATALOG_KEYWORDS = List.of(
            "recommend", "suggest", "buy", "purchase", "product", "products", "best",
            "under", "below", "price", "budget", "cheap", "affordable",
            "₹", "rupees", "inr", "rs",
            "moisturizer", "moisturiser", "cleanser", "sunscreen", "serum", "cream",
            "face wash", "toner", "mask", "oil", "gel", "lotion", "spf",
            "where to buy", "show me", "need a", "looking for",
            "brand", "shop");

    static final List<String> DOCUMENT_KEYWORDS = List.of(
            "how to", "what is", "what are", "why does", "why do", "explain", "learn",
            "article", "blog", "read about", "guide", "tips",
            "benefits of", "causes of", "treatment for", "cure for",
            "routine for", "steps for", "regimen", "process",
            "information", "tell me about", "help me understand", "difference between");

    static final List<String> GENERAL_KEYWORDS = List.of(
            "latest", "news", "recent", "research", "study", "studies", "trend", "trends",
            "clinical", "trial", "trials", "breakthrough", "fda", "approved", "new findings");

    private static final List<String> CATALOG_TIE_BREAK = List.of(
            "recommend", "buy", "purchase", "price", "under", "below");
    private static final List<String> DOCUMENT_TIE_BREAK = List.of(
            "how", "what", "why", "explain");

    private static final List<String> FOLLOW_UP_MARKERS = List.of(
            "cheaper", "pricier", "more", "another", "other", "others", "instead", "also",
            "what about", "how about", "and for", "those", "these", "them", "ones", "same", "similar",
            "that one", "this one");

    private static final Pattern YEAR = Pattern.compile("\\b(?:19|20)\\d{2}\\b");

    private final ConstraintExtractor extractor;
    private final int minScore;

    public RuleBasedIntentClassifier(ConstraintExtractor extractor) {
        this(extractor, DEFAULT_MIN_SCORE);
    }

    public RuleBasedIntentClassifier(ConstraintExtractor extractor, int minScore) {
        if (minScore < 1) {
            throw new IllegalArgumentException("minScore must be >= 1 but was " + minScore);
        }
        this.extractor = extractor;
        this.minScore = minScore;
    }

    @Override
    public QueryIntent classify(String query, List<Turn> recentHistory) {
        String text = query == null ? "" : query.toLowerCase(Locale.ROOT).trim();
        List<Constraint> constraints = extractor.extract(text);
        Map<Intent, Integer> scores = score(text);

        int top = scores.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        Set<Intent> leaders = scores.entrySet().stream()
                .filter(e -> e.getValue() == top)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Intent.class)));

        if (top >= minScore && leaders.size() == 1) {
            Intent winner = leaders.iterator().next();
            return new QueryIntent(winner, constraints, false, "keyword scores " + scores);
        }

        if (top == 0) {
            leaders = EnumSet.allOf(Intent.class);
        }
        QueryIntent resolved = resolveAmbiguous(text, constraints, scores, leaders, recentHistory);
        log.debug("Ambiguous classification for '{}' (scores {}), resolved to {}: {}",
                query, scores, resolved.intent().label(), resolved.reasoning());
        return resolved;
    }

    private QueryIntent resolveAmbiguous(String text,
                                         List<Constraint> constraints,
                                         Map<Intent, Integer> scores,
                                         Set<Intent> leaders,
                                         List<Turn> history) {
        if (history != null && !history.isEmpty() && anyPresent(text, FOLLOW_UP_MARKERS)) {
            Turn previous = history.get(history.size() - 1);
            return new QueryIntent(
                    previous.intent(),
                    inherit(constraints, previous.constraints()),
                    true,
                    "follow-up of previous " + previous.intent().label() + " turn");
        }
        if (leaders.contains(Intent.CATALOG_LOOKUP) && anyPresent(text, CATALOG_TIE_BREAK)) {
            return new QueryIntent(Intent.CATALOG_LOOKUP, constraints, true, "tie-break on purchase wording, scores " + scores);
        }
        if (leaders.contains(Intent.DOCUMENT_LOOKUP) && anyPresent(text, DOCUMENT_TIE_BREAK)) {
            return new QueryIntent(Intent.DOCUMENT_LOOKUP, constraints, true, "tie-break on question wording, scores " + scores);
        }
        return new QueryIntent(Intent.GENERAL_KNOWLEDGE, constraints, true, "no clear signal, scores " + scores);
    }

    /**
     * Current constraints first, then the previous turn's constraints on attributes the current
     * query does not constrain.
     */
    static List<Constraint> inherit(List<Constraint> current, List<Constraint> previous) {
        Set<String> mentioned = current.stream().map(Constraint::attribute).collect(Collectors.toSet());
        List<Constraint> merged = new ArrayList<>(current);
        previous.stream()
                .filter(c -> !mentioned.contains(c.attribute()))
                .forEach(merged::add);
        return merged;
    }

    Map<Intent, Integer> score(String text) {
        Map<Intent, Integer> scores = new EnumMap<>(Intent.class);
        scores.put(Intent.CATALOG_LOOKUP, count(text, CATALOG_KEYWORDS));
        scores.put(Intent.DOCUMENT_LOOKUP, count(text, DOCUMENT_KEYWORDS));
        int general = count(text, GENERAL_KEYWORDS);
        if (YEAR.matcher(text).find()) {
            general++;
        }
        scores.put(Intent.GENERAL_KNOWLEDGE, general);
        return scores;
    }

    private static int count(String text, List<String> keywords) {
        return (int) keywords.stream().filter(k -> present(text, k)).count();
    }

    private static boolean anyPresent(String text, List<String> keywords) {
        return keywords.stream().anyMatch(k -> present(text, k));
    }

    private static boolean present(String text, String keyword) {
        // Symbols like ₹ have no word boundary against the amount that follows
        return Character.isLetterOrDigit(keyword.charAt(0))
                ? ConstraintExtractor.containsPhrase(text, keyword)
                : text.contains(keyword);
    }
}
