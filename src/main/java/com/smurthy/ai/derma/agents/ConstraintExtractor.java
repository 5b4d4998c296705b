package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.retrieval.Constraint;
import com.smurthy.ai.derma.retrieval.ConstraintMatcher;
import com.smurthy.ai.derma.retrieval.ProductCategory;
import com.smurthy.ai.derma.retrieval.SkinType;
import com.smurthy.ai.derma.retrieval.SourceSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic extraction of structured constraints from free text.
 *
 * Recognized:
 * - price bounds: "under 1200", "below ₹999", "max Rs. 1,500", "above 500", "between 500 and 1500", "2k"
 * - category, skin type, ingredient and concern vocabulary
 * - brand: a known brand name anywhere in the text, or "minimalist brand" / "brand cetaphil"
 * - minimum rating: "rated 4+", "rating above 4", "4 stars and up"
 *
 * Numbers that cannot be parsed are left out; extraction never fails.
 */
public class ConstraintExtractor {

    public static final String CONCERN = "concern";

    private static final String CURRENCY = "(?:₹|rs\\.?|inr)?\\s*";
    private static final String AMOUNT = "(\\d[\\d,]*(?:\\.\\d+)?)(\\s*k\\b)?";
    private static final String RUPEE_SUFFIX = "(?:\\s*(?:rupees|rs\\.?|inr|/-))?";

    private static final Pattern BETWEEN = Pattern.compile(
            "\\bbetween\\s+" + CURRENCY + AMOUNT + RUPEE_SUFFIX + "\\s*(?:and|to|-)\\s*" + CURRENCY + AMOUNT);
    private static final Pattern RANGE = Pattern.compile(
            "(?:₹|rs\\.?|inr)\\s*" + AMOUNT + "\\s*(?:-|to)\\s*(?:₹|rs\\.?|inr)?\\s*" + AMOUNT);
    private static final Pattern UPPER = Pattern.compile(
            "\\b(?:under|below|less than|cheaper than|max(?:imum)?|within|upto|up to|not more than)\\s+"
                    + "(?:of\\s+)?" + "(₹|rs\\.?|inr)?\\s*" + AMOUNT + "(\\s*(?:rupees|rs\\.?|inr|/-))?");
    private static final Pattern LOWER = Pattern.compile(
            "\\b(?:above|over|more than|at least|min(?:imum)?|starting from)\\s+"
                    + "(₹|rs\\.?|inr)?\\s*" + AMOUNT + "(\\s*(?:rupees|rs\\.?|inr|/-))?");
    private static final Pattern RATING = Pattern.compile(
            "\\b(?:rated|rating(?:\\s+(?:of|above|over|at least))?)\\s*(\\d(?:\\.\\d)?)\\s*(?:\\+|stars?|and above|or more)?"
                    + "|\\b(\\d(?:\\.\\d)?)\\s*(?:\\+\\s*)?stars?(?:\\s+and\\s+(?:up|above))?");

    /** Without a currency marker a bare number must be at least this large to read as a price ("over 30" is usually an age). */
    private static final double BARE_PRICE_FLOOR = 100;
    private static final double MAX_RATING = 5;

    private static final List<String> INGREDIENTS = List.of(
            "niacinamide", "retinol", "hyaluronic acid", "salicylic acid", "glycolic acid", "lactic acid",
            "vitamin c", "ceramide", "peptides", "benzoyl peroxide", "azelaic acid", "tea tree",
            "aloe vera", "centella", "squalane", "zinc oxide", "bakuchiol", "snail mucin");

    private static final List<String> DEFAULT_BRANDS = List.of(
            "minimalist", "the derma co", "cetaphil", "cerave", "the ordinary", "la roche-posay",
            "neutrogena", "plum", "mamaearth", "dot & key", "foxtale", "re'equil", "deconstruct");

    private static final Pattern NAMED_BRAND = Pattern.compile(
            "(?<![\\p{L}\\d&'.-])([\\p{L}\\d][\\p{L}\\d&'.-]*)\\s+brand\\b|\\bbrand\\s+(?:called\\s+|named\\s+)?([\\p{L}\\d][\\p{L}\\d&'.-]*)");

    /** Words that sit next to "brand" without naming one ("any brand", "which brand", "brand new"). */
    private static final Set<String> NOT_A_BRAND = Set.of(
            "a", "an", "the", "any", "which", "what", "good", "best", "top", "my", "your", "this", "that",
            "same", "other", "another", "one", "favorite", "favourite", "popular", "premium", "local",
            "indian", "cheap", "affordable", "different", "new", "of", "for", "is", "and", "or", "own",
            "some", "trusted", "recommended", "by", "from", "with");

    private static final List<String> CONCERNS = List.of(
            "acne", "pigmentation", "dark circles", "aging", "wrinkles", "dryness", "redness",
            "rosacea", "blackheads", "pores", "tan", "dullness", "dark spots", "eczema");

    private final List<String> knownBrands;

    public ConstraintExtractor() {
        this(DEFAULT_BRANDS);
    }

    /**
     * @param knownBrands brand names recognized anywhere in a query; an empty collection falls back
     *                    to the built-in list
     */
    public ConstraintExtractor(Collection<String> knownBrands) {
        List<String> brands = knownBrands == null ? List.of() : knownBrands.stream()
                .filter(brand -> brand != null && !brand.isBlank())
                .map(brand -> brand.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .collect(Collectors.toList());
        this.knownBrands = brands.isEmpty() ? DEFAULT_BRANDS : brands;
    }

    public List<Constraint> extract(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String text = query.toLowerCase(Locale.ROOT);
        List<Constraint> constraints = new ArrayList<>(extractPrice(text));

        Set<String> categories = new LinkedHashSet<>();
        for (ProductCategory category : ProductCategory.values()) {
            if (category.phrases().stream().anyMatch(phrase -> containsPhrase(text, phrase))) {
                categories.add(category.schemaValue());
            }
        }
        if (!categories.isEmpty()) {
            constraints.add(Constraint.oneOf(SourceSchema.CATEGORY, categories));
        }

        Set<String> brands = extractBrands(text);
        if (brands.size() == 1) {
            constraints.add(Constraint.equalTo(SourceSchema.BRAND, brands.iterator().next()));
        } else if (!brands.isEmpty()) {
            constraints.add(Constraint.oneOf(SourceSchema.BRAND, brands));
        }

        Set<String> skinTypes = new LinkedHashSet<>();
        for (SkinType skinType : SkinType.values()) {
            if (skinType.phrases().stream().anyMatch(phrase -> containsPhrase(text, phrase))) {
                skinTypes.add(skinType.schemaValue());
            }
        }
        if (!skinTypes.isEmpty()) {
            constraints.add(Constraint.containsAny(SourceSchema.SKIN_TYPE, skinTypes));
        }

        Set<String> ingredients = matching(text, INGREDIENTS);
        if (!ingredients.isEmpty()) {
            constraints.add(Constraint.containsAny(SourceSchema.KEY_INGREDIENTS, ingredients));
        }

        Set<String> concerns = matching(text, CONCERNS);
        if (!concerns.isEmpty()) {
            constraints.add(Constraint.containsAny(CONCERN, concerns));
        }

        extractRating(text).ifPresent(constraints::add);
        return constraints;
    }

    private List<Constraint> extractPrice(String text) {
        Matcher between = BETWEEN.matcher(text);
        if (between.find()) {
            return range(between.group(1), between.group(2), between.group(3), between.group(4));
        }
        Matcher range = RANGE.matcher(text);
        if (range.find()) {
            return range(range.group(1), range.group(2), range.group(3), range.group(4));
        }

        List<Constraint> bounds = new ArrayList<>();
        Matcher upper = UPPER.matcher(text);
        if (upper.find()) {
            Double value = priceMention(upper.group(1), upper.group(2), upper.group(3), upper.group(4));
            if (value != null) {
                bounds.add(Constraint.atMost(SourceSchema.PRICE, value));
            }
        }
        Matcher lower = LOWER.matcher(text);
        if (lower.find()) {
            Double value = priceMention(lower.group(1), lower.group(2), lower.group(3), lower.group(4));
            if (value != null) {
                bounds.add(0, Constraint.atLeast(SourceSchema.PRICE, value));
            }
        }
        return bounds;
    }

    private List<Constraint> range(String first, String firstK, String second, String secondK) {
        Double a = parseAmount(first, firstK);
        Double b = parseAmount(second, secondK);
        if (a == null || b == null) {
            return List.of();
        }
        return List.of(
                Constraint.atLeast(SourceSchema.PRICE, Math.min(a, b)),
                Constraint.atMost(SourceSchema.PRICE, Math.max(a, b)));
    }

    private Double priceMention(String currency, String amount, String thousands, String suffix) {
        Double value = parseAmount(amount, thousands);
        if (value == null) {
            return null;
        }
        boolean marked = currency != null || (suffix != null && !suffix.isBlank()) || thousands != null;
        return marked || value >= BARE_PRICE_FLOOR ? value : null;
    }

    private Set<String> extractBrands(String text) {
        Set<String> found = matching(text, knownBrands);
        Matcher named = NAMED_BRAND.matcher(text);
        while (named.find()) {
            String raw = named.group(1) != null ? named.group(1) : named.group(2);
            String candidate = raw.replaceAll("[.'-]+$", "");
            if (!candidate.isEmpty() && !NOT_A_BRAND.contains(candidate)
                    && found.stream().noneMatch(brand -> containsPhrase(brand, candidate))) {
                found.add(candidate);
            }
        }
        return found;
    }

    private Optional<Constraint> extractRating(String text) {
        Matcher matcher = RATING.matcher(text);
        while (matcher.find()) {
            String raw = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            Double value = parseAmount(raw, null);
            if (value != null && value > 0 && value <= MAX_RATING) {
                return Optional.of(Constraint.atLeast(SourceSchema.RATING, value));
            }
        }
        return Optional.empty();
    }

    static Double parseAmount(String raw, String thousands) {
        if (raw == null) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.replace(",", ""));
            return thousands != null ? value * 1000 : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Set<String> matching(String text, List<String> vocabulary) {
        Set<String> found = new LinkedHashSet<>();
        for (String term : vocabulary) {
            if (containsPhrase(text, term)) {
                found.add(term);
            }
        }
        return found;
    }

    static boolean containsPhrase(String text, String phrase) {
        return ConstraintMatcher.containsPhrase(text, phrase);
    }
}
