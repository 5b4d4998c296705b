package com.smurthy.ai.derma.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Attribute schema of one retrieval source.
 *
 * Constraints are type-checked against the schema before a search; a constraint on an unknown
 * attribute, with an operator the attribute type does not support, or with a value outside a closed
 * vocabulary is dropped with a warning and never fails the search.
 */
public final class SourceSchema {

    private static final Logger log = LoggerFactory.getLogger(SourceSchema.class);

    public static final String PRICE = "price";
    public static final String CATEGORY = "category";
    public static final String SKIN_TYPE = "skin_type";
    public static final String KEY_INGREDIENTS = "key_ingredients";
    public static final String BRAND = "brand";
    public static final String RATING = "rating";
    public static final String TAGS = "tags";
    public static final String AUTHOR = "author";

    private static final int PRODUCT_DESCRIPTION_LIMIT = 300;
    private static final int ARTICLE_EXCERPT_LIMIT = 800;

    private final SourceKind kind;
    private final String idKey;
    private final Map<String, AttributeSpec> attributes;
    private final ExcerptFormatter formatter;

    public SourceSchema(SourceKind kind, String idKey, List<AttributeSpec> attributes, ExcerptFormatter formatter) {
        this.kind = kind;
        this.idKey = idKey;
        this.attributes = new LinkedHashMap<>();
        attributes.forEach(spec -> this.attributes.put(spec.name(), spec));
        this.formatter = formatter;
    }

    /**
     * Product catalog: {@code {id, name, price, category, skin_type, key_ingredients, brand, rating, url}}.
     *
     * {@code category} is pushed down as its lower-case vocabulary value, so ingested products must
     * carry it in that form ({@code "serum"}, not {@code "Serum"}).
     */
    public static SourceSchema catalog() {
        return new SourceSchema(SourceKind.CATALOG, "product_id", List.of(
                AttributeSpec.number(PRICE, true),
                AttributeSpec.enumerated(CATEGORY, Arrays.stream(ProductCategory.values())
                        .map(ProductCategory::schemaValue)
                        .collect(Collectors.toSet()), true),
                AttributeSpec.tags(SKIN_TYPE, Arrays.stream(SkinType.values())
                        .map(SkinType::schemaValue)
                        .collect(Collectors.toSet())),
                AttributeSpec.tags(KEY_INGREDIENTS, null),
                AttributeSpec.text(BRAND, false),
                AttributeSpec.number(RATING, true)
        ), SourceSchema::formatProduct);
    }

    /**
     * Blog articles, chunked: {@code {doc_id, title, author, date, tags, url, chunk_index, total_chunks}}.
     */
    public static SourceSchema documents() {
        return new SourceSchema(SourceKind.DOCUMENT, "doc_id", List.of(
                AttributeSpec.tags(TAGS, null),
                AttributeSpec.text(AUTHOR, false)
        ), SourceSchema::formatArticle);
    }

    public SourceKind kind() {
        return kind;
    }

    public String idKey() {
        return idKey;
    }

    public ExcerptFormatter formatter() {
        return formatter;
    }

    public Optional<AttributeSpec> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean isFilterableAtQueryTime(Constraint constraint) {
        return attribute(constraint.attribute())
                .map(AttributeSpec::filterableAtQueryTime)
                .orElse(false);
    }

    /**
     * @return the constraints that type-check against this schema, in their original order
     */
    public List<Constraint> validate(List<Constraint> constraints) {
        if (constraints == null || constraints.isEmpty()) {
            return List.of();
        }
        List<Constraint> valid = new ArrayList<>();
        for (Constraint constraint : constraints) {
            String problem = problemWith(constraint);
            if (problem == null) {
                valid.add(constraint);
            } else {
                log.warn("Dropping invalid constraint [{}] for {} source: {}", constraint, kind.label(), problem);
            }
        }
        return valid;
    }

    private String problemWith(Constraint constraint) {
        AttributeSpec spec = attributes.get(constraint.attribute());
        if (spec == null) {
            return "unknown attribute";
        }
        if (!spec.type().supports(constraint.operator())) {
            return "operator " + constraint.operator() + " not supported for " + spec.type() + " attribute";
        }
        if (spec.type() == AttributeType.NUMBER) {
            Double bound = constraint.numericValue();
            if (bound == null || bound.isNaN() || bound.isInfinite() || bound < 0) {
                return "expected a non-negative number but got " + constraint.value();
            }
            return null;
        }
        if (constraint.values().isEmpty()) {
            return "empty value set";
        }
        if (!spec.allowedValues().isEmpty() && !spec.allowedValues().containsAll(constraint.values())) {
            return "values outside vocabulary " + spec.allowedValues();
        }
        return null;
    }

    // ========== EXCERPT FORMATTING ==========

    static String formatProduct(String text, Map<String, Object> metadata) {
        StringBuilder sb = new StringBuilder();
        sb.append("Product: ").append(metadata.getOrDefault("name", "Unknown Product")).append("\n");
        sb.append("Brand: ").append(metadata.getOrDefault(BRAND, "Unknown")).append("\n");
        Object price = metadata.get(PRICE);
        if (price instanceof Number number) {
            sb.append(String.format(Locale.ROOT, "Price: ₹%.2f%n", number.doubleValue()));
        }
        Object rating = metadata.get(RATING);
        if (rating instanceof Number number && number.doubleValue() > 0) {
            sb.append(String.format(Locale.ROOT, "Rating: %.1f/5 (%s reviews)%n",
                    number.doubleValue(), metadata.getOrDefault("rating_count", 0)));
        }
        appendIfPresent(sb, "Category", metadata.get(CATEGORY));
        appendIfPresent(sb, "Skin types", metadata.get(SKIN_TYPE));
        appendIfPresent(sb, "Key ingredients", metadata.get(KEY_INGREDIENTS));
        appendIfPresent(sb, "URL", metadata.get("url"));
        if (text != null && !text.isBlank()) {
            sb.append("Description: ").append(truncate(text, PRODUCT_DESCRIPTION_LIMIT)).append("\n");
        }
        return sb.toString().trim();
    }

    static String formatArticle(String text, Map<String, Object> metadata) {
        StringBuilder sb = new StringBuilder();
        sb.append("Article: ").append(metadata.getOrDefault("title", "Untitled")).append("\n");
        appendIfPresent(sb, "Author", metadata.get(AUTHOR));
        appendIfPresent(sb, "Published", metadata.get("date"));
        appendIfPresent(sb, "Tags", metadata.get(TAGS));
        Object chunk = metadata.get("chunk_index");
        Object total = metadata.get("total_chunks");
        if (chunk instanceof Number index && total instanceof Number count && count.intValue() > 1) {
            sb.append("Section: Part ").append(index.intValue() + 1).append(" of ").append(count.intValue()).append("\n");
        }
        appendIfPresent(sb, "URL", metadata.get("url"));
        if (text != null && !text.isBlank()) {
            sb.append("\n").append(truncate(text, ARTICLE_EXCERPT_LIMIT));
        }
        return sb.toString().trim();
    }

    private static void appendIfPresent(StringBuilder sb, String label, Object value) {
        if (value == null) {
            return;
        }
        String rendered = value instanceof Iterable<?> iterable
                ? String.join(", ", toStrings(iterable))
                : value.toString();
        if (!rendered.isBlank()) {
            sb.append(label).append(": ").append(rendered).append("\n");
        }
    }

    private static List<String> toStrings(Iterable<?> iterable) {
        List<String> out = new ArrayList<>();
        iterable.forEach(v -> out.add(String.valueOf(v)));
        return out;
    }

    private static String truncate(String text, int limit) {
        String trimmed = text.trim();
        return trimmed.length() <= limit ? trimmed : trimmed.substring(0, limit) + "...";
    }
}
