package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.retrieval.Constraint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ConstraintExtractor.
 *
 * Covers price bounds in their common phrasings, the attribute vocabularies, and the cases
 * where a number must not be read as a price.
 */
class ConstraintExtractorTest {

    private final ConstraintExtractor extractor = new ConstraintExtractor();

    @Test
    @DisplayName("Should extract budget, category and skin type from a shopping query")
    void testShoppingQuery() {
        // When
        List<Constraint> constraints = extractor.extract("Recommend a moisturizer under 1200 for oily skin");

        // Then
        assertThat(constraints).containsExactly(
                Constraint.atMost("price", 1200),
                Constraint.oneOf("category", List.of("moisturizer")),
                Constraint.containsAny("skin_type", List.of("oily")));
    }

    @Test
    @DisplayName("Should read a price range with rupee signs and thousands separators")
    void testBetweenRange() {
        // When
        List<Constraint> constraints = extractor.extract("serum between ₹500 and ₹1,500");

        // Then
        assertThat(constraints).contains(
                Constraint.atLeast("price", 500),
                Constraint.atMost("price", 1500),
                Constraint.oneOf("category", List.of("serum")));
    }

    @Test
    @DisplayName("Should order a reversed range from low to high")
    void testReversedRange() {
        // When
        List<Constraint> constraints = extractor.extract("toner between 1500 and 500");

        // Then
        assertThat(constraints).startsWith(
                Constraint.atLeast("price", 500),
                Constraint.atMost("price", 1500));
    }

    @Test
    @DisplayName("Should understand Rs. prefixes and the k suffix")
    void testLowerBoundWithThousands() {
        // When
        List<Constraint> constraints = extractor.extract("Sunscreen above Rs. 2k");

        // Then
        assertThat(constraints).contains(Constraint.atLeast("price", 2000));
    }

    @Test
    @DisplayName("Should not mistake small bare numbers for prices")
    void testAgeIsNotAPrice() {
        // When
        List<Constraint> constraints = extractor.extract("best eye cream for skin over 30");

        // Then
        assertThat(constraints).noneMatch(c -> c.attribute().equals("price"));
        assertThat(constraints).contains(Constraint.oneOf("category", List.of("eye-cream")));
    }

    @Test
    @DisplayName("Should extract ingredients, concerns and a minimum rating")
    void testIngredientsConcernsAndRating() {
        // When
        List<Constraint> constraints = extractor.extract("niacinamide serum rated 4+ for acne and dark spots");

        // Then
        assertThat(constraints).contains(
                Constraint.containsAny("key_ingredients", List.of("niacinamide")),
                Constraint.containsAny("concern", List.of("acne", "dark spots")),
                Constraint.atLeast("rating", 4));
    }

    @Test
    @DisplayName("Should silently omit unparseable or absent values")
    void testNothingToExtract() {
        assertThat(extractor.extract("under budget please")).isEmpty();
        assertThat(extractor.extract("   ")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    @DisplayName("Should extract a brand named with the word brand")
    void testNamedBrand() {
        // When
        List<Constraint> constraints = extractor.extract("Show me Minimalist brand products under 800");

        // Then
        assertThat(constraints).contains(
                Constraint.equalTo("brand", "minimalist"),
                Constraint.atMost("price", 800));
        assertThat(extractor.extract("serum from brand Foxtale")).contains(Constraint.equalTo("brand", "foxtale"));
    }

    @Test
    @DisplayName("Should recognize configured brands without the word brand")
    void testKnownBrands() {
        // Given
        ConstraintExtractor custom = new ConstraintExtractor(List.of("Derma Labs"));

        // When
        List<Constraint> constraints = custom.extract("derma labs sunscreen for oily skin");

        // Then
        assertThat(constraints).contains(Constraint.equalTo("brand", "derma labs"));
        assertThat(extractor.extract("cetaphil or cerave cleanser")).contains(
                Constraint.oneOf("brand", List.of("cetaphil", "cerave")));
    }

    @Test
    @DisplayName("Should not read generic words next to brand as a brand name")
    void testGenericBrandMention() {
        assertThat(extractor.extract("which brand is best for acne")).noneMatch(c -> c.attribute().equals("brand"));
        assertThat(extractor.extract("any good brand of sunscreen")).noneMatch(c -> c.attribute().equals("brand"));
    }
}
