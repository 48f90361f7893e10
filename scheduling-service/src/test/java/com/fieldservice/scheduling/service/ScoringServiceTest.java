package com.fieldservice.scheduling.service;

import com.fieldservice.scheduling.model.ScoreComponents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for recommendation scoring.
 *
 * Score formula:
 *   score = 0.4 * availability + 0.3 * (rating / 5) + 0.3 * (1 - miles / 50)
 *
 * Rounded HALF_UP to 2 decimals.
 */
class ScoringServiceTest {

    private ScoringService service;

    @BeforeEach
    void setUp() {
        service = new ScoringService();
    }

    @Test
    @DisplayName("All components at 1.0 give a perfect score of 1.00")
    void perfectScore() {
        assertThat(service.calculateScore(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE))
                .isEqualByComparingTo("1.00");
    }

    @Test
    @DisplayName("All components at 0.0 give a score of 0.00")
    void zeroScore() {
        assertThat(service.calculateScore(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO))
                .isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("Each component contributes exactly its weight")
    void weightsApplyPerComponent() {
        assertThat(service.calculateScore(BigDecimal.ONE, BigDecimal.ZERO, BigDecimal.ZERO)).isEqualByComparingTo("0.4");
        assertThat(service.calculateScore(BigDecimal.ZERO, BigDecimal.ONE, BigDecimal.ZERO)).isEqualByComparingTo("0.3");
        assertThat(service.calculateScore(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ONE)).isEqualByComparingTo("0.3");
    }

    @Test
    @DisplayName("Score always carries two decimal places")
    void scoreScaleIsTwo() {
        BigDecimal score = service.calculateScore(BigDecimal.ONE, new BigDecimal("0.9"), new BigDecimal("0.9"));
        assertThat(score.scale()).isEqualTo(2);
        assertThat(score).isEqualByComparingTo("0.94");
    }

    @Test
    @DisplayName("Half-way values round up (0.3 * 0.25 = 0.075 -> 0.08)")
    void roundsHalfUp() {
        BigDecimal score = service.calculateScore(BigDecimal.ZERO, new BigDecimal("0.25"), BigDecimal.ZERO);
        assertThat(score).isEqualByComparingTo("0.08");
    }

    @Test
    @DisplayName("Components outside [0, 1] are rejected")
    void outOfRangeComponentsRejected() {
        assertThatThrownBy(() -> service.calculateScore(new BigDecimal("1.01"), BigDecimal.ONE, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 0.0 and 1.0");
        assertThatThrownBy(() -> service.calculateScore(BigDecimal.ONE, new BigDecimal("-0.1"), BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.calculateScore(BigDecimal.ONE, BigDecimal.ONE, new BigDecimal("2")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.calculateScore(null, BigDecimal.ONE, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Unrated contractor gets the 0.5 baseline")
    void nullRatingUsesBaseline() {
        assertThat(service.normalizeRatingScore(null)).isEqualByComparingTo("0.5");
    }

    @Test
    @DisplayName("Rating normalizes against 5.0")
    void ratingNormalization() {
        assertThat(service.normalizeRatingScore(new BigDecimal("5.0"))).isEqualByComparingTo("1.0");
        assertThat(service.normalizeRatingScore(new BigDecimal("0.0"))).isEqualByComparingTo("0.0");
        assertThat(service.normalizeRatingScore(new BigDecimal("4.5"))).isEqualByComparingTo("0.9");
    }

    @Test
    @DisplayName("Rating score stays in [0, 1] and never decreases as rating rises")
    void ratingScoreMonotonic() {
        BigDecimal previous = BigDecimal.ZERO;
        for (BigDecimal r = BigDecimal.ZERO; r.compareTo(new BigDecimal("5.0")) <= 0; r = r.add(new BigDecimal("0.25"))) {
            BigDecimal normalized = service.normalizeRatingScore(r);
            assertThat(normalized).isBetween(BigDecimal.ZERO, BigDecimal.ONE);
            assertThat(normalized).isGreaterThanOrEqualTo(previous);
            previous = normalized;
        }
    }

    @Test
    @DisplayName("Out-of-range ratings are clamped")
    void ratingClamped() {
        assertThat(service.normalizeRatingScore(new BigDecimal("7.5"))).isEqualByComparingTo("1");
        assertThat(service.normalizeRatingScore(new BigDecimal("-1"))).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Distance anchors: 0 mi -> 1.0, 25 mi -> 0.5, 50 mi -> 0.0")
    void distanceAnchors() {
        assertThat(service.normalizeDistanceScore(BigDecimal.ZERO)).isEqualByComparingTo("1.0");
        assertThat(service.normalizeDistanceScore(new BigDecimal("25"))).isEqualByComparingTo("0.5");
        assertThat(service.normalizeDistanceScore(new BigDecimal("50"))).isEqualByComparingTo("0.0");
        assertThat(service.normalizeDistanceScore(new BigDecimal("120"))).isEqualByComparingTo("0.0");
    }

    @Test
    @DisplayName("Negative distance is treated as maximal closeness")
    void negativeDistanceIsClosest() {
        assertThat(service.normalizeDistanceScore(new BigDecimal("-3"))).isEqualByComparingTo("1.0");
    }

    @Test
    @DisplayName("Distance score stays in [0, 1] and never increases as distance grows")
    void distanceScoreMonotonic() {
        BigDecimal previous = BigDecimal.ONE;
        for (BigDecimal d = BigDecimal.ZERO; d.compareTo(new BigDecimal("60")) <= 0; d = d.add(new BigDecimal("2.5"))) {
            BigDecimal normalized = service.normalizeDistanceScore(d);
            assertThat(normalized).isBetween(BigDecimal.ZERO, BigDecimal.ONE);
            assertThat(normalized).isLessThanOrEqualTo(previous);
            previous = normalized;
        }
    }

    @Test
    @DisplayName("Null distance is rejected")
    void nullDistanceRejected() {
        assertThatThrownBy(() -> service.normalizeDistanceScore(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Score components combine availability, rating and distance signals")
    void scoreComponents() {
        ScoreComponents components = service.scoreComponents(false, null, new BigDecimal("10"));

        assertThat(components.availability()).isEqualByComparingTo("0");
        assertThat(components.rating()).isEqualByComparingTo("0.5");
        assertThat(components.distance()).isEqualByComparingTo("0.8");
        assertThat(service.calculateScore(components)).isEqualByComparingTo("0.39");
    }
}
