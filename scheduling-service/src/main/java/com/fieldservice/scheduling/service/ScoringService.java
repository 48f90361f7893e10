package com.fieldservice.scheduling.service;

import com.fieldservice.scheduling.model.ScoreComponents;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Contractor recommendation scoring: normalizes availability, rating and distance
 * into [0, 1] and blends them with fixed weights.
 *
 * Formula:
 *   score = 0.4 * availability + 0.3 * rating + 0.3 * distance   (rounded HALF_UP to 2 decimals)
 *
 *   availability = 1.0 if free for the window, else 0.0
 *   rating       = averageRating / 5.0, or 0.5 for contractors with no reviews
 *   distance     = 1.0 - miles / 50.0, 1.0 at or below zero, 0.0 at 50 miles and beyond
 */
@Slf4j
@Service
public class ScoringService {

    static final BigDecimal AVAILABILITY_WEIGHT  = new BigDecimal("0.4");
    static final BigDecimal RATING_WEIGHT        = new BigDecimal("0.3");
    static final BigDecimal DISTANCE_WEIGHT      = new BigDecimal("0.3");
    static final BigDecimal MAX_DISTANCE_MILES   = new BigDecimal("50");
    static final BigDecimal NULL_RATING_BASELINE = new BigDecimal("0.5");
    static final BigDecimal MAX_RATING           = new BigDecimal("5.0");

    public static final int MAX_RECOMMENDATIONS = 5;

    /**
     * Duration used for the availability signal. The job's own estimated duration is
     * not consulted here; slot finding and conflict windows of existing assignments do use it.
     */
    public static final BigDecimal ASSUMED_JOB_DURATION_HOURS = new BigDecimal("8");

    private static final int SCORE_SCALE = 2;

    public BigDecimal calculateScore(BigDecimal availabilityScore, BigDecimal ratingScore, BigDecimal distanceScore) {
        requireUnitInterval("availability", availabilityScore);
        requireUnitInterval("rating", ratingScore);
        requireUnitInterval("distance", distanceScore);

        BigDecimal score = AVAILABILITY_WEIGHT.multiply(availabilityScore)
                .add(RATING_WEIGHT.multiply(ratingScore))
                .add(DISTANCE_WEIGHT.multiply(distanceScore))
                .setScale(SCORE_SCALE, RoundingMode.HALF_UP);

        log.debug("Score calc: availability={} rating={} distance={} -> {}",
                availabilityScore, ratingScore, distanceScore, score);
        return score;
    }

    public BigDecimal calculateScore(ScoreComponents components) {
        return calculateScore(components.availability(), components.rating(), components.distance());
    }

    public BigDecimal normalizeRatingScore(BigDecimal rating) {
        if (rating == null) {
            return NULL_RATING_BASELINE;
        }
        return clamp(rating.divide(MAX_RATING, MathContext.DECIMAL64));
    }

    public BigDecimal normalizeDistanceScore(BigDecimal distanceMiles) {
        if (distanceMiles == null) {
            throw new IllegalArgumentException("Distance must not be null");
        }
        if (distanceMiles.signum() <= 0) {
            return BigDecimal.ONE;
        }
        if (distanceMiles.compareTo(MAX_DISTANCE_MILES) >= 0) {
            return BigDecimal.ZERO;
        }
        return clamp(BigDecimal.ONE.subtract(distanceMiles.divide(MAX_DISTANCE_MILES, MathContext.DECIMAL64)));
    }

    public BigDecimal availabilityScore(boolean available) {
        return available ? BigDecimal.ONE : BigDecimal.ZERO;
    }

    public ScoreComponents scoreComponents(boolean available, BigDecimal rating, BigDecimal distanceMiles) {
        return new ScoreComponents(
                availabilityScore(available),
                normalizeRatingScore(rating),
                normalizeDistanceScore(distanceMiles));
    }

    private void requireUnitInterval(String name, BigDecimal value) {
        if (value == null || value.compareTo(BigDecimal.ZERO) < 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException(
                    "All scores must be between 0.0 and 1.0; " + name + " was " + value);
        }
    }

    private BigDecimal clamp(BigDecimal value) {
        return value.max(BigDecimal.ZERO).min(BigDecimal.ONE);
    }
}
