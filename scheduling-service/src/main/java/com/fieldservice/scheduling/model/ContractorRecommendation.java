package com.fieldservice.scheduling.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * One ranked contractor in a recommendation response.
 */
@Data
@Builder
public class ContractorRecommendation {

    private Long contractorId;
    private String name;

    /** 0.4 × availability + 0.3 × rating + 0.3 × distance, two decimals. */
    private BigDecimal score;

    /** Null when the contractor has no reviews yet. */
    private BigDecimal rating;
    private int reviewCount;
    private BigDecimal distanceMiles;
    private int travelTimeMinutes;

    /** Start times of free one-hour slots on the job's date. */
    private List<LocalDateTime> availableTimeSlots;
}
