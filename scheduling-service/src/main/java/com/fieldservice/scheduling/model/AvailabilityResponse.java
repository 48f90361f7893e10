package com.fieldservice.scheduling.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
public class AvailabilityResponse {
    private Long contractorId;
    private LocalDateTime desiredDateTime;
    private BigDecimal durationHours;
    private int travelTimeMinutes;
    private boolean available;
}
