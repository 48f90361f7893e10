package com.fieldservice.scheduling.distance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One origin/destination element of a distance matrix.
 * Status values: OK, ZERO_RESULTS, NOT_FOUND, REQUEST_DENIED, ...
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistanceResult {

    public static final String STATUS_OK = "OK";

    /** Miles; null when unavailable. */
    private BigDecimal distanceMiles;

    /** Minutes; null when unavailable. */
    private Integer travelTimeMinutes;

    @Builder.Default
    private String status = STATUS_OK;

    private String errorMessage;

    @JsonIgnore
    public boolean isOk() {
        return STATUS_OK.equals(status);
    }
}
