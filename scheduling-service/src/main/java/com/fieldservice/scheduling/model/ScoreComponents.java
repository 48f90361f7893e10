package com.fieldservice.scheduling.model;

import java.math.BigDecimal;

/**
 * The three normalized [0, 1] signals for one contractor against one job.
 */
public record ScoreComponents(BigDecimal availability, BigDecimal rating, BigDecimal distance) {
}
