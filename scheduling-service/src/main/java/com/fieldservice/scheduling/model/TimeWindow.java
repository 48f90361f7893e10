package com.fieldservice.scheduling.model;

import com.fieldservice.scheduling.entity.Assignment;
import com.fieldservice.scheduling.entity.Job;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Half-open interval [start, end) on the UTC timeline.
 */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    public static TimeWindow of(LocalDateTime start, BigDecimal durationHours) {
        return new TimeWindow(start, start.plus(hoursToDuration(durationHours)));
    }

    /**
     * Window a contractor is committed to by an assignment; empty when the
     * assignment has no job loaded or the job has no start.
     */
    public static Optional<TimeWindow> occupiedBy(Assignment assignment) {
        Job job = assignment.getJob();
        if (job == null || job.getDesiredDateTime() == null) {
            return Optional.empty();
        }
        BigDecimal hours = job.getEstimatedDurationHours() != null ? job.getEstimatedDurationHours() : BigDecimal.ZERO;
        return Optional.of(of(job.getDesiredDateTime(), hours));
    }

    public static Duration hoursToDuration(BigDecimal hours) {
        long seconds = hours.multiply(SECONDS_PER_HOUR).setScale(0, RoundingMode.HALF_UP).longValueExact();
        return Duration.ofSeconds(seconds);
    }

    public boolean overlaps(TimeWindow other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }
}
