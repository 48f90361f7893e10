package com.fieldservice.shared.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a job-to-contractor assignment.
 * PENDING → ACCEPTED → IN_PROGRESS → COMPLETED, or PENDING → DECLINED.
 */
public enum AssignmentStatus {
    PENDING,
    ACCEPTED,
    DECLINED,
    IN_PROGRESS,
    COMPLETED;

    /** Statuses during which the contractor's time is committed to the job. */
    public static final Set<AssignmentStatus> ACTIVE = EnumSet.of(PENDING, ACCEPTED, IN_PROGRESS);
}
