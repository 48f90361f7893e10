package com.fieldservice.scheduling.entity;

import com.fieldservice.shared.enums.JobStatus;
import com.fieldservice.shared.enums.TradeType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * A customer's work request. Desired date-time is stored in UTC.
 */
@Entity
@Table(name = "jobs",
        indexes = {
                @Index(name = "idx_job_desired_datetime", columnList = "desired_date_time"),
                @Index(name = "idx_job_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id")
    private Long customerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false)
    private TradeType jobType;

    @Column(name = "location")
    private String location;

    @Column(name = "latitude", nullable = false)
    private double latitude;

    @Column(name = "longitude", nullable = false)
    private double longitude;

    @Column(name = "desired_date_time", nullable = false)
    private LocalDateTime desiredDateTime;

    @Column(name = "estimated_duration_hours", nullable = false, precision = 6, scale = 2)
    private BigDecimal estimatedDurationHours;

    @Column(name = "description", length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "assigned_contractor_id")
    private Long assignedContractorId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
