package com.fieldservice.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * One entry of a dispatcher's curated contractor list.
 */
@Entity
@Table(name = "dispatcher_contractor_lists",
        uniqueConstraints = @UniqueConstraint(name = "uq_dispatcher_contractor",
                columnNames = {"dispatcher_id", "contractor_id"}),
        indexes = @Index(name = "idx_dcl_dispatcher", columnList = "dispatcher_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class DispatcherContractorList {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dispatcher_id", nullable = false)
    private Long dispatcherId;

    @Column(name = "contractor_id", nullable = false)
    private Long contractorId;

    @CreationTimestamp
    @Column(name = "added_at", updatable = false)
    private Instant addedAt;
}
