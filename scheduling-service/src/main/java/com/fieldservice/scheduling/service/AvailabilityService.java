package com.fieldservice.scheduling.service;

import com.fieldservice.scheduling.entity.Assignment;
import com.fieldservice.scheduling.entity.Contractor;
import com.fieldservice.scheduling.exception.NotFoundException;
import com.fieldservice.scheduling.model.TimeWindow;
import com.fieldservice.scheduling.repository.AssignmentRepository;
import com.fieldservice.scheduling.repository.ContractorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a contractor is free for a candidate window by checking it
 * against the occupied windows of their active assignments.
 *
 * Candidate window: [desiredStart - travelTime, desiredStart + duration).
 * Two windows conflict when they overlap as half-open intervals, so back-to-back
 * jobs do not conflict.
 *
 * Working hours are not enforced here; only free-slot enumeration is bounded by them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final ContractorRepository contractorRepository;
    private final AssignmentRepository assignmentRepository;

    /**
     * Pure check over an already-loaded assignment list.
     *
     * @param travelTimeMinutes buffer before the job start; the scoring flow always passes 0
     */
    public boolean isAvailable(List<Assignment> existingAssignments, LocalDateTime desiredStart,
                               BigDecimal jobDurationHours, int travelTimeMinutes) {
        validate(desiredStart, jobDurationHours, travelTimeMinutes);

        TimeWindow job = TimeWindow.of(desiredStart, jobDurationHours);
        TimeWindow candidate = new TimeWindow(job.start().minusMinutes(travelTimeMinutes), job.end());

        for (Assignment assignment : existingAssignments) {
            Optional<TimeWindow> occupied = TimeWindow.occupiedBy(assignment);
            if (occupied.isPresent() && candidate.overlaps(occupied.get())) {
                log.debug("Window {} conflicts with assignment {} occupying {}",
                        candidate, assignment.getId(), occupied.get());
                return false;
            }
        }
        return true;
    }

    /**
     * Looks up the contractor and their active assignments for the date of {@code desiredStart}.
     *
     * @throws NotFoundException if the contractor does not exist
     */
    public boolean calculateAvailability(Long contractorId, LocalDateTime desiredStart,
                                         BigDecimal jobDurationHours, int travelTimeMinutes) {
        validate(desiredStart, jobDurationHours, travelTimeMinutes);

        Contractor contractor = contractorRepository.findById(contractorId)
                .orElseThrow(() -> NotFoundException.contractor(contractorId));

        boolean available = calculateAvailability(contractor, desiredStart, jobDurationHours, travelTimeMinutes);
        log.info("Availability check for contractor={} start={} duration={}h travel={}m -> {}",
                contractorId, desiredStart, jobDurationHours, travelTimeMinutes, available);
        return available;
    }

    public boolean calculateAvailability(Contractor contractor, LocalDateTime desiredStart,
                                         BigDecimal jobDurationHours, int travelTimeMinutes) {
        List<Assignment> assignments = assignmentRepository.findActiveByContractorAndDate(
                contractor.getId(), desiredStart.toLocalDate());
        return isAvailable(assignments, desiredStart, jobDurationHours, travelTimeMinutes);
    }

    private void validate(LocalDateTime desiredStart, BigDecimal jobDurationHours, int travelTimeMinutes) {
        if (desiredStart == null) {
            throw new IllegalArgumentException("Desired start must not be null");
        }
        if (jobDurationHours == null || jobDurationHours.signum() <= 0) {
            throw new IllegalArgumentException("Job duration must be greater than zero, got " + jobDurationHours);
        }
        if (travelTimeMinutes < 0) {
            throw new IllegalArgumentException("Travel time cannot be negative, got " + travelTimeMinutes);
        }
    }
}
