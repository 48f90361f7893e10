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

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Enumerates a contractor's free one-hour slots for a date.
 *
 * Slots start at date + workingHoursStart and step by one hour while the slot
 * start is before date + workingHoursEnd. A slot is dropped if it overlaps any
 * active assignment's occupied window.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeSlotService {

    public static final Duration SLOT_LENGTH = Duration.ofHours(1);

    private final ContractorRepository contractorRepository;
    private final AssignmentRepository assignmentRepository;

    public List<LocalDateTime> findFreeSlots(LocalTime workingHoursStart, LocalTime workingHoursEnd,
                                             LocalDate date, List<Assignment> assignments) {
        if (workingHoursStart == null || workingHoursEnd == null || !workingHoursEnd.isAfter(workingHoursStart)) {
            return List.of();
        }

        List<TimeWindow> occupied = assignments.stream()
                .map(TimeWindow::occupiedBy)
                .flatMap(Optional::stream)
                .toList();

        List<LocalDateTime> free = new ArrayList<>();
        LocalDateTime current = date.atTime(workingHoursStart);
        LocalDateTime end = date.atTime(workingHoursEnd);

        while (current.isBefore(end)) {
            TimeWindow slot = new TimeWindow(current, current.plus(SLOT_LENGTH));
            if (occupied.stream().noneMatch(slot::overlaps)) {
                free.add(current);
            }
            current = slot.end();
        }
        return free;
    }

    /**
     * Fail-soft variant used while ranking: any fault yields no slots instead of an error.
     */
    public List<LocalDateTime> findFreeSlots(Contractor contractor, LocalDate date) {
        try {
            List<Assignment> assignments = assignmentRepository.findActiveByContractorAndDate(contractor.getId(), date);
            return findFreeSlots(contractor.getWorkingHoursStart(), contractor.getWorkingHoursEnd(), date, assignments);
        } catch (RuntimeException e) {
            log.warn("Error getting available time slots for contractor {} on {}", contractor.getId(), date, e);
            return List.of();
        }
    }

    /**
     * @throws NotFoundException if the contractor does not exist
     */
    public List<LocalDateTime> getAvailableTimeSlots(Long contractorId, LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("Date must not be null");
        }
        Contractor contractor = contractorRepository.findById(contractorId)
                .orElseThrow(() -> NotFoundException.contractor(contractorId));
        List<LocalDateTime> slots = findFreeSlots(contractor, date);
        log.debug("Contractor {} has {} free slots on {}", contractorId, slots.size(), date);
        return slots;
    }
}
