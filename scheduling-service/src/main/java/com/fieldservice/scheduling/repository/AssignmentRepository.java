package com.fieldservice.scheduling.repository;

import com.fieldservice.scheduling.entity.Assignment;
import com.fieldservice.shared.enums.AssignmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface AssignmentRepository extends JpaRepository<Assignment, Long> {

    /**
     * Assignments of a contractor whose job starts in [rangeStart, rangeEnd), job fetched eagerly
     * so the occupied window can be derived outside a persistence context.
     */
    @Query("SELECT a FROM Assignment a JOIN FETCH a.job j " +
            "WHERE a.contractorId = :contractorId AND a.status IN :statuses " +
            "AND j.desiredDateTime >= :rangeStart AND j.desiredDateTime < :rangeEnd " +
            "ORDER BY j.desiredDateTime")
    List<Assignment> findByContractorAndJobStartBetween(Long contractorId,
                                                        Collection<AssignmentStatus> statuses,
                                                        LocalDateTime rangeStart,
                                                        LocalDateTime rangeEnd);

    /**
     * Active (pending, accepted, in-progress) assignments whose job starts on the given date.
     */
    default List<Assignment> findActiveByContractorAndDate(Long contractorId, LocalDate date) {
        return findByContractorAndJobStartBetween(contractorId, AssignmentStatus.ACTIVE,
                date.atStartOfDay(), date.plusDays(1).atStartOfDay());
    }
}
