package com.fieldservice.scheduling.repository;

import com.fieldservice.scheduling.entity.Contractor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ContractorRepository extends JpaRepository<Contractor, Long> {

    @Query("SELECT c.id FROM Contractor c WHERE c.active = true ORDER BY c.id")
    List<Long> findActiveContractorIds();
}
