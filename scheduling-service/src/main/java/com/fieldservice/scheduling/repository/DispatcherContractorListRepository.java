package com.fieldservice.scheduling.repository;

import com.fieldservice.scheduling.entity.DispatcherContractorList;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DispatcherContractorListRepository extends JpaRepository<DispatcherContractorList, Long> {

    @Query("SELECT d.contractorId FROM DispatcherContractorList d WHERE d.dispatcherId = :dispatcherId ORDER BY d.id")
    List<Long> findContractorIdsByDispatcherId(Long dispatcherId);
}
