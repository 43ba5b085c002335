package com.labvault.lims.repository;

import com.labvault.lims.model.SequencingRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface SequencingRunRepository extends JpaRepository<SequencingRun, Long> {
    Optional<SequencingRun> findByServiceRequestNumber(String serviceRequestNumber);

    Optional<SequencingRun> findByFlowcellId(String flowcellId);

    @Query("select coalesce(max(r.runNumber), 0) from SequencingRun r")
    int findMaxRunNumber();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from SequencingRun r where r.id = :id")
    int deleteRunById(@Param("id") Long id);
}
