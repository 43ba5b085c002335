package com.labvault.lims.repository;

import com.labvault.lims.model.LinkStatus;
import com.labvault.lims.model.SequencingSample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SequencingSampleRepository extends JpaRepository<SequencingSample, Long> {
    List<SequencingSample> findBySequencingRunIdOrderByWuidAscIdAsc(Long sequencingRunId);

    long countBySequencingRunId(Long sequencingRunId);

    long countBySequencingRunIdAndLinkStatus(Long sequencingRunId, LinkStatus linkStatus);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from SequencingSample s where s.sequencingRun.id = :runId")
    int deleteBySequencingRunId(@Param("runId") Long runId);
}
