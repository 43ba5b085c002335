package com.labvault.lims.repository;

import com.labvault.lims.model.IdGenerationLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface IdGenerationLogRepository extends JpaRepository<IdGenerationLog, Long> {
    List<IdGenerationLog> findByEntityTypeOrderByGeneratedAtDesc(String entityType);
}
