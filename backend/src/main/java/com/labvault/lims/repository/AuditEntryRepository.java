package com.labvault.lims.repository;

import com.labvault.lims.model.AuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditEntryRepository extends JpaRepository<AuditEntry, Long> {
    List<AuditEntry> findByActionOrderByCreatedAtDesc(String action);
}
