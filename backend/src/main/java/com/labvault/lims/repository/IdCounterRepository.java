package com.labvault.lims.repository;

import com.labvault.lims.model.IdCounter;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface IdCounterRepository extends JpaRepository<IdCounter, String> {
    // Row lock is held until the surrounding transaction ends
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from IdCounter c where c.entityType = :entityType")
    Optional<IdCounter> findForUpdate(@Param("entityType") String entityType);
}
