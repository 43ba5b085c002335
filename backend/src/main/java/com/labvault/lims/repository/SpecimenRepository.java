package com.labvault.lims.repository;

import com.labvault.lims.model.Specimen;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SpecimenRepository extends JpaRepository<Specimen, Long> {
    Optional<Specimen> findBySpecimenNumber(Integer specimenNumber);
}
