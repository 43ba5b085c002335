package com.labvault.lims.service;

import java.util.Optional;

/**
 * Read-only lookup of a specimen by the WUID embedded in facility sample names.
 * An empty result means no specimen carries that number; store failures are thrown
 * as {@link org.springframework.dao.DataAccessException}, never reported as "not found".
 */
public interface SpecimenResolver {
    Optional<Long> findSpecimenIdByWuid(int wuid);
}
