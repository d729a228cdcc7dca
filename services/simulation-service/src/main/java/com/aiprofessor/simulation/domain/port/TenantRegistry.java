package com.aiprofessor.simulation.domain.port;

import com.aiprofessor.simulation.domain.TenantRecord;
import java.util.Optional;

/** Read access to the schools registered in the central database. */
public interface TenantRegistry {

    Optional<TenantRecord> findTenantById(String tenantId);
}
