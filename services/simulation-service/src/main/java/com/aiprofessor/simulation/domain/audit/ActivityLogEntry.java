package com.aiprofessor.simulation.domain.audit;

import com.aiprofessor.security.Role;
import com.aiprofessor.simulation.domain.RequestOrigin;
import java.time.Instant;
import java.util.Map;

/**
 * One audit entry. Category, level and descriptions derive from {@link #type()}.
 *
 * @param performedBy user who acted
 * @param targetUserId user acted upon, the simulated student for simulation entries
 * @param metadata free-form details, copied
 */
public record ActivityLogEntry(
        ActivityType type,
        String performedBy,
        Role performedByRole,
        String tenantId,
        String tenantName,
        String targetUserId,
        String targetUserEmail,
        Role targetUserRole,
        Map<String, Object> metadata,
        RequestOrigin origin,
        boolean success,
        Instant createdAt) {

    public ActivityLogEntry {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (performedBy == null || performedBy.isBlank()) {
            throw new IllegalArgumentException("performedBy must not be null or blank");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        if (origin == null) {
            origin = RequestOrigin.unknown();
        }
    }

    public String category() {
        return ActivityType.CATEGORY;
    }

    public String level() {
        return type.level();
    }
}
