package com.aiprofessor.simulation.domain;

import com.aiprofessor.security.Role;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A staff member viewing the platform as one student.
 *
 * <p>A session is created ACTIVE and moves to ENDED exactly once. {@code endedAt} and {@code
 * durationSeconds} are set only on ENDED sessions.
 */
public record SimulationSession(
        String id,
        String originalUserId,
        Role originalUserRole,
        String originalUserEmail,
        String originalUserTenantId,
        String simulatedStudentId,
        String simulatedStudentEmail,
        String simulatedStudentName,
        String tenantId,
        String tenantName,
        SimulationMode mode,
        SimulationStatus status,
        Instant startedAt,
        Instant endedAt,
        Long durationSeconds,
        Set<String> pagesVisited,
        int modulesViewed,
        int quizzesViewed,
        int aiChatsOpened,
        String purpose,
        RequestOrigin origin,
        Instant createdAt) {

    public SimulationSession {
        if (originalUserId == null || originalUserId.isBlank()) {
            throw new IllegalArgumentException("originalUserId must not be null or blank");
        }
        if (originalUserRole == null) {
            throw new IllegalArgumentException("originalUserRole must not be null");
        }
        if (simulatedStudentId == null || simulatedStudentId.isBlank()) {
            throw new IllegalArgumentException("simulatedStudentId must not be null or blank");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt must not be null");
        }
        if (mode == null) {
            mode = SimulationMode.DEFAULT;
        }
        if (status == null) {
            status = SimulationStatus.ACTIVE;
        }
        if (origin == null) {
            origin = RequestOrigin.unknown();
        }
        pagesVisited =
                pagesVisited == null
                        ? Set.of()
                        : Collections.unmodifiableSet(new LinkedHashSet<>(pagesVisited));
    }

    /** A fresh ACTIVE session with zeroed counters and no id yet. */
    public static SimulationSession begin(
            String originalUserId,
            Role originalUserRole,
            String originalUserEmail,
            String originalUserTenantId,
            StudentRecord student,
            TenantRecord tenant,
            SimulationMode mode,
            String purpose,
            RequestOrigin origin,
            Instant now) {
        return new SimulationSession(
                null,
                originalUserId,
                originalUserRole,
                originalUserEmail,
                originalUserTenantId,
                student.id(),
                student.email(),
                student.fullName(),
                tenant.id(),
                tenant.name(),
                mode,
                SimulationStatus.ACTIVE,
                now,
                null,
                null,
                Set.of(),
                0,
                0,
                0,
                purpose,
                origin,
                now);
    }

    public boolean isActive() {
        return status == SimulationStatus.ACTIVE;
    }

    public SimulationSession withId(String newId) {
        return new SimulationSession(
                newId,
                originalUserId,
                originalUserRole,
                originalUserEmail,
                originalUserTenantId,
                simulatedStudentId,
                simulatedStudentEmail,
                simulatedStudentName,
                tenantId,
                tenantName,
                mode,
                status,
                startedAt,
                endedAt,
                durationSeconds,
                pagesVisited,
                modulesViewed,
                quizzesViewed,
                aiChatsOpened,
                purpose,
                origin,
                createdAt);
    }

    /** Copy of this session ended at {@code at}. */
    public SimulationSession endedAt(Instant at) {
        return new SimulationSession(
                id,
                originalUserId,
                originalUserRole,
                originalUserEmail,
                originalUserTenantId,
                simulatedStudentId,
                simulatedStudentEmail,
                simulatedStudentName,
                tenantId,
                tenantName,
                mode,
                SimulationStatus.ENDED,
                startedAt,
                at,
                durationSeconds(startedAt, at),
                pagesVisited,
                modulesViewed,
                quizzesViewed,
                aiChatsOpened,
                purpose,
                origin,
                createdAt);
    }

    /** Whole seconds between the two instants, never negative. */
    public static long durationSeconds(Instant startedAt, Instant endedAt) {
        return Math.max(0L, Duration.between(startedAt, endedAt).getSeconds());
    }
}
