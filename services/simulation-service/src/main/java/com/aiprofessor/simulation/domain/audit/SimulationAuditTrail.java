package com.aiprofessor.simulation.domain.audit;

import com.aiprofessor.observability.BestEffortExecutor;
import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.security.Role;
import com.aiprofessor.simulation.domain.RequestOrigin;
import com.aiprofessor.simulation.domain.SimulationSession;
import com.aiprofessor.simulation.domain.port.ActivityLogSink;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the simulation audit entries. Every write is handed to the {@link BestEffortExecutor}, so
 * callers never wait for the sink and never see its failures.
 */
public class SimulationAuditTrail {

    private final ActivityLogSink sink;
    private final BestEffortExecutor bestEffort;
    private final Clock clock;

    public SimulationAuditTrail(ActivityLogSink sink, BestEffortExecutor bestEffort, Clock clock) {
        this.sink = sink;
        this.bestEffort = bestEffort;
        this.clock = clock;
    }

    public void started(SimulationSession session) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("simulation_session_id", session.id());
        metadata.put("simulation_mode", session.mode().name());
        metadata.put("simulated_student_name", session.simulatedStudentName());
        if (session.purpose() != null) {
            metadata.put("purpose", session.purpose());
        }
        submit(ActivityType.SIMULATION_STARTED, session, metadata, session.origin());
    }

    /** Records the end of {@code session}, which must already carry its end time and duration. */
    public void ended(SimulationSession session) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("simulation_session_id", session.id());
        metadata.put("simulation_mode", session.mode().name());
        metadata.put("duration_seconds", session.durationSeconds());
        metadata.put("modules_viewed", session.modulesViewed());
        metadata.put("quizzes_viewed", session.quizzesViewed());
        metadata.put("ai_chats_opened", session.aiChatsOpened());
        metadata.put("pages_visited", new ArrayList<>(session.pagesVisited()));
        submit(ActivityType.SIMULATION_ENDED, session, metadata, RequestOrigin.unknown());
    }

    public void writeBlocked(
            PlatformSecurityContext caller, String method, String path, RequestOrigin origin) {
        var claims = caller.simulation();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("simulation_session_id", claims.sessionId());
        metadata.put("method", method);
        metadata.put("path", path);
        ActivityLogEntry entry =
                new ActivityLogEntry(
                        ActivityType.SIMULATION_WRITE_BLOCKED,
                        claims.originalUserId(),
                        claims.originalUserRole(),
                        caller.tenantId(),
                        null,
                        caller.userId(),
                        caller.user().email(),
                        Role.STUDENT,
                        metadata,
                        origin,
                        false,
                        clock.instant());
        bestEffort.submit("audit." + entry.type().name().toLowerCase(Locale.ROOT), () -> sink.record(entry));
    }

    private void submit(
            ActivityType type,
            SimulationSession session,
            Map<String, Object> metadata,
            RequestOrigin origin) {
        ActivityLogEntry entry =
                new ActivityLogEntry(
                        type,
                        session.originalUserId(),
                        session.originalUserRole(),
                        session.tenantId(),
                        session.tenantName(),
                        session.simulatedStudentId(),
                        session.simulatedStudentEmail(),
                        Role.STUDENT,
                        metadata,
                        origin,
                        true,
                        clock.instant());
        bestEffort.submit("audit." + type.name().toLowerCase(Locale.ROOT), () -> sink.record(entry));
    }
}
