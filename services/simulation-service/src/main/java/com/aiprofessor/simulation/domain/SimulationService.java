package com.aiprofessor.simulation.domain;

import com.aiprofessor.database.tenant.TenantConnection;
import com.aiprofessor.database.tenant.TenantConnectionCache;
import com.aiprofessor.observability.BestEffortExecutor;
import com.aiprofessor.observability.MetricFactory;
import com.aiprofessor.security.AuthenticatedUser;
import com.aiprofessor.security.JwtTokenService;
import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.security.Role;
import com.aiprofessor.security.RoleChecker;
import com.aiprofessor.security.SimulationClaims;
import com.aiprofessor.security.TokenPair;
import com.aiprofessor.simulation.domain.audit.SimulationAuditTrail;
import com.aiprofessor.simulation.domain.error.AlreadySimulatingException;
import com.aiprofessor.simulation.domain.error.InvalidSimulationStateException;
import com.aiprofessor.simulation.domain.error.SimulationBadRequestException;
import com.aiprofessor.simulation.domain.error.SimulationForbiddenException;
import com.aiprofessor.simulation.domain.error.SimulationNotFoundException;
import com.aiprofessor.simulation.domain.port.SimulationSessionRepository;
import com.aiprofessor.simulation.domain.port.StudentDirectory;
import com.aiprofessor.simulation.domain.port.TenantRegistry;
import com.aiprofessor.simulation.domain.tenant.TenantResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts and ends simulation sessions and issues the matching credentials.
 *
 * <p>Session transitions go through {@link SimulationSessionRepository#markEnded}, which only
 * ends ACTIVE sessions. Two concurrent {@code start} calls of the same staff member are not
 * serialized; each ends whatever was ACTIVE when it ran.
 */
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    static final String METRIC_STARTED = "simulation.sessions.started";
    static final String METRIC_ENDED = "simulation.sessions.ended";

    private static final Set<Role> SIMULATING_ROLES =
            EnumSet.of(Role.SUPER_ADMIN, Role.SCHOOL_ADMIN, Role.PROFESSOR);

    private final SimulationSessionRepository sessions;
    private final TenantRegistry tenants;
    private final StudentDirectory students;
    private final TenantConnectionCache connections;
    private final JwtTokenService tokens;
    private final TenantResolver tenantResolver;
    private final SimulationAuditTrail audit;
    private final BestEffortExecutor bestEffort;
    private final MetricFactory metrics;
    private final Clock clock;

    public SimulationService(
            SimulationSessionRepository sessions,
            TenantRegistry tenants,
            StudentDirectory students,
            TenantConnectionCache connections,
            JwtTokenService tokens,
            TenantResolver tenantResolver,
            SimulationAuditTrail audit,
            BestEffortExecutor bestEffort,
            MetricFactory metrics,
            Clock clock) {
        this.sessions = sessions;
        this.tenants = tenants;
        this.students = students;
        this.connections = connections;
        this.tokens = tokens;
        this.tenantResolver = tenantResolver;
        this.audit = audit;
        this.bestEffort = bestEffort;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Starts a simulation of {@code command.studentId()} for the calling staff member.
     *
     * <p>Any ACTIVE session of the caller is ended first. For a simulation credential the role
     * check applies to the staff member behind it, so such a caller gets {@link
     * AlreadySimulatingException} rather than a role error.
     */
    public SimulationStart start(PlatformSecurityContext caller, StartSimulationCommand command) {
        Role staffRole =
                caller.simulationClaims()
                        .map(SimulationClaims::originalUserRole)
                        .orElse(caller.role());
        if (!SIMULATING_ROLES.contains(staffRole)) {
            throw new SimulationForbiddenException("simulation.role-not-allowed");
        }
        if (caller.isSimulation()) {
            throw new AlreadySimulatingException("simulation.already-active");
        }

        Instant now = clock.instant();
        int autoEnded = endAll(sessions.findActive(caller.userId()), now);
        if (autoEnded > 0) {
            log.info("Auto-ended {} active simulation session(s) of {}", autoEnded, caller.userId());
        }

        String tenantId = tenantResolver.resolve(caller, command.tenantId());
        TenantRecord tenant = requireTenant(tenantId);
        TenantConnection connection = connections.getConnection(tenant.databaseName());
        StudentRecord student =
                students.findActiveStudentById(connection, command.studentId())
                        .orElseThrow(
                                () ->
                                        new SimulationNotFoundException(
                                                "simulation.student-not-found",
                                                command.studentId()));
        if (!student.isActive()) {
            throw new SimulationBadRequestException("simulation.student-inactive");
        }

        SimulationSession session =
                sessions.create(
                        SimulationSession.begin(
                                caller.userId(),
                                caller.role(),
                                caller.user().email(),
                                caller.tenantId(),
                                student,
                                tenant,
                                command.mode(),
                                command.purpose(),
                                command.origin(),
                                now));
        log.info(
                "Simulation session {} started by {} ({}) as student {} in tenant {}",
                session.id(),
                caller.userId(),
                caller.role().value(),
                student.id(),
                tenant.id());
        audit.started(session);
        metrics.counter(METRIC_STARTED, "Simulation sessions started", "mode", session.mode().name())
                .increment();

        AuthenticatedUser simulatedStudent =
                new AuthenticatedUser(
                        student.id(), student.email(), Role.STUDENT, tenant.id(), caller.language());
        TokenPair pair =
                tokens.issueSimulation(
                        simulatedStudent,
                        new SimulationClaims(session.id(), caller.userId(), caller.role()));
        return new SimulationStart(session, student, tenant, pair);
    }

    /**
     * Ends the caller's simulation and issues fresh credentials for the staff member who started
     * it.
     *
     * <p>A simulation credential names its session; a staff credential falls back to the latest
     * ACTIVE session of that user. Finding nothing is not an error.
     */
    public SimulationEnd end(PlatformSecurityContext caller) {
        Optional<SimulationSession> found =
                caller.isSimulation()
                        ? sessions.findById(caller.simulation().sessionId())
                        : sessions.findLatestActive(caller.userId());
        if (found.isEmpty()) {
            log.info("No simulation session to end for {}", caller.userId());
            return SimulationEnd.nothingToEnd();
        }
        SimulationSession session = found.get();
        if (!session.isActive()) {
            throw new InvalidSimulationStateException("simulation.already-ended");
        }
        SimulationSession ended = session.endedAt(clock.instant());
        if (!sessions.markEnded(ended.id(), ended.endedAt(), ended.durationSeconds())) {
            throw new InvalidSimulationStateException("simulation.already-ended");
        }
        afterEnded(ended);

        AuthenticatedUser staff =
                new AuthenticatedUser(
                        ended.originalUserId(),
                        ended.originalUserEmail(),
                        ended.originalUserRole(),
                        ended.originalUserTenantId(),
                        caller.language());
        return new SimulationEnd(ended, tokens.issue(staff));
    }

    /** Ends every ACTIVE session of the calling staff member and returns how many were ended. */
    public int cleanupStuckSessions(PlatformSecurityContext caller) {
        requireActingStaff(caller);
        int count = endAll(sessions.findActive(caller.userId()), clock.instant());
        log.info("Cleaned up {} stuck simulation session(s) of {}", count, caller.userId());
        return count;
    }

    public SimulationStatusView status(PlatformSecurityContext caller) {
        return caller.simulationClaims()
                .flatMap(claims -> sessions.findById(claims.sessionId()))
                .map(SimulationStatusView::of)
                .orElseGet(SimulationStatusView::notInSimulation);
    }

    /** Students the caller may simulate, in the tenant chosen by the role's resolution rule. */
    public PageResult<StudentRecord> availableStudents(
            PlatformSecurityContext caller, String search, String requestedTenantId, Paging paging) {
        requireActingStaff(caller);
        TenantRecord tenant = requireTenant(tenantResolver.resolve(caller, requestedTenantId));
        TenantConnection connection = connections.getConnection(tenant.databaseName());
        return students.searchActive(connection, search, paging);
    }

    public PageResult<SimulationSession> history(PlatformSecurityContext caller, Paging paging) {
        return sessions.findHistory(HistoryScope.forCaller(caller), paging);
    }

    /** Adds {@code path} to the session's visited pages. Failures are logged, never thrown. */
    public void trackPageVisit(String sessionId, String path) {
        if (sessionId == null || path == null || path.isBlank()) {
            return;
        }
        bestEffort.submit("simulation.track-page", () -> sessions.addPageVisit(sessionId, path));
    }

    /** Adds one to a session counter. Failures are logged, never thrown. */
    public void incrementActivityCounter(String sessionId, ActivityCounter counter) {
        if (sessionId == null || counter == null) {
            return;
        }
        bestEffort.submit(
                "simulation.increment-counter",
                () -> sessions.incrementCounter(sessionId, counter));
    }

    private int endAll(List<SimulationSession> active, Instant now) {
        int count = 0;
        for (SimulationSession session : active) {
            SimulationSession ended = session.endedAt(now);
            if (sessions.markEnded(ended.id(), now, ended.durationSeconds())) {
                afterEnded(ended);
                count++;
            } else {
                log.debug("Session {} was already ended", session.id());
            }
        }
        return count;
    }

    private void afterEnded(SimulationSession ended) {
        log.info(
                "Simulation session {} ended after {}s",
                ended.id(),
                ended.durationSeconds());
        audit.ended(ended);
        metrics.counter(METRIC_ENDED, "Simulation sessions ended", "mode", ended.mode().name())
                .increment();
    }

    private TenantRecord requireTenant(String tenantId) {
        return tenants.findTenantById(tenantId)
                .filter(tenant -> !tenant.isDeleted())
                .orElseThrow(
                        () -> new SimulationNotFoundException("simulation.tenant-not-found", tenantId));
    }

    private static void requireActingStaff(PlatformSecurityContext caller) {
        if (!RoleChecker.isActingStaff(caller)) {
            throw new SimulationForbiddenException("simulation.role-not-allowed");
        }
    }
}
