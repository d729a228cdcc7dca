package com.aiprofessor.simulation.api;

import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.security.TokenPair;
import com.aiprofessor.simulation.api.dto.CleanupResponse;
import com.aiprofessor.simulation.api.dto.EndSimulationResponse;
import com.aiprofessor.simulation.api.dto.PageResponse;
import com.aiprofessor.simulation.api.dto.SessionSummary;
import com.aiprofessor.simulation.api.dto.SimulationStatusResponse;
import com.aiprofessor.simulation.api.dto.StartSimulationRequest;
import com.aiprofessor.simulation.api.dto.StartSimulationResponse;
import com.aiprofessor.simulation.api.dto.StudentSummary;
import com.aiprofessor.simulation.api.dto.TenantSummary;
import com.aiprofessor.simulation.domain.Paging;
import com.aiprofessor.simulation.domain.RequestOrigin;
import com.aiprofessor.simulation.domain.SimulationEnd;
import com.aiprofessor.simulation.domain.SimulationService;
import com.aiprofessor.simulation.domain.SimulationStart;
import com.aiprofessor.simulation.domain.StartSimulationCommand;
import com.aiprofessor.simulation.infrastructure.web.AllowSimulationWrite;
import com.aiprofessor.simulation.infrastructure.web.LocalizedMessages;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Simulation ("view as student") endpoints. */
@RestController
@RequestMapping("/api/simulation")
public class SimulationController {

    private final SimulationService simulations;
    private final LocalizedMessages messages;

    public SimulationController(SimulationService simulations, LocalizedMessages messages) {
        this.simulations = simulations;
        this.messages = messages;
    }

    @PostMapping("/start")
    public StartSimulationResponse start(
            PlatformSecurityContext caller,
            @Valid @RequestBody StartSimulationRequest body,
            HttpServletRequest request) {
        StartSimulationCommand command =
                new StartSimulationCommand(
                        body.studentId(),
                        body.simulationMode(),
                        body.tenantId(),
                        body.purpose(),
                        new RequestOrigin(
                                request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT)));
        SimulationStart started = simulations.start(caller, command);
        TokenPair tokens = started.tokens();
        return new StartSimulationResponse(
                messages.get(caller.language(), "simulation.started", started.student().fullName()),
                tokens.accessToken(),
                tokens.refreshToken(),
                tokens.accessTokenExpiresIn(),
                started.session().id(),
                started.session().mode(),
                StudentSummary.of(started.student()),
                new TenantSummary(started.tenant().id(), started.tenant().name()));
    }

    /** Reachable with a simulation credential even though it is a POST. */
    @AllowSimulationWrite
    @PostMapping("/end")
    public EndSimulationResponse end(PlatformSecurityContext caller) {
        SimulationEnd ended = simulations.end(caller);
        String key = ended.ended() ? "simulation.ended" : "simulation.nothing-to-end";
        TokenPair tokens = ended.tokens();
        return new EndSimulationResponse(
                messages.get(caller.language(), key),
                tokens.accessToken(),
                tokens.refreshToken(),
                tokens.accessTokenExpiresIn(),
                ended.ended() ? SessionSummary.of(ended.session()) : null);
    }

    @GetMapping("/status")
    public SimulationStatusResponse status(PlatformSecurityContext caller) {
        return SimulationStatusResponse.of(simulations.status(caller));
    }

    @GetMapping("/students")
    public PageResponse<StudentSummary> students(
            PlatformSecurityContext caller,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String search,
            @RequestParam(name = "tenant_id", required = false) String tenantId) {
        return PageResponse.of(
                simulations.availableStudents(caller, search, tenantId, Paging.of(page, limit)),
                StudentSummary::of);
    }

    @GetMapping("/history")
    public PageResponse<SessionSummary> history(
            PlatformSecurityContext caller,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return PageResponse.of(
                simulations.history(caller, Paging.of(page, limit)), SessionSummary::of);
    }

    @PostMapping("/cleanup")
    public CleanupResponse cleanup(PlatformSecurityContext caller) {
        int count = simulations.cleanupStuckSessions(caller);
        return new CleanupResponse(messages.get(caller.language(), "simulation.cleanup", count), count);
    }
}
