package com.aiprofessor.simulation.infrastructure.web;

import com.aiprofessor.database.tenant.DatabaseConfigurationException;
import com.aiprofessor.observability.CorrelationContextHolder;
import com.aiprofessor.security.InvalidTokenException;
import com.aiprofessor.security.Language;
import com.aiprofessor.simulation.domain.error.SimulationException;
import com.aiprofessor.simulation.domain.error.SimulationForbiddenException;
import com.aiprofessor.simulation.domain.error.SimulationNotFoundException;
import com.aiprofessor.simulation.domain.error.SimulationWriteBlockedException;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Domain errors carry a message key which is resolved in the caller's language. Every problem
 * has a {@code code} (the message key), a {@code timestamp} and the {@code correlationId}:
 *
 * <pre>
 * {
 *   "type": "https://aiprofessor.com/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "Write operations are not allowed in simulation mode",
 *   "code": "simulation.write-blocked",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://aiprofessor.com/errors/";

    private final LocalizedMessages messages;

    public GlobalExceptionHandler(LocalizedMessages messages) {
        this.messages = messages;
    }

    @ExceptionHandler(SimulationException.class)
    public ResponseEntity<ProblemDetail> handleSimulation(
            SimulationException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex);
        log.warn("Simulation request rejected with {}: {}", status.value(), ex.messageKey());
        String detail =
                messages.get(LocalizedMessages.languageOf(request), ex.messageKey(), ex.arguments());
        ProblemDetail problem = problem(status, detail, ex.messageKey());
        if (ex instanceof SimulationWriteBlockedException) {
            problem.setProperty("method", ((SimulationWriteBlockedException) ex).method());
            problem.setProperty("path", ((SimulationWriteBlockedException) ex).path());
        }
        return ResponseEntity.status(status).body(problem);
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<ProblemDetail> handleInvalidToken(
            InvalidTokenException ex, HttpServletRequest request) {
        log.warn("Unauthenticated request: {}", ex.getMessage());
        String key = "auth.invalid-token";
        ProblemDetail problem =
                problem(
                        HttpStatus.UNAUTHORIZED,
                        messages.get(LocalizedMessages.languageOf(request), key),
                        key);
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problem);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        log.warn("Validation failed: {}", ex.getMessage());
        String key = "error.validation";
        String fields =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .collect(Collectors.joining("; "));
        String detail = messages.get(LocalizedMessages.languageOf(request), key);
        ProblemDetail problem =
                problem(HttpStatus.BAD_REQUEST, fields.isEmpty() ? detail : detail + ": " + fields, key);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {}", ex.getMessage());
        String key = "error.validation";
        ProblemDetail problem =
                problem(
                        HttpStatus.BAD_REQUEST,
                        messages.get(LocalizedMessages.languageOf(request), key),
                        key);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(DatabaseConfigurationException.class)
    public ResponseEntity<ProblemDetail> handleConfiguration(
            DatabaseConfigurationException ex, HttpServletRequest request) {
        log.error("Database configuration error", ex);
        String key = "error.configuration";
        ProblemDetail problem =
                problem(
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        messages.get(LocalizedMessages.languageOf(request), key),
                        key);
        return ResponseEntity.internalServerError().body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse) {
            // framework errors such as unknown routes keep their own status
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            log.warn("Request failed with {}: {}", status.value(), ex.getMessage());
            ProblemDetail problem = ((ErrorResponse) ex).getBody();
            enrich(problem, "error." + status.value());
            return ResponseEntity.status(status).body(problem);
        }
        log.error("Internal server error", ex);
        String key = "error.internal";
        ProblemDetail problem =
                problem(
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        messages.get(languageOrDefault(request), key),
                        key);
        return ResponseEntity.internalServerError().body(problem);
    }

    static HttpStatus statusOf(SimulationException ex) {
        if (ex instanceof SimulationForbiddenException
                || ex instanceof SimulationWriteBlockedException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof SimulationNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static Language languageOrDefault(HttpServletRequest request) {
        return request == null ? Language.DEFAULT : LocalizedMessages.languageOf(request);
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String code) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(
                URI.create(
                        ERROR_TYPE_BASE
                                + status.name().toLowerCase(Locale.ROOT).replace('_', '-')));
        enrich(problem, code);
        return problem;
    }

    private static void enrich(ProblemDetail problem, String code) {
        problem.setProperty("code", code);
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
