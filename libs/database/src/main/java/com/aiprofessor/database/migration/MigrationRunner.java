package com.aiprofessor.database.migration;

import com.aiprofessor.observability.MetricFactory;
import com.aiprofessor.observability.SpanHelper;
import io.opentelemetry.api.trace.SpanKind;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies pending migrations in registry order.
 *
 * <p>For each migration of the target's type: skip it if a successful attempt is already recorded,
 * otherwise run {@code up} inside a span, record the attempt (success or failure) and stop at the
 * first failure. A failing migration never throws past the runner; it shows up as a failed {@link
 * MigrationResult}. Errors opening the database or writing the tracker do propagate.
 */
public class MigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private final MigrationRegistry registry;
    private final MigrationTargetProvider targets;
    private final SpanHelper spans;
    private final MetricFactory metrics;
    private final Clock clock;

    public MigrationRunner(
            MigrationRegistry registry,
            MigrationTargetProvider targets,
            SpanHelper spans,
            MetricFactory metrics,
            Clock clock) {
        if (registry == null || targets == null || spans == null || metrics == null || clock == null) {
            throw new IllegalArgumentException("MigrationRunner collaborators must not be null");
        }
        this.registry = registry;
        this.targets = targets;
        this.spans = spans;
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Runs pending central migrations. */
    public List<MigrationResult> runCentral() {
        try (MigrationTarget target = targets.central()) {
            return run(target);
        }
    }

    /** Runs pending tenant migrations against {@code tenantDbName}. */
    public List<MigrationResult> runTenant(String tenantDbName) {
        if (tenantDbName == null || tenantDbName.isBlank()) {
            throw new IllegalArgumentException("tenantDbName must not be null or blank");
        }
        try (MigrationTarget target = targets.tenant(tenantDbName)) {
            return run(target);
        }
    }

    /**
     * Runs central migrations, then tenant migrations for {@code tenantDbName} when given. Tenant
     * migrations are skipped when any central migration failed.
     */
    public MigrationReport runAll(String tenantDbName) {
        List<MigrationResult> central = runCentral();
        boolean centralFailed = central.stream().anyMatch(r -> !r.success());
        if (tenantDbName == null || tenantDbName.isBlank()) {
            return MigrationReport.central(central);
        }
        if (centralFailed) {
            log.error("Central migrations failed, skipping tenant migrations for {}", tenantDbName);
            return new MigrationReport(central, List.of(), true);
        }
        return new MigrationReport(central, runTenant(tenantDbName), false);
    }

    /** Attempts recorded on the target database. */
    public List<MigrationRecord> history(MigrationType type, String tenantDbName) {
        try (MigrationTarget target =
                type == MigrationType.CENTRAL ? targets.central() : targets.tenant(tenantDbName)) {
            return target.records().findAll();
        }
    }

    private List<MigrationResult> run(MigrationTarget target) {
        List<Migration> migrations = registry.migrations(target.type());
        log.info("[{}] {} migration(s) registered", target.label(), migrations.size());

        List<MigrationResult> results = new ArrayList<>();
        for (Migration migration : migrations) {
            if (target.records().hasSucceeded(migration.name(), target.type(), target.tenantDbName())) {
                log.debug("[{}] {} already applied, skipping", target.label(), migration.name());
                continue;
            }
            MigrationResult result = execute(migration, target);
            results.add(result);
            if (!result.success()) {
                log.error("[{}] Stopping after failed migration {}", target.label(), migration.name());
                break;
            }
        }
        if (results.isEmpty()) {
            log.info("[{}] No pending migrations", target.label());
        }
        return results;
    }

    private MigrationResult execute(Migration migration, MigrationTarget target) {
        log.info("[{}] Running {}", target.label(), migration.name());
        MigrationContext context = new MigrationContext(target.database(), target.tenantDbName());
        Map<String, String> attributes = new HashMap<>();
        attributes.put("migration.name", migration.name());
        attributes.put("migration.type", migration.type().value());
        if (target.tenantDbName() != null) {
            attributes.put("db.name", target.tenantDbName());
        }

        long started = clock.millis();
        String error = null;
        try {
            spans.withSpan(
                    "migration " + migration.name(),
                    SpanKind.INTERNAL,
                    attributes,
                    () -> {
                        migration.up(context);
                        return null;
                    });
        } catch (Exception e) {
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }
        long elapsed = Math.max(0, clock.millis() - started);
        boolean success = error == null;

        metrics.timer(
                        "migration.execution",
                        "Time spent applying a migration",
                        "type", migration.type().value(),
                        "outcome", success ? "success" : "failure")
                .record(elapsed, TimeUnit.MILLISECONDS);

        MigrationRecord record =
                new MigrationRecord(
                        migration.name(),
                        migration.type(),
                        target.tenantDbName(),
                        clock.instant(),
                        elapsed,
                        success,
                        error);
        target.records().record(record);

        if (success) {
            log.info("[{}] {} completed in {}ms", target.label(), migration.name(), elapsed);
        } else {
            log.error("[{}] {} failed after {}ms: {}", target.label(), migration.name(), elapsed, error);
        }
        return MigrationResult.of(record);
    }
}
