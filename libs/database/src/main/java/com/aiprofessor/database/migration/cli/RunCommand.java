package com.aiprofessor.database.migration.cli;

import com.aiprofessor.database.migration.MigrationReport;
import com.aiprofessor.database.migration.MigrationResult;
import com.aiprofessor.database.migration.MigrationRunner;
import com.aiprofessor.database.tenant.DatabaseConfigurationException;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/** {@code migrate run}: applies pending migrations and logs a summary. */
@Command(
        name = "run",
        mixinStandardHelpOptions = true,
        description = "Applies pending migrations. Central migrations run first; tenant migrations"
                + " are skipped when a central migration fails.")
class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Spec CommandSpec spec;

    @Option(
            names = "--type",
            defaultValue = "ALL",
            description = "central, tenant or all (default: ${DEFAULT-VALUE})")
    MigrationScope type;

    @Option(names = "--db-name", description = "Tenant database name")
    String dbName;

    private final MigrationRunnerFactory runners;
    private final MigrationEnvironment environment;

    RunCommand(MigrationRunnerFactory runners, MigrationEnvironment environment) {
        this.runners = runners;
        this.environment = environment;
    }

    @Override
    public Integer call() {
        String tenant = dbName == null || dbName.isBlank() ? null : dbName.strip();
        if (type == MigrationScope.TENANT && tenant == null) {
            throw new ParameterException(spec.commandLine(), "--db-name is required when --type is tenant");
        }
        if (type == MigrationScope.ALL && tenant == null) {
            log.warn("No --db-name provided, only central migrations will run");
        }
        try {
            environment.requireFor(type, tenant);
        } catch (DatabaseConfigurationException e) {
            log.error("{}", e.getMessage());
            return MigrationCommand.EXIT_FAILURE;
        }

        MigrationRunner runner = runners.create(environment);
        MigrationReport report;
        switch (type) {
            case CENTRAL:
                report = MigrationReport.central(runner.runCentral());
                break;
            case TENANT:
                report = MigrationReport.tenant(runner.runTenant(tenant));
                break;
            default:
                report = runner.runAll(tenant);
                break;
        }
        logSummary(report, tenant);
        return report.hasFailures() ? MigrationCommand.EXIT_FAILURE : MigrationCommand.EXIT_OK;
    }

    private void logSummary(MigrationReport report, String tenant) {
        log.info("Migration results");
        logSection("Central database", report.central());
        if (report.tenantSkipped()) {
            log.warn("Tenant database {}: skipped because central migrations failed", tenant);
        } else if (tenant != null) {
            logSection("Tenant database " + tenant, report.tenant());
        }
        log.info("Executed: {}, failed: {}", report.executed(), report.failed());
    }

    private static void logSection(String title, List<MigrationResult> results) {
        if (results.isEmpty()) {
            log.info("{}: nothing to apply", title);
            return;
        }
        log.info("{}:", title);
        for (MigrationResult result : results) {
            if (result.success()) {
                log.info("  OK     {} ({}ms)", result.migrationName(), result.executionTimeMs());
            } else {
                log.error("  FAILED {} ({}ms): {}", result.migrationName(), result.executionTimeMs(), result.error());
            }
        }
    }
}
