package com.aiprofessor.database.migration.cli;

import com.aiprofessor.database.migration.MigrationRegistry;
import com.aiprofessor.database.migration.MigrationRunner;
import com.aiprofessor.database.migration.MongoMigrationTargetProvider;
import com.aiprofessor.database.tenant.MongoTenantConnectionFactory;
import com.aiprofessor.observability.MetricFactory;
import com.aiprofessor.observability.SpanHelper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * {@code migrate} command line entry point.
 *
 * <pre>
 * migrate run [--type central|tenant|all] [--db-name NAME]
 * migrate status [--type central|tenant] [--db-name NAME]
 * </pre>
 *
 * <p>Exit code 0 when everything that ran succeeded, 1 on a failed migration, an invalid
 * invocation or missing configuration.
 */
@Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        description = "Runs AI Professor database migrations.",
        footer = {
            "",
            "Environment:",
            "  MONGODB_URI        central database connection string",
            "  CENTRAL_DB_URI     alternative central database connection string",
            "  MONGODB_BASE_URI   tenant base URI, without a database name"
        })
public class MigrationCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final Logger log = LoggerFactory.getLogger(MigrationCommand.class);

    @Spec CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_FAILURE;
    }

    public static void main(String[] args) {
        System.exit(execute(MigrationCommand::mongoRunner, System.getenv(), args));
    }

    /** Parses and runs {@code args}; returns the process exit code. */
    public static int execute(MigrationRunnerFactory runners, Map<String, String> env, String... args) {
        return commandLine(runners, MigrationEnvironment.from(env)).execute(args);
    }

    static CommandLine commandLine(MigrationRunnerFactory runners, MigrationEnvironment environment) {
        CommandLine commandLine = new CommandLine(new MigrationCommand());
        commandLine.addSubcommand("run", new RunCommand(runners, environment));
        commandLine.addSubcommand("status", new StatusCommand(runners, environment));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setParameterExceptionHandler(
                (ex, args) -> {
                    CommandLine failed = ex.getCommandLine();
                    failed.getErr().println(ex.getMessage());
                    failed.usage(failed.getErr());
                    return EXIT_FAILURE;
                });
        commandLine.setExecutionExceptionHandler(
                (ex, failed, parseResult) -> {
                    log.error("Migration command failed: {}", ex.getMessage(), ex);
                    return EXIT_FAILURE;
                });
        return commandLine;
    }

    static MigrationRunner mongoRunner(MigrationEnvironment environment) {
        return new MigrationRunner(
                MigrationRegistry.standard(),
                new MongoMigrationTargetProvider(
                        environment.centralUri(),
                        new MongoTenantConnectionFactory(environment.tenantBaseUri())),
                new SpanHelper(GlobalOpenTelemetry.getTracer("aiprofessor-migrations")),
                new MetricFactory(new SimpleMeterRegistry(), "migration-cli"),
                Clock.systemUTC());
    }
}
