package com.aiprofessor.database.migration.cli;

import com.aiprofessor.database.migration.MigrationRecord;
import com.aiprofessor.database.migration.MigrationType;
import com.aiprofessor.database.tenant.DatabaseConfigurationException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/** {@code migrate status}: prints the attempts recorded on one database. */
@Command(
        name = "status",
        mixinStandardHelpOptions = true,
        description = "Lists recorded migration attempts of the central database or one tenant database.")
class StatusCommand implements Callable<Integer> {

    @Spec CommandSpec spec;

    @Option(
            names = "--type",
            defaultValue = "CENTRAL",
            description = "central or tenant (default: ${DEFAULT-VALUE})")
    MigrationScope type;

    @Option(names = "--db-name", description = "Tenant database name")
    String dbName;

    private final MigrationRunnerFactory runners;
    private final MigrationEnvironment environment;

    StatusCommand(MigrationRunnerFactory runners, MigrationEnvironment environment) {
        this.runners = runners;
        this.environment = environment;
    }

    @Override
    public Integer call() {
        if (type == MigrationScope.ALL) {
            throw new ParameterException(spec.commandLine(), "--type must be central or tenant");
        }
        if (type == MigrationScope.TENANT && (dbName == null || dbName.isBlank())) {
            throw new ParameterException(spec.commandLine(), "--db-name is required when --type is tenant");
        }
        String tenant = type == MigrationScope.TENANT ? dbName.strip() : null;
        PrintWriter out = spec.commandLine().getOut();
        try {
            environment.requireFor(type, tenant);
        } catch (DatabaseConfigurationException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return MigrationCommand.EXIT_FAILURE;
        }

        MigrationType migrationType = type == MigrationScope.TENANT ? MigrationType.TENANT : MigrationType.CENTRAL;
        List<MigrationRecord> records = runners.create(environment).history(migrationType, tenant);
        if (records.isEmpty()) {
            out.println("No migrations recorded");
        }
        for (MigrationRecord record : records) {
            out.printf(
                    "%-7s %-50s %s %dms%s%n",
                    record.success() ? "OK" : "FAILED",
                    record.migrationName(),
                    record.executedAt(),
                    record.executionTimeMs(),
                    record.errorMessage() == null ? "" : "  " + record.errorMessage());
        }
        out.flush();
        return MigrationCommand.EXIT_OK;
    }
}
