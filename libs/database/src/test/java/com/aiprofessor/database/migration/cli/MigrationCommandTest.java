package com.aiprofessor.database.migration.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiprofessor.database.migration.Migration;
import com.aiprofessor.database.migration.MigrationContext;
import com.aiprofessor.database.migration.MigrationRecord;
import com.aiprofessor.database.migration.MigrationRecordStore;
import com.aiprofessor.database.migration.MigrationRegistry;
import com.aiprofessor.database.migration.MigrationRunner;
import com.aiprofessor.database.migration.MigrationTarget;
import com.aiprofessor.database.migration.MigrationTargetProvider;
import com.aiprofessor.database.migration.MigrationType;
import com.aiprofessor.observability.MetricFactory;
import com.aiprofessor.observability.SpanHelper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

@DisplayName("MigrationCommand")
class MigrationCommandTest {

    private static final MigrationEnvironment CONFIGURED =
            new MigrationEnvironment("mongodb://localhost:27017/central", "mongodb://localhost:27017");

    private final List<String> executed = new ArrayList<>();
    private final List<MigrationRecord> records = new ArrayList<>();
    private boolean failTenant;
    private StringWriter err;
    private StringWriter out;

    @BeforeEach
    void setUp() {
        err = new StringWriter();
        out = new StringWriter();
    }

    private int run(MigrationEnvironment environment, String... args) {
        CommandLine commandLine = MigrationCommand.commandLine(this::runner, environment);
        commandLine.setErr(new PrintWriter(err));
        commandLine.setOut(new PrintWriter(out));
        return commandLine.execute(args);
    }

    private MigrationRunner runner(MigrationEnvironment environment) {
        MigrationRecordStore store =
                new MigrationRecordStore() {
                    @Override
                    public boolean hasSucceeded(String name, MigrationType type, String tenantDbName) {
                        return false;
                    }

                    @Override
                    public void record(MigrationRecord record) {
                        records.add(record);
                    }

                    @Override
                    public List<MigrationRecord> findAll() {
                        return List.copyOf(records);
                    }
                };
        MigrationTargetProvider provider =
                new MigrationTargetProvider() {
                    @Override
                    public MigrationTarget central() {
                        return new MigrationTarget(MigrationType.CENTRAL, null, null, store, null);
                    }

                    @Override
                    public MigrationTarget tenant(String tenantDbName) {
                        return new MigrationTarget(MigrationType.TENANT, tenantDbName, null, store, null);
                    }
                };
        return new MigrationRunner(
                new MigrationRegistry(
                        List.of(
                                migration("20250101000000-central-step", MigrationType.CENTRAL),
                                migration("20250101000000-tenant-step", MigrationType.TENANT))),
                provider,
                new SpanHelper(OpenTelemetry.noop().getTracer("test")),
                new MetricFactory(new SimpleMeterRegistry(), "test"),
                Clock.systemUTC());
    }

    private Migration migration(String name, MigrationType type) {
        return new Migration() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public MigrationType type() {
                return type;
            }

            @Override
            public void up(MigrationContext context) {
                if (type == MigrationType.TENANT && failTenant) {
                    throw new IllegalStateException("tenant step failed");
                }
                executed.add(name);
            }

            @Override
            public void down(MigrationContext context) {}
        };
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("should default to all and run central only without a database name")
        void defaultsToAll() {
            assertThat(run(CONFIGURED, "run")).isZero();
            assertThat(executed).containsExactly("20250101000000-central-step");
        }

        @Test
        @DisplayName("should run central and tenant migrations for --type all with --db-name")
        void runsAll() {
            assertThat(run(CONFIGURED, "run", "--type", "all", "--db-name", "school_a")).isZero();
            assertThat(executed)
                    .containsExactly("20250101000000-central-step", "20250101000000-tenant-step");
        }

        @Test
        @DisplayName("should accept the type case-insensitively")
        void typeIsCaseInsensitive() {
            assertThat(run(CONFIGURED, "run", "--type", "CENTRAL")).isZero();
        }

        @Test
        @DisplayName("should exit 1 when a migration fails")
        void exitsOneOnFailure() {
            failTenant = true;

            assertThat(run(CONFIGURED, "run", "--type", "tenant", "--db-name", "school_a")).isEqualTo(1);
            assertThat(records).extracting(MigrationRecord::success).containsExactly(false);
        }

        @Test
        @DisplayName("should reject --type tenant without --db-name")
        void tenantNeedsDbName() {
            assertThat(run(CONFIGURED, "run", "--type", "tenant")).isEqualTo(1);
            assertThat(err.toString()).contains("--db-name is required");
            assertThat(executed).isEmpty();
        }

        @Test
        @DisplayName("should reject an unknown type")
        void rejectsUnknownType() {
            assertThat(run(CONFIGURED, "run", "--type", "everything")).isEqualTo(1);
        }

        @Test
        @DisplayName("should exit 1 when the central URI is missing")
        void missingCentralUri() {
            MigrationEnvironment env = MigrationEnvironment.from(Map.of("MONGODB_BASE_URI", "mongodb://x"));

            assertThat(run(env, "run", "--type", "central")).isEqualTo(1);
            assertThat(executed).isEmpty();
        }

        @Test
        @DisplayName("should exit 1 when the tenant base URI is missing")
        void missingTenantBaseUri() {
            MigrationEnvironment env = MigrationEnvironment.from(Map.of("CENTRAL_DB_URI", "mongodb://x/central"));

            assertThat(run(env, "run", "--db-name", "school_a")).isEqualTo(1);
            assertThat(executed).isEmpty();
        }
    }

    @Nested
    @DisplayName("status and usage")
    class StatusAndUsage {

        @Test
        @DisplayName("status should list recorded attempts")
        void statusLists() {
            run(CONFIGURED, "run", "--type", "central");

            assertThat(run(CONFIGURED, "status")).isZero();
            assertThat(out.toString()).contains("OK").contains("20250101000000-central-step");
        }

        @Test
        @DisplayName("no subcommand should print usage and exit 1")
        void noSubcommand() {
            assertThat(run(CONFIGURED)).isEqualTo(1);
            assertThat(err.toString()).contains("Usage: migrate");
        }

        @Test
        @DisplayName("--help should exit 0")
        void help() {
            assertThat(run(CONFIGURED, "run", "--help")).isZero();
        }

        @Test
        @DisplayName("environment should prefer MONGODB_URI over CENTRAL_DB_URI")
        void environmentPrecedence() {
            MigrationEnvironment env =
                    MigrationEnvironment.from(Map.of("MONGODB_URI", "mongodb://a/x", "CENTRAL_DB_URI", "mongodb://b/y"));

            assertThat(env.centralUri()).isEqualTo("mongodb://a/x");
        }
    }
}
