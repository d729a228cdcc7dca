package com.aiprofessor.database.migration;

import java.util.List;

/**
 * Results of a run over the central database and, optionally, one tenant database.
 *
 * @param central results of central migrations executed in this run
 * @param tenant results of tenant migrations executed in this run
 * @param tenantSkipped true when tenant migrations were requested but skipped because a central
 *     migration failed
 */
public record MigrationReport(
        List<MigrationResult> central, List<MigrationResult> tenant, boolean tenantSkipped) {

    public MigrationReport {
        central = central == null ? List.of() : List.copyOf(central);
        tenant = tenant == null ? List.of() : List.copyOf(tenant);
    }

    public static MigrationReport central(List<MigrationResult> central) {
        return new MigrationReport(central, List.of(), false);
    }

    public static MigrationReport tenant(List<MigrationResult> tenant) {
        return new MigrationReport(List.of(), tenant, false);
    }

    public int executed() {
        return central.size() + tenant.size();
    }

    public long failed() {
        return central.stream().filter(r -> !r.success()).count()
                + tenant.stream().filter(r -> !r.success()).count();
    }

    /** True when any executed migration failed or tenant migrations were skipped. */
    public boolean hasFailures() {
        return failed() > 0 || tenantSkipped;
    }
}
