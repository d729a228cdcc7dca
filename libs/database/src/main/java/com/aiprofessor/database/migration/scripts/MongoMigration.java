package com.aiprofessor.database.migration.scripts;

import com.aiprofessor.database.migration.Migration;
import com.aiprofessor.database.migration.MigrationContext;
import com.aiprofessor.database.migration.MigrationType;
import com.mongodb.client.result.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/** Base class for migrations made of bulk updates on one database. */
abstract class MongoMigration implements Migration {

    static final String STATUS_ACTIVE = "ACTIVE";
    static final String STATUS_INACTIVE = "INACTIVE";

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String name;
    private final MigrationType type;

    MongoMigration(String name, MigrationType type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public MigrationType type() {
        return type;
    }

    /** Runs an {@code updateMany} and logs the number of modified documents. */
    protected long updateMany(
            MigrationContext context, String collection, Query query, Update update, String what) {
        UpdateResult result = context.database().updateMulti(query, update, collection);
        long modified = result.getModifiedCount();
        log.info("[{}] {}: {} {} document(s)", target(context), name, what, modified);
        return modified;
    }

    private static String target(MigrationContext context) {
        return context.tenantDbName() == null ? "central" : context.tenantDbName();
    }

    @Override
    public String toString() {
        return type.value() + ":" + name;
    }
}
