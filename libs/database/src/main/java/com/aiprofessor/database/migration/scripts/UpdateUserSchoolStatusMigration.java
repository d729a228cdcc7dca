package com.aiprofessor.database.migration.scripts;

import static org.springframework.data.mongodb.core.query.Criteria.where;

import com.aiprofessor.database.migration.MigrationContext;
import com.aiprofessor.database.migration.MigrationType;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/**
 * Gives every user and school a status: ACTIVE where missing, INACTIVE for soft-deleted records.
 * Reverting resets all statuses to ACTIVE; the field stays.
 */
public class UpdateUserSchoolStatusMigration extends MongoMigration {

    public UpdateUserSchoolStatusMigration() {
        super("20250109120000-update-user-school-status", MigrationType.CENTRAL);
    }

    @Override
    public void up(MigrationContext context) {
        for (String collection : new String[] {"users", "schools"}) {
            updateMany(
                    context,
                    collection,
                    Query.query(where("status").exists(false)),
                    Update.update("status", STATUS_ACTIVE),
                    "set ACTIVE on " + collection);
            updateMany(
                    context,
                    collection,
                    Query.query(where("deleted_at").ne(null).and("status").is(STATUS_ACTIVE)),
                    Update.update("status", STATUS_INACTIVE),
                    "set INACTIVE on deleted " + collection);
        }
    }

    @Override
    public void down(MigrationContext context) {
        for (String collection : new String[] {"users", "schools"}) {
            updateMany(
                    context,
                    collection,
                    new Query(),
                    Update.update("status", STATUS_ACTIVE),
                    "reset status on " + collection);
        }
    }
}
