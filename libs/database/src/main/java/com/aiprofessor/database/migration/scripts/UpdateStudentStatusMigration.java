package com.aiprofessor.database.migration.scripts;

import static org.springframework.data.mongodb.core.query.Criteria.where;

import com.aiprofessor.database.migration.MigrationContext;
import com.aiprofessor.database.migration.MigrationType;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/** Tenant counterpart of {@link UpdateUserSchoolStatusMigration} for {@code students}. */
public class UpdateStudentStatusMigration extends MongoMigration {

    static final String STUDENTS = "students";

    public UpdateStudentStatusMigration() {
        super("20250109120000-update-student-status", MigrationType.TENANT);
    }

    @Override
    public void up(MigrationContext context) {
        updateMany(
                context,
                STUDENTS,
                Query.query(where("status").exists(false)),
                Update.update("status", STATUS_ACTIVE),
                "set ACTIVE on students");
        updateMany(
                context,
                STUDENTS,
                Query.query(where("deleted_at").ne(null).and("status").is(STATUS_ACTIVE)),
                Update.update("status", STATUS_INACTIVE),
                "set INACTIVE on deleted students");
    }

    @Override
    public void down(MigrationContext context) {
        updateMany(
                context,
                STUDENTS,
                new Query(),
                Update.update("status", STATUS_ACTIVE),
                "reset status on students");
    }
}
