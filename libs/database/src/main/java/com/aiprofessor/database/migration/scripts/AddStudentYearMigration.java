package com.aiprofessor.database.migration.scripts;

import static org.springframework.data.mongodb.core.query.Criteria.where;

import com.aiprofessor.database.migration.MigrationContext;
import com.aiprofessor.database.migration.MigrationType;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/** Puts students without a study year in year 1. */
public class AddStudentYearMigration extends MongoMigration {

    public AddStudentYearMigration() {
        super("20250120000001-add-student-year", MigrationType.TENANT);
    }

    @Override
    public void up(MigrationContext context) {
        updateMany(
                context,
                UpdateStudentStatusMigration.STUDENTS,
                Query.query(where("year").exists(false)),
                Update.update("year", 1),
                "set year=1 on");
    }

    @Override
    public void down(MigrationContext context) {
        updateMany(
                context,
                UpdateStudentStatusMigration.STUDENTS,
                Query.query(where("year").exists(true)),
                new Update().unset("year"),
                "removed year from");
    }
}
