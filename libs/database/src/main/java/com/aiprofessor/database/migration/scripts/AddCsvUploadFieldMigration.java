package com.aiprofessor.database.migration.scripts;

import static org.springframework.data.mongodb.core.query.Criteria.where;

import com.aiprofessor.database.migration.MigrationContext;
import com.aiprofessor.database.migration.MigrationType;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/** Adds {@code is_csv_upload = false} to students created before bulk import existed. */
public class AddCsvUploadFieldMigration extends MongoMigration {

    public AddCsvUploadFieldMigration() {
        super("20250109120001-add-csv-upload-field", MigrationType.TENANT);
    }

    @Override
    public void up(MigrationContext context) {
        updateMany(
                context,
                UpdateStudentStatusMigration.STUDENTS,
                Query.query(where("is_csv_upload").exists(false)),
                Update.update("is_csv_upload", false),
                "added is_csv_upload to");
    }

    @Override
    public void down(MigrationContext context) {
        updateMany(
                context,
                UpdateStudentStatusMigration.STUDENTS,
                Query.query(where("is_csv_upload").exists(true)),
                new Update().unset("is_csv_upload"),
                "removed is_csv_upload from");
    }
}
