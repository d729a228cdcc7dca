package com.aiprofessor.database.migration.scripts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiprofessor.database.migration.MigrationContext;
import com.aiprofessor.database.migration.MigrationType;
import com.mongodb.client.result.UpdateResult;
import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

@ExtendWith(MockitoExtension.class)
@DisplayName("Shipped migrations")
class StudentMigrationsTest {

    @Mock private MongoTemplate template;

    private MigrationContext tenant;

    @BeforeEach
    void setUp() {
        tenant = new MigrationContext(template, "school_a");
        when(template.updateMulti(any(Query.class), any(Update.class), any(String.class)))
                .thenReturn(UpdateResult.acknowledged(3, 3L, null));
    }

    @Test
    @DisplayName("add-student-year should set year 1 where missing")
    void addStudentYear() {
        AddStudentYearMigration migration = new AddStudentYearMigration();
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);

        migration.up(tenant);

        verify(template).updateMulti(query.capture(), update.capture(), eq("students"));
        assertThat(query.getValue().getQueryObject())
                .isEqualTo(new Document("year", new Document("$exists", false)));
        assertThat(update.getValue().getUpdateObject())
                .isEqualTo(new Document("$set", new Document("year", 1)));
        assertThat(migration.type()).isEqualTo(MigrationType.TENANT);
    }

    @Test
    @DisplayName("add-csv-upload-field down should unset the field")
    void csvUploadDown() {
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);

        new AddCsvUploadFieldMigration().down(tenant);

        verify(template).updateMulti(any(Query.class), update.capture(), eq("students"));
        assertThat(update.getValue().getUpdateObject())
                .isEqualTo(new Document("$unset", new Document("is_csv_upload", 1)));
    }

    @Test
    @DisplayName("update-student-status should activate, then deactivate deleted students")
    void studentStatus() {
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);

        new UpdateStudentStatusMigration().up(tenant);

        verify(template, times(2)).updateMulti(any(Query.class), update.capture(), eq("students"));
        List<Update> updates = update.getAllValues();
        assertThat(updates.get(0).getUpdateObject())
                .isEqualTo(new Document("$set", new Document("status", "ACTIVE")));
        assertThat(updates.get(1).getUpdateObject())
                .isEqualTo(new Document("$set", new Document("status", "INACTIVE")));
    }

    @Test
    @DisplayName("update-user-school-status should touch users and schools")
    void userSchoolStatus() {
        new UpdateUserSchoolStatusMigration().up(new MigrationContext(template, null));

        verify(template, times(2)).updateMulti(any(Query.class), any(Update.class), eq("users"));
        verify(template, times(2)).updateMulti(any(Query.class), any(Update.class), eq("schools"));
    }
}
