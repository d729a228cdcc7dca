package com.aiprofessor.simulation.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.aiprofessor.database.tenant.TenantConnection;
import com.aiprofessor.simulation.domain.StudentRecord;
import com.mongodb.client.MongoClient;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.regex.Pattern;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

@DisplayName("MongoStudentDirectory")
class MongoStudentDirectoryTest {

    private final MongoTemplate template = mock(MongoTemplate.class);
    private final TenantConnection connection =
            new TenantConnection("db_lyon", template, mock(MongoClient.class), Instant.EPOCH);
    private final MongoStudentDirectory directory = new MongoStudentDirectory();

    @Test
    @DisplayName("without a search term only ACTIVE, non-deleted students match")
    void blankSearch() {
        Document criteria = MongoStudentDirectory.searchCriteria("  ").getCriteriaObject();

        assertThat(criteria).containsEntry("status", "ACTIVE").containsEntry("deleted_at", null);
        assertThat(criteria).doesNotContainKey("$or");
    }

    @Test
    @DisplayName("search terms are matched literally and case-insensitively")
    @SuppressWarnings("unchecked")
    void searchIsQuoted() {
        Document criteria = MongoStudentDirectory.searchCriteria(" Mar.tin ").getCriteriaObject();

        List<Document> alternatives = (List<Document>) criteria.get("$or");
        assertThat(alternatives).hasSize(4);
        Pattern firstName = (Pattern) alternatives.get(0).get("first_name");
        assertThat(firstName.pattern()).isEqualTo(Pattern.quote("Mar.tin"));
        assertThat(firstName.flags() & Pattern.CASE_INSENSITIVE).isNotZero();
        assertThat(alternatives.get(3)).containsEntry("email", "mar.tin");
    }

    @Test
    @DisplayName("looks students up by ObjectId and maps their fields")
    void findsStudent() {
        ObjectId id = new ObjectId();
        Document stored =
                new Document("_id", id)
                        .append("email", "alice@school.test")
                        .append("first_name", "Alice")
                        .append("last_name", "Martin")
                        .append("student_code", "C-1")
                        .append("year", 3)
                        .append("status", "INACTIVE")
                        .append("created_at", new Date());
        when(template.findOne(any(Query.class), eq(Document.class), eq("students"))).thenReturn(stored);

        StudentRecord student = directory.findActiveStudentById(connection, id.toHexString()).orElseThrow();

        assertThat(student.id()).isEqualTo(id.toHexString());
        assertThat(student.fullName()).isEqualTo("Alice Martin");
        assertThat(student.year()).isEqualTo(3);
        assertThat(student.isActive()).isFalse();
    }

    @Test
    @DisplayName("malformed ids are not found")
    void malformedId() {
        assertThat(directory.findActiveStudentById(connection, "stu-1")).isEmpty();
        verifyNoInteractions(template);
    }
}
