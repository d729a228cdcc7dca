package com.aiprofessor.simulation.infrastructure.persistence;

import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.ID;
import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.instant;
import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.objectId;
import static org.springframework.data.mongodb.core.query.Criteria.where;

import com.aiprofessor.database.tenant.TenantConnection;
import com.aiprofessor.simulation.domain.PageResult;
import com.aiprofessor.simulation.domain.Paging;
import com.aiprofessor.simulation.domain.StudentRecord;
import com.aiprofessor.simulation.domain.port.StudentDirectory;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

/**
 * {@link StudentDirectory} over the {@code students} collection of a tenant database. E-mails are
 * stored in clear in this deployment.
 */
public class MongoStudentDirectory implements StudentDirectory {

    static final String COLLECTION = "students";

    private static final Sort BY_NAME =
            Sort.by(Sort.Order.asc("first_name"), Sort.Order.asc("last_name"));

    @Override
    public Optional<StudentRecord> findActiveStudentById(
            TenantConnection connection, String studentId) {
        return objectId(studentId)
                .map(
                        id ->
                                connection
                                        .template()
                                        .findOne(
                                                Query.query(
                                                        where(ID).is(id).and("deleted_at").is(null)),
                                                Document.class,
                                                COLLECTION))
                .map(MongoStudentDirectory::toStudent);
    }

    @Override
    public PageResult<StudentRecord> searchActive(
            TenantConnection connection, String search, Paging paging) {
        MongoTemplate template = connection.template();
        Query query = Query.query(searchCriteria(search));
        long total = template.count(query, COLLECTION);
        query.with(BY_NAME).skip(paging.offset()).limit(paging.limit());
        List<StudentRecord> items =
                template.find(query, Document.class, COLLECTION).stream()
                        .map(MongoStudentDirectory::toStudent)
                        .collect(Collectors.toList());
        return new PageResult<>(items, paging, total);
    }

    static Criteria searchCriteria(String search) {
        Criteria criteria =
                where("status").is(StudentRecord.STATUS_ACTIVE).and("deleted_at").is(null);
        if (search == null || search.isBlank()) {
            return criteria;
        }
        String term = search.strip();
        Pattern pattern = Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE);
        return criteria.orOperator(
                where("first_name").regex(pattern),
                where("last_name").regex(pattern),
                where("student_code").regex(pattern),
                where("email").is(term.toLowerCase(Locale.ROOT)));
    }

    static StudentRecord toStudent(Document document) {
        Number year = document.get("year", Number.class);
        return new StudentRecord(
                MongoDocuments.id(document),
                document.getString("email"),
                document.getString("first_name"),
                document.getString("last_name"),
                document.getString("student_code"),
                year == null ? null : year.intValue(),
                document.getString("status"),
                instant(document, "deleted_at"));
    }
}
