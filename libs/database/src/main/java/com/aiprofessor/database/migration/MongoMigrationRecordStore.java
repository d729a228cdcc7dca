package com.aiprofessor.database.migration;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.stream.Collectors;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

/** {@link MigrationRecordStore} over the {@code migration_tracker} collection. */
public class MongoMigrationRecordStore implements MigrationRecordStore {

    static final String COLLECTION = "migration_tracker";

    private final MongoTemplate template;

    public MongoMigrationRecordStore(MongoTemplate template) {
        if (template == null) {
            throw new IllegalArgumentException("template must not be null");
        }
        this.template = template;
    }

    @Override
    public boolean hasSucceeded(String migrationName, MigrationType type, String tenantDbName) {
        Criteria criteria =
                Criteria.where("migration_name")
                        .is(migrationName)
                        .and("migration_type")
                        .is(type.value())
                        .and("success")
                        .is(true);
        if (type == MigrationType.TENANT) {
            criteria = criteria.and("tenant_db_name").is(tenantDbName);
        }
        return template.exists(Query.query(criteria), COLLECTION);
    }

    @Override
    public void record(MigrationRecord record) {
        Document document =
                new Document("migration_name", record.migrationName())
                        .append("migration_type", record.type().value())
                        .append("tenant_db_name", record.tenantDbName())
                        .append("executed_at", toDate(record.executedAt()))
                        .append("execution_time_ms", record.executionTimeMs())
                        .append("success", record.success())
                        .append("error_message", record.errorMessage());
        template.insert(document, COLLECTION);
    }

    @Override
    public List<MigrationRecord> findAll() {
        Query query = new Query().with(Sort.by(Sort.Direction.ASC, "executed_at"));
        return template.find(query, Document.class, COLLECTION).stream()
                .map(MongoMigrationRecordStore::toRecord)
                .collect(Collectors.toList());
    }

    private static MigrationRecord toRecord(Document document) {
        Date executedAt = document.getDate("executed_at");
        Number time = document.get("execution_time_ms", Number.class);
        return new MigrationRecord(
                document.getString("migration_name"),
                MigrationType.fromValue(document.getString("migration_type")),
                document.getString("tenant_db_name"),
                executedAt == null ? null : executedAt.toInstant(),
                time == null ? 0 : time.longValue(),
                Boolean.TRUE.equals(document.getBoolean("success")),
                document.getString("error_message"));
    }

    private static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }
}
