package com.aiprofessor.simulation.infrastructure.persistence;

import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.toDate;

import com.aiprofessor.security.Role;
import com.aiprofessor.simulation.domain.audit.ActivityLogEntry;
import com.aiprofessor.simulation.domain.port.ActivityLogSink;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;

/** {@link ActivityLogSink} over the central {@code activity_logs} collection. */
public class MongoActivityLogSink implements ActivityLogSink {

    static final String COLLECTION = "activity_logs";

    private final MongoTemplate template;

    public MongoActivityLogSink(MongoTemplate template) {
        this.template = template;
    }

    @Override
    public void record(ActivityLogEntry entry) {
        Document description =
                new Document("en", entry.type().descriptionEn())
                        .append("fr", entry.type().descriptionFr());
        Document document =
                new Document("activity_type", entry.type().name())
                        .append("category", entry.category())
                        .append("level", entry.level())
                        .append("description", description)
                        .append("performed_by", entry.performedBy())
                        .append("performed_by_role", roleValue(entry.performedByRole()))
                        .append("tenant_id", entry.tenantId())
                        .append("tenant_name", entry.tenantName())
                        .append("target_user_id", entry.targetUserId())
                        .append("target_user_email", entry.targetUserEmail())
                        .append("target_user_role", roleValue(entry.targetUserRole()))
                        .append("metadata", new Document(entry.metadata()))
                        .append("ip_address", entry.origin().ipAddress())
                        .append("user_agent", entry.origin().userAgent())
                        .append("is_success", entry.success())
                        .append("created_at", toDate(entry.createdAt()));
        template.insert(document, COLLECTION);
    }

    private static String roleValue(Role role) {
        return role == null ? null : role.value();
    }
}
