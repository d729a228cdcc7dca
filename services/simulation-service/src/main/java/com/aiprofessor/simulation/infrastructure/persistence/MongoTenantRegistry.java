package com.aiprofessor.simulation.infrastructure.persistence;

import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.instant;
import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.objectId;

import com.aiprofessor.simulation.domain.TenantRecord;
import com.aiprofessor.simulation.domain.port.TenantRegistry;
import java.util.Optional;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;

/** {@link TenantRegistry} over the central {@code schools} collection. */
public class MongoTenantRegistry implements TenantRegistry {

    static final String COLLECTION = "schools";

    private final MongoTemplate template;

    public MongoTenantRegistry(MongoTemplate template) {
        this.template = template;
    }

    @Override
    public Optional<TenantRecord> findTenantById(String tenantId) {
        return objectId(tenantId)
                .map(id -> template.findById(id, Document.class, COLLECTION))
                .map(
                        document ->
                                new TenantRecord(
                                        MongoDocuments.id(document),
                                        document.getString("name"),
                                        document.getString("db_name"),
                                        document.getString("status"),
                                        instant(document, "deleted_at")));
    }
}
