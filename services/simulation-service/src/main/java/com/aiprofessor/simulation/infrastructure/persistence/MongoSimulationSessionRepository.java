package com.aiprofessor.simulation.infrastructure.persistence;

import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.ID;
import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.instant;
import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.intValue;
import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.longValue;
import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.objectId;
import static com.aiprofessor.simulation.infrastructure.persistence.MongoDocuments.toDate;
import static org.springframework.data.mongodb.core.query.Criteria.where;

import com.aiprofessor.security.Role;
import com.aiprofessor.simulation.domain.ActivityCounter;
import com.aiprofessor.simulation.domain.HistoryScope;
import com.aiprofessor.simulation.domain.PageResult;
import com.aiprofessor.simulation.domain.Paging;
import com.aiprofessor.simulation.domain.RequestOrigin;
import com.aiprofessor.simulation.domain.SimulationMode;
import com.aiprofessor.simulation.domain.SimulationSession;
import com.aiprofessor.simulation.domain.SimulationStatus;
import com.aiprofessor.simulation.domain.port.SimulationSessionRepository;
import com.mongodb.client.result.UpdateResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/** {@link SimulationSessionRepository} over the central {@code simulation_sessions} collection. */
public class MongoSimulationSessionRepository implements SimulationSessionRepository {

    static final String COLLECTION = "simulation_sessions";

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "started_at");

    private final MongoTemplate template;

    public MongoSimulationSessionRepository(MongoTemplate template) {
        this.template = template;
    }

    @Override
    public SimulationSession create(SimulationSession session) {
        ObjectId id = new ObjectId();
        template.insert(toDocument(session).append(ID, id), COLLECTION);
        return session.withId(id.toHexString());
    }

    @Override
    public Optional<SimulationSession> findById(String sessionId) {
        return objectId(sessionId)
                .map(id -> template.findById(id, Document.class, COLLECTION))
                .map(MongoSimulationSessionRepository::toSession);
    }

    @Override
    public Optional<SimulationSession> findLatestActive(String originalUserId) {
        Query query = activeOf(originalUserId).with(NEWEST_FIRST).limit(1);
        return Optional.ofNullable(template.findOne(query, Document.class, COLLECTION))
                .map(MongoSimulationSessionRepository::toSession);
    }

    @Override
    public List<SimulationSession> findActive(String originalUserId) {
        return template.find(activeOf(originalUserId).with(NEWEST_FIRST), Document.class, COLLECTION)
                .stream()
                .map(MongoSimulationSessionRepository::toSession)
                .collect(Collectors.toList());
    }

    @Override
    public boolean markEnded(String sessionId, Instant endedAt, long durationSeconds) {
        Optional<ObjectId> id = objectId(sessionId);
        if (id.isEmpty()) {
            return false;
        }
        Query query =
                Query.query(where(ID).is(id.get()).and("status").is(SimulationStatus.ACTIVE.name()));
        Update update =
                new Update()
                        .set("status", SimulationStatus.ENDED.name())
                        .set("ended_at", toDate(endedAt))
                        .set("duration_seconds", durationSeconds)
                        .set("updated_at", toDate(endedAt));
        UpdateResult result = template.updateFirst(query, update, COLLECTION);
        return result.getModifiedCount() > 0;
    }

    @Override
    public void addPageVisit(String sessionId, String path) {
        objectId(sessionId)
                .ifPresent(
                        id ->
                                template.updateFirst(
                                        Query.query(where(ID).is(id)),
                                        new Update().addToSet("pages_visited", path),
                                        COLLECTION));
    }

    @Override
    public void incrementCounter(String sessionId, ActivityCounter counter) {
        objectId(sessionId)
                .ifPresent(
                        id ->
                                template.updateFirst(
                                        Query.query(where(ID).is(id)),
                                        new Update().inc(counter.field(), 1),
                                        COLLECTION));
    }

    @Override
    public PageResult<SimulationSession> findHistory(HistoryScope scope, Paging paging) {
        Criteria criteria = new Criteria();
        if (scope.tenantId() != null) {
            criteria = criteria.and("tenant_id").is(scope.tenantId());
        }
        if (scope.originalUserId() != null) {
            criteria = criteria.and("original_user_id").is(scope.originalUserId());
        }
        long total = template.count(Query.query(criteria), COLLECTION);
        Query page =
                Query.query(criteria).with(NEWEST_FIRST).skip(paging.offset()).limit(paging.limit());
        List<SimulationSession> items =
                template.find(page, Document.class, COLLECTION).stream()
                        .map(MongoSimulationSessionRepository::toSession)
                        .collect(Collectors.toList());
        return new PageResult<>(items, paging, total);
    }

    private static Query activeOf(String originalUserId) {
        return Query.query(
                where("original_user_id")
                        .is(originalUserId)
                        .and("status")
                        .is(SimulationStatus.ACTIVE.name()));
    }

    static Document toDocument(SimulationSession session) {
        return new Document("original_user_id", session.originalUserId())
                .append("original_user_role", session.originalUserRole().value())
                .append("original_user_email", session.originalUserEmail())
                .append("original_user_tenant_id", session.originalUserTenantId())
                .append("simulated_student_id", session.simulatedStudentId())
                .append("simulated_student_email", session.simulatedStudentEmail())
                .append("simulated_student_name", session.simulatedStudentName())
                .append("tenant_id", session.tenantId())
                .append("tenant_name", session.tenantName())
                .append("simulation_mode", session.mode().name())
                .append("status", session.status().name())
                .append("started_at", toDate(session.startedAt()))
                .append("ended_at", toDate(session.endedAt()))
                .append("duration_seconds", session.durationSeconds())
                .append("pages_visited", new ArrayList<>(session.pagesVisited()))
                .append("modules_viewed", session.modulesViewed())
                .append("quizzes_viewed", session.quizzesViewed())
                .append("ai_chats_opened", session.aiChatsOpened())
                .append("purpose", session.purpose())
                .append("ip_address", session.origin().ipAddress())
                .append("user_agent", session.origin().userAgent())
                .append("created_at", toDate(session.createdAt()));
    }

    static SimulationSession toSession(Document document) {
        List<String> pages = document.getList("pages_visited", String.class);
        String role = document.getString("original_user_role");
        return new SimulationSession(
                MongoDocuments.id(document),
                document.getString("original_user_id"),
                Role.fromString(role)
                        .orElseThrow(() -> new IllegalStateException("Unknown staff role: " + role)),
                document.getString("original_user_email"),
                document.getString("original_user_tenant_id"),
                document.getString("simulated_student_id"),
                document.getString("simulated_student_email"),
                document.getString("simulated_student_name"),
                document.getString("tenant_id"),
                document.getString("tenant_name"),
                SimulationMode.valueOf(document.getString("simulation_mode")),
                SimulationStatus.valueOf(document.getString("status")),
                instant(document, "started_at"),
                instant(document, "ended_at"),
                longValue(document, "duration_seconds"),
                pages == null ? null : new LinkedHashSet<>(pages),
                intValue(document, "modules_viewed"),
                intValue(document, "quizzes_viewed"),
                intValue(document, "ai_chats_opened"),
                document.getString("purpose"),
                new RequestOrigin(document.getString("ip_address"), document.getString("user_agent")),
                instant(document, "created_at"));
    }
}
