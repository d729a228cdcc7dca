package com.aiprofessor.simulation.domain.port;

import com.aiprofessor.simulation.domain.ActivityCounter;
import com.aiprofessor.simulation.domain.HistoryScope;
import com.aiprofessor.simulation.domain.PageResult;
import com.aiprofessor.simulation.domain.Paging;
import com.aiprofessor.simulation.domain.SimulationSession;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage of simulation sessions in the central database.
 *
 * <p>Every mutation is a single-document update; {@link #markEnded} only applies to sessions that
 * are still ACTIVE.
 */
public interface SimulationSessionRepository {

    /** Stores a new session and returns it with its generated id. */
    SimulationSession create(SimulationSession session);

    Optional<SimulationSession> findById(String sessionId);

    /** The most recently started ACTIVE session of the user. */
    Optional<SimulationSession> findLatestActive(String originalUserId);

    List<SimulationSession> findActive(String originalUserId);

    /**
     * Moves the session to ENDED if it is ACTIVE.
     *
     * @return false when the session was not ACTIVE any more, i.e. someone else ended it
     */
    boolean markEnded(String sessionId, Instant endedAt, long durationSeconds);

    /** Adds {@code path} to the visited pages unless already present. */
    void addPageVisit(String sessionId, String path);

    void incrementCounter(String sessionId, ActivityCounter counter);

    /** Sessions within the scope, newest first. */
    PageResult<SimulationSession> findHistory(HistoryScope scope, Paging paging);
}
