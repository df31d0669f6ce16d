package com.eainde.fitengine.session;

import com.eainde.fitengine.exception.SessionAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory home of every candidate- and JD-derived record, keyed by the owning session id.
 *
 * <p>Nothing here is persisted. A read must come from the owning session while it is active;
 * everything else is refused.</p>
 */
@Slf4j
@Component
public class SessionRecordStore {

    private final Map<String, Map<String, Object>> storage = new ConcurrentHashMap<>();

    public void put(AnalysisSession owner, String key, Object value) {
        owner.ensureActive();
        storage.computeIfAbsent(owner.getId(), k -> new ConcurrentHashMap<>()).put(key, value);
    }

    /**
     * Reads a record tagged with {@code ownerSessionId} on behalf of {@code requester}.
     *
     * @throws SessionAccessException if the requester does not own the record or is no longer active
     */
    public <T> Optional<T> read(AnalysisSession requester, String ownerSessionId, String key, Class<T> type) {
        if (!requester.getId().equals(ownerSessionId)) {
            log.warn("Session {} attempted to read data of session {}", requester.getId(), ownerSessionId);
            throw new SessionAccessException("Session " + requester.getId()
                    + " may not read records of session " + ownerSessionId);
        }
        requester.ensureActive();
        Map<String, Object> records = storage.get(ownerSessionId);
        if (records == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(key)).map(type::cast);
    }

    /**
     * Deletes every record tagged with the session id and returns how many there were.
     */
    public int purge(String sessionId) {
        Map<String, Object> removed = storage.remove(sessionId);
        return removed == null ? 0 : removed.size();
    }

    public boolean holdsRecordsFor(String sessionId) {
        return storage.containsKey(sessionId);
    }

    public int sessionCount() {
        return storage.size();
    }
}
