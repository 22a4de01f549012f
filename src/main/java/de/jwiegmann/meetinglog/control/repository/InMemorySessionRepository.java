package de.jwiegmann.meetinglog.control.repository;

import de.jwiegmann.meetinglog.entity.SessionContext;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

@Repository
public class InMemorySessionRepository {

    private final Map<String, SessionContext> store = new ConcurrentHashMap<>();

    public SessionContext save(SessionContext session) {
        store.put(session.getSessionId(), session);
        return session;
    }

    public Optional<SessionContext> find(String sessionId) {
        return Optional.ofNullable(store.get(sessionId));
    }

    public Optional<SessionContext> remove(String sessionId) {
        return Optional.ofNullable(store.remove(sessionId));
    }

    /**
     * Entfernt alle Sessions, auf die das Prädikat zutrifft, und liefert sie zurück.
     */
    public List<SessionContext> removeIf(Predicate<SessionContext> condition) {
        List<SessionContext> removed = new ArrayList<>();
        store.values().removeIf(session -> {
            if (condition.test(session)) {
                removed.add(session);
                return true;
            }
            return false;
        });
        return removed;
    }
}
