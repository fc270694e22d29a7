package runbroker.coordinator.service;

import runbroker.coordinator.model.DemandSpec;
import runbroker.coordinator.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sessions known to the coordinator and their parent links.
 * A session exists once a run names it, either as its own session or as
 * the parent of another.
 */
public class SessionDirectory {

    private static final Logger log = LoggerFactory.getLogger(SessionDirectory.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Session> sessions = new LinkedHashMap<>();

    /**
     * Record that a run targets {@code sessionName} with an optional parent.
     * A different non-null parent replaces the stored one; a non-empty
     * demand becomes the session's affinity.
     */
    public Session touch(String sessionName, String parentSessionName, DemandSpec demand) {
        Instant now = Instant.now();
        boolean pinAffinity = demand != null && !demand.isEmpty();
        lock.lock();
        try {
            if (parentSessionName != null && !sessions.containsKey(parentSessionName)) {
                sessions.put(parentSessionName, new Session(parentSessionName, null, DemandSpec.none(), now));
            }
            Session existing = sessions.get(sessionName);
            Session updated;
            if (existing == null) {
                updated = new Session(sessionName, parentSessionName, pinAffinity ? demand : DemandSpec.none(), now);
            } else {
                updated = existing;
                if (parentSessionName != null && !parentSessionName.equals(existing.parentSessionName())) {
                    if (existing.hasParent()) {
                        log.info("Session {} parent changed {} -> {}", sessionName,
                                existing.parentSessionName(), parentSessionName);
                    }
                    updated = updated.withParent(parentSessionName);
                }
                if (pinAffinity && !demand.equals(existing.affinity())) {
                    updated = updated.withAffinity(demand);
                }
                if (updated == existing) {
                    return existing;
                }
            }
            sessions.put(sessionName, updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Demand a resume of the session must satisfy, empty for an unknown session.
     */
    public DemandSpec affinity(String sessionName) {
        return find(sessionName).map(Session::affinity).orElse(DemandSpec.none());
    }

    public Optional<Session> find(String sessionName) {
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionName));
        } finally {
            lock.unlock();
        }
    }

    public boolean exists(String sessionName) {
        return find(sessionName).isPresent();
    }

    public List<Session> findAll() {
        lock.lock();
        try {
            return new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forget a session. Children that still point at it have their
     * callbacks dropped until a new run names it again.
     *
     * @return true if the session existed
     */
    public boolean delete(String sessionName) {
        Session removed;
        lock.lock();
        try {
            removed = sessions.remove(sessionName);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            log.info("Deleted session {}", sessionName);
        }
        return removed != null;
    }
}
