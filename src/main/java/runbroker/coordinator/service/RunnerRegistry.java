package runbroker.coordinator.service;

import runbroker.coordinator.model.Runner;
import runbroker.coordinator.model.RunnerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory registry of runners. Entries are never removed: staleness is
 * derived from the last heartbeat so runs stay attributable to dead runners.
 */
public class RunnerRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunnerRegistry.class);

    private static final class Entry {
        final String runnerId;
        final Set<String> tags;
        final String profile;
        final boolean strictTags;
        final String hostname;
        final Instant registeredAt;
        Instant lastHeartbeat;
        boolean deregistering;
        boolean deregistered;

        Entry(String runnerId, Set<String> tags, String profile, boolean strictTags, String hostname, Instant now) {
            this.runnerId = runnerId;
            this.tags = tags;
            this.profile = profile;
            this.strictTags = strictTags;
            this.hostname = hostname;
            this.registeredAt = now;
            this.lastHeartbeat = now;
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> runners = new LinkedHashMap<>();
    private final Duration heartbeatTimeout;

    public RunnerRegistry(Duration heartbeatTimeout) {
        this.heartbeatTimeout = heartbeatTimeout;
    }

    /**
     * Register a new runner and return its snapshot.
     */
    public Runner register(Set<String> tags, String profile, boolean strictTags, String hostname) {
        String runnerId = "rnr_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        Instant now = Instant.now();
        Runner snapshot;
        lock.lock();
        try {
            Entry entry = new Entry(runnerId, tags == null ? Set.of() : Set.copyOf(tags), profile, strictTags,
                    hostname, now);
            runners.put(runnerId, entry);
            snapshot = snapshot(entry, now);
        } finally {
            lock.unlock();
        }
        log.info("Registered runner {} (tags={}, profile={}, strictTags={})",
                runnerId, snapshot.tags(), snapshot.profile(), strictTags);
        return snapshot;
    }

    /**
     * Record a heartbeat.
     *
     * @throws NotFoundException if the runner was never registered
     */
    public void heartbeat(String runnerId) {
        lock.lock();
        try {
            Entry entry = runners.get(runnerId);
            if (entry == null) {
                throw NotFoundException.runner(runnerId);
            }
            entry.lastHeartbeat = Instant.now();
        } finally {
            lock.unlock();
        }
        log.debug("Heartbeat from runner {}", runnerId);
    }

    /**
     * Recency check only; never removes anything.
     */
    public boolean isAlive(String runnerId) {
        lock.lock();
        try {
            Entry entry = runners.get(runnerId);
            return entry != null && !isStale(entry, Instant.now());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Runner> find(String runnerId) {
        lock.lock();
        try {
            Entry entry = runners.get(runnerId);
            return entry == null ? Optional.empty() : Optional.of(snapshot(entry, Instant.now()));
        } finally {
            lock.unlock();
        }
    }

    public Runner get(String runnerId) {
        return find(runnerId).orElseThrow(() -> NotFoundException.runner(runnerId));
    }

    /**
     * All runners, most recent heartbeat first.
     */
    public List<Runner> findAll() {
        Instant now = Instant.now();
        List<Runner> list;
        lock.lock();
        try {
            list = new ArrayList<>(runners.size());
            for (Entry e : runners.values()) {
                list.add(snapshot(e, now));
            }
        } finally {
            lock.unlock();
        }
        list.sort(Comparator.comparing(Runner::lastHeartbeat, Comparator.nullsLast(Comparator.reverseOrder())));
        return list;
    }

    public int countByStatus(RunnerStatus status) {
        return (int) findAll().stream().filter(r -> r.status() == status).count();
    }

    /**
     * Mark the runner for graceful shutdown. Its next poll is answered with a
     * deregistration signal instead of work.
     *
     * @throws NotFoundException if the runner was never registered
     */
    public void deregister(String runnerId) {
        lock.lock();
        try {
            Entry entry = runners.get(runnerId);
            if (entry == null) {
                throw NotFoundException.runner(runnerId);
            }
            if (!entry.deregistered) {
                entry.deregistering = true;
            }
        } finally {
            lock.unlock();
        }
        log.info("Runner {} marked for deregistration", runnerId);
    }

    public boolean isDeregistered(String runnerId) {
        lock.lock();
        try {
            Entry entry = runners.get(runnerId);
            return entry != null && (entry.deregistering || entry.deregistered);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record that the runner has been told about its deregistration.
     *
     * @return true the first time, false if already finalized or unknown
     */
    public boolean confirmDeregistered(String runnerId) {
        lock.lock();
        try {
            Entry entry = runners.get(runnerId);
            if (entry == null || entry.deregistered) {
                return false;
            }
            entry.deregistering = false;
            entry.deregistered = true;
        } finally {
            lock.unlock();
        }
        log.info("Runner {} deregistered", runnerId);
        return true;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    /**
     * Seconds since the last heartbeat, or empty for an unknown runner.
     */
    public Optional<Double> secondsSinceHeartbeat(String runnerId) {
        lock.lock();
        try {
            Entry entry = runners.get(runnerId);
            if (entry == null) {
                return Optional.empty();
            }
            return Optional.of(Duration.between(entry.lastHeartbeat, Instant.now()).toMillis() / 1000.0);
        } finally {
            lock.unlock();
        }
    }

    private boolean isStale(Entry entry, Instant now) {
        return Duration.between(entry.lastHeartbeat, now).compareTo(heartbeatTimeout) > 0;
    }

    private Runner snapshot(Entry e, Instant now) {
        RunnerStatus status;
        if (e.deregistered) {
            status = RunnerStatus.DEREGISTERED;
        } else if (e.deregistering) {
            status = RunnerStatus.DEREGISTERING;
        } else if (isStale(e, now)) {
            status = RunnerStatus.STALE;
        } else {
            status = RunnerStatus.ONLINE;
        }
        return Runner.builder()
                .id(e.runnerId)
                .tags(e.tags)
                .profile(e.profile)
                .strictTags(e.strictTags)
                .hostname(e.hostname)
                .status(status)
                .registeredAt(e.registeredAt)
                .lastHeartbeat(e.lastHeartbeat)
                .build();
    }
}
