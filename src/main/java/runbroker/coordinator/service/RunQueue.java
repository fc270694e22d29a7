package runbroker.coordinator.service;

import runbroker.coordinator.model.DemandSpec;
import runbroker.coordinator.model.Run;
import runbroker.coordinator.model.RunKind;
import runbroker.coordinator.model.RunStatus;
import runbroker.coordinator.model.Runner;
import runbroker.coordinator.model.SubmitRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Owner of every run and the only place run state changes.
 *
 * <p>All mutations happen under one lock, so a claim hands a run to exactly
 * one runner and an illegal report leaves the run untouched. Listeners are
 * notified after the lock is released.
 */
public class RunQueue {

    private static final Logger log = LoggerFactory.getLogger(RunQueue.class);

    public static final String ORPHANED_ERROR = "orphaned: runner unresponsive";

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Run> runs = new LinkedHashMap<>();
    /** Pending run ids in submission order. */
    private final Set<String> pending = new LinkedHashSet<>();
    private final List<RunLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final SessionDirectory sessions;

    public RunQueue(SessionDirectory sessions) {
        this.sessions = sessions;
    }

    public void addListener(RunLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Enqueue a new pending run.
     *
     * @throws ValidationException if kind, session name or payload is missing
     */
    public Run submit(SubmitRun request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        if (request.kind() == null) {
            throw new ValidationException("kind is required");
        }
        if (request.sessionName() == null || request.sessionName().isBlank()) {
            throw new ValidationException("session_name is required");
        }
        if (request.payload() == null || request.payload().isBlank()) {
            throw new ValidationException("payload is required");
        }
        String parent = request.parentSessionName();
        if (parent != null && parent.isBlank()) {
            parent = null;
        }

        String sessionName = request.sessionName().trim();
        DemandSpec demand = request.demand() == null ? DemandSpec.none() : request.demand();
        if (request.kind() == RunKind.RESUME) {
            // a resume goes back to where the session ran
            demand = DemandSpec.merge(sessions.affinity(sessionName), demand);
        }

        Run run = Run.builder()
                .id(generateId())
                .kind(request.kind())
                .sessionName(sessionName)
                .parentSessionName(parent == null ? null : parent.trim())
                .payload(request.payload())
                .demand(demand)
                .status(RunStatus.PENDING)
                .createdAt(Instant.now())
                .build();

        sessions.touch(run.sessionName(), run.parentSessionName(), run.demand());

        lock.lock();
        try {
            runs.put(run.id(), run);
            pending.add(run.id());
        } finally {
            lock.unlock();
        }

        log.info("Submitted run {} ({} session={}, parent={}, demand={})", run.id(), run.kind(),
                run.sessionName(), run.parentSessionName(), run.demand().isEmpty() ? "-" : run.demand());
        for (RunLifecycleListener listener : listeners) {
            try {
                listener.onSubmitted(run);
            } catch (RuntimeException e) {
                log.error("Listener failed on submission of run {}", run.id(), e);
            }
        }
        return run;
    }

    /**
     * Claim the oldest pending run the runner is eligible for.
     */
    public Optional<Run> claim(Runner runner) {
        Run claimed = null;
        lock.lock();
        try {
            Iterator<String> it = pending.iterator();
            while (it.hasNext()) {
                Run candidate = runs.get(it.next());
                if (DemandMatcher.matches(candidate.demand(), runner)) {
                    it.remove();
                    claimed = candidate.toBuilder()
                            .status(RunStatus.CLAIMED)
                            .runnerId(runner.id())
                            .claimedAt(Instant.now())
                            .build();
                    runs.put(claimed.id(), claimed);
                    break;
                }
            }
        } finally {
            lock.unlock();
        }
        if (claimed != null) {
            log.info("Run {} claimed by runner {}", claimed.id(), runner.id());
        }
        return Optional.ofNullable(claimed);
    }

    public Run reportStarted(String runId, String runnerId) {
        return transition(runId, runnerId, RunStatus.RUNNING, null, null);
    }

    public Run reportCompleted(String runId, String runnerId) {
        return reportCompleted(runId, runnerId, null);
    }

    /**
     * @param result output passed on to the parent session, may be null
     */
    public Run reportCompleted(String runId, String runnerId, String result) {
        return transition(runId, runnerId, RunStatus.COMPLETED, null, result);
    }

    public Run reportFailed(String runId, String runnerId, String error) {
        return transition(runId, runnerId, RunStatus.FAILED,
                (error == null || error.isBlank()) ? "unknown error" : error, null);
    }

    public Run reportStopped(String runId, String runnerId) {
        return transition(runId, runnerId, RunStatus.STOPPED, null, null);
    }

    /**
     * Move a claimed or running run to stopping. The caller is responsible
     * for telling the runner.
     *
     * @throws NotFoundException if the run is unknown
     * @throws ConflictException if the run is in any other state
     */
    public Run requestStop(String runId) {
        Run updated;
        lock.lock();
        try {
            Run run = runs.get(runId);
            if (run == null) {
                throw NotFoundException.run(runId);
            }
            if (run.status() != RunStatus.CLAIMED && run.status() != RunStatus.RUNNING) {
                throw new ConflictException("cannot stop run " + runId + " in status " + run.status().wireName());
            }
            updated = run.toBuilder().status(RunStatus.STOPPING).build();
            runs.put(runId, updated);
        } finally {
            lock.unlock();
        }
        log.info("Stop requested for run {} on runner {}", runId, updated.runnerId());
        return updated;
    }

    private Run transition(String runId, String runnerId, RunStatus next, String error, String result) {
        Run updated;
        lock.lock();
        try {
            Run run = runs.get(runId);
            if (run == null) {
                throw NotFoundException.run(runId);
            }
            if (run.isTerminal()) {
                throw new ConflictException("run " + runId + " is already " + run.status().wireName());
            }
            if (!Objects.equals(run.runnerId(), runnerId)) {
                throw new ConflictException("run " + runId + " is not held by runner " + runnerId);
            }
            if (!run.status().canTransitionTo(next)) {
                throw new ConflictException("illegal transition " + run.status().wireName() + " -> "
                        + next.wireName() + " for run " + runId);
            }
            updated = apply(run, next, error, Instant.now());
            if (result != null) {
                updated = updated.toBuilder().result(result).build();
            }
            runs.put(runId, updated);
        } finally {
            lock.unlock();
        }

        if (updated.isTerminal()) {
            log.info("Run {} {} (runner {})", runId, next.wireName(), runnerId);
            fireTerminal(updated);
        } else {
            log.info("Run {} {} on runner {}", runId, next.wireName(), runnerId);
        }
        return updated;
    }

    private static Run apply(Run run, RunStatus next, String error, Instant now) {
        Run.Builder b = run.toBuilder().status(next);
        if (next == RunStatus.RUNNING) {
            b.startedAt(now);
        }
        if (next.isTerminal()) {
            b.lastRunnerId(run.runnerId() != null ? run.runnerId() : run.lastRunnerId())
                    .runnerId(null)
                    .error(error)
                    .completedAt(now);
        }
        return b.build();
    }

    /**
     * Fail held runs whose claim is older than {@code grace} and whose runner
     * no longer heartbeats.
     *
     * @return the runs that were failed
     */
    public List<Run> failOrphaned(Duration grace, Predicate<String> isRunnerAlive) {
        Instant cutoff = Instant.now().minus(grace);

        Map<String, String> candidates = new LinkedHashMap<>();
        lock.lock();
        try {
            for (Run run : runs.values()) {
                if (run.status().holdsRunner() && run.claimedAt() != null && run.claimedAt().isBefore(cutoff)) {
                    candidates.put(run.id(), run.runnerId());
                }
            }
        } finally {
            lock.unlock();
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        // liveness is checked outside the queue lock; the registry has its own
        candidates.values().removeIf(isRunnerAlive);
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<Run> failed = new ArrayList<>();
        Instant now = Instant.now();
        lock.lock();
        try {
            for (Map.Entry<String, String> c : candidates.entrySet()) {
                Run run = runs.get(c.getKey());
                if (run == null || !run.status().holdsRunner() || !c.getValue().equals(run.runnerId())) {
                    continue;
                }
                Run updated = apply(run, RunStatus.FAILED, ORPHANED_ERROR, now);
                runs.put(run.id(), updated);
                failed.add(updated);
            }
        } finally {
            lock.unlock();
        }

        for (Run run : failed) {
            log.warn("Run {} orphaned by runner {} (claimed at {})", run.id(), run.lastRunnerId(), run.claimedAt());
            fireTerminal(run);
        }
        return failed;
    }

    /**
     * Fail pending runs with a demand that no runner has claimed within
     * {@code timeout}. A zero or negative timeout does nothing.
     */
    public List<Run> failUnmatched(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return List.of();
        }
        Instant now = Instant.now();
        Instant cutoff = now.minus(timeout);
        String error = "no matching runner within " + timeout.toSeconds() + "s";

        List<Run> failed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<String> it = pending.iterator();
            while (it.hasNext()) {
                Run run = runs.get(it.next());
                DemandSpec demand = run.demand();
                if (!demand.isEmpty() && run.createdAt().isBefore(cutoff)) {
                    it.remove();
                    Run updated = run.toBuilder()
                            .status(RunStatus.FAILED)
                            .error(error)
                            .completedAt(now)
                            .build();
                    runs.put(run.id(), updated);
                    failed.add(updated);
                }
            }
        } finally {
            lock.unlock();
        }

        for (Run run : failed) {
            log.warn("Run {} failed: {} (demand={})", run.id(), error, run.demand());
            fireTerminal(run);
        }
        return failed;
    }

    public Optional<Run> find(String runId) {
        lock.lock();
        try {
            return Optional.ofNullable(runs.get(runId));
        } finally {
            lock.unlock();
        }
    }

    public Run get(String runId) {
        return find(runId).orElseThrow(() -> NotFoundException.run(runId));
    }

    /**
     * Runs in submission order, optionally filtered by status.
     */
    public List<Run> list(Optional<RunStatus> status) {
        lock.lock();
        try {
            List<Run> out = new ArrayList<>();
            for (Run run : runs.values()) {
                if (status.isEmpty() || run.status() == status.get()) {
                    out.add(run);
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether the session has a run that is not yet terminal.
     */
    public boolean hasActiveRun(String sessionName) {
        lock.lock();
        try {
            for (Run run : runs.values()) {
                if (!run.isTerminal() && run.sessionName().equals(sessionName)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public int count(RunStatus status) {
        lock.lock();
        try {
            if (status == RunStatus.PENDING) {
                return pending.size();
            }
            int n = 0;
            for (Run run : runs.values()) {
                if (run.status() == status) {
                    n++;
                }
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    public Map<RunStatus, Integer> countsByStatus() {
        Map<RunStatus, Integer> counts = new EnumMap<>(RunStatus.class);
        for (RunStatus s : RunStatus.values()) {
            counts.put(s, 0);
        }
        lock.lock();
        try {
            for (Run run : runs.values()) {
                counts.merge(run.status(), 1, Integer::sum);
            }
        } finally {
            lock.unlock();
        }
        return counts;
    }

    private void fireTerminal(Run run) {
        for (RunLifecycleListener listener : listeners) {
            try {
                listener.onTerminal(run);
            } catch (RuntimeException e) {
                log.error("Listener failed on terminal run {}", run.id(), e);
            }
        }
    }

    private static String generateId() {
        return "run_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
