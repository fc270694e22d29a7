package runbroker.coordinator.service;

import runbroker.coordinator.model.ChildNotification;
import runbroker.coordinator.model.Run;
import runbroker.coordinator.model.RunStatus;
import runbroker.coordinator.model.Session;
import runbroker.coordinator.model.SubmitRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Wakes parent sessions when their child runs finish.
 *
 * <p>When a child's run reaches a terminal state the parent is resumed
 * right away if it has no active run; otherwise the outcome is queued and
 * delivered, together with everything else queued for that parent, as a
 * single resume once the parent goes idle.
 *
 * <p>Every decision for a session is taken under that session's lock and
 * the resume is submitted before the lock is released, so a sibling that
 * arrives concurrently already sees the parent busy. Session locks are
 * always taken before the run queue's lock, never after.
 */
public class CallbackProcessor implements RunLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(CallbackProcessor.class);

    static final String COMPLETED_TEMPLATE = """
            The child agent session "%s" has completed.

            ## Child Result

            %s

            Please continue with the orchestration based on this result.""";

    static final String FAILED_TEMPLATE = """
            The child agent session "%s" has failed.

            ## Error

            %s

            Please handle this failure and continue with the orchestration.""";

    static final String AGGREGATED_TEMPLATE = """
            Multiple child agent sessions have completed.

            %s

            Please continue with the orchestration based on these results.""";

    private final RunQueue queue;
    private final SessionDirectory sessions;

    // one entry per live session, retired by clearPending when the session is deleted
    private final Map<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();
    // lists are only touched under the owning session's lock
    private final Map<String, List<ChildNotification>> pending = new ConcurrentHashMap<>();

    public CallbackProcessor(RunQueue queue, SessionDirectory sessions) {
        this.queue = queue;
        this.sessions = sessions;
    }

    @Override
    public void onTerminal(Run run) {
        String session = run.sessionName();
        String parent = sessions.find(session)
                .map(Session::parentSessionName)
                .orElse(run.parentSessionName());

        if (parent != null) {
            if (parent.equals(session)) {
                log.warn("Skipping callback: session {} is its own parent", session);
            } else {
                notifyParent(parent, ChildNotification.of(run));
            }
        }

        flushIfIdle(session);
    }

    private void notifyParent(String parent, ChildNotification notification) {
        ReentrantLock lock = lockSession(parent);
        try {
            if (!sessions.exists(parent)) {
                log.warn("Dropping callback from {} ({}): parent session {} no longer exists",
                        notification.childSessionName(), notification.childRunId(), parent);
                return;
            }
            List<ChildNotification> queued = pending.computeIfAbsent(parent, p -> new ArrayList<>());
            queued.add(notification);

            if (queue.hasActiveRun(parent)) {
                log.info("Parent {} is busy, queued callback from {} ({} pending)",
                        parent, notification.childSessionName(), queued.size());
                return;
            }
            log.info("Parent {} is idle, delivering callback from {}", parent, notification.childSessionName());
            deliver(parent);
        } finally {
            lock.unlock();
        }
    }

    private void flushIfIdle(String session) {
        ReentrantLock lock = lockSession(session);
        try {
            List<ChildNotification> queued = pending.get(session);
            if (queued == null || queued.isEmpty()) {
                return;
            }
            if (queue.hasActiveRun(session)) {
                log.debug("Session {} still busy, holding {} callbacks", session, queued.size());
                return;
            }
            log.info("Session {} went idle with {} pending callbacks, flushing", session, queued.size());
            deliver(session);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take everything queued for the session and submit one resume run.
     * The queue pins the resume to the session's affinity.
     * Must hold the session's lock.
     */
    private void deliver(String session) {
        List<ChildNotification> children = pending.remove(session);
        if (children == null || children.isEmpty()) {
            return;
        }
        try {
            Run resume = queue.submit(SubmitRun.resume(session, buildPayload(children)));
            log.info("Created callback resume run {} for {} with {} child result(s)",
                    resume.id(), session, children.size());
        } catch (RuntimeException e) {
            log.error("Failed to create callback run for {}, dropping {} notification(s)",
                    session, children.size(), e);
        }
    }

    static String buildPayload(List<ChildNotification> children) {
        if (children.size() == 1) {
            ChildNotification child = children.get(0);
            if (child.failed()) {
                return FAILED_TEMPLATE.formatted(child.childSessionName(), errorText(child));
            }
            return COMPLETED_TEMPLATE.formatted(child.childSessionName(), resultText(child));
        }

        String sections = children.stream()
                .map(child -> "### Child: " + child.childSessionName() + " (" + statusLabel(child) + ")\n\n"
                        + (child.failed() ? errorText(child) : resultText(child)))
                .collect(Collectors.joining("\n\n---\n\n"));
        return AGGREGATED_TEMPLATE.formatted(sections);
    }

    private static String statusLabel(ChildNotification child) {
        return child.failed() ? child.childStatus().name() : child.childStatus().wireName();
    }

    private static String resultText(ChildNotification child) {
        String result = child.childResult();
        return (result == null || result.isBlank()) ? "(No result available)" : result;
    }

    private static String errorText(ChildNotification child) {
        String error = child.childError();
        if (error != null && !error.isBlank()) {
            return error;
        }
        return child.childStatus() == RunStatus.STOPPED ? "Stopped before completion" : "Unknown error";
    }

    /**
     * Drop everything queued for a session and its lock, e.g. when it is deleted.
     *
     * @return number of notifications dropped
     */
    public int clearPending(String session) {
        ReentrantLock lock = lockSession(session);
        try {
            List<ChildNotification> removed = pending.remove(session);
            int count = removed == null ? 0 : removed.size();
            if (count > 0) {
                log.info("Cleared {} pending callbacks for {}", count, session);
            }
            // retire the lock; waiters on it retry against a fresh one
            sessionLocks.remove(session, lock);
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Child session names queued for {@code session}, oldest first.
     */
    public List<String> pendingFor(String session) {
        ReentrantLock lock = lockSession(session);
        try {
            List<ChildNotification> queued = pending.get(session);
            if (queued == null) {
                return List.of();
            }
            return queued.stream().map(ChildNotification::childSessionName).collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Integer> pendingCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String session : pending.keySet()) {
            int n = pendingFor(session).size();
            if (n > 0) {
                counts.put(session, n);
            }
        }
        return counts;
    }

    int sessionLockCount() {
        return sessionLocks.size();
    }

    /**
     * Lock the session. Returns only once the caller holds the lock currently
     * registered for it, so a lock retired by {@link #clearPending} is never used.
     */
    private ReentrantLock lockSession(String session) {
        while (true) {
            ReentrantLock lock = sessionLocks.computeIfAbsent(session, s -> new ReentrantLock());
            lock.lock();
            if (sessionLocks.get(session) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }
}
