package runbroker.coordinator.service;

import runbroker.coordinator.model.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-runner mailbox of pending stop commands plus the wake signal the
 * runner's long-poll parks on.
 *
 * <p>The same signal is raised for new runs ({@link #wakeAll()}), so one
 * condition wait covers every reason a poll has to return early.
 */
public class StopChannel implements RunLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(StopChannel.class);

    private static final class Mailbox {
        final Set<String> pendingStops = new LinkedHashSet<>();
        final WakeSignal wake = new WakeSignal();
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Mailbox> mailboxes = new HashMap<>();

    /**
     * Create the runner's mailbox. Idempotent.
     */
    public void register(String runnerId) {
        lock.lock();
        try {
            mailboxes.computeIfAbsent(runnerId, id -> new Mailbox());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queue a stop for {@code runId} and wake the runner's poll.
     *
     * @return false if the runner has no mailbox; the run is unreachable
     */
    public boolean requestStop(String runnerId, String runId) {
        Mailbox mailbox;
        lock.lock();
        try {
            mailbox = mailboxes.get(runnerId);
            if (mailbox == null) {
                return false;
            }
            mailbox.pendingStops.add(runId);
        } finally {
            lock.unlock();
        }
        mailbox.wake.signal();
        log.debug("Queued stop of run {} for runner {}", runId, runnerId);
        return true;
    }

    /**
     * Take every pending stop for the runner and reset its signal.
     * Safe to call repeatedly; returns an empty list when nothing is pending.
     */
    public List<String> drain(String runnerId) {
        lock.lock();
        try {
            Mailbox mailbox = mailboxes.get(runnerId);
            if (mailbox == null || mailbox.pendingStops.isEmpty()) {
                return List.of();
            }
            List<String> stops = new ArrayList<>(mailbox.pendingStops);
            mailbox.pendingStops.clear();
            mailbox.wake.reset();
            return stops;
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount(String runnerId) {
        lock.lock();
        try {
            Mailbox mailbox = mailboxes.get(runnerId);
            return mailbox == null ? 0 : mailbox.pendingStops.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(String runnerId) {
        lock.lock();
        try {
            return mailboxes.containsKey(runnerId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wake one runner without queueing a stop (e.g. deregistration).
     */
    public void wake(String runnerId) {
        WakeSignal signal = signalOf(runnerId);
        if (signal != null) {
            signal.signal();
        }
    }

    /**
     * Wake every runner, used when a new run becomes claimable.
     */
    public void wakeAll() {
        List<WakeSignal> signals;
        lock.lock();
        try {
            signals = new ArrayList<>(mailboxes.size());
            for (Mailbox m : mailboxes.values()) {
                signals.add(m.wake);
            }
        } finally {
            lock.unlock();
        }
        for (WakeSignal s : signals) {
            s.signal();
        }
    }

    @Override
    public void onSubmitted(Run run) {
        wakeAll();
    }

    /**
     * Clear the runner's signal so only events after this call end the next wait.
     */
    public void resetWake(String runnerId) {
        WakeSignal signal = signalOf(runnerId);
        if (signal != null) {
            signal.reset();
        }
    }

    /**
     * Park until the runner is woken or the timeout elapses.
     *
     * @return true if woken, false on timeout or unknown runner
     */
    public boolean awaitWake(String runnerId, long timeoutNanos) throws InterruptedException {
        WakeSignal signal = signalOf(runnerId);
        if (signal == null) {
            return false;
        }
        return signal.await(timeoutNanos);
    }

    private WakeSignal signalOf(String runnerId) {
        lock.lock();
        try {
            Mailbox mailbox = mailboxes.get(runnerId);
            return mailbox == null ? null : mailbox.wake;
        } finally {
            lock.unlock();
        }
    }
}
