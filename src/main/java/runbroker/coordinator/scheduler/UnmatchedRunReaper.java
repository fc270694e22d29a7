package runbroker.coordinator.scheduler;

import runbroker.coordinator.model.Run;
import runbroker.coordinator.service.RunQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Background task that fails pending runs whose demand no runner has
 * satisfied within the no-match timeout. Runs without a demand wait forever.
 */
public class UnmatchedRunReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(UnmatchedRunReaper.class);

    private final RunQueue queue;
    private final Duration timeout;

    public UnmatchedRunReaper(RunQueue queue, Duration timeout) {
        this.queue = queue;
        this.timeout = timeout;
    }

    @Override
    public void run() {
        try {
            reapUnmatchedRuns();
        } catch (Exception e) {
            log.error("Unmatched run reaper error", e);
        }
    }

    public int reapUnmatchedRuns() {
        List<Run> failed = queue.failUnmatched(timeout);
        if (!failed.isEmpty()) {
            log.info("Unmatched run reaper: {} run(s) failed after {}", failed.size(), timeout);
        }
        return failed.size();
    }

    public boolean isEnabled() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }
}
