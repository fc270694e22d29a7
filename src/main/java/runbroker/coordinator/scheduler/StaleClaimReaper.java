package runbroker.coordinator.scheduler;

import runbroker.coordinator.model.Run;
import runbroker.coordinator.service.RunQueue;
import runbroker.coordinator.service.RunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Background task that fails runs held by runners that stopped heartbeating.
 *
 * A run is orphaned when:
 * - it is claimed, running or stopping
 * - it was claimed longer ago than the grace period
 * - its runner is no longer alive
 *
 * Orphaned runs go to FAILED, which also wakes their parent session.
 */
public class StaleClaimReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleClaimReaper.class);

    private final RunQueue queue;
    private final RunnerRegistry runners;
    private final Duration grace;

    public StaleClaimReaper(RunQueue queue, RunnerRegistry runners, Duration grace) {
        this.queue = queue;
        this.runners = runners;
        this.grace = grace;
    }

    @Override
    public void run() {
        try {
            reapOrphanedRuns();
        } catch (Exception e) {
            log.error("Stale claim reaper error", e);
        }
    }

    /**
     * @return number of runs failed
     */
    public int reapOrphanedRuns() {
        List<Run> failed = queue.failOrphaned(grace, runners::isAlive);
        if (failed.isEmpty()) {
            log.debug("No orphaned runs found");
            return 0;
        }
        log.info("Stale claim reaper: {} orphaned run(s) failed", failed.size());
        return failed.size();
    }
}
