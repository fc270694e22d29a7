package runbroker.coordinator.scheduler;

import runbroker.coordinator.config.CoordinatorConfig;
import runbroker.coordinator.service.RunQueue;
import runbroker.coordinator.service.RunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - StaleClaimReaper: fails runs held by dead runners
 * - UnmatchedRunReaper: fails pending runs no runner can take
 *
 * Uses a single-threaded executor so sweeps never overlap. Each reaper
 * catches its own errors, so a failed sweep never cancels the schedule.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final StaleClaimReaper staleClaimReaper;
    private final UnmatchedRunReaper unmatchedRunReaper;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(RunQueue queue, RunnerRegistry runners, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "runbroker-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.staleClaimReaper = new StaleClaimReaper(queue, runners, config.staleClaimGrace());
        this.unmatchedRunReaper = new UnmatchedRunReaper(queue, config.noMatchTimeout());
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.sweepInterval().toMillis();
        executor.scheduleAtFixedRate(
                staleClaimReaper,
                intervalMs, // initial delay
                intervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Stale claim reaper scheduled every {}ms (grace {})", intervalMs, config.staleClaimGrace());

        if (unmatchedRunReaper.isEnabled()) {
            executor.scheduleAtFixedRate(
                    unmatchedRunReaper,
                    intervalMs,
                    intervalMs,
                    TimeUnit.MILLISECONDS);
            log.info("Unmatched run reaper scheduled every {}ms (timeout {})", intervalMs, config.noMatchTimeout());
        } else {
            log.info("Unmatched run reaper disabled");
        }

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public StaleClaimReaper staleClaimReaper() {
        return staleClaimReaper;
    }

    public UnmatchedRunReaper unmatchedRunReaper() {
        return unmatchedRunReaper;
    }
}
