package runbroker.coordinator.service;

import runbroker.coordinator.model.PollResult;
import runbroker.coordinator.model.Run;
import runbroker.coordinator.model.Runner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Serves a runner's long-poll: returns as soon as there is something for the
 * runner, or empty once the wait elapses.
 *
 * <p>Each cycle checks, in order: deregistration, pending stop commands, a
 * claimable run. Between cycles the caller parks on the runner's wake signal
 * for at most one slice, so a new run or stop is picked up without waiting
 * for the slice to run out.
 */
public class LongPollDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LongPollDispatcher.class);

    private final RunnerRegistry runners;
    private final RunQueue queue;
    private final StopChannel stopChannel;
    private final Duration maxPollWait;
    private final Duration pollSlice;

    public LongPollDispatcher(RunnerRegistry runners, RunQueue queue, StopChannel stopChannel,
            Duration maxPollWait, Duration pollSlice) {
        this.runners = runners;
        this.queue = queue;
        this.stopChannel = stopChannel;
        this.maxPollWait = maxPollWait;
        this.pollSlice = pollSlice;
    }

    /**
     * Block the calling thread until work, a stop, a deregistration or the timeout.
     *
     * @param maxWait requested wait, clamped to {@code [0, maxPollWait]}; null means the maximum
     * @throws NotFoundException if the runner is not registered
     */
    public PollResult poll(String runnerId, Duration maxWait) throws InterruptedException {
        if (runners.find(runnerId).isEmpty()) {
            throw NotFoundException.runner(runnerId);
        }
        stopChannel.register(runnerId);

        Duration wait = clamp(maxWait);
        long deadline = System.nanoTime() + wait.toNanos();
        long sliceNanos = Math.max(1L, pollSlice.toNanos());

        while (true) {
            // only events after this point end the wait below
            stopChannel.resetWake(runnerId);

            if (runners.isDeregistered(runnerId)) {
                runners.confirmDeregistered(runnerId);
                log.info("Runner {} told to shut down", runnerId);
                return PollResult.deregistration();
            }

            List<String> stops = stopChannel.drain(runnerId);
            if (!stops.isEmpty()) {
                log.info("Delivering stop of {} to runner {}", stops, runnerId);
                return PollResult.stop(stops);
            }

            Runner runner = runners.get(runnerId);
            Optional<Run> claimed = queue.claim(runner);
            if (claimed.isPresent()) {
                return PollResult.run(claimed.get());
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0L) {
                log.debug("Poll by runner {} timed out after {}", runnerId, wait);
                return PollResult.empty();
            }
            stopChannel.awaitWake(runnerId, Math.min(sliceNanos, remaining));
        }
    }

    Duration clamp(Duration requested) {
        if (requested == null) {
            return maxPollWait;
        }
        if (requested.isNegative()) {
            return Duration.ZERO;
        }
        return requested.compareTo(maxPollWait) > 0 ? maxPollWait : requested;
    }

    public Duration maxPollWait() {
        return maxPollWait;
    }
}
