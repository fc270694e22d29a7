package runbroker.coordinator.service;

import runbroker.coordinator.model.Run;
import runbroker.coordinator.model.Runner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Service layer for runner lifecycle: registration, heartbeats and
 * deregistration.
 */
public class RunnerService {

    private static final Logger log = LoggerFactory.getLogger(RunnerService.class);

    private final RunnerRegistry registry;
    private final RunQueue queue;
    private final StopChannel stopChannel;
    private final Duration staleClaimGrace;

    public RunnerService(RunnerRegistry registry, RunQueue queue, StopChannel stopChannel, Duration staleClaimGrace) {
        this.registry = registry;
        this.queue = queue;
        this.stopChannel = stopChannel;
        this.staleClaimGrace = staleClaimGrace;
    }

    /**
     * Register a runner, create its stop mailbox and recover runs orphaned
     * by runners that went away.
     */
    public Runner register(Set<String> tags, String profile, boolean strictTags, String hostname) {
        Runner runner = registry.register(tags, profile, strictTags, hostname);
        stopChannel.register(runner.id());

        List<Run> orphaned = queue.failOrphaned(staleClaimGrace, registry::isAlive);
        if (!orphaned.isEmpty()) {
            log.info("Registration of {} recovered {} orphaned run(s)", runner.id(), orphaned.size());
        }
        return runner;
    }

    public void heartbeat(String runnerId) {
        requireRunnerId(runnerId);
        registry.heartbeat(runnerId);
    }

    /**
     * Deregister a runner. An external request only marks it; the runner
     * learns on its next poll. A runner shutting itself down is deregistered
     * immediately.
     */
    public void deregister(String runnerId, boolean selfInitiated) {
        requireRunnerId(runnerId);
        registry.deregister(runnerId);
        if (selfInitiated) {
            registry.confirmDeregistered(runnerId);
        }
        stopChannel.wake(runnerId);
    }

    public Runner get(String runnerId) {
        return registry.get(runnerId);
    }

    public List<Runner> findAll() {
        return registry.findAll();
    }

    private static void requireRunnerId(String runnerId) {
        if (runnerId == null || runnerId.isBlank()) {
            throw new ValidationException("runner_id is required");
        }
    }
}
