package runbroker.coordinator.service;

import runbroker.coordinator.model.Run;
import runbroker.coordinator.model.RunStatus;
import runbroker.coordinator.model.SubmitRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Service layer for run operations used by the HTTP controllers.
 * Combines the run queue with the stop channel where an operation needs both.
 */
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private final RunQueue queue;
    private final StopChannel stopChannel;

    public RunService(RunQueue queue, StopChannel stopChannel) {
        this.queue = queue;
        this.stopChannel = stopChannel;
    }

    public Run submit(SubmitRun request) {
        return queue.submit(request);
    }

    /**
     * Move the run to stopping and queue the stop for its runner.
     * If the runner cannot be reached the run stays stopping until the
     * orphan sweep fails it.
     */
    public Run stop(String runId) {
        Run run = queue.requestStop(runId);
        if (!stopChannel.requestStop(run.runnerId(), runId)) {
            log.warn("Runner {} of run {} has no stop mailbox; stop will not be delivered", run.runnerId(), runId);
        }
        return run;
    }

    public Run reportStarted(String runId, String runnerId) {
        requireRunner(runnerId);
        return queue.reportStarted(runId, runnerId);
    }

    public Run reportCompleted(String runId, String runnerId, String result) {
        requireRunner(runnerId);
        return queue.reportCompleted(runId, runnerId, result);
    }

    public Run reportFailed(String runId, String runnerId, String error) {
        requireRunner(runnerId);
        return queue.reportFailed(runId, runnerId, error);
    }

    public Run reportStopped(String runId, String runnerId) {
        requireRunner(runnerId);
        return queue.reportStopped(runId, runnerId);
    }

    public Optional<Run> findById(String runId) {
        return queue.find(runId);
    }

    public List<Run> findAll(Optional<RunStatus> status) {
        return queue.list(status);
    }

    private static void requireRunner(String runnerId) {
        if (runnerId == null || runnerId.isBlank()) {
            throw new ValidationException("runner_id is required");
        }
    }
}
