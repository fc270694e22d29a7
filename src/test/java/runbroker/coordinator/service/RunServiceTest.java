package runbroker.coordinator.service;

import runbroker.coordinator.model.Run;
import runbroker.coordinator.model.RunStatus;
import runbroker.coordinator.model.Runner;
import runbroker.coordinator.model.SubmitRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RunServiceTest {

    private RunQueue queue;
    private StopChannel stopChannel;
    private RunService service;

    @BeforeEach
    void setUp() {
        queue = new RunQueue(new SessionDirectory());
        stopChannel = new StopChannel();
        service = new RunService(queue, stopChannel);
    }

    private Run claimed(String runnerId) {
        Run run = service.submit(SubmitRun.start("s-" + runnerId, "payload"));
        queue.claim(Runner.builder().id(runnerId).build()).orElseThrow();
        return run;
    }

    @Test
    void stopQueuesCommandForRunner() {
        stopChannel.register("rnr_1");
        Run run = claimed("rnr_1");

        Run stopping = service.stop(run.id());

        assertEquals(RunStatus.STOPPING, stopping.status());
        assertEquals(List.of(run.id()), stopChannel.drain("rnr_1"));
    }

    @Test
    void stopWithoutMailboxStillMovesToStopping() {
        Run run = claimed("rnr_ghost");

        Run stopping = service.stop(run.id());

        assertEquals(RunStatus.STOPPING, stopping.status());
        assertFalse(stopChannel.isRegistered("rnr_ghost"));
    }

    @Test
    void stopOfPendingOrTerminalRunConflicts() {
        Run pending = service.submit(SubmitRun.start("s1", "p"));
        assertThrows(ConflictException.class, () -> service.stop(pending.id()));

        Run done = claimed("rnr_1");
        service.reportStarted(done.id(), "rnr_1");
        service.reportCompleted(done.id(), "rnr_1", "ok");
        assertThrows(ConflictException.class, () -> service.stop(done.id()));
    }

    @Test
    void stopOfUnknownRunIsNotFound() {
        assertThrows(NotFoundException.class, () -> service.stop("run_missing"));
    }

    @Test
    void stoppingRunFinishesAsStopped() {
        stopChannel.register("rnr_1");
        Run run = claimed("rnr_1");
        service.reportStarted(run.id(), "rnr_1");
        service.stop(run.id());

        // a late completion is not accepted once a stop is underway
        assertThrows(ConflictException.class, () -> service.reportCompleted(run.id(), "rnr_1", "late"));

        Run stopped = service.reportStopped(run.id(), "rnr_1");
        assertEquals(RunStatus.STOPPED, stopped.status());
    }

    @Test
    void reportsRequireRunnerId() {
        Run run = claimed("rnr_1");

        assertThrows(ValidationException.class, () -> service.reportStarted(run.id(), null));
        assertThrows(ValidationException.class, () -> service.reportFailed(run.id(), "", "x"));
        assertThrows(ValidationException.class, () -> service.reportStopped(run.id(), " "));
    }

    @Test
    void completedResultIsKept() {
        Run run = claimed("rnr_1");
        service.reportStarted(run.id(), "rnr_1");

        service.reportCompleted(run.id(), "rnr_1", "final answer");

        Run done = service.findById(run.id()).orElseThrow();
        assertEquals(RunStatus.COMPLETED, done.status());
        assertEquals("final answer", done.result());
    }

    @Test
    void findAllFiltersByStatus() {
        service.submit(SubmitRun.start("a", "p"));
        claimed("rnr_1");

        assertEquals(2, service.findAll(Optional.empty()).size());
        assertEquals(1, service.findAll(Optional.of(RunStatus.PENDING)).size());
        assertEquals(1, service.findAll(Optional.of(RunStatus.CLAIMED)).size());
        assertTrue(service.findAll(Optional.of(RunStatus.FAILED)).isEmpty());
    }
}
