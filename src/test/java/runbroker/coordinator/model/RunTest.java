package runbroker.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunTest {

    @Test
    void buildMinimalRun() {
        Run run = Run.builder()
                .id("run_1")
                .sessionName("s1")
                .payload("do the thing")
                .build();

        assertEquals("run_1", run.id());
        assertEquals(RunKind.START, run.kind());
        assertEquals(RunStatus.PENDING, run.status());
        assertTrue(run.demand().isEmpty());
        assertNull(run.runnerId());
        assertNull(run.completedAt());
        assertFalse(run.hasParent());
        assertFalse(run.isTerminal());
    }

    @Test
    void heldRunRequiresRunner() {
        Run.Builder claimedWithoutRunner = Run.builder()
                .id("run_2")
                .sessionName("s1")
                .payload("p")
                .status(RunStatus.CLAIMED);

        assertThrows(IllegalStateException.class, claimedWithoutRunner::build);
    }

    @Test
    void terminalRunRequiresCompletedAtAndNoRunner() {
        Instant now = Instant.now();

        Run.Builder missingCompletedAt = Run.builder()
                .id("run_3").sessionName("s1").payload("p")
                .status(RunStatus.COMPLETED);
        assertThrows(IllegalStateException.class, missingCompletedAt::build);

        Run.Builder keepsRunner = Run.builder()
                .id("run_3").sessionName("s1").payload("p")
                .status(RunStatus.FAILED).runnerId("rnr_1").completedAt(now);
        assertThrows(IllegalStateException.class, keepsRunner::build);

        Run ok = Run.builder()
                .id("run_3").sessionName("s1").payload("p")
                .status(RunStatus.FAILED).lastRunnerId("rnr_1").completedAt(now)
                .error("boom")
                .build();
        assertTrue(ok.isTerminal());
        assertEquals("rnr_1", ok.lastRunnerId());
    }

    @Test
    void toBuilderCopiesAllFields() {
        Instant now = Instant.now();
        Run original = Run.builder()
                .id("run_4")
                .kind(RunKind.RESUME)
                .sessionName("child")
                .parentSessionName("parent")
                .payload("p")
                .demand(DemandSpec.ofTags("gpu"))
                .status(RunStatus.RUNNING)
                .runnerId("rnr_1")
                .createdAt(now)
                .claimedAt(now)
                .startedAt(now)
                .build();

        Run copy = original.toBuilder().build();

        assertEquals(original, copy);
        assertEquals(RunKind.RESUME, copy.kind());
        assertEquals("parent", copy.parentSessionName());
        assertEquals(DemandSpec.ofTags("gpu"), copy.demand());
        assertEquals("rnr_1", copy.runnerId());
        assertEquals(now, copy.startedAt());
    }

    @Test
    void stateMachineTransitions() {
        assertTrue(RunStatus.PENDING.canTransitionTo(RunStatus.CLAIMED));
        assertFalse(RunStatus.PENDING.canTransitionTo(RunStatus.RUNNING));
        assertTrue(RunStatus.CLAIMED.canTransitionTo(RunStatus.RUNNING));
        assertTrue(RunStatus.CLAIMED.canTransitionTo(RunStatus.STOPPING));
        assertFalse(RunStatus.CLAIMED.canTransitionTo(RunStatus.COMPLETED));
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.COMPLETED));
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.FAILED));
        assertTrue(RunStatus.STOPPING.canTransitionTo(RunStatus.STOPPED));
        assertFalse(RunStatus.STOPPING.canTransitionTo(RunStatus.COMPLETED));

        for (RunStatus terminal : new RunStatus[] { RunStatus.COMPLETED, RunStatus.FAILED, RunStatus.STOPPED }) {
            for (RunStatus next : RunStatus.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
    }

    @Test
    void wireNames() {
        assertEquals("stopping", RunStatus.STOPPING.wireName());
        assertEquals(RunStatus.COMPLETED, RunStatus.fromWire("completed"));
        assertThrows(IllegalArgumentException.class, () -> RunStatus.fromWire("done"));

        assertEquals(RunKind.START, RunKind.fromWire("start"));
        assertEquals(RunKind.RESUME, RunKind.fromWire("resume_session"));
        assertThrows(IllegalArgumentException.class, () -> RunKind.fromWire("restart"));
    }
}
