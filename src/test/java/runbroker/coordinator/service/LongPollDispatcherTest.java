package runbroker.coordinator.service;

import runbroker.coordinator.model.DemandSpec;
import runbroker.coordinator.model.PollResult;
import runbroker.coordinator.model.Run;
import runbroker.coordinator.model.RunStatus;
import runbroker.coordinator.model.Runner;
import runbroker.coordinator.model.SubmitRun;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LongPollDispatcherTest {

    private RunnerRegistry registry;
    private RunQueue queue;
    private StopChannel stopChannel;
    private RunService runService;
    private LongPollDispatcher dispatcher;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        registry = new RunnerRegistry(Duration.ofMinutes(2));
        queue = new RunQueue(new SessionDirectory());
        stopChannel = new StopChannel();
        queue.addListener(stopChannel);
        runService = new RunService(queue, stopChannel);
        // long slice so that only a wake signal can end the wait early
        dispatcher = new LongPollDispatcher(registry, queue, stopChannel, Duration.ofSeconds(10),
                Duration.ofSeconds(5));
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private Runner register(String... tags) {
        Runner runner = registry.register(Set.of(tags), null, false, null);
        stopChannel.register(runner.id());
        return runner;
    }

    @Test
    void returnsPendingRunImmediately() throws Exception {
        Runner runner = register();
        Run submitted = queue.submit(SubmitRun.start("s1", "p"));

        PollResult result = dispatcher.poll(runner.id(), Duration.ofSeconds(5));

        assertTrue(result.hasRun());
        assertEquals(submitted.id(), result.run().id());
        assertEquals(RunStatus.CLAIMED, result.run().status());
    }

    @Test
    void returnsEmptyAfterTimeout() throws Exception {
        Runner runner = register();

        long start = System.nanoTime();
        PollResult result = dispatcher.poll(runner.id(), Duration.ofMillis(200));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(result.isEmpty());
        assertTrue(elapsedMs >= 150, "returned after " + elapsedMs + "ms");
        assertTrue(elapsedMs < 3000, "returned after " + elapsedMs + "ms");
    }

    @Test
    void zeroWaitChecksOnce() throws Exception {
        Runner runner = register();

        assertTrue(dispatcher.poll(runner.id(), Duration.ZERO).isEmpty());
        assertTrue(dispatcher.poll(runner.id(), Duration.ofSeconds(-3)).isEmpty());
    }

    @Test
    void newRunWakesParkedPoll() throws Exception {
        Runner runner = register();
        Future<PollResult> poll = pool.submit(() -> dispatcher.poll(runner.id(), Duration.ofSeconds(8)));
        Thread.sleep(100);

        long start = System.nanoTime();
        Run submitted = queue.submit(SubmitRun.start("s1", "p"));
        PollResult result = poll.get(3, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(submitted.id(), result.run().id());
        assertTrue(elapsedMs < 2000, "woken after " + elapsedMs + "ms");
    }

    @Test
    void nonMatchingRunDoesNotEndPoll() throws Exception {
        Runner runner = register();
        Future<PollResult> poll = pool.submit(() -> dispatcher.poll(runner.id(), Duration.ofMillis(400)));
        Thread.sleep(100);

        queue.submit(SubmitRun.start("s1", "p").withDemand(DemandSpec.ofTags("gpu")));

        assertTrue(poll.get(3, TimeUnit.SECONDS).isEmpty());
        assertEquals(1, queue.count(RunStatus.PENDING));
    }

    @Test
    void stopIsDeliveredMidWait() throws Exception {
        Runner runner = register();
        queue.submit(SubmitRun.start("s1", "p"));
        Run run = dispatcher.poll(runner.id(), Duration.ZERO).run();
        queue.reportStarted(run.id(), runner.id());

        Future<PollResult> poll = pool.submit(() -> dispatcher.poll(runner.id(), Duration.ofSeconds(8)));
        Thread.sleep(100);

        long start = System.nanoTime();
        runService.stop(run.id());
        PollResult result = poll.get(3, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(List.of(run.id()), result.stopRuns());
        assertTrue(elapsedMs < 2000, "woken after " + elapsedMs + "ms");

        // drained: the next poll does not see it again
        assertTrue(dispatcher.poll(runner.id(), Duration.ZERO).isEmpty());
    }

    @Test
    void stopsTakePriorityOverNewRuns() throws Exception {
        Runner runner = register();
        queue.submit(SubmitRun.start("s1", "p"));
        Run run = dispatcher.poll(runner.id(), Duration.ZERO).run();

        queue.submit(SubmitRun.start("s2", "p"));
        runService.stop(run.id());

        PollResult first = dispatcher.poll(runner.id(), Duration.ZERO);
        assertEquals(List.of(run.id()), first.stopRuns());
        assertTrue(dispatcher.poll(runner.id(), Duration.ZERO).hasRun());
    }

    @Test
    void deregisteredRunnerIsToldOnEveryPoll() throws Exception {
        Runner runner = register();
        queue.submit(SubmitRun.start("s1", "p"));
        registry.deregister(runner.id());

        assertTrue(dispatcher.poll(runner.id(), Duration.ofSeconds(1)).deregistered());
        assertTrue(dispatcher.poll(runner.id(), Duration.ofSeconds(1)).deregistered());
        // the pending run was not handed to a leaving runner
        assertEquals(1, queue.count(RunStatus.PENDING));
    }

    @Test
    void unknownRunnerIsRejected() {
        assertThrows(NotFoundException.class, () -> dispatcher.poll("rnr_missing", Duration.ZERO));
    }

    @Test
    void waitIsClampedToMaximum() {
        assertEquals(Duration.ofSeconds(10), dispatcher.clamp(Duration.ofMinutes(5)));
        assertEquals(Duration.ofSeconds(10), dispatcher.clamp(null));
        assertEquals(Duration.ZERO, dispatcher.clamp(Duration.ofSeconds(-1)));
        assertEquals(Duration.ofSeconds(3), dispatcher.clamp(Duration.ofSeconds(3)));
    }
}
