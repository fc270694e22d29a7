package runbroker.coordinator.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StopChannelTest {

    @Test
    void stopForUnknownRunnerIsRejected() {
        StopChannel channel = new StopChannel();

        assertFalse(channel.requestStop("rnr_unknown", "run_1"));
        assertEquals(List.of(), channel.drain("rnr_unknown"));
    }

    @Test
    void drainReturnsStopsInOrderAndIsIdempotent() {
        StopChannel channel = new StopChannel();
        channel.register("rnr_a");

        assertTrue(channel.requestStop("rnr_a", "run_1"));
        assertTrue(channel.requestStop("rnr_a", "run_2"));
        assertTrue(channel.requestStop("rnr_a", "run_1"));
        assertEquals(2, channel.pendingCount("rnr_a"));

        assertEquals(List.of("run_1", "run_2"), channel.drain("rnr_a"));
        assertEquals(List.of(), channel.drain("rnr_a"));
        assertEquals(0, channel.pendingCount("rnr_a"));
    }

    @Test
    void registerIsIdempotent() {
        StopChannel channel = new StopChannel();
        channel.register("rnr_a");
        channel.requestStop("rnr_a", "run_1");
        channel.register("rnr_a");

        assertTrue(channel.isRegistered("rnr_a"));
        assertEquals(List.of("run_1"), channel.drain("rnr_a"));
    }

    @Test
    void requestStopWakesWaitingPoll() throws Exception {
        StopChannel channel = new StopChannel();
        channel.register("rnr_a");

        Thread stopper = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            channel.requestStop("rnr_a", "run_1");
        });
        stopper.start();

        long start = System.nanoTime();
        boolean woken = channel.awaitWake("rnr_a", TimeUnit.SECONDS.toNanos(5));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        stopper.join();

        assertTrue(woken);
        assertTrue(elapsedMs < 2000, "woken after " + elapsedMs + "ms");
    }

    @Test
    void awaitTimesOutWithoutSignal() throws Exception {
        StopChannel channel = new StopChannel();
        channel.register("rnr_a");

        assertFalse(channel.awaitWake("rnr_a", TimeUnit.MILLISECONDS.toNanos(50)));
        assertFalse(channel.awaitWake("rnr_unknown", TimeUnit.MILLISECONDS.toNanos(50)));
    }

    @Test
    void wakeAllSignalsEveryRunner() throws Exception {
        StopChannel channel = new StopChannel();
        channel.register("rnr_a");
        channel.register("rnr_b");

        channel.wakeAll();

        assertTrue(channel.awaitWake("rnr_a", 0L));
        assertTrue(channel.awaitWake("rnr_b", 0L));
        // the signal is consumed by the wait
        assertFalse(channel.awaitWake("rnr_a", 0L));
    }

    @Test
    void resetDiscardsEarlierSignal() throws Exception {
        StopChannel channel = new StopChannel();
        channel.register("rnr_a");

        channel.wake("rnr_a");
        channel.resetWake("rnr_a");

        assertFalse(channel.awaitWake("rnr_a", TimeUnit.MILLISECONDS.toNanos(20)));
    }
}
