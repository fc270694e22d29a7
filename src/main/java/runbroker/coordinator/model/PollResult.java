package runbroker.coordinator.model;

import java.util.List;

/**
 * Outcome of one long-poll. Exactly one of the shapes is populated.
 */
public record PollResult(Run run, List<String> stopRuns, boolean deregistered) {

    private static final PollResult EMPTY = new PollResult(null, List.of(), false);
    private static final PollResult DEREGISTERED = new PollResult(null, List.of(), true);

    public static PollResult run(Run run) {
        return new PollResult(run, List.of(), false);
    }

    public static PollResult stop(List<String> runIds) {
        return new PollResult(null, List.copyOf(runIds), false);
    }

    public static PollResult deregistration() {
        return DEREGISTERED;
    }

    public static PollResult empty() {
        return EMPTY;
    }

    public boolean hasRun() {
        return run != null;
    }

    public boolean hasStops() {
        return !stopRuns.isEmpty();
    }

    public boolean isEmpty() {
        return run == null && stopRuns.isEmpty() && !deregistered;
    }
}
