package runbroker.coordinator.model;

/**
 * Request to enqueue a run. Validated by the run queue, not here.
 */
public record SubmitRun(
        RunKind kind,
        String sessionName,
        String parentSessionName,
        String payload,
        DemandSpec demand) {

    public static SubmitRun start(String sessionName, String payload) {
        return new SubmitRun(RunKind.START, sessionName, null, payload, DemandSpec.none());
    }

    public static SubmitRun resume(String sessionName, String payload) {
        return new SubmitRun(RunKind.RESUME, sessionName, null, payload, DemandSpec.none());
    }

    public SubmitRun withParent(String parent) {
        return new SubmitRun(kind, sessionName, parent, payload, demand);
    }

    public SubmitRun withDemand(DemandSpec d) {
        return new SubmitRun(kind, sessionName, parentSessionName, payload, d);
    }
}
