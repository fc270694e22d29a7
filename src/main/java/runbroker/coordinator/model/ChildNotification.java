package runbroker.coordinator.model;

/**
 * A child run outcome waiting to be delivered to its parent session.
 */
public record ChildNotification(
        String childSessionName,
        String childRunId,
        RunStatus childStatus,
        String childResult,
        String childError) {

    public static ChildNotification of(Run run) {
        return new ChildNotification(run.sessionName(), run.id(), run.status(), run.result(), run.error());
    }

    public boolean failed() {
        return childStatus != RunStatus.COMPLETED;
    }
}
