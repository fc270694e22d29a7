package runbroker.coordinator.model;

/**
 * Runner liveness as seen by the coordinator. Derived on read from the last
 * heartbeat and the deregistration flags; runners are never removed.
 */
public enum RunnerStatus {
    /** Heartbeat within the timeout */
    ONLINE,
    /** No heartbeat within the timeout; its claims may be orphaned */
    STALE,
    /** Deregistration requested, signalled on the next poll */
    DEREGISTERING,
    /** Deregistration delivered; the runner receives no more work */
    DEREGISTERED
}
