package runbroker.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Run lifecycle status.
 *
 * <pre>
 * PENDING -> CLAIMED -> RUNNING -> {COMPLETED | FAILED | STOPPING}
 * STOPPING -> STOPPED
 * </pre>
 */
public enum RunStatus {
    /** Submitted, waiting for a matching runner */
    PENDING,
    /** Handed to a runner, not yet started */
    CLAIMED,
    /** Runner reported that execution started */
    RUNNING,
    /** Stop requested, waiting for the runner to confirm */
    STOPPING,
    /** Finished successfully */
    COMPLETED,
    /** Finished with an error (reported, orphaned or unmatched) */
    FAILED,
    /** Terminated on request */
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }

    /** Statuses in which a runner is assigned to the run. */
    public boolean holdsRunner() {
        return this == CLAIMED || this == RUNNING || this == STOPPING;
    }

    /**
     * Whether the state machine allows moving from this status to {@code next}.
     */
    public boolean canTransitionTo(RunStatus next) {
        return switch (this) {
            case PENDING -> next == CLAIMED;
            case CLAIMED -> next == RUNNING || next == STOPPING;
            case RUNNING -> next == COMPLETED || next == FAILED || next == STOPPING;
            case STOPPING -> next == STOPPED;
            case COMPLETED, FAILED, STOPPED -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown run status: " + value);
        }
    }
}
