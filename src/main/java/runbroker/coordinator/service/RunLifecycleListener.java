package runbroker.coordinator.service;

import runbroker.coordinator.model.Run;

/**
 * Observer of run queue events. Called after the queue lock is released,
 * on the thread that caused the event.
 */
public interface RunLifecycleListener {

    /** A new run became pending. */
    default void onSubmitted(Run run) {
    }

    /** A run reached completed, failed or stopped. */
    default void onTerminal(Run run) {
    }
}
