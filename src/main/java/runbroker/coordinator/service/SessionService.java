package runbroker.coordinator.service;

import runbroker.coordinator.model.Session;

import java.util.List;

/**
 * Read and delete access to sessions, joining the directory with the run
 * queue (busy/idle) and the callback processor (queued notifications).
 */
public class SessionService {

    /**
     * Point-in-time view of a session.
     */
    public record SessionState(Session session, boolean busy, List<String> pendingNotifications) {
    }

    private final SessionDirectory sessions;
    private final RunQueue queue;
    private final CallbackProcessor callbacks;

    public SessionService(SessionDirectory sessions, RunQueue queue, CallbackProcessor callbacks) {
        this.sessions = sessions;
        this.queue = queue;
        this.callbacks = callbacks;
    }

    /**
     * @throws NotFoundException if no run ever named the session
     */
    public SessionState get(String name) {
        Session session = sessions.find(name).orElseThrow(() -> NotFoundException.session(name));
        return new SessionState(session, queue.hasActiveRun(name), callbacks.pendingFor(name));
    }

    /**
     * Delete the session and drop callbacks queued for it.
     *
     * @return number of queued notifications dropped
     * @throws NotFoundException if the session does not exist
     */
    public int delete(String name) {
        if (!sessions.delete(name)) {
            throw NotFoundException.session(name);
        }
        return callbacks.clearPending(name);
    }
}
