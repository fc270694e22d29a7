package runbroker.coordinator.service;

/**
 * Unknown run, runner or session id.
 */
public class NotFoundException extends CoordinatorException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException run(String runId) {
        return new NotFoundException("run not found: " + runId);
    }

    public static NotFoundException runner(String runnerId) {
        return new NotFoundException("runner not found: " + runnerId);
    }

    public static NotFoundException session(String sessionName) {
        return new NotFoundException("session not found: " + sessionName);
    }
}
