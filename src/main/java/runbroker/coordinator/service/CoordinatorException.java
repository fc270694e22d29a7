package runbroker.coordinator.service;

/**
 * Base of the errors an external caller can trigger. Each subtype maps to one
 * HTTP status in {@link runbroker.coordinator.server.RouterHandler}.
 */
public abstract class CoordinatorException extends RuntimeException {

    protected CoordinatorException(String message) {
        super(message);
    }
}
