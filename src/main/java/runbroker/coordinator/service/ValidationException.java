package runbroker.coordinator.service;

/**
 * Malformed request: the operation is rejected before anything is stored.
 */
public class ValidationException extends CoordinatorException {

    public ValidationException(String message) {
        super(message);
    }
}
