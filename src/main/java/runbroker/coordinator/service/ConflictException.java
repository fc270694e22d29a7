package runbroker.coordinator.service;

/**
 * Operation not legal in the current state. Nothing was changed.
 */
public class ConflictException extends CoordinatorException {

    public ConflictException(String message) {
        super(message);
    }
}
