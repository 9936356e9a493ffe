package blackcap.coordinator.error;

/** Job spec is incompatible with the target cluster. */
public class PreparationException extends PermanentBackendException {

    public PreparationException(String message) {
        super(message);
    }

    public PreparationException(String message, Throwable cause) {
        super(message, cause);
    }
}
