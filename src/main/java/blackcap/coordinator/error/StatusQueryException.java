package blackcap.coordinator.error;

public class StatusQueryException extends TransientBackendException {

    public StatusQueryException(String message) {
        super(message);
    }

    public StatusQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
