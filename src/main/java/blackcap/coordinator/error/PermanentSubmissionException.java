package blackcap.coordinator.error;

public class PermanentSubmissionException extends PermanentBackendException {

    public PermanentSubmissionException(String message) {
        super(message);
    }

    public PermanentSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
