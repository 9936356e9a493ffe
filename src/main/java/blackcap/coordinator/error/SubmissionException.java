package blackcap.coordinator.error;

public class SubmissionException extends TransientBackendException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
