package blackcap.coordinator.error;

/** The job already has an active schedule. */
public class DuplicateScheduleException extends ConflictException {

    public DuplicateScheduleException(String message) {
        super(message);
    }

    public DuplicateScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
