package blackcap.coordinator.error;

public class ScheduleNotFoundException extends NotFoundException {

    public ScheduleNotFoundException(String message) {
        super(message);
    }

    public ScheduleNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
