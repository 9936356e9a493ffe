package blackcap.coordinator.error;

/** Request rejected because of its shape or content. */
public class ValidationException extends BlackcapException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
