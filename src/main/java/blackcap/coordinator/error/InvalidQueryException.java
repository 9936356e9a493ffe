package blackcap.coordinator.error;

/** Schedule query used an unknown query type. */
public class InvalidQueryException extends ValidationException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
