package blackcap.coordinator.error;

/**
 * Root of the coordinator's unchecked exception hierarchy.
 */
public abstract class BlackcapException extends RuntimeException {

    protected BlackcapException(String message) {
        super(message);
    }

    protected BlackcapException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    /** Classify any throwable, falling back to INTERNAL for foreign exceptions. */
    public static ErrorKind kindOf(Throwable t) {
        if (t instanceof BlackcapException be) {
            return be.kind();
        }
        if (t instanceof IllegalArgumentException) {
            return ErrorKind.VALIDATION;
        }
        return ErrorKind.INTERNAL;
    }
}
