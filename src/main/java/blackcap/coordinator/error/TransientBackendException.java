package blackcap.coordinator.error;

/** Retryable failure talking to a cluster backend. */
public class TransientBackendException extends BlackcapException {

    public TransientBackendException(String message) {
        super(message);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT_BACKEND;
    }
}
