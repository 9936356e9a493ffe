package blackcap.coordinator.error;

/** Cluster backend rejected the request and retrying will not help. */
public class PermanentBackendException extends BlackcapException {

    public PermanentBackendException(String message) {
        super(message);
    }

    public PermanentBackendException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PERMANENT_BACKEND;
    }
}
