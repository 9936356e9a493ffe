package blackcap.coordinator.error;

/** A referenced job, schedule or cluster does not exist. */
public class NotFoundException extends BlackcapException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
