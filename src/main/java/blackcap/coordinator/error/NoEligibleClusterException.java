package blackcap.coordinator.error;

/** No configured cluster offers every capability a job requires. */
public class NoEligibleClusterException extends NotFoundException {

    public NoEligibleClusterException(String message) {
        super(message);
    }

    public NoEligibleClusterException(String message, Throwable cause) {
        super(message, cause);
    }
}
