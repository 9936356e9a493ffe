package blackcap.coordinator.auth;

/**
 * Operations a session token may be authorized for.
 */
public enum Action {
    SUBMIT_JOB(true),
    CANCEL_JOB(true),
    CREATE_SCHEDULE(true),
    UPDATE_SCHEDULE(true),
    DELETE_SCHEDULE(true),
    READ(false);

    private final boolean mutating;

    Action(boolean mutating) {
        this.mutating = mutating;
    }

    public boolean isMutating() {
        return mutating;
    }
}
