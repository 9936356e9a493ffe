package blackcap.coordinator.auth;

import blackcap.coordinator.model.User;

/**
 * Result of checking a session token.
 *
 * @param outcome why the token was accepted or rejected
 * @param user    the token's user when {@code outcome} is VALID, otherwise null
 */
public record TokenVerification(Outcome outcome, User user) {

    public enum Outcome {
        VALID,
        ABSENT,
        MALFORMED,
        BAD_SIGNATURE,
        EXPIRED,
        UNKNOWN_USER
    }

    public static TokenVerification valid(User user) {
        return new TokenVerification(Outcome.VALID, user);
    }

    public static TokenVerification rejected(Outcome outcome) {
        return new TokenVerification(outcome, null);
    }

    public boolean isValid() {
        return outcome == Outcome.VALID;
    }
}
