package blackcap.coordinator.auth;

/**
 * Authenticates callers and decides what their session tokens allow.
 */
public interface IdentityProvider {

    /**
     * Exchange credentials for a session token.
     *
     * @throws blackcap.coordinator.error.UnauthorizedException if the credentials are not accepted
     */
    SessionToken authenticate(Credentials credentials);

    /**
     * Check a token without regard to any action.
     */
    TokenVerification verify(SessionToken token);

    /**
     * @return true if the token is valid and its user may perform {@code action}
     */
    boolean authorize(SessionToken token, Action action);
}
