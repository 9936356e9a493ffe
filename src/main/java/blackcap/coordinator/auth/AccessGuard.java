package blackcap.coordinator.auth;

import blackcap.coordinator.error.UnauthorizedException;
import blackcap.coordinator.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gate run before every state-changing operation. Anything other than a positive answer
 * from the identity provider, including a provider failure, is treated as unauthorized.
 */
public final class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final IdentityProvider identityProvider;

    public AccessGuard(IdentityProvider identityProvider) {
        this.identityProvider = identityProvider;
    }

    /**
     * @return the token's user
     * @throws UnauthorizedException if the token may not perform {@code action}
     */
    public User require(SessionToken token, Action action) {
        boolean allowed;
        TokenVerification verification;
        try {
            allowed = identityProvider.authorize(token, action);
            verification = allowed ? identityProvider.verify(token) : null;
        } catch (RuntimeException e) {
            log.warn("Identity provider failed while authorizing {}: {}", action, e.getMessage());
            throw new UnauthorizedException("Authorization failed", e);
        }
        if (!allowed || verification == null || !verification.isValid()) {
            throw new UnauthorizedException("Not authorized to " + action);
        }
        return verification.user();
    }

    public IdentityProvider identityProvider() {
        return identityProvider;
    }
}
