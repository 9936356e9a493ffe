package blackcap.coordinator.auth;

import blackcap.coordinator.error.UnauthorizedException;
import blackcap.coordinator.model.User;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SignedTokenIdentityProviderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Map<String, String> KEYS = Map.of(
            "Alice@Example.org", "alice-key",
            "bob@example.org", "bob-key");

    private SignedTokenIdentityProvider provider;

    @BeforeEach
    void setUp() {
        provider = providerAt(NOW);
    }

    private static SignedTokenIdentityProvider providerAt(Instant instant) {
        return new SignedTokenIdentityProvider("test-secret", KEYS, Set.of("bob@example.org"),
                Duration.ofMinutes(30), Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void loginIssuesVerifiableToken() {
        SessionToken token = provider.authenticate(new Credentials("alice@example.org", "alice-key"));

        TokenVerification verification = provider.verify(token);
        assertTrue(verification.isValid());
        User user = verification.user();
        assertEquals("alice@example.org", user.email());
        assertEquals("alice", user.name());
        assertEquals("example.org", user.organisation());
        assertTrue(provider.authorize(token, Action.CREATE_SCHEDULE));
    }

    @Test
    void wrongKeyIsRejected() {
        assertThrows(UnauthorizedException.class,
                () -> provider.authenticate(new Credentials("alice@example.org", "nope")));
        assertThrows(UnauthorizedException.class,
                () -> provider.authenticate(new Credentials("mallory@example.org", "alice-key")));
        assertThrows(IllegalArgumentException.class,
                () -> provider.authenticate(new Credentials("alice@example.org", "")));
    }

    @Test
    void expiredTokenIsRejected() {
        SessionToken token = provider.authenticate(new Credentials("alice@example.org", "alice-key"));

        assertTrue(providerAt(NOW.plus(Duration.ofMinutes(29))).verify(token).isValid());
        SignedTokenIdentityProvider later = providerAt(NOW.plus(Duration.ofMinutes(30)));
        assertEquals(TokenVerification.Outcome.EXPIRED, later.verify(token).outcome());
        assertFalse(later.authorize(token, Action.READ));
    }

    @Test
    void tamperedTokenFailsSignature() {
        String value = provider.authenticate(new Credentials("alice@example.org", "alice-key")).value();
        String forgedSignature = value.substring(0, value.indexOf('.') + 1) + "AAAA";

        assertEquals(TokenVerification.Outcome.BAD_SIGNATURE, provider.verify(SessionToken.of(forgedSignature)).outcome());

        SignedTokenIdentityProvider otherKey = new SignedTokenIdentityProvider("other-secret", KEYS, Set.of(),
                Duration.ofMinutes(30), Clock.fixed(NOW, ZoneOffset.UTC));
        assertEquals(TokenVerification.Outcome.BAD_SIGNATURE, otherKey.verify(SessionToken.of(value)).outcome());
    }

    @Test
    void malformedAndAbsentTokens() {
        assertEquals(TokenVerification.Outcome.ABSENT, provider.verify(SessionToken.ABSENT).outcome());
        assertEquals(TokenVerification.Outcome.MALFORMED, provider.verify(SessionToken.of("garbage")).outcome());
        assertEquals(TokenVerification.Outcome.MALFORMED, provider.verify(SessionToken.of("a.b.c")).outcome());
        assertEquals(TokenVerification.Outcome.MALFORMED, provider.verify(SessionToken.of("!!!.###")).outcome());
    }

    @Test
    void removedAccountIsUnknown() {
        SessionToken token = provider.authenticate(new Credentials("alice@example.org", "alice-key"));
        SignedTokenIdentityProvider withoutAlice = new SignedTokenIdentityProvider("test-secret",
                Map.of("bob@example.org", "bob-key"), Set.of(), Duration.ofMinutes(30), Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(TokenVerification.Outcome.UNKNOWN_USER, withoutAlice.verify(token).outcome());
    }

    @Test
    void readOnlyAccountMayOnlyRead() {
        SessionToken token = provider.authenticate(new Credentials("BOB@example.org", "bob-key"));

        assertTrue(provider.authorize(token, Action.READ));
        for (Action action : Action.values()) {
            if (action.isMutating()) {
                assertFalse(provider.authorize(token, action), action.name());
            }
        }
    }
}
