package blackcap.coordinator.auth;

import blackcap.coordinator.error.UnauthorizedException;
import blackcap.coordinator.model.User;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Identity provider backed by configured accounts and HMAC-SHA256 signed tokens.
 *
 * <p>Token layout: {@code base64url(claims-json) + "." + base64url(hmac(claims-json))}.
 * Claims carry the user fields and an {@code exp} epoch second.
 */
public final class SignedTokenIdentityProvider implements IdentityProvider {

    private static final Logger log = LoggerFactory.getLogger(SignedTokenIdentityProvider.class);

    private static final String HMAC = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper mapper = new ObjectMapper();
    private final byte[] secret;
    private final Map<String, String> apiKeys;
    private final Set<String> readOnly;
    private final Duration ttl;
    private final Clock clock;

    /**
     * @param secretKey signing key; a random key is generated when blank, so tokens do not survive a restart
     * @param apiKeys   account email to API key
     * @param readOnly  emails denied mutating actions
     */
    public SignedTokenIdentityProvider(String secretKey, Map<String, String> apiKeys, Set<String> readOnly,
            Duration ttl, Clock clock) {
        this.secret = secretKey == null || secretKey.isBlank() ? randomKey()
                : secretKey.getBytes(StandardCharsets.UTF_8);
        this.apiKeys = new TreeMap<>();
        apiKeys.forEach((email, key) -> this.apiKeys.put(normalize(email), key));
        this.readOnly = new TreeSet<>();
        readOnly.forEach(email -> this.readOnly.add(normalize(email)));
        this.ttl = ttl;
        this.clock = clock;
    }

    private static byte[] randomKey() {
        log.warn("No secret key configured, generating an ephemeral one");
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        return key;
    }

    @Override
    public SessionToken authenticate(Credentials credentials) {
        credentials.validate();
        String email = normalize(credentials.email());
        String expected = apiKeys.get(email);
        if (expected == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                credentials.apiKey().getBytes(StandardCharsets.UTF_8))) {
            log.info("Login rejected for {}", email);
            throw new UnauthorizedException("Invalid credentials");
        }

        User user = userFor(email);
        ObjectNode claims = mapper.createObjectNode();
        claims.put("sub", user.userId());
        claims.put("email", user.email());
        claims.put("name", user.name());
        claims.put("org", user.organisation());
        claims.put("exp", clock.instant().plus(ttl).getEpochSecond());

        byte[] payload = claims.toString().getBytes(StandardCharsets.UTF_8);
        log.info("Issued session token for {}", email);
        return new SessionToken(ENCODER.encodeToString(payload) + "." + ENCODER.encodeToString(sign(payload)));
    }

    @Override
    public TokenVerification verify(SessionToken token) {
        if (token == null || !token.isPresent()) {
            log.debug("No session token");
            return TokenVerification.rejected(TokenVerification.Outcome.ABSENT);
        }

        String value = token.value();
        int dot = value.indexOf('.');
        if (dot <= 0 || dot != value.lastIndexOf('.') || dot == value.length() - 1) {
            log.warn("Malformed session token");
            return TokenVerification.rejected(TokenVerification.Outcome.MALFORMED);
        }

        byte[] payload;
        byte[] signature;
        JsonNode claims;
        try {
            payload = DECODER.decode(value.substring(0, dot));
            signature = DECODER.decode(value.substring(dot + 1));
            claims = mapper.readTree(payload);
        } catch (IllegalArgumentException | IOException e) {
            log.warn("Malformed session token: {}", e.getMessage());
            return TokenVerification.rejected(TokenVerification.Outcome.MALFORMED);
        }

        if (!MessageDigest.isEqual(sign(payload), signature)) {
            log.warn("Session token signature mismatch");
            return TokenVerification.rejected(TokenVerification.Outcome.BAD_SIGNATURE);
        }
        if (claims == null || !claims.path("exp").canConvertToLong() || !claims.hasNonNull("email")) {
            log.warn("Session token is missing claims");
            return TokenVerification.rejected(TokenVerification.Outcome.MALFORMED);
        }

        Instant expiry = Instant.ofEpochSecond(claims.get("exp").asLong());
        if (!clock.instant().isBefore(expiry)) {
            log.info("Session token for {} expired at {}", claims.get("email").asText(), expiry);
            return TokenVerification.rejected(TokenVerification.Outcome.EXPIRED);
        }

        String email = claims.get("email").asText();
        if (!apiKeys.containsKey(email)) {
            log.warn("Session token for unknown account {}", email);
            return TokenVerification.rejected(TokenVerification.Outcome.UNKNOWN_USER);
        }
        return TokenVerification.valid(userFor(email));
    }

    @Override
    public boolean authorize(SessionToken token, Action action) {
        TokenVerification verification = verify(token);
        if (!verification.isValid()) {
            return false;
        }
        if (action.isMutating() && readOnly.contains(verification.user().email())) {
            log.info("{} denied {} (read-only account)", verification.user().email(), action);
            return false;
        }
        return true;
    }

    private byte[] sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(secret, HMAC));
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static User userFor(String email) {
        int at = email.indexOf('@');
        String name = at > 0 ? email.substring(0, at) : email;
        String organisation = at > 0 ? email.substring(at + 1) : null;
        return new User(email, email, name, organisation);
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
