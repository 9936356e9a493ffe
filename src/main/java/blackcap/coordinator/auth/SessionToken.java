package blackcap.coordinator.auth;

/**
 * Opaque session token issued by an {@link IdentityProvider}.
 */
public record SessionToken(String value) {

    public static final SessionToken ABSENT = new SessionToken(null);

    public static SessionToken of(String value) {
        return value == null || value.isBlank() ? ABSENT : new SessionToken(value.trim());
    }

    public boolean isPresent() {
        return value != null;
    }

    @Override
    public String toString() {
        return isPresent() ? "SessionToken{***}" : "SessionToken{absent}";
    }
}
