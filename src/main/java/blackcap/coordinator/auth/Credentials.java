package blackcap.coordinator.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login credentials: an account email and its API key.
 */
public record Credentials(
        @JsonProperty("email") String email,
        @JsonProperty("apiKey") String apiKey) {

    public void validate() {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey is required");
        }
    }

    @Override
    public String toString() {
        return "Credentials{email='" + email + "'}";
    }
}
