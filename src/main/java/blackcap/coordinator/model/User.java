package blackcap.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Authenticated caller, as carried in a session token.
 */
public record User(
        @JsonProperty("userId") String userId,
        @JsonProperty("email") String email,
        @JsonProperty("name") String name,
        @JsonProperty("organisation") String organisation) {

    public User {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(email, "email is required");
    }
}
