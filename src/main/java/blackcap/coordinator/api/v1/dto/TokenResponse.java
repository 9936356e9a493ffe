package blackcap.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for a successful login.
 * POST /api/v1/auth/login
 */
public record TokenResponse(
        @JsonProperty("token") String token,
        @JsonProperty("expiresInSeconds") long expiresInSeconds) {
}
