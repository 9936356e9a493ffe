package blackcap.coordinator.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Typed update of a schedule's mutable fields. A null {@code externalJobId} leaves it unchanged.
 */
public record ScheduleUpdate(
        @JsonProperty("scheduleId") String scheduleId,
        @JsonProperty("externalJobId") String externalJobId) {

    public void validate() {
        if (scheduleId == null || scheduleId.isBlank()) {
            throw new IllegalArgumentException("scheduleId is required");
        }
        if (externalJobId != null && externalJobId.isBlank()) {
            throw new IllegalArgumentException("externalJobId must not be blank");
        }
    }
}
