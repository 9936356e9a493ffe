package blackcap.coordinator.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScheduleDelete(@JsonProperty("scheduleId") String scheduleId) {

    public void validate() {
        if (scheduleId == null || scheduleId.isBlank()) {
            throw new IllegalArgumentException("scheduleId is required");
        }
    }
}
