package blackcap.coordinator.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request to schedule an existing job on some cluster.
 */
public record ScheduleCreate(@JsonProperty("jobId") String jobId) {

    public void validate() {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
    }
}
