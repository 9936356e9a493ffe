package blackcap.coordinator.schema;

import java.util.Objects;

/**
 * Scheduler output: a create request with its target cluster chosen, ready for persistence.
 */
public record ScheduledCreate(String jobId, String clusterId) {

    public ScheduledCreate {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(clusterId, "clusterId is required");
    }
}
