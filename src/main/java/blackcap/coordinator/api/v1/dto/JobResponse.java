package blackcap.coordinator.api.v1.dto;

import blackcap.coordinator.model.Job;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;
import java.util.Set;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("name") String name,
        @JsonProperty("owner") String owner,
        @JsonProperty("status") String status,
        @JsonProperty("requiredCapabilities") Set<String> requiredCapabilities,
        @JsonProperty("spec") @JsonRawValue String spec,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    /** Create response from domain model */
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.name(),
                job.owner(),
                job.status().name(),
                job.requiredCapabilities(),
                job.spec(),
                job.createdAt(),
                job.updatedAt(),
                job.finishedAt());
    }

    /** Compact version for list responses */
    public JobResponse compact() {
        return new JobResponse(jobId, name, owner, status, requiredCapabilities, null,
                createdAt, updatedAt, finishedAt);
    }
}
