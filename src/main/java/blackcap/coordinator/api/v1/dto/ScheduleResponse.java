package blackcap.coordinator.api.v1.dto;

import blackcap.coordinator.model.Schedule;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleResponse(
        @JsonProperty("scheduleId") String scheduleId,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("clusterId") String clusterId,
        @JsonProperty("externalJobId") String externalJobId,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("deletedAt") Instant deletedAt) {

    public static ScheduleResponse from(Schedule schedule) {
        return new ScheduleResponse(
                schedule.id(),
                schedule.jobId(),
                schedule.clusterId(),
                schedule.externalJobId(),
                schedule.createdBy(),
                schedule.createdAt(),
                schedule.updatedAt(),
                schedule.deletedAt());
    }
}
