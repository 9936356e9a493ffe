package blackcap.coordinator.schema;

import blackcap.coordinator.error.InvalidQueryException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Schedule lookup parameters. Soft-deleted schedules are only returned with {@code includeDeleted}.
 */
public record ScheduleGetQueryParams(
        @JsonProperty("queryType") String queryType,
        @JsonProperty("value") String value,
        @JsonProperty("includeDeleted") boolean includeDeleted) {

    public ScheduleGetQueryParams(String queryType, String value) {
        this(queryType, value, false);
    }

    /** Validate and return the parsed query type. */
    public ScheduleQueryType type() {
        ScheduleQueryType type = ScheduleQueryType.parse(queryType);
        if (value == null || value.isBlank()) {
            throw new InvalidQueryException("value is required for query_type " + queryType);
        }
        return type;
    }
}
