package blackcap.coordinator.schema;

import blackcap.coordinator.error.InvalidQueryException;

import java.util.Locale;

/**
 * Field a schedule lookup filters on.
 */
public enum ScheduleQueryType {
    SCHEDULE_ID,
    JOB_ID,
    CLUSTER_ID;

    /**
     * Parse a wire value such as {@code job_id} or {@code JOB_ID}.
     *
     * @throws InvalidQueryException for null or unknown values
     */
    public static ScheduleQueryType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidQueryException("query_type is required");
        }
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("unknown query_type: " + value);
        }
    }
}
