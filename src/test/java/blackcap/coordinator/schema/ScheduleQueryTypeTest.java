package blackcap.coordinator.schema;

import blackcap.coordinator.error.InvalidQueryException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleQueryTypeTest {

    @Test
    void parsesWireForms() {
        assertEquals(ScheduleQueryType.JOB_ID, ScheduleQueryType.parse("job_id"));
        assertEquals(ScheduleQueryType.CLUSTER_ID, ScheduleQueryType.parse("cluster-id"));
        assertEquals(ScheduleQueryType.SCHEDULE_ID, ScheduleQueryType.parse(" SCHEDULE_ID "));
    }

    @Test
    void rejectsUnknownOrMissing() {
        assertThrows(InvalidQueryException.class, () -> ScheduleQueryType.parse("owner"));
        assertThrows(InvalidQueryException.class, () -> ScheduleQueryType.parse(""));
        assertThrows(InvalidQueryException.class, () -> new ScheduleGetQueryParams("job_id", null).type());
    }
}
