package blackcap.coordinator.scheduler;

import blackcap.coordinator.schema.ScheduleCreate;
import blackcap.coordinator.schema.ScheduledCreate;

/**
 * Chooses the cluster a job runs on.
 *
 * A scheduler does not deduplicate; the schedule store rejects a second active schedule.
 */
public interface Scheduler {

    /**
     * Select a cluster for the job named in {@code request}.
     *
     * @throws blackcap.coordinator.error.NotFoundException          if the job does not exist
     * @throws blackcap.coordinator.error.NoEligibleClusterException if no cluster offers the job's capabilities
     */
    ScheduledCreate schedule(ScheduleCreate request);

    /** Name used to select this strategy in configuration. */
    String name();
}
