package blackcap.coordinator.repository;

import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.schema.ScheduleQueryType;
import blackcap.coordinator.schema.ScheduleUpdate;
import blackcap.coordinator.schema.ScheduledCreate;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Schedule persistence.
 * A schedule is active until soft-deleted; at most one active schedule may reference a job.
 */
public interface ScheduleRepository {

    /**
     * Create an active schedule and move its job from PENDING to SCHEDULED, in one transaction.
     *
     * @param request   job and target cluster
     * @param createdBy id of the creating user
     * @return the stored schedule
     * @throws blackcap.coordinator.error.NotFoundException          if the job does not exist
     * @throws blackcap.coordinator.error.DuplicateScheduleException if the job already has an active schedule
     * @throws blackcap.coordinator.error.ConflictException          if the job is already terminal, or was
     *                                                               submitted under an earlier schedule
     */
    Schedule create(ScheduledCreate request, String createdBy);

    Optional<Schedule> findById(String scheduleId);

    /**
     * Find schedules by one field.
     *
     * @param includeDeleted also return soft-deleted schedules
     */
    List<Schedule> findBy(ScheduleQueryType type, String value, boolean includeDeleted);

    Optional<Schedule> findActiveByJobId(String jobId);

    /**
     * All active schedules, oldest first.
     */
    List<Schedule> findActive();

    int countActiveByCluster(String clusterId);

    /**
     * Apply a typed update to an active schedule and refresh {@code updated_at}.
     *
     * @throws blackcap.coordinator.error.ScheduleNotFoundException if there is no such active schedule
     */
    Schedule update(ScheduleUpdate update);

    /**
     * Soft-delete a schedule, releasing its job for rescheduling.
     *
     * @return false if the schedule does not exist or is already deleted
     */
    boolean softDelete(String scheduleId);

    String generateId();
}
