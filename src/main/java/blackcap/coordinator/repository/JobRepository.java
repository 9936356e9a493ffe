package blackcap.coordinator.repository;

import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 */
public interface JobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Get jobs by status, oldest first.
     */
    List<Job> findByStatus(JobStatus status);

    /**
     * Get recent jobs ordered by creation time, newest first.
     *
     * @param limit maximum results
     */
    List<Job> findRecent(int limit);

    /**
     * Move a job to {@code target} if, and only if, its current status allows that transition.
     * The check and the write happen in one conditional statement, so a job that has been
     * cancelled or finished concurrently is never overwritten.
     *
     * @return true if the status changed
     */
    boolean advanceStatus(String jobId, JobStatus target);

    /**
     * Generate a new unique Job ID.
     *
     * @return unique ID like "job-{uuid}"
     */
    String generateId();
}
