package blackcap.coordinator.cluster;

import blackcap.coordinator.model.ClusterDescriptor;
import blackcap.coordinator.model.Job;

/**
 * An execution backend able to accept, run and report on jobs.
 *
 * <p>Implementations are selected by configuration at process start (see {@link ClusterRegistry}).
 * Calls may block on the network; the coordinator always invokes them through {@link ClusterCalls},
 * which applies a timeout. Implementations must be thread-safe.
 */
public interface Cluster extends AutoCloseable {

    ClusterDescriptor descriptor();

    default String id() {
        return descriptor().id();
    }

    /** Fixed table mapping this backend's status strings to job statuses. */
    StatusVocabulary vocabulary();

    /**
     * Validate and stage a job for submission.
     *
     * @throws blackcap.coordinator.error.PreparationException if the job is incompatible with this cluster
     */
    void prepare(Job job);

    /**
     * Submit a prepared job.
     *
     * @return backend job identifier
     * @throws blackcap.coordinator.error.SubmissionException          on retryable failure
     * @throws blackcap.coordinator.error.PermanentSubmissionException on non-retryable rejection
     */
    String submit(Job job);

    /**
     * Query backend status of a submitted job, one value per sub-task.
     * The returned sequence is lazy, finite and may be iterated more than once.
     *
     * @throws blackcap.coordinator.error.StatusQueryException on any failure (always retryable)
     */
    Iterable<String> getStatus(String externalJobId);

    @Override
    default void close() {
    }
}
