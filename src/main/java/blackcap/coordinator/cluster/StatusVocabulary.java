package blackcap.coordinator.cluster;

import blackcap.coordinator.model.JobStatus;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a backend's status vocabulary onto {@link JobStatus}.
 */
public final class StatusVocabulary {

    private static final Logger log = LoggerFactory.getLogger(StatusVocabulary.class);

    /** slurmrestd job_state values */
    public static final StatusVocabulary SLURM = new StatusVocabulary("slurm", ImmutableMap.<String, JobStatus>builder()
            .put("PENDING", JobStatus.SCHEDULED)
            .put("REQUEUED", JobStatus.SCHEDULED)
            .put("SUSPENDED", JobStatus.SCHEDULED)
            .put("CONFIGURING", JobStatus.RUNNING)
            .put("RUNNING", JobStatus.RUNNING)
            .put("COMPLETING", JobStatus.RUNNING)
            .put("COMPLETED", JobStatus.SUCCEEDED)
            .put("FAILED", JobStatus.FAILED)
            .put("TIMEOUT", JobStatus.FAILED)
            .put("NODE_FAIL", JobStatus.FAILED)
            .put("OUT_OF_MEMORY", JobStatus.FAILED)
            .put("BOOT_FAIL", JobStatus.FAILED)
            .put("DEADLINE", JobStatus.FAILED)
            .put("PREEMPTED", JobStatus.FAILED)
            .put("CANCELLED", JobStatus.CANCELLED)
            .build());

    /** Kubernetes pod/job phases */
    public static final StatusVocabulary KUBERNETES = new StatusVocabulary("kubernetes",
            ImmutableMap.<String, JobStatus>builder()
                    .put("PENDING", JobStatus.SCHEDULED)
                    .put("RUNNING", JobStatus.RUNNING)
                    .put("SUCCEEDED", JobStatus.SUCCEEDED)
                    .put("FAILED", JobStatus.FAILED)
                    .build());

    /** In-process local backend */
    public static final StatusVocabulary LOCAL = new StatusVocabulary("local", ImmutableMap.<String, JobStatus>builder()
            .put("QUEUED", JobStatus.SCHEDULED)
            .put("RUNNING", JobStatus.RUNNING)
            .put("DONE", JobStatus.SUCCEEDED)
            .put("ERROR", JobStatus.FAILED)
            .put("LOST", JobStatus.FAILED)
            .put("CANCELLED", JobStatus.CANCELLED)
            .build());

    private final String backend;
    private final Map<String, JobStatus> table;

    public StatusVocabulary(String backend, Map<String, JobStatus> table) {
        this.backend = backend;
        this.table = ImmutableMap.copyOf(table);
    }

    public String backend() {
        return backend;
    }

    /** Map one backend status (case-insensitive). */
    public Optional<JobStatus> map(String backendStatus) {
        if (backendStatus == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.get(backendStatus.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * Fold the statuses of all sub-tasks of a job into a single job status.
     * Unknown values are skipped; an empty result means nothing usable was reported.
     */
    public Optional<JobStatus> fold(Iterable<String> backendStatuses) {
        List<JobStatus> mapped = new ArrayList<>();
        for (String raw : backendStatuses) {
            Optional<JobStatus> status = map(raw);
            if (status.isPresent()) {
                mapped.add(status.get());
            } else {
                log.warn("Ignoring unknown {} status '{}'", backend, raw);
            }
        }
        return fold(mapped);
    }

    static Optional<JobStatus> fold(List<JobStatus> statuses) {
        if (statuses.isEmpty()) {
            return Optional.empty();
        }
        if (statuses.contains(JobStatus.FAILED)) {
            return Optional.of(JobStatus.FAILED);
        }
        if (statuses.contains(JobStatus.CANCELLED)) {
            return Optional.of(JobStatus.CANCELLED);
        }
        if (statuses.stream().allMatch(s -> s == JobStatus.SUCCEEDED)) {
            return Optional.of(JobStatus.SUCCEEDED);
        }
        if (statuses.contains(JobStatus.RUNNING) || statuses.contains(JobStatus.SUCCEEDED)) {
            return Optional.of(JobStatus.RUNNING);
        }
        return Optional.of(JobStatus.SCHEDULED);
    }

    @Override
    public String toString() {
        return "StatusVocabulary{" + backend + ", " + table.size() + " entries}";
    }
}
