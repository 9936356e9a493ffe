package blackcap.coordinator.reconcile;

import blackcap.coordinator.cluster.Cluster;
import blackcap.coordinator.cluster.ClusterCalls;
import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.config.CoordinatorConfig;
import blackcap.coordinator.error.StatusQueryException;
import blackcap.coordinator.error.TransientBackendException;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;
import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.repository.JobRepository;
import blackcap.coordinator.repository.ScheduleRepository;
import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;
import com.github.rholder.retry.StopStrategies;
import com.github.rholder.retry.WaitStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background task that brings job status in line with what the clusters report.
 *
 * For every active, submitted schedule whose job is not terminal, the reconciler:
 * 1. Polls the cluster, retrying transient failures with exponential backoff
 * 2. Folds the backend statuses through the cluster's vocabulary
 * 3. Writes the result if it moves the job forward; the write is conditional,
 *    so a job cancelled meanwhile keeps its CANCELLED status
 * 4. Soft-deletes the schedule once the job is terminal
 */
public class StatusReconciler implements Runnable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatusReconciler.class);

    public enum Outcome {
        /** Status moved forward */
        ADVANCED,
        /** Backend reports nothing new */
        UNCHANGED,
        /** Job is terminal and its schedule was released */
        RELEASED,
        /** Another pass holds the job's lock */
        SKIPPED,
        /** Poll failed after retries or the cluster is gone */
        FAILED
    }

    private final JobRepository jobRepository;
    private final ScheduleRepository scheduleRepository;
    private final ClusterRegistry clusters;
    private final ClusterCalls calls;
    private final JobLocks locks;
    private final Retryer<List<String>> retryer;
    private final ExecutorService pollers;

    public StatusReconciler(JobRepository jobRepository, ScheduleRepository scheduleRepository,
            ClusterRegistry clusters, ClusterCalls calls, JobLocks locks, CoordinatorConfig config) {
        this.jobRepository = jobRepository;
        this.scheduleRepository = scheduleRepository;
        this.clusters = clusters;
        this.calls = calls;
        this.locks = locks;
        this.retryer = RetryerBuilder.<List<String>>newBuilder()
                .retryIfExceptionOfType(TransientBackendException.class)
                .withWaitStrategy(WaitStrategies.exponentialWait(
                        config.retryMultiplierMs(), config.retryMaxWait().toMillis(), TimeUnit.MILLISECONDS))
                .withStopStrategy(StopStrategies.stopAfterAttempt(config.retryAttempts()))
                .build();
        AtomicInteger counter = new AtomicInteger();
        this.pollers = Executors.newFixedThreadPool(Math.max(1, config.pollParallelism()), r -> {
            Thread t = new Thread(r, "blackcap-poller-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void run() {
        try {
            reconcileAll();
        } catch (Exception e) {
            log.error("Status reconciler error", e);
        }
    }

    /**
     * Reconcile every active, submitted schedule, polling different jobs in parallel.
     *
     * @return count of schedules per outcome
     */
    public Map<Outcome, Integer> reconcileAll() {
        List<Schedule> submitted = new ArrayList<>();
        for (Schedule schedule : scheduleRepository.findActive()) {
            if (schedule.isSubmitted()) {
                submitted.add(schedule);
            }
        }

        Map<Outcome, Integer> summary = new EnumMap<>(Outcome.class);
        if (submitted.isEmpty()) {
            log.debug("No submitted schedules to reconcile");
            return summary;
        }

        List<Future<Outcome>> futures = new ArrayList<>();
        for (Schedule schedule : submitted) {
            futures.add(pollers.submit(() -> reconcile(schedule)));
        }

        for (int i = 0; i < futures.size(); i++) {
            Outcome outcome;
            try {
                outcome = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Reconciliation interrupted");
                break;
            } catch (ExecutionException e) {
                log.error("Failed to reconcile schedule {}", submitted.get(i).id(), e.getCause());
                outcome = Outcome.FAILED;
            }
            summary.merge(outcome, 1, Integer::sum);
        }

        log.info("Status reconciler: {} schedules, {}", submitted.size(), summary);
        return summary;
    }

    /**
     * Reconcile one schedule under its job's lock.
     */
    public Outcome reconcile(Schedule schedule) {
        AtomicReference<Outcome> outcome = new AtomicReference<>();
        boolean ran = locks.tryRun(schedule.jobId(), () -> outcome.set(reconcileLocked(schedule)));
        if (!ran) {
            log.debug("Job {} is busy, skipping this pass", schedule.jobId());
            return Outcome.SKIPPED;
        }
        return outcome.get();
    }

    private Outcome reconcileLocked(Schedule schedule) {
        Optional<Job> found = jobRepository.findById(schedule.jobId());
        if (found.isEmpty()) {
            log.warn("Schedule {} references missing job {}", schedule.id(), schedule.jobId());
            return Outcome.FAILED;
        }
        if (found.get().isTerminal()) {
            return release(schedule, found.get().status());
        }

        Optional<Cluster> cluster = clusters.find(schedule.clusterId());
        if (cluster.isEmpty()) {
            log.warn("Schedule {} is bound to unknown cluster {}", schedule.id(), schedule.clusterId());
            return Outcome.FAILED;
        }

        List<String> values;
        try {
            values = poll(cluster.get(), schedule.externalJobId());
        } catch (TransientBackendException e) {
            log.warn("Status of job {} unavailable: {}", schedule.jobId(), e.getMessage());
            return Outcome.FAILED;
        }

        Optional<JobStatus> reported = cluster.get().vocabulary().fold(values);
        if (reported.isEmpty()) {
            log.debug("Job {}: no recognised status in {}", schedule.jobId(), values);
            return Outcome.UNCHANGED;
        }

        // re-read: a cancel may have landed while we were polling
        Job current = jobRepository.findById(schedule.jobId()).orElse(found.get());
        if (current.isTerminal()) {
            return release(schedule, current.status());
        }
        JobStatus target = reported.get();
        if (!current.status().canTransitionTo(target)) {
            return Outcome.UNCHANGED;
        }
        if (!jobRepository.advanceStatus(current.id(), target)) {
            log.debug("Job {} changed concurrently, {} not applied", current.id(), target);
            return Outcome.UNCHANGED;
        }

        log.info("Job {}: {} -> {} (cluster {})", current.id(), current.status(), target, schedule.clusterId());
        if (target.isTerminal()) {
            scheduleRepository.softDelete(schedule.id());
        }
        return Outcome.ADVANCED;
    }

    private Outcome release(Schedule schedule, JobStatus status) {
        if (scheduleRepository.softDelete(schedule.id())) {
            log.info("Released schedule {} of {} job {}", schedule.id(), status, schedule.jobId());
        }
        return Outcome.RELEASED;
    }

    /**
     * Query a cluster for a job's statuses, retrying transient failures.
     *
     * @throws TransientBackendException once the retries are exhausted
     */
    public List<String> poll(Cluster cluster, String externalJobId) {
        try {
            return retryer.call(() -> calls.status(cluster, externalJobId));
        } catch (RetryException e) {
            Attempt<?> last = e.getLastFailedAttempt();
            Throwable cause = last.hasException() ? last.getExceptionCause() : null;
            throw new StatusQueryException("Status query for " + externalJobId + " on " + cluster.id()
                    + " failed after " + e.getNumberOfFailedAttempts() + " attempts", cause);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new StatusQueryException("Status query for " + externalJobId + " failed", e.getCause());
        }
    }

    @Override
    public void close() {
        pollers.shutdownNow();
    }
}
