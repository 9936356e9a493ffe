package blackcap.coordinator.reconcile;

import blackcap.coordinator.cluster.Cluster;
import blackcap.coordinator.cluster.ClusterCalls;
import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.error.PermanentBackendException;
import blackcap.coordinator.error.ScheduleNotFoundException;
import blackcap.coordinator.error.TransientBackendException;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;
import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.repository.JobRepository;
import blackcap.coordinator.repository.ScheduleRepository;
import blackcap.coordinator.schema.ScheduleUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Background task that hands new schedules to their clusters.
 *
 * For each active schedule without an external job id:
 * - prepare and submit the job, then record the returned id
 * - on a permanent failure mark the job FAILED and release the schedule
 * - on a transient failure leave everything for the next pass
 */
public class SubmissionDispatcher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SubmissionDispatcher.class);

    public enum Outcome {
        SUBMITTED,
        REJECTED,
        DEFERRED,
        SKIPPED
    }

    private final JobRepository jobRepository;
    private final ScheduleRepository scheduleRepository;
    private final ClusterRegistry clusters;
    private final ClusterCalls calls;
    private final JobLocks locks;

    public SubmissionDispatcher(JobRepository jobRepository, ScheduleRepository scheduleRepository,
            ClusterRegistry clusters, ClusterCalls calls, JobLocks locks) {
        this.jobRepository = jobRepository;
        this.scheduleRepository = scheduleRepository;
        this.clusters = clusters;
        this.calls = calls;
        this.locks = locks;
    }

    @Override
    public void run() {
        try {
            dispatchPending();
        } catch (Exception e) {
            log.error("Submission dispatcher error", e);
        }
    }

    /**
     * @return number of schedules submitted in this pass
     */
    public int dispatchPending() {
        int submitted = 0;
        int rejected = 0;
        int deferred = 0;

        for (Schedule schedule : scheduleRepository.findActive()) {
            if (schedule.isSubmitted()) {
                continue;
            }
            switch (dispatch(schedule)) {
                case SUBMITTED -> submitted++;
                case REJECTED -> rejected++;
                case DEFERRED -> deferred++;
                default -> {
                }
            }
        }

        if (submitted + rejected + deferred > 0) {
            log.info("Submission dispatcher: {} submitted, {} rejected, {} deferred",
                    submitted, rejected, deferred);
        }
        return submitted;
    }

    /**
     * Submit one schedule under its job's lock.
     */
    public Outcome dispatch(Schedule schedule) {
        Outcome[] outcome = {Outcome.SKIPPED};
        locks.tryRun(schedule.jobId(), () -> outcome[0] = dispatchLocked(schedule));
        return outcome[0];
    }

    private Outcome dispatchLocked(Schedule schedule) {
        // re-read under the lock: another pass may have submitted or released it
        Optional<Schedule> fresh = scheduleRepository.findById(schedule.id());
        if (fresh.isEmpty() || !fresh.get().isActive() || fresh.get().isSubmitted()) {
            return Outcome.SKIPPED;
        }

        Optional<Job> job = jobRepository.findById(schedule.jobId());
        if (job.isEmpty()) {
            log.warn("Schedule {} references missing job {}", schedule.id(), schedule.jobId());
            return Outcome.SKIPPED;
        }
        if (job.get().isTerminal()) {
            scheduleRepository.softDelete(schedule.id());
            return Outcome.SKIPPED;
        }

        Optional<Cluster> cluster = clusters.find(schedule.clusterId());
        if (cluster.isEmpty()) {
            log.warn("Schedule {} is bound to unknown cluster {}", schedule.id(), schedule.clusterId());
            return Outcome.DEFERRED;
        }

        try {
            calls.prepare(cluster.get(), job.get());
            String externalId = calls.submit(cluster.get(), job.get());
            try {
                scheduleRepository.update(new ScheduleUpdate(schedule.id(), externalId));
            } catch (ScheduleNotFoundException e) {
                // the run exists on the cluster but nothing tracks it; never submit this job again
                log.warn("Schedule {} was released while job {} was being submitted as {}, cancelling the job",
                        schedule.id(), job.get().id(), externalId);
                jobRepository.advanceStatus(job.get().id(), JobStatus.CANCELLED);
                return Outcome.SKIPPED;
            }
            log.info("Submitted job {} to cluster {} as {}", job.get().id(), cluster.get().id(), externalId);
            return Outcome.SUBMITTED;
        } catch (PermanentBackendException e) {
            log.warn("Cluster {} rejected job {}: {}", cluster.get().id(), job.get().id(), e.getMessage());
            jobRepository.advanceStatus(job.get().id(), JobStatus.FAILED);
            scheduleRepository.softDelete(schedule.id());
            return Outcome.REJECTED;
        } catch (TransientBackendException e) {
            log.info("Submission of job {} deferred: {}", job.get().id(), e.getMessage());
            return Outcome.DEFERRED;
        }
    }
}
