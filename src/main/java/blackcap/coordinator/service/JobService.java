package blackcap.coordinator.service;

import blackcap.coordinator.auth.AccessGuard;
import blackcap.coordinator.auth.Action;
import blackcap.coordinator.auth.SessionToken;
import blackcap.coordinator.error.ConflictException;
import blackcap.coordinator.error.NotFoundException;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;
import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.model.User;
import blackcap.coordinator.repository.JobRepository;
import blackcap.coordinator.repository.ScheduleRepository;
import blackcap.coordinator.schema.ItemResult;
import blackcap.coordinator.schema.JobCreate;
import blackcap.coordinator.schema.ScheduleCreate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Business logic for Job management: submission, scheduling and cancellation.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final AccessGuard accessGuard;
    private final JobRepository jobRepository;
    private final ScheduleRepository scheduleRepository;
    private final ScheduleService scheduleService;

    public JobService(AccessGuard accessGuard, JobRepository jobRepository,
            ScheduleRepository scheduleRepository, ScheduleService scheduleService) {
        this.accessGuard = accessGuard;
        this.jobRepository = jobRepository;
        this.scheduleRepository = scheduleRepository;
        this.scheduleService = scheduleService;
    }

    /**
     * Create a new PENDING job owned by the caller.
     */
    public Job submitJob(SessionToken token, JobCreate request) {
        User user = accessGuard.require(token, Action.SUBMIT_JOB);
        request.validate();

        Job job = Job.builder()
                .id(jobRepository.generateId())
                .name(request.name())
                .owner(user.userId())
                .spec(request.specJson())
                .requiredCapabilities(request.capabilities())
                .status(JobStatus.PENDING)
                .createdAt(Instant.now())
                .build();

        jobRepository.save(job);
        log.info("Created job {} for {} requiring {}", job.id(), user.email(), job.requiredCapabilities());
        return job;
    }

    /**
     * Place each job on a cluster and persist the schedules.
     */
    public List<ItemResult<Schedule>> scheduleJobs(SessionToken token, List<ScheduleCreate> requests) {
        return scheduleService.create(token, requests);
    }

    /**
     * Cancel a job. CANCELLED is absorbing: cancelling twice is a no-op, and the reconciler
     * never overwrites it. Cancelling a job that already finished otherwise is a conflict.
     */
    public Job cancelJob(SessionToken token, String jobId) {
        User user = accessGuard.require(token, Action.CANCEL_JOB);
        Job job = getJob(jobId);

        if (job.status() != JobStatus.CANCELLED) {
            if (!jobRepository.advanceStatus(jobId, JobStatus.CANCELLED)) {
                Job current = getJob(jobId);
                if (current.status() != JobStatus.CANCELLED) {
                    throw new ConflictException("Job " + jobId + " is already " + current.status());
                }
            } else {
                log.info("Job {} cancelled by {}", jobId, user.email());
            }
        }

        scheduleRepository.findActiveByJobId(jobId)
                .ifPresent(schedule -> scheduleRepository.softDelete(schedule.id()));
        return getJob(jobId);
    }

    /**
     * @throws NotFoundException if the job does not exist
     */
    public Job getJob(String jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
    }

    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> findRecent(int limit) {
        return jobRepository.findRecent(limit);
    }

    /**
     * Jobs currently in {@code status}, oldest first.
     */
    public List<Job> findByStatus(JobStatus status, int limit) {
        return jobRepository.findByStatus(status).stream().limit(limit).toList();
    }
}
