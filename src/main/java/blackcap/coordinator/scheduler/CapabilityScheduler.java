package blackcap.coordinator.scheduler;

import blackcap.coordinator.cluster.Cluster;
import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.error.NoEligibleClusterException;
import blackcap.coordinator.error.NotFoundException;
import blackcap.coordinator.model.ClusterDescriptor;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.repository.JobRepository;
import blackcap.coordinator.schema.ScheduleCreate;
import blackcap.coordinator.schema.ScheduledCreate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Base for schedulers that first narrow the registry to clusters offering every capability
 * the job requires, then let the subclass pick one of them.
 */
public abstract class CapabilityScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(CapabilityScheduler.class);

    protected final JobRepository jobRepository;
    protected final ClusterRegistry clusters;

    protected CapabilityScheduler(JobRepository jobRepository, ClusterRegistry clusters) {
        this.jobRepository = jobRepository;
        this.clusters = clusters;
    }

    @Override
    public final ScheduledCreate schedule(ScheduleCreate request) {
        request.validate();
        Job job = jobRepository.findById(request.jobId())
                .orElseThrow(() -> new NotFoundException("Job not found: " + request.jobId()));

        // registry order is by cluster id
        List<ClusterDescriptor> eligible = clusters.all().stream()
                .map(Cluster::descriptor)
                .filter(d -> d.supports(job.requiredCapabilities()))
                .collect(Collectors.toList());

        if (eligible.isEmpty()) {
            throw new NoEligibleClusterException("No cluster offers " + job.requiredCapabilities()
                    + " for job " + job.id());
        }

        ClusterDescriptor chosen = select(job, eligible);
        log.debug("{} placed job {} on cluster {} ({} eligible)", name(), job.id(), chosen.id(), eligible.size());
        return new ScheduledCreate(job.id(), chosen.id());
    }

    /**
     * Pick one of the eligible clusters.
     *
     * @param eligible non-empty, ordered by cluster id
     */
    protected abstract ClusterDescriptor select(Job job, List<ClusterDescriptor> eligible);
}
