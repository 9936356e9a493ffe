package blackcap.coordinator.scheduler;

import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.model.ClusterDescriptor;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.repository.JobRepository;

import java.util.List;

/**
 * Places a job on the first eligible cluster by id, ignoring load.
 */
public final class FirstFitScheduler extends CapabilityScheduler {

    public static final String NAME = "first-fit";

    public FirstFitScheduler(JobRepository jobRepository, ClusterRegistry clusters) {
        super(jobRepository, clusters);
    }

    @Override
    protected ClusterDescriptor select(Job job, List<ClusterDescriptor> eligible) {
        return eligible.get(0);
    }

    @Override
    public String name() {
        return NAME;
    }
}
