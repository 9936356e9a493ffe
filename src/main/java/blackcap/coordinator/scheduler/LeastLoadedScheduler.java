package blackcap.coordinator.scheduler;

import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.model.ClusterDescriptor;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.repository.JobRepository;

import java.util.List;

/**
 * Places a job on the eligible cluster with the fewest active schedules.
 * Ties go to the lowest cluster id.
 */
public final class LeastLoadedScheduler extends CapabilityScheduler {

    public static final String NAME = "least-loaded";

    private final LoadProbe loadProbe;

    public LeastLoadedScheduler(JobRepository jobRepository, ClusterRegistry clusters, LoadProbe loadProbe) {
        super(jobRepository, clusters);
        this.loadProbe = loadProbe;
    }

    @Override
    protected ClusterDescriptor select(Job job, List<ClusterDescriptor> eligible) {
        ClusterDescriptor best = null;
        int bestLoad = Integer.MAX_VALUE;
        for (ClusterDescriptor candidate : eligible) {
            int load = loadProbe.activeSchedules(candidate.id());
            if (best == null || load < bestLoad
                    || (load == bestLoad && candidate.id().compareTo(best.id()) < 0)) {
                best = candidate;
                bestLoad = load;
            }
        }
        return best;
    }

    @Override
    public String name() {
        return NAME;
    }
}
