package blackcap.coordinator.scheduler;

import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.repository.JobRepository;

import java.util.List;
import java.util.Locale;

/**
 * Builds the scheduler strategy named in configuration.
 */
public final class SchedulerRegistry {

    public static final String DEFAULT = LeastLoadedScheduler.NAME;

    private SchedulerRegistry() {
    }

    public static List<String> names() {
        return List.of(FirstFitScheduler.NAME, LeastLoadedScheduler.NAME);
    }

    /**
     * @throws IllegalArgumentException for an unknown strategy name
     */
    public static Scheduler create(String name, JobRepository jobs, ClusterRegistry clusters, LoadProbe load) {
        String key = name == null || name.isBlank() ? DEFAULT : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case LeastLoadedScheduler.NAME -> new LeastLoadedScheduler(jobs, clusters, load);
            case FirstFitScheduler.NAME -> new FirstFitScheduler(jobs, clusters);
            default -> throw new IllegalArgumentException(
                    "Unknown scheduler strategy '" + name + "', expected one of " + names());
        };
    }
}
