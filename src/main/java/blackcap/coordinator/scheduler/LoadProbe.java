package blackcap.coordinator.scheduler;

/**
 * Current load of a cluster, measured as the number of active schedules bound to it.
 */
@FunctionalInterface
public interface LoadProbe {

    int activeSchedules(String clusterId);
}
