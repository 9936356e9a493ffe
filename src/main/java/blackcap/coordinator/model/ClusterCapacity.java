package blackcap.coordinator.model;

/**
 * Current load of a cluster against its limit.
 *
 * @param load  active schedules bound to the cluster
 * @param limit configured limit, 0 = unlimited
 */
public record ClusterCapacity(int load, int limit) {

    public boolean isFull() {
        return limit > 0 && load >= limit;
    }
}
