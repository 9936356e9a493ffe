package blackcap.coordinator.model;

import java.util.Objects;
import java.util.Set;

/**
 * Static description of a configured cluster.
 *
 * @param id           unique cluster id
 * @param type         backend type key (local, slurm, kubernetes)
 * @param capabilities labels describing what job specs the cluster can run
 * @param limit        maximum concurrently active schedules, 0 = unlimited
 */
public record ClusterDescriptor(String id, String type, Set<String> capabilities, int limit) {

    public ClusterDescriptor {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative");
        }
    }

    /** True if every required label is offered by this cluster. */
    public boolean supports(Set<String> required) {
        return capabilities.containsAll(required);
    }
}
