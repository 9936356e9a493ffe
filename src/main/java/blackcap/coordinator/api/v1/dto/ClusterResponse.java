package blackcap.coordinator.api.v1.dto;

import blackcap.coordinator.model.ClusterCapacity;
import blackcap.coordinator.model.ClusterDescriptor;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;
import java.util.TreeSet;

/**
 * Response DTO for a configured cluster and its current load.
 * GET /api/v1/clusters
 */
public record ClusterResponse(
        @JsonProperty("clusterId") String clusterId,
        @JsonProperty("type") String type,
        @JsonProperty("capabilities") Set<String> capabilities,
        @JsonProperty("activeSchedules") int activeSchedules,
        @JsonProperty("limit") int limit,
        @JsonProperty("full") boolean full) {

    public static ClusterResponse from(ClusterDescriptor descriptor, ClusterCapacity capacity) {
        return new ClusterResponse(
                descriptor.id(),
                descriptor.type(),
                new TreeSet<>(descriptor.capabilities()),
                capacity.load(),
                capacity.limit(),
                capacity.isFull());
    }
}
