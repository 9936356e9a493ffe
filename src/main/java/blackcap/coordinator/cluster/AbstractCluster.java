package blackcap.coordinator.cluster;

import blackcap.coordinator.error.PreparationException;
import blackcap.coordinator.model.ClusterDescriptor;
import blackcap.coordinator.model.Job;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared preparation rules: capability check and spec parsing.
 * Subclasses add backend-specific checks in {@link #prepareSpec(Job, JsonNode)}.
 */
public abstract class AbstractCluster implements Cluster {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private final ClusterDescriptor descriptor;

    protected AbstractCluster(ClusterDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public ClusterDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public final void prepare(Job job) {
        if (!descriptor.supports(job.requiredCapabilities())) {
            Set<String> missing = new TreeSet<>(job.requiredCapabilities());
            missing.removeAll(descriptor.capabilities());
            throw new PreparationException("Cluster " + id() + " lacks capabilities " + missing
                    + " required by job " + job.id());
        }
        prepareSpec(job, parseSpec(job));
    }

    /** Backend-specific validation of the parsed job spec. */
    protected void prepareSpec(Job job, JsonNode spec) {
    }

    protected static JsonNode parseSpec(Job job) {
        try {
            JsonNode node = MAPPER.readTree(job.spec());
            if (node == null || !node.isObject()) {
                throw new PreparationException("Job " + job.id() + " spec is not a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new PreparationException("Job " + job.id() + " spec is not valid JSON", e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + descriptor.id() + "}";
    }
}
