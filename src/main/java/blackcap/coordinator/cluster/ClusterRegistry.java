package blackcap.coordinator.cluster;

import blackcap.coordinator.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Holds the clusters configured at process start.
 * Backends are built from a type-keyed factory table; tests may register extra types or ready instances.
 */
public final class ClusterRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterRegistry.class);

    private static final Map<String, Function<ClusterSettings, Cluster>> DEFAULT_FACTORIES = Map.of(
            "local", LocalCluster::new,
            "slurm", SlurmCluster::new,
            "kubernetes", KubernetesCluster::new);

    private final Map<String, Cluster> clusters = new TreeMap<>();

    public ClusterRegistry() {
    }

    /**
     * Build every configured cluster using the default backend table.
     *
     * @throws IllegalArgumentException for an unknown type or duplicate id
     */
    public static ClusterRegistry fromSettings(List<ClusterSettings> settings) {
        return fromSettings(settings, DEFAULT_FACTORIES);
    }

    public static ClusterRegistry fromSettings(List<ClusterSettings> settings,
            Map<String, Function<ClusterSettings, Cluster>> factories) {
        ClusterRegistry registry = new ClusterRegistry();
        for (ClusterSettings s : settings) {
            Function<ClusterSettings, Cluster> factory = factories.get(s.type().toLowerCase(Locale.ROOT));
            if (factory == null) {
                throw new IllegalArgumentException("Unknown cluster type '" + s.type() + "' for cluster " + s.id());
            }
            registry.register(factory.apply(s));
        }
        return registry;
    }

    public ClusterRegistry register(Cluster cluster) {
        if (clusters.putIfAbsent(cluster.id(), cluster) != null) {
            throw new IllegalArgumentException("Duplicate cluster id: " + cluster.id());
        }
        log.info("Registered cluster {} (type={}, capabilities={}, limit={})",
                cluster.id(), cluster.descriptor().type(), cluster.descriptor().capabilities(),
                cluster.descriptor().limit());
        return this;
    }

    public Optional<Cluster> find(String clusterId) {
        return Optional.ofNullable(clusters.get(clusterId));
    }

    public Cluster require(String clusterId) {
        return find(clusterId).orElseThrow(() -> new NotFoundException("Unknown cluster: " + clusterId));
    }

    /** All clusters ordered by id. */
    public List<Cluster> all() {
        return Collections.unmodifiableList(new ArrayList<>(clusters.values()));
    }

    public int size() {
        return clusters.size();
    }

    /** Supported backend type keys. */
    public static List<String> knownTypes() {
        return new ArrayList<>(new TreeMap<>(DEFAULT_FACTORIES).keySet());
    }

    @Override
    public void close() {
        for (Cluster cluster : clusters.values()) {
            try {
                cluster.close();
            } catch (Exception e) {
                log.warn("Error closing cluster {}: {}", cluster.id(), e.getMessage());
            }
        }
    }
}
