package blackcap.coordinator.cluster;

import blackcap.coordinator.model.ClusterDescriptor;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of one cluster, as read from a {@code [cluster <id>]} INI section.
 *
 * @param properties backend-specific keys (endpoint, token, namespace, ...)
 */
public record ClusterSettings(
        String id,
        String type,
        Set<String> capabilities,
        int limit,
        Map<String, String> properties) {

    public ClusterSettings {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
        properties = properties != null ? Map.copyOf(properties) : Map.of();
    }

    public ClusterDescriptor descriptor() {
        return new ClusterDescriptor(id, type, capabilities, limit);
    }

    public String property(String key, String def) {
        String value = properties.get(key);
        return (value == null || value.isBlank()) ? def : value.trim();
    }

    public String requireProperty(String key) {
        String value = property(key, null);
        if (value == null) {
            throw new IllegalArgumentException("cluster " + id + ": '" + key + "' is required for type " + type);
        }
        return value;
    }

    public int intProperty(String key, int def) {
        String value = property(key, null);
        return value == null ? def : Integer.parseInt(value);
    }

    public Duration durationMsProperty(String key, Duration def) {
        String value = property(key, null);
        return value == null ? def : Duration.ofMillis(Long.parseLong(value));
    }
}
