package blackcap.coordinator.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;
import java.util.TreeSet;

/**
 * Job submission. {@code spec} is kept verbatim; {@code requiredCapabilities} drives cluster selection.
 */
public record JobCreate(
        @JsonProperty("name") String name,
        @JsonProperty("spec") JsonNode spec,
        @JsonProperty("requiredCapabilities") Set<String> requiredCapabilities) {

    public void validate() {
        if (spec == null || !spec.isObject()) {
            throw new IllegalArgumentException("spec must be a JSON object");
        }
        if (requiredCapabilities != null) {
            for (String label : requiredCapabilities) {
                if (label == null || label.isBlank()) {
                    throw new IllegalArgumentException("requiredCapabilities must not contain blank labels");
                }
            }
        }
    }

    public String specJson() {
        return spec.toString();
    }

    public Set<String> capabilities() {
        return requiredCapabilities != null ? new TreeSet<>(requiredCapabilities) : new TreeSet<>();
    }
}
