package blackcap.coordinator.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable domain model representing a submitted unit of work.
 * The spec payload is opaque JSON handed to the cluster backend unchanged.
 */
public final class Job {
    private final String id;
    private final String name;
    private final String owner;
    private final String spec;
    private final Set<String> requiredCapabilities;
    private final JobStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant finishedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name;
        this.owner = Objects.requireNonNull(builder.owner, "owner is required");
        this.spec = Objects.requireNonNull(builder.spec, "spec is required");
        this.requiredCapabilities = Set.copyOf(builder.requiredCapabilities);
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String owner() {
        return owner;
    }

    public String spec() {
        return spec;
    }

    public Set<String> requiredCapabilities() {
        return requiredCapabilities;
    }

    public JobStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .owner(owner)
                .spec(spec)
                .requiredCapabilities(requiredCapabilities)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String owner;
        private String spec = "{}";
        private Set<String> requiredCapabilities = new TreeSet<>();
        private JobStatus status = JobStatus.PENDING;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder spec(String spec) {
            this.spec = spec;
            return this;
        }

        public Builder requiredCapabilities(Set<String> requiredCapabilities) {
            this.requiredCapabilities = requiredCapabilities != null
                    ? new TreeSet<>(requiredCapabilities)
                    : new TreeSet<>();
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', status=" + status + ", requires=" + requiredCapabilities + "}";
    }
}
