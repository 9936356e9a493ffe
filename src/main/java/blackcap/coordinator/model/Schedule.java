package blackcap.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Binding of a job to the cluster it runs on.
 * A schedule is active until it is soft-deleted; at most one active schedule exists per job.
 */
public final class Schedule {
    private final String id;
    private final String jobId;
    private final String clusterId;
    private final String externalJobId;
    private final String createdBy;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant deletedAt;

    private Schedule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.clusterId = Objects.requireNonNull(builder.clusterId, "clusterId is required");
        this.externalJobId = builder.externalJobId;
        this.createdBy = builder.createdBy;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.deletedAt = builder.deletedAt;
    }

    public String id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public String clusterId() {
        return clusterId;
    }

    /** Backend identifier, null until submission succeeds */
    public String externalJobId() {
        return externalJobId;
    }

    public String createdBy() {
        return createdBy;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant deletedAt() {
        return deletedAt;
    }

    public boolean isActive() {
        return deletedAt == null;
    }

    public boolean isSubmitted() {
        return externalJobId != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .clusterId(clusterId)
                .externalJobId(externalJobId)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .deletedAt(deletedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String jobId;
        private String clusterId;
        private String externalJobId;
        private String createdBy;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant deletedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder clusterId(String clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        public Builder externalJobId(String externalJobId) {
            this.externalJobId = externalJobId;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
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

        public Builder deletedAt(Instant deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public Schedule build() {
            return new Schedule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Schedule schedule))
            return false;
        return Objects.equals(id, schedule.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Schedule{id='" + id + "', job=" + jobId + ", cluster=" + clusterId
                + ", external=" + externalJobId + ", active=" + isActive() + "}";
    }
}
