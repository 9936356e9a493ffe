package blackcap.coordinator.store;

import blackcap.coordinator.error.ConflictException;
import blackcap.coordinator.error.DuplicateScheduleException;
import blackcap.coordinator.error.NotFoundException;
import blackcap.coordinator.error.ScheduleNotFoundException;
import blackcap.coordinator.model.JobStatus;
import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.repository.ScheduleRepository;
import blackcap.coordinator.scheduler.LoadProbe;
import blackcap.coordinator.schema.ScheduleQueryType;
import blackcap.coordinator.schema.ScheduleUpdate;
import blackcap.coordinator.schema.ScheduledCreate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of ScheduleRepository.
 *
 * <p>Uniqueness of the active schedule per job is enforced twice: the create transaction
 * locks the job row and checks for an existing active schedule, and the
 * {@code uq_schedules_active_job} constraint rejects whatever slips past that check.
 */
public class JdbcScheduleRepository implements ScheduleRepository, LoadProbe {

    private static final Logger log = LoggerFactory.getLogger(JdbcScheduleRepository.class);

    private final Database db;

    public JdbcScheduleRepository(Database db) {
        this.db = db;
    }

    @Override
    public Schedule create(ScheduledCreate request, String createdBy) {
        String scheduleId = generateId();
        Instant now = Instant.now();

        Schedule created = db.inTransaction(conn -> {
            JobStatus status = lockJob(conn, request.jobId());
            if (status.isTerminal()) {
                throw new ConflictException("Job " + request.jobId() + " is already " + status);
            }
            if (hasActiveSchedule(conn, request.jobId())) {
                throw new DuplicateScheduleException("Job " + request.jobId() + " already has an active schedule");
            }
            if (status == JobStatus.RUNNING || wasSubmitted(conn, request.jobId())) {
                throw new ConflictException("Job " + request.jobId() + " was already submitted to a cluster");
            }

            String insert = """
                        INSERT INTO schedules (id, job_id, active_job_id, cluster_id, created_by, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?)
                    """;
            try (PreparedStatement ps = conn.prepareStatement(insert)) {
                ps.setString(1, scheduleId);
                ps.setString(2, request.jobId());
                ps.setString(3, request.jobId());
                ps.setString(4, request.clusterId());
                ps.setString(5, createdBy);
                ps.setTimestamp(6, Timestamp.from(now));
                ps.setTimestamp(7, Timestamp.from(now));
                ps.executeUpdate();
            } catch (SQLException e) {
                if (Database.UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw new DuplicateScheduleException(
                            "Job " + request.jobId() + " already has an active schedule", e);
                }
                throw e;
            }

            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE jobs SET status = ?, updated_at = ? WHERE id = ? AND status = ?")) {
                ps.setString(1, JobStatus.SCHEDULED.name());
                ps.setTimestamp(2, Timestamp.from(now));
                ps.setString(3, request.jobId());
                ps.setString(4, JobStatus.PENDING.name());
                ps.executeUpdate();
            }

            return Schedule.builder()
                    .id(scheduleId)
                    .jobId(request.jobId())
                    .clusterId(request.clusterId())
                    .createdBy(createdBy)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        });

        log.info("Created schedule {} for job {} on cluster {}", scheduleId, request.jobId(), request.clusterId());
        return created;
    }

    private JobStatus lockJob(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT status FROM jobs WHERE id = ? FOR UPDATE")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException("Job not found: " + jobId);
                }
                return JobStatus.valueOf(rs.getString("status"));
            }
        }
    }

    private boolean hasActiveSchedule(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schedules WHERE job_id = ? AND deleted_at IS NULL")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private boolean wasSubmitted(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schedules WHERE job_id = ? AND external_job_id IS NOT NULL")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public Optional<Schedule> findById(String scheduleId) {
        List<Schedule> found = findBy(ScheduleQueryType.SCHEDULE_ID, scheduleId, true);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<Schedule> findBy(ScheduleQueryType type, String value, boolean includeDeleted) {
        String column = switch (type) {
            case SCHEDULE_ID -> "id";
            case JOB_ID -> "job_id";
            case CLUSTER_ID -> "cluster_id";
        };
        String sql = "SELECT * FROM schedules WHERE " + column + " = ?"
                + (includeDeleted ? "" : " AND deleted_at IS NULL")
                + " ORDER BY created_at ASC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, value);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find schedules by " + type, e);
        }
    }

    @Override
    public Optional<Schedule> findActiveByJobId(String jobId) {
        List<Schedule> found = findBy(ScheduleQueryType.JOB_ID, jobId, false);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<Schedule> findActive() {
        String sql = "SELECT * FROM schedules WHERE deleted_at IS NULL ORDER BY created_at ASC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find active schedules", e);
        }
    }

    @Override
    public int countActiveByCluster(String clusterId) {
        String sql = "SELECT COUNT(*) FROM schedules WHERE cluster_id = ? AND deleted_at IS NULL";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, clusterId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count schedules for cluster: " + clusterId, e);
        }
    }

    @Override
    public int activeSchedules(String clusterId) {
        return countActiveByCluster(clusterId);
    }

    @Override
    public Schedule update(ScheduleUpdate update) {
        String sql = """
                    UPDATE schedules SET external_job_id = COALESCE(?, external_job_id), updated_at = ?
                    WHERE id = ? AND deleted_at IS NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, update.externalJobId());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, update.scheduleId());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                throw new ScheduleNotFoundException("Schedule not found: " + update.scheduleId());
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update schedule: " + update.scheduleId(), e);
        }

        return findById(update.scheduleId())
                .orElseThrow(() -> new ScheduleNotFoundException("Schedule not found: " + update.scheduleId()));
    }

    @Override
    public boolean softDelete(String scheduleId) {
        String sql = """
                    UPDATE schedules SET deleted_at = ?, updated_at = ?, active_job_id = NULL
                    WHERE id = ? AND deleted_at IS NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setTimestamp(1, now);
            ps.setTimestamp(2, now);
            ps.setString(3, scheduleId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.info("Soft-deleted schedule {}", scheduleId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete schedule: " + scheduleId, e);
        }
    }

    @Override
    public String generateId() {
        return "sch-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    private List<Schedule> executeQuery(PreparedStatement ps) throws SQLException {
        List<Schedule> schedules = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                schedules.add(mapRow(rs));
            }
        }
        return schedules;
    }

    private Schedule mapRow(ResultSet rs) throws SQLException {
        return Schedule.builder()
                .id(rs.getString("id"))
                .jobId(rs.getString("job_id"))
                .clusterId(rs.getString("cluster_id"))
                .externalJobId(rs.getString("external_job_id"))
                .createdBy(rs.getString("created_by"))
                .createdAt(JdbcJobRepository.toInstant(rs.getTimestamp("created_at")))
                .updatedAt(JdbcJobRepository.toInstant(rs.getTimestamp("updated_at")))
                .deletedAt(JdbcJobRepository.toInstant(rs.getTimestamp("deleted_at")))
                .build();
    }
}
