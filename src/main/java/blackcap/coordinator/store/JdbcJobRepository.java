package blackcap.coordinator.store;

import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;
import blackcap.coordinator.repository.JobRepository;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private static final Joiner CAPABILITY_JOINER = Joiner.on(',');
    private static final Splitter CAPABILITY_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, name, owner, spec, required_capabilities, status, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant createdAt = job.createdAt() != null ? job.createdAt() : Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.name());
            ps.setString(3, job.owner());
            ps.setString(4, job.spec());
            ps.setString(5, CAPABILITY_JOINER.join(job.requiredCapabilities()));
            ps.setString(6, job.status().name());
            ps.setTimestamp(7, Timestamp.from(createdAt));
            ps.setTimestamp(8, Timestamp.from(createdAt));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            List<Job> jobs = executeQuery(ps);
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        String sql = "SELECT * FROM jobs WHERE status = ? ORDER BY created_at ASC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs by status", e);
        }
    }

    @Override
    public List<Job> findRecent(int limit) {
        String sql = "SELECT * FROM jobs ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent jobs", e);
        }
    }

    @Override
    public boolean advanceStatus(String jobId, JobStatus target) {
        Set<JobStatus> from = JobStatus.predecessorsOf(target);
        if (from.isEmpty()) {
            return false;
        }
        String placeholders = String.join(", ", Collections.nCopies(from.size(), "?"));
        String sql = """
                    UPDATE jobs SET status = ?, updated_at = ?, finished_at = COALESCE(?, finished_at)
                    WHERE id = ? AND status IN (%s)
                """.formatted(placeholders);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            int i = 1;
            ps.setString(i++, target.name());
            ps.setTimestamp(i++, now);
            ps.setTimestamp(i++, target.isTerminal() ? now : null);
            ps.setString(i++, jobId);
            for (JobStatus status : from) {
                ps.setString(i++, status.name());
            }

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Job {} -> {}", jobId, target);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job status: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    static Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .owner(rs.getString("owner"))
                .spec(rs.getString("spec"))
                .requiredCapabilities(new LinkedHashSet<>(
                        CAPABILITY_SPLITTER.splitToList(rs.getString("required_capabilities"))))
                .status(JobStatus.valueOf(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
