package openorchestrator.scheduler.store;

import openorchestrator.scheduler.model.Job;
import openorchestrator.scheduler.model.JobStatus;
import openorchestrator.scheduler.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public Job start(String processName, String schedulerName) {
        String sql = """
                    INSERT INTO jobs (id, process_name, scheduler_name, status, start_time)
                    VALUES (?, ?, ?, 'RUNNING', ?)
                """;

        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .processName(processName)
                .schedulerName(schedulerName)
                .status(JobStatus.RUNNING)
                .startTime(Instant.now())
                .build();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.id());
            ps.setString(2, job.processName());
            ps.setString(3, job.schedulerName());
            JdbcSupport.setTimestamp(ps, 4, job.startTime());

            ps.executeUpdate();
            conn.commit();

            log.debug("Job {} started for process '{}' on {}", job.id(), processName, schedulerName);
            return job;
        } catch (SQLException e) {
            throw new StoreException("Failed to start job for process: " + processName, e);
        }
    }

    @Override
    public boolean updateStatus(String jobId, JobStatus status) {
        // end_time keeps its first value; a job row is frozen once it has one.
        String sql = status.isTerminal()
                ? "UPDATE jobs SET status = ?, end_time = COALESCE(end_time, ?) WHERE id = ? AND end_time IS NULL"
                : "UPDATE jobs SET status = ? WHERE id = ? AND end_time IS NULL";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            if (status.isTerminal()) {
                ps.setTimestamp(2, Timestamp.from(Instant.now()));
                ps.setString(3, jobId);
            } else {
                ps.setString(2, jobId);
            }

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.debug("Job {} not updated to {} (missing or already ended)", jobId, status);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update job status: " + jobId, e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findRecent(int limit) {
        String sql = "SELECT * FROM jobs ORDER BY start_time DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<Job> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new StoreException("Failed to find recent jobs", e);
        }
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .processName(rs.getString("process_name"))
                .schedulerName(rs.getString("scheduler_name"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .startTime(JdbcSupport.toInstant(rs.getTimestamp("start_time")))
                .endTime(JdbcSupport.toInstant(rs.getTimestamp("end_time")))
                .build();
    }
}
