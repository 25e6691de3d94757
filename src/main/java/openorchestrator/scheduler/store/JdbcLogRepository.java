package openorchestrator.scheduler.store;

import openorchestrator.scheduler.model.LogEntry;
import openorchestrator.scheduler.model.LogLevel;
import openorchestrator.scheduler.repository.LogRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JDBC implementation of LogRepository.
 */
public class JdbcLogRepository implements LogRepository {

    // Column width of logs.message
    private static final int MAX_MESSAGE_LENGTH = 8000;

    private final Database db;

    public JdbcLogRepository(Database db) {
        this.db = db;
    }

    @Override
    public void create(String processName, LogLevel level, String message) {
        create(processName, null, level, message);
    }

    @Override
    public void create(String processName, String jobId, LogLevel level, String message) {
        String sql = """
                    INSERT INTO logs (id, log_time, log_level, process_name, job_id, message)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, UUID.randomUUID().toString());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, level.name());
            ps.setString(4, processName);
            ps.setString(5, jobId);
            ps.setString(6, truncate(message));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to create log for process: " + processName, e);
        }
    }

    @Override
    public List<LogEntry> findRecent(int limit) {
        String sql = "SELECT * FROM logs ORDER BY log_time DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find recent logs", e);
        }
    }

    @Override
    public List<LogEntry> findByProcess(String processName, int limit) {
        String sql = "SELECT * FROM logs WHERE process_name = ? ORDER BY log_time DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, processName);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find logs for process: " + processName, e);
        }
    }

    private List<LogEntry> executeQuery(PreparedStatement ps) throws SQLException {
        List<LogEntry> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(new LogEntry(
                        rs.getString("id"),
                        JdbcSupport.toInstant(rs.getTimestamp("log_time")),
                        LogLevel.valueOf(rs.getString("log_level")),
                        rs.getString("process_name"),
                        rs.getString("job_id"),
                        rs.getString("message")));
            }
        }
        return results;
    }

    private static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) : message;
    }
}
