package openorchestrator.scheduler.store;

import openorchestrator.scheduler.model.SchedulerHeartbeat;
import openorchestrator.scheduler.repository.SchedulerRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of SchedulerRepository.
 * Heartbeats are upserts keyed by machine name.
 */
public class JdbcSchedulerRepository implements SchedulerRepository {

    private final Database db;

    public JdbcSchedulerRepository(Database db) {
        this.db = db;
    }

    @Override
    public void ping(String machineName) {
        String sql = "MERGE INTO schedulers (machine_name, last_update) KEY (machine_name) VALUES (?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, machineName);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to ping from scheduler: " + machineName, e);
        }
    }

    @Override
    public void recordTriggerStart(String machineName, String triggerName) {
        String sql = """
                    MERGE INTO schedulers (machine_name, last_update, latest_trigger, last_trigger_start)
                    KEY (machine_name)
                    VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setString(1, machineName);
            ps.setTimestamp(2, now);
            ps.setString(3, triggerName);
            ps.setTimestamp(4, now);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to record trigger start on: " + machineName, e);
        }
    }

    @Override
    public Optional<SchedulerHeartbeat> findByName(String machineName) {
        String sql = "SELECT * FROM schedulers WHERE machine_name = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, machineName);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find scheduler: " + machineName, e);
        }
    }

    @Override
    public List<SchedulerHeartbeat> findAll() {
        String sql = "SELECT * FROM schedulers ORDER BY last_update DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<SchedulerHeartbeat> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapRow(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new StoreException("Failed to list schedulers", e);
        }
    }

    private SchedulerHeartbeat mapRow(ResultSet rs) throws SQLException {
        return new SchedulerHeartbeat(
                rs.getString("machine_name"),
                JdbcSupport.toInstant(rs.getTimestamp("last_update")),
                rs.getString("latest_trigger"),
                JdbcSupport.toInstant(rs.getTimestamp("last_trigger_start")));
    }
}
