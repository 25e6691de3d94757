package openorchestrator.scheduler.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.model.TriggerSchedule;
import openorchestrator.scheduler.model.TriggerSchedule.CronSchedule;
import openorchestrator.scheduler.model.TriggerSchedule.QueueSchedule;
import openorchestrator.scheduler.model.TriggerSchedule.SingleSchedule;
import openorchestrator.scheduler.model.TriggerStatus;
import openorchestrator.scheduler.model.TriggerType;
import openorchestrator.scheduler.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TriggerRepository.
 * Claims are single conditional UPDATE statements so that concurrent
 * schedulers sharing the database never both win the same trigger.
 */
public class JdbcTriggerRepository implements TriggerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTriggerRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final Database db;

    public JdbcTriggerRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Trigger trigger) {
        String sql = """
                    INSERT INTO triggers (id, name, type, process_name, process_path, process_args, status,
                                          is_git_repo, git_branch, is_blocking, priority, scheduler_whitelist,
                                          last_run, next_run, cron_expr, queue_name, min_batch_size)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, trigger.id());
            ps.setString(2, trigger.name());
            ps.setString(3, trigger.type().name());
            ps.setString(4, trigger.processName());
            ps.setString(5, trigger.processPath());
            ps.setString(6, trigger.processArgs());
            ps.setString(7, trigger.status().name());
            ps.setBoolean(8, trigger.gitRepo());
            ps.setString(9, trigger.gitBranch());
            ps.setBoolean(10, trigger.blocking());
            ps.setInt(11, trigger.priority());
            ps.setString(12, writeWhitelist(trigger.schedulerWhitelist()));
            JdbcSupport.setTimestamp(ps, 13, trigger.lastRun());

            Instant nextRun = null;
            String cronExpr = null;
            String queueName = null;
            Integer minBatchSize = null;
            TriggerSchedule schedule = trigger.schedule();
            if (schedule instanceof SingleSchedule single) {
                nextRun = single.nextRun();
            } else if (schedule instanceof CronSchedule cron) {
                nextRun = cron.nextRun();
                cronExpr = cron.cronExpr();
            } else if (schedule instanceof QueueSchedule queue) {
                queueName = queue.queueName();
                minBatchSize = queue.minBatchSize();
            }
            JdbcSupport.setTimestamp(ps, 14, nextRun);
            ps.setString(15, cronExpr);
            ps.setString(16, queueName);
            JdbcSupport.setIntOrNull(ps, 17, minBatchSize);

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved trigger {}", trigger);
        } catch (SQLException e) {
            throw new StoreException("Failed to save trigger: " + trigger.id(), e);
        }
    }

    @Override
    public Optional<Trigger> findById(String triggerId) {
        String sql = "SELECT * FROM triggers WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, triggerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find trigger: " + triggerId, e);
        }
    }

    @Override
    public List<Trigger> findAll() {
        String sql = "SELECT * FROM triggers ORDER BY type, priority DESC, name";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list triggers", e);
        }
    }

    @Override
    public List<Trigger> findPendingSingle(Instant now) {
        return findPendingByNextRun(TriggerType.SINGLE, now);
    }

    @Override
    public List<Trigger> findPendingScheduled(Instant now) {
        return findPendingByNextRun(TriggerType.SCHEDULED, now);
    }

    private List<Trigger> findPendingByNextRun(TriggerType type, Instant now) {
        String sql = """
                    SELECT * FROM triggers
                    WHERE type = ? AND status = 'IDLE' AND next_run <= ?
                    ORDER BY priority DESC, next_run, id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, type.name());
            ps.setTimestamp(2, Timestamp.from(now));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find pending " + type + " triggers", e);
        }
    }

    @Override
    public List<Trigger> findPendingQueue() {
        String sql = """
                    SELECT t.*,
                           (SELECT MIN(q.created_date) FROM queue_elements q
                             WHERE q.queue_name = t.queue_name AND q.status = 'NEW') AS oldest_new
                    FROM triggers t
                    WHERE t.type = 'QUEUE' AND t.status = 'IDLE'
                      AND (SELECT COUNT(*) FROM queue_elements q
                            WHERE q.queue_name = t.queue_name AND q.status = 'NEW') >= t.min_batch_size
                    ORDER BY t.priority DESC, oldest_new, t.id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find pending QUEUE triggers", e);
        }
    }

    @Override
    public boolean beginSingle(String triggerId, Instant now) {
        String sql = """
                    UPDATE triggers
                    SET status = 'RUNNING', last_run = ?
                    WHERE id = ? AND type = 'SINGLE' AND status = 'IDLE'
                """;
        return claim(sql, triggerId, ps -> {
            ps.setTimestamp(1, Timestamp.from(now));
            ps.setString(2, triggerId);
        });
    }

    @Override
    public boolean beginScheduled(String triggerId, Instant now, Instant nextRun) {
        String sql = """
                    UPDATE triggers
                    SET status = 'RUNNING', last_run = ?, next_run = ?
                    WHERE id = ? AND type = 'SCHEDULED' AND status = 'IDLE'
                """;
        return claim(sql, triggerId, ps -> {
            ps.setTimestamp(1, Timestamp.from(now));
            ps.setTimestamp(2, Timestamp.from(nextRun));
            ps.setString(3, triggerId);
        });
    }

    @Override
    public boolean beginQueue(String triggerId, Instant now) {
        String sql = """
                    UPDATE triggers
                    SET status = 'RUNNING', last_run = ?
                    WHERE id = ? AND type = 'QUEUE' AND status = 'IDLE'
                """;
        return claim(sql, triggerId, ps -> {
            ps.setTimestamp(1, Timestamp.from(now));
            ps.setString(2, triggerId);
        });
    }

    private boolean claim(String sql, String triggerId, StatementBinder binder) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Trigger {} claimed", triggerId);
            } else {
                log.debug("Trigger {} was not IDLE, claim lost", triggerId);
            }

            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to begin trigger: " + triggerId, e);
        }
    }

    @Override
    public boolean updateStatus(String triggerId, TriggerStatus status) {
        String sql = "UPDATE triggers SET status = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setString(2, triggerId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update trigger status: " + triggerId, e);
        }
    }

    @Override
    public boolean transition(String triggerId, TriggerStatus expected, TriggerStatus target) {
        String sql = "UPDATE triggers SET status = ? WHERE id = ? AND status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, target.name());
            ps.setString(2, triggerId);
            ps.setString(3, expected.name());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to move trigger " + triggerId + " from " + expected + " to " + target, e);
        }
    }

    @Override
    public Optional<TriggerStatus> requestPause(String triggerId) {
        // Both transitions are conditional so a concurrent claim cannot be overwritten.
        String sql = """
                    UPDATE triggers
                    SET status = CASE status WHEN 'IDLE' THEN 'PAUSED' ELSE 'PAUSING' END
                    WHERE id = ? AND status IN ('IDLE', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, triggerId);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to pause trigger: " + triggerId, e);
        }

        return findById(triggerId).map(Trigger::status);
    }

    @Override
    public boolean resume(String triggerId) {
        String sql = "UPDATE triggers SET status = 'IDLE' WHERE id = ? AND status IN ('PAUSED', 'FAILED')";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, triggerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to resume trigger: " + triggerId, e);
        }
    }

    @Override
    public boolean delete(String triggerId) {
        String sql = "DELETE FROM triggers WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, triggerId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete trigger: " + triggerId, e);
        }
    }

    // Helper methods

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    /**
     * Map every row of the result. A row that cannot be mapped (malformed
     * whitelist, unknown type or status, missing kind column) is logged and
     * skipped so the rest of the result stays usable.
     */
    private List<Trigger> executeQuery(PreparedStatement ps) throws SQLException {
        List<Trigger> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                try {
                    results.add(mapRow(rs));
                } catch (RuntimeException e) {
                    log.warn("Skipping unreadable trigger row {}: {}", rs.getString("id"), e.getMessage());
                }
            }
        }
        return results;
    }

    private Trigger mapRow(ResultSet rs) throws SQLException {
        TriggerType type = TriggerType.valueOf(rs.getString("type"));
        Instant nextRun = JdbcSupport.toInstant(rs.getTimestamp("next_run"));

        TriggerSchedule schedule = switch (type) {
            case SINGLE -> new SingleSchedule(nextRun);
            case SCHEDULED -> new CronSchedule(rs.getString("cron_expr"), nextRun);
            case QUEUE -> new QueueSchedule(rs.getString("queue_name"), rs.getInt("min_batch_size"));
        };

        return Trigger.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .processName(rs.getString("process_name"))
                .processPath(rs.getString("process_path"))
                .processArgs(rs.getString("process_args"))
                .status(TriggerStatus.valueOf(rs.getString("status")))
                .gitRepo(rs.getBoolean("is_git_repo"))
                .gitBranch(rs.getString("git_branch"))
                .blocking(rs.getBoolean("is_blocking"))
                .priority(rs.getInt("priority"))
                .schedulerWhitelist(readWhitelist(rs.getString("scheduler_whitelist")))
                .lastRun(JdbcSupport.toInstant(rs.getTimestamp("last_run")))
                .schedule(schedule)
                .build();
    }

    private static String writeWhitelist(List<String> whitelist) {
        try {
            return MAPPER.writeValueAsString(whitelist);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize scheduler whitelist", e);
        }
    }

    private static List<String> readWhitelist(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new StoreException("Malformed scheduler whitelist: " + json, e);
        }
    }
}
