package openorchestrator.scheduler.store;

import openorchestrator.scheduler.model.QueueElement;
import openorchestrator.scheduler.model.QueueElementStatus;
import openorchestrator.scheduler.repository.QueueRepository;

import java.sql.*;
import java.time.Instant;
import java.util.UUID;

/**
 * JDBC implementation of QueueRepository.
 */
public class JdbcQueueRepository implements QueueRepository {

    private final Database db;

    public JdbcQueueRepository(Database db) {
        this.db = db;
    }

    @Override
    public QueueElement enqueue(String queueName, String reference, String data, String createdBy) {
        String sql = """
                    INSERT INTO queue_elements (id, queue_name, status, reference, data, created_date, created_by)
                    VALUES (?, ?, 'NEW', ?, ?, ?, ?)
                """;

        QueueElement element = new QueueElement(
                UUID.randomUUID().toString(), queueName, QueueElementStatus.NEW,
                reference, data, Instant.now(), createdBy);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, element.id());
            ps.setString(2, queueName);
            ps.setString(3, reference);
            ps.setString(4, data);
            JdbcSupport.setTimestamp(ps, 5, element.createdDate());
            ps.setString(6, createdBy);

            ps.executeUpdate();
            conn.commit();
            return element;
        } catch (SQLException e) {
            throw new StoreException("Failed to enqueue element in queue: " + queueName, e);
        }
    }

    @Override
    public int countNew(String queueName) {
        String sql = "SELECT COUNT(*) FROM queue_elements WHERE queue_name = ? AND status = 'NEW'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queueName);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count queue elements: " + queueName, e);
        }
    }

    @Override
    public boolean updateStatus(String elementId, QueueElementStatus status) {
        String sql = """
                    UPDATE queue_elements
                    SET status = ?,
                        start_date = COALESCE(?, start_date),
                        end_date = COALESCE(?, end_date)
                    WHERE id = ?
                """;

        Timestamp now = Timestamp.from(Instant.now());
        boolean finished = status == QueueElementStatus.DONE
                || status == QueueElementStatus.FAILED
                || status == QueueElementStatus.ABANDONED;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setTimestamp(2, status == QueueElementStatus.IN_PROGRESS ? now : null);
            ps.setTimestamp(3, finished ? now : null);
            ps.setString(4, elementId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update queue element: " + elementId, e);
        }
    }
}
