package in.vouchguard.repository;

import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.domain.alert.AlertStatus;
import in.vouchguard.domain.alert.AlertType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class PostgresAlertRepository implements AlertRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresAlertRepository.class);

    private final DataSource dataSource;

    public PostgresAlertRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean insertIfAbsent(Alert alert) {
        String sql = """
            INSERT INTO alerts (id, review_id, relation_id, type, channel, status, message_id, sent_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, alert.id());
            ps.setString(2, alert.reviewId());
            ps.setString(3, alert.relationId());
            ps.setString(4, alert.type().name());
            ps.setString(5, alert.channel().name());
            ps.setString(6, alert.status().name());
            ps.setString(7, alert.messageId());
            ps.setTimestamp(8, JdbcCounts.timestamp(alert.sentAt()));

            return ps.executeUpdate() > 0;

        } catch (Exception e) {
            log.error("Error inserting alert {}: {}", alert.id(), e.getMessage(), e);
            throw new RuntimeException("Failed to insert alert", e);
        }
    }

    @Override
    public Optional<Alert> findById(String id) {
        String sql = "SELECT * FROM alerts WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error finding alert {}: {}", id, e.getMessage(), e);
        }

        return Optional.empty();
    }

    @Override
    public List<Alert> find(AlertStatus status, String relationId, int limit, int offset) {
        StringBuilder sql = new StringBuilder("SELECT * FROM alerts WHERE 1=1");
        if (status != null) {
            sql.append(" AND status = ?");
        }
        if (relationId != null) {
            sql.append(" AND relation_id = ?");
        }
        sql.append(" ORDER BY sent_at DESC LIMIT ? OFFSET ?");
        List<Alert> alerts = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            if (relationId != null) {
                ps.setString(idx++, relationId);
            }
            ps.setInt(idx++, limit);
            ps.setInt(idx, offset);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    alerts.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error listing alerts: {}", e.getMessage(), e);
        }

        return alerts;
    }

    @Override
    public boolean updateStatus(String id, AlertStatus status) {
        String sql = "UPDATE alerts SET status = ?, responded_at = NOW() WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setString(2, id);
            return ps.executeUpdate() > 0;

        } catch (Exception e) {
            log.error("Error updating alert {} to {}: {}", id, status, e.getMessage(), e);
            throw new RuntimeException("Failed to update alert status", e);
        }
    }

    @Override
    public int confirmPendingByReviewId(String reviewId) {
        String sql = """
            UPDATE alerts SET status = 'CONFIRMED', responded_at = NOW()
            WHERE review_id = ? AND status = 'PENDING'
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, reviewId);
            return ps.executeUpdate();

        } catch (Exception e) {
            log.error("Error confirming alerts for review {}: {}", reviewId, e.getMessage(), e);
            throw new RuntimeException("Failed to confirm alerts", e);
        }
    }

    @Override
    public int expirePendingBefore(Instant cutoff) {
        String sql = """
            UPDATE alerts SET status = 'EXPIRED', responded_at = NOW()
            WHERE status = 'PENDING' AND sent_at < ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();

        } catch (Exception e) {
            log.error("Error expiring alerts: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to expire alerts", e);
        }
    }

    @Override
    public int count() {
        return JdbcCounts.count(dataSource, "SELECT COUNT(*) FROM alerts");
    }

    @Override
    public int countByStatus(AlertStatus status) {
        return JdbcCounts.count(dataSource, "SELECT COUNT(*) FROM alerts WHERE status = ?", status.name());
    }

    private Alert mapRow(ResultSet rs) throws SQLException {
        return new Alert(
            rs.getString("id"),
            rs.getString("review_id"),
            rs.getString("relation_id"),
            AlertType.valueOf(rs.getString("type")),
            AlertChannel.valueOf(rs.getString("channel")),
            AlertStatus.valueOf(rs.getString("status")),
            rs.getString("message_id"),
            JdbcCounts.instant(rs, "sent_at"),
            JdbcCounts.instant(rs, "responded_at")
        );
    }
}
