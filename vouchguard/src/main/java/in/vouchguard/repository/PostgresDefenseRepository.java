package in.vouchguard.repository;

import in.vouchguard.domain.defense.Defense;
import in.vouchguard.domain.defense.DefenseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.Optional;

public final class PostgresDefenseRepository implements DefenseRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresDefenseRepository.class);

    private final DataSource dataSource;

    public PostgresDefenseRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean insertIfNoActive(Defense defense) {
        // Partial unique index on review_id WHERE status IN ('PENDING','CONFIRMED') backs the conflict
        String sql = """
            INSERT INTO defenses (id, review_id, target_key, score, comment, status, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, defense.id());
            ps.setString(2, defense.reviewId());
            ps.setString(3, defense.targetKey());
            ps.setInt(4, defense.score());
            ps.setString(5, defense.comment());
            ps.setString(6, defense.status().name());
            ps.setTimestamp(7, JdbcCounts.timestamp(defense.createdAt()));

            return ps.executeUpdate() > 0;

        } catch (Exception e) {
            log.error("Error inserting defense for review {}: {}", defense.reviewId(), e.getMessage(), e);
            throw new RuntimeException("Failed to insert defense", e);
        }
    }

    @Override
    public Optional<Defense> findById(String id) {
        return findOne("SELECT * FROM defenses WHERE id = ?", id);
    }

    @Override
    public Optional<Defense> findActiveByReviewId(String reviewId) {
        return findOne("""
            SELECT * FROM defenses
            WHERE review_id = ? AND status IN ('PENDING', 'CONFIRMED')
            ORDER BY created_at DESC
            LIMIT 1
            """, reviewId);
    }

    @Override
    public boolean confirm(String id) {
        String sql = """
            UPDATE defenses SET status = 'CONFIRMED'
            WHERE id = ? AND status IN ('PENDING', 'CONFIRMED')
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            return ps.executeUpdate() > 0;

        } catch (Exception e) {
            log.error("Error confirming defense {}: {}", id, e.getMessage(), e);
            throw new RuntimeException("Failed to confirm defense", e);
        }
    }

    @Override
    public boolean markPosted(String id, int score, String comment, String networkReviewId, String txHash) {
        String sql = """
            UPDATE defenses
            SET status = 'POSTED', score = ?, comment = ?, network_review_id = ?, tx_hash = ?,
                error = NULL, posted_at = NOW()
            WHERE id = ? AND status IN ('PENDING', 'CONFIRMED')
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, score);
            ps.setString(2, comment);
            ps.setString(3, networkReviewId);
            ps.setString(4, txHash);
            ps.setString(5, id);
            return ps.executeUpdate() > 0;

        } catch (Exception e) {
            log.error("Error marking defense {} posted: {}", id, e.getMessage(), e);
            throw new RuntimeException("Failed to mark defense posted", e);
        }
    }

    @Override
    public boolean markFailed(String id, String error) {
        String sql = """
            UPDATE defenses SET status = 'FAILED', error = ?
            WHERE id = ? AND status IN ('PENDING', 'CONFIRMED')
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, error);
            ps.setString(2, id);
            return ps.executeUpdate() > 0;

        } catch (Exception e) {
            log.error("Error marking defense {} failed: {}", id, e.getMessage(), e);
            throw new RuntimeException("Failed to mark defense failed", e);
        }
    }

    @Override
    public int countByStatus(DefenseStatus status) {
        return JdbcCounts.count(dataSource, "SELECT COUNT(*) FROM defenses WHERE status = ?", status.name());
    }

    private Optional<Defense> findOne(String sql, String param) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error finding defense by {}: {}", param, e.getMessage(), e);
        }

        return Optional.empty();
    }

    private Defense mapRow(ResultSet rs) throws SQLException {
        return new Defense(
            rs.getString("id"),
            rs.getString("review_id"),
            rs.getString("target_key"),
            rs.getInt("score"),
            rs.getString("comment"),
            DefenseStatus.valueOf(rs.getString("status")),
            rs.getString("network_review_id"),
            rs.getString("tx_hash"),
            rs.getString("error"),
            JdbcCounts.instant(rs, "created_at"),
            JdbcCounts.instant(rs, "posted_at")
        );
    }
}
