package in.vouchguard.repository;

import in.vouchguard.domain.activity.ActivityRecord;
import in.vouchguard.domain.activity.ActivityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class PostgresActivityRepository implements ActivityRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresActivityRepository.class);

    private final DataSource dataSource;

    public PostgresActivityRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean insertIfAbsent(ActivityRecord record) {
        String sql = """
            INSERT INTO activities (id, relation_id, activity_id, type, author_key, author_name,
                                    author_address, score, comment, negative, alerted, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.id());
            ps.setString(2, record.relationId());
            ps.setString(3, record.activityId());
            ps.setString(4, record.type().wireName());
            ps.setString(5, record.authorKey());
            ps.setString(6, record.authorName());
            ps.setString(7, record.authorAddress());
            ps.setInt(8, record.score());
            ps.setString(9, record.comment());
            ps.setBoolean(10, record.negative());
            ps.setBoolean(11, record.alerted());
            ps.setTimestamp(12, JdbcCounts.timestamp(record.createdAt()));

            return ps.executeUpdate() > 0;

        } catch (Exception e) {
            log.error("Error inserting activity {}: {}", record.activityId(), e.getMessage(), e);
            throw new RuntimeException("Failed to insert activity", e);
        }
    }

    @Override
    public Optional<ActivityRecord> findByActivityId(String activityId) {
        String sql = "SELECT * FROM activities WHERE activity_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, activityId);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error finding activity {}: {}", activityId, e.getMessage(), e);
        }

        return Optional.empty();
    }

    @Override
    public void markAlerted(String id) {
        String sql = "UPDATE activities SET alerted = TRUE WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            ps.executeUpdate();

        } catch (Exception e) {
            log.error("Error marking activity {} alerted: {}", id, e.getMessage(), e);
            throw new RuntimeException("Failed to mark activity alerted", e);
        }
    }

    @Override
    public List<ActivityRecord> find(Boolean negative, String relationId, int limit, int offset) {
        StringBuilder sql = new StringBuilder("SELECT * FROM activities WHERE 1=1");
        if (negative != null) {
            sql.append(" AND negative = ?");
        }
        if (relationId != null) {
            sql.append(" AND relation_id = ?");
        }
        sql.append(" ORDER BY created_at DESC LIMIT ? OFFSET ?");
        List<ActivityRecord> records = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int idx = 1;
            if (negative != null) {
                ps.setBoolean(idx++, negative);
            }
            if (relationId != null) {
                ps.setString(idx++, relationId);
            }
            ps.setInt(idx++, limit);
            ps.setInt(idx, offset);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error listing activities: {}", e.getMessage(), e);
        }

        return records;
    }

    @Override
    public int count() {
        return JdbcCounts.count(dataSource, "SELECT COUNT(*) FROM activities");
    }

    @Override
    public int countNegative() {
        return JdbcCounts.count(dataSource, "SELECT COUNT(*) FROM activities WHERE negative = TRUE");
    }

    private ActivityRecord mapRow(ResultSet rs) throws SQLException {
        return new ActivityRecord(
            rs.getString("id"),
            rs.getString("relation_id"),
            rs.getString("activity_id"),
            ActivityType.fromWire(rs.getString("type")).orElse(ActivityType.REVIEW),
            rs.getString("author_key"),
            rs.getString("author_name"),
            rs.getString("author_address"),
            rs.getInt("score"),
            rs.getString("comment"),
            rs.getBoolean("negative"),
            rs.getBoolean("alerted"),
            JdbcCounts.instant(rs, "created_at")
        );
    }
}
