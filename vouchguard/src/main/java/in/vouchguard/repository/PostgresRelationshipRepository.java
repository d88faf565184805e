package in.vouchguard.repository;

import in.vouchguard.domain.relation.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class PostgresRelationshipRepository implements RelationshipRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresRelationshipRepository.class);

    private final DataSource dataSource;

    public PostgresRelationshipRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void upsert(Relationship relationship) {
        String sql = """
            INSERT INTO relationships (id, user_key, name, address, avatar_url, active, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, NOW(), NOW())
            ON CONFLICT (id)
            DO UPDATE SET
                user_key = EXCLUDED.user_key,
                name = EXCLUDED.name,
                address = EXCLUDED.address,
                avatar_url = EXCLUDED.avatar_url,
                active = EXCLUDED.active,
                updated_at = NOW()
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, relationship.id());
            ps.setString(2, relationship.userKey());
            ps.setString(3, relationship.name());
            ps.setString(4, relationship.address());
            ps.setString(5, relationship.avatarUrl());
            ps.setBoolean(6, relationship.active());
            ps.executeUpdate();

        } catch (Exception e) {
            log.error("Error upserting relationship {}: {}", relationship.id(), e.getMessage(), e);
            throw new RuntimeException("Failed to upsert relationship", e);
        }
    }

    @Override
    public Optional<Relationship> findById(String id) {
        String sql = "SELECT * FROM relationships WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error finding relationship {}: {}", id, e.getMessage(), e);
        }

        return Optional.empty();
    }

    @Override
    public List<Relationship> findAll(Boolean active) {
        String sql = active == null
            ? "SELECT * FROM relationships ORDER BY updated_at DESC"
            : "SELECT * FROM relationships WHERE active = ? ORDER BY updated_at DESC";
        List<Relationship> relationships = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            if (active != null) {
                ps.setBoolean(1, active);
            }

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    relationships.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error listing relationships: {}", e.getMessage(), e);
        }

        return relationships;
    }

    @Override
    public void updateScore(String id, int score) {
        String sql = "UPDATE relationships SET score = ?, updated_at = NOW() WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, score);
            ps.setString(2, id);
            ps.executeUpdate();

        } catch (Exception e) {
            log.error("Error updating score for {}: {}", id, e.getMessage(), e);
            throw new RuntimeException("Failed to update relationship score", e);
        }
    }

    @Override
    public int count() {
        return JdbcCounts.count(dataSource, "SELECT COUNT(*) FROM relationships");
    }

    @Override
    public int countActive() {
        return JdbcCounts.count(dataSource, "SELECT COUNT(*) FROM relationships WHERE active = TRUE");
    }

    private Relationship mapRow(ResultSet rs) throws SQLException {
        int score = rs.getInt("score");
        Integer scoreOrNull = rs.wasNull() ? null : score;
        return new Relationship(
            rs.getString("id"),
            rs.getString("user_key"),
            rs.getString("name"),
            rs.getString("address"),
            rs.getString("avatar_url"),
            rs.getBoolean("active"),
            scoreOrNull,
            JdbcCounts.instant(rs, "created_at"),
            JdbcCounts.instant(rs, "updated_at")
        );
    }
}
