package in.vouchguard.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Optional;

public final class PostgresSettingsRepository implements SettingsRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSettingsRepository.class);

    private final DataSource dataSource;

    public PostgresSettingsRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<String> get(String key) {
        String sql = "SELECT value FROM app_config WHERE key = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString("value"));
                }
            }
        } catch (Exception e) {
            log.error("Error reading config {}: {}", key, e.getMessage(), e);
        }

        return Optional.empty();
    }

    @Override
    public void set(String key, String value) {
        String sql = """
            INSERT INTO app_config (key, value, updated_at)
            VALUES (?, ?, NOW())
            ON CONFLICT (key)
            DO UPDATE SET value = EXCLUDED.value, updated_at = NOW()
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();

        } catch (Exception e) {
            log.error("Error writing config {}: {}", key, e.getMessage(), e);
            throw new RuntimeException("Failed to write config " + key, e);
        }
    }
}
