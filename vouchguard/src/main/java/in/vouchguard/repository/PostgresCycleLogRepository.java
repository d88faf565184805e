package in.vouchguard.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.vouchguard.domain.monitoring.CycleLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;

public final class PostgresCycleLogRepository implements CycleLogRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresCycleLogRepository.class);
    private static final TypeReference<List<String>> ERROR_LIST = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper mapper = new ObjectMapper();

    public PostgresCycleLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(CycleLog cycleLog) {
        String sql = """
            INSERT INTO cycle_logs (relations_checked, activities_found, new_negative, alerts_sent,
                                    errors, duration_ms, run_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, cycleLog.relationsChecked());
            ps.setInt(2, cycleLog.activitiesFound());
            ps.setInt(3, cycleLog.newNegative());
            ps.setInt(4, cycleLog.alertsSent());
            ps.setString(5, mapper.writeValueAsString(cycleLog.errors()));
            ps.setLong(6, cycleLog.durationMs());
            ps.setTimestamp(7, JdbcCounts.timestamp(cycleLog.runAt()));
            ps.executeUpdate();

        } catch (Exception e) {
            log.error("Error inserting cycle log: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to insert cycle log", e);
        }
    }

    @Override
    public List<CycleLog> findRecent(int limit) {
        String sql = "SELECT * FROM cycle_logs ORDER BY run_at DESC LIMIT ?";
        List<CycleLog> logs = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    logs.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error listing cycle logs: {}", e.getMessage(), e);
        }

        return logs;
    }

    private CycleLog mapRow(ResultSet rs) throws Exception {
        String errorsJson = rs.getString("errors");
        List<String> errors = errorsJson != null ? mapper.readValue(errorsJson, ERROR_LIST) : List.of();
        return new CycleLog(
            rs.getLong("id"),
            rs.getInt("relations_checked"),
            rs.getInt("activities_found"),
            rs.getInt("new_negative"),
            rs.getInt("alerts_sent"),
            errors,
            rs.getLong("duration_ms"),
            JdbcCounts.instant(rs, "run_at")
        );
    }
}
