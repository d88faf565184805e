package in.vouchguard.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import in.vouchguard.application.alert.AlertDispatcher;
import in.vouchguard.application.monitoring.CycleScheduler;
import in.vouchguard.auth.SessionTokenWatchdog;
import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.alert.AlertStatus;
import in.vouchguard.domain.defense.DefenseStatus;
import in.vouchguard.domain.monitoring.CycleResult;
import in.vouchguard.domain.relation.Relationship;
import in.vouchguard.network.NetworkScore;
import in.vouchguard.network.TrustNetworkClient;
import in.vouchguard.repository.ActivityRepository;
import in.vouchguard.repository.AlertRepository;
import in.vouchguard.repository.CycleLogRepository;
import in.vouchguard.repository.DefenseRepository;
import in.vouchguard.repository.RelationshipRepository;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-mostly API for the dashboard:
 * - GET /api/health, /api/stats
 * - POST /api/monitor/run, GET /api/monitor/status, GET /api/monitor/logs
 * - GET /api/relations, /api/relations/{id}
 * - GET /api/reviews
 * - GET /api/alerts, /api/alerts/{id}, PATCH /api/alerts/{id}
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);

    private final TrustNetworkClient networkClient;
    private final SessionTokenWatchdog tokenWatchdog;
    private final RelationshipRepository relationshipRepo;
    private final ActivityRepository activityRepo;
    private final AlertRepository alertRepo;
    private final DefenseRepository defenseRepo;
    private final CycleLogRepository cycleLogRepo;
    private final CycleScheduler scheduler;
    private final AlertDispatcher dispatcher;

    public ApiHandlers(TrustNetworkClient networkClient,
                       SessionTokenWatchdog tokenWatchdog,
                       RelationshipRepository relationshipRepo,
                       ActivityRepository activityRepo,
                       AlertRepository alertRepo,
                       DefenseRepository defenseRepo,
                       CycleLogRepository cycleLogRepo,
                       CycleScheduler scheduler,
                       AlertDispatcher dispatcher) {
        this.networkClient = networkClient;
        this.tokenWatchdog = tokenWatchdog;
        this.relationshipRepo = relationshipRepo;
        this.activityRepo = activityRepo;
        this.alertRepo = alertRepo;
        this.defenseRepo = defenseRepo;
        this.cycleLogRepo = cycleLogRepo;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
    }

    public void health(HttpServerExchange exchange) {
        try {
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "ok");
            health.put("ts", Instant.now());
            health.put("network", Map.of("healthy", networkClient.healthCheck()));
            health.put("token", Map.of(
                "status", tokenWatchdog.getStatus(),
                "summary", tokenWatchdog.formatStatus()));
            health.put("store", Map.of(
                "relations", relationshipRepo.count(),
                "reviews", activityRepo.count(),
                "alerts", alertRepo.count()));
            health.put("scheduler", scheduler.getStatus());
            health.put("channels", dispatcher.channelStatus());
            HttpJson.ok(exchange, health);
        } catch (Exception e) {
            log.error("Failed to build health: {}", e.getMessage(), e);
            HttpJson.error(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Health check failed");
        }
    }

    public void stats(HttpServerExchange exchange) {
        try {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("relations", Map.of(
                "total", relationshipRepo.count(),
                "active", relationshipRepo.countActive()));
            stats.put("reviews", Map.of(
                "total", activityRepo.count(),
                "negative", activityRepo.countNegative()));

            Map<String, Integer> alerts = new LinkedHashMap<>();
            alerts.put("total", alertRepo.count());
            for (AlertStatus status : AlertStatus.values()) {
                alerts.put(status.name().toLowerCase(Locale.ROOT), alertRepo.countByStatus(status));
            }
            stats.put("alerts", alerts);

            Map<String, Integer> defenses = new LinkedHashMap<>();
            for (DefenseStatus status : DefenseStatus.values()) {
                defenses.put(status.name().toLowerCase(Locale.ROOT), defenseRepo.countByStatus(status));
            }
            stats.put("defenses", defenses);
            stats.put("recentRuns", cycleLogRepo.findRecent(10));
            stats.put("scheduler", scheduler.getStatus());
            HttpJson.ok(exchange, stats);
        } catch (Exception e) {
            log.error("Failed to build stats: {}", e.getMessage(), e);
            HttpJson.error(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to fetch stats");
        }
    }

    public void runMonitor(HttpServerExchange exchange) {
        CycleResult result = scheduler.triggerManually();
        if (result.skipped()) {
            HttpJson.error(exchange, StatusCodes.CONFLICT, CycleResult.ALREADY_RUNNING);
            return;
        }
        HttpJson.ok(exchange, result);
    }

    public void monitorStatus(HttpServerExchange exchange) {
        HttpJson.ok(exchange, scheduler.getStatus());
    }

    public void monitorLogs(HttpServerExchange exchange) {
        int limit = HttpJson.queryInt(exchange, "limit", 20, 1, 200);
        HttpJson.ok(exchange, cycleLogRepo.findRecent(limit));
    }

    public void relations(HttpServerExchange exchange) {
        Boolean active = HttpJson.queryBool(exchange, "active").orElse(null);
        HttpJson.ok(exchange, relationshipRepo.findAll(active));
    }

    /**
     * Relationship detail. The last-known score is refreshed from the network
     * when it answers; otherwise the stored value is returned.
     */
    public void relation(HttpServerExchange exchange) {
        String id = HttpJson.pathParam(exchange, "id");
        Optional<Relationship> found = relationshipRepo.findById(id);
        if (found.isEmpty()) {
            HttpJson.error(exchange, StatusCodes.NOT_FOUND, "Relation not found");
            return;
        }

        Relationship relationship = found.get();
        NetworkScore score = null;
        try {
            Optional<NetworkScore> fetched = networkClient.getScore(relationship.userKey());
            if (fetched.isPresent()) {
                score = fetched.get();
                relationshipRepo.updateScore(relationship.id(), score.score());
                relationship = relationshipRepo.findById(id).orElse(relationship);
            }
        } catch (Exception e) {
            log.warn("Score refresh failed for {}: {}", relationship.userKey(), e.getMessage());
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("relation", relationship);
        detail.put("score", score);
        detail.put("profileUrl", networkClient.profileUrl(relationship.address()));
        detail.put("recentReviews", activityRepo.find(null, relationship.id(), 20, 0));
        HttpJson.ok(exchange, detail);
    }

    public void reviews(HttpServerExchange exchange) {
        Boolean negative = HttpJson.queryBool(exchange, "negative").orElse(null);
        String relationId = HttpJson.query(exchange, "relationId").orElse(null);
        int limit = HttpJson.queryInt(exchange, "limit", 50, 1, 500);
        int offset = HttpJson.queryInt(exchange, "offset", 0, 0, Integer.MAX_VALUE);
        HttpJson.ok(exchange, activityRepo.find(negative, relationId, limit, offset));
    }

    public void alerts(HttpServerExchange exchange) {
        Optional<String> statusParam = HttpJson.query(exchange, "status");
        AlertStatus status = null;
        if (statusParam.isPresent()) {
            Optional<AlertStatus> parsed = parseStatus(statusParam.get());
            if (parsed.isEmpty()) {
                HttpJson.error(exchange, StatusCodes.BAD_REQUEST, "Invalid status: " + statusParam.get());
                return;
            }
            status = parsed.get();
        }
        String relationId = HttpJson.query(exchange, "relationId").orElse(null);
        int limit = HttpJson.queryInt(exchange, "limit", 50, 1, 500);
        int offset = HttpJson.queryInt(exchange, "offset", 0, 0, Integer.MAX_VALUE);
        HttpJson.ok(exchange, alertRepo.find(status, relationId, limit, offset));
    }

    public void alert(HttpServerExchange exchange) {
        String id = HttpJson.pathParam(exchange, "id");
        Optional<Alert> alert = alertRepo.findById(id);
        if (alert.isEmpty()) {
            HttpJson.error(exchange, StatusCodes.NOT_FOUND, "Alert not found");
            return;
        }
        HttpJson.ok(exchange, alert.get());
    }

    public void updateAlert(HttpServerExchange exchange) {
        String id = HttpJson.pathParam(exchange, "id");
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = HttpJson.MAPPER.readTree(body);
                Optional<AlertStatus> status = parseStatus(json.path("status").asText(""));
                if (status.isEmpty()) {
                    HttpJson.error(ex, StatusCodes.BAD_REQUEST, "Invalid status");
                    return;
                }
                if (!alertRepo.updateStatus(id, status.get())) {
                    HttpJson.error(ex, StatusCodes.NOT_FOUND, "Alert not found");
                    return;
                }
                log.info("Alert {} set to {}", id, status.get());
                HttpJson.ok(ex, alertRepo.findById(id).orElse(null));
            } catch (Exception e) {
                log.warn("Invalid alert update for {}: {}", id, e.getMessage());
                HttpJson.error(ex, StatusCodes.BAD_REQUEST, "Invalid request body");
            }
        });
    }

    private static Optional<AlertStatus> parseStatus(String value) {
        try {
            return Optional.of(AlertStatus.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
