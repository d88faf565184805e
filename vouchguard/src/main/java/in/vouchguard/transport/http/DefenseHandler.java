package in.vouchguard.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import in.vouchguard.application.defense.DefenseService;
import in.vouchguard.application.defense.DefenseTemplates;
import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.defense.DefenseResult;
import in.vouchguard.repository.AlertRepository;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Defense endpoints:
 * - POST /api/defend - submit an operator-written review
 * - POST /api/defend/confirm/{alertId} - confirm the prepared defense for an alert
 * - GET /api/defend/suggest?score= - template suggestion
 * - GET /api/defend/pending - pending alerts with their prepared defense
 */
public final class DefenseHandler {
    private static final Logger log = LoggerFactory.getLogger(DefenseHandler.class);

    static final int MIN_SCORE = -5;
    static final int MAX_SCORE = 5;
    static final int MAX_COMMENT_LENGTH = 1000;

    private final DefenseService defenseService;
    private final AlertRepository alertRepo;

    public DefenseHandler(DefenseService defenseService, AlertRepository alertRepo) {
        this.defenseService = defenseService;
        this.alertRepo = alertRepo;
    }

    public void defend(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            JsonNode json;
            try {
                json = HttpJson.MAPPER.readTree(body);
            } catch (Exception e) {
                HttpJson.error(ex, StatusCodes.BAD_REQUEST, "Invalid request body");
                return;
            }
            if (json == null || !json.isObject()) {
                HttpJson.error(ex, StatusCodes.BAD_REQUEST, "Invalid request body");
                return;
            }

            String targetKey = json.path("targetUserkey").asText("").trim();
            JsonNode scoreNode = json.path("score");
            String comment = json.path("comment").asText("");
            if (targetKey.isEmpty()) {
                HttpJson.error(ex, StatusCodes.BAD_REQUEST, "targetUserkey is required");
                return;
            }
            if (!scoreNode.isIntegralNumber() || !scoreNode.canConvertToInt()
                    || scoreNode.asInt() < MIN_SCORE || scoreNode.asInt() > MAX_SCORE) {
                HttpJson.error(ex, StatusCodes.BAD_REQUEST,
                    "score must be an integer between " + MIN_SCORE + " and " + MAX_SCORE);
                return;
            }
            if (comment.isBlank() || comment.length() > MAX_COMMENT_LENGTH) {
                HttpJson.error(ex, StatusCodes.BAD_REQUEST,
                    "comment must be 1 to " + MAX_COMMENT_LENGTH + " characters");
                return;
            }

            DefenseResult result = defenseService.postCustomDefense(targetKey, scoreNode.asInt(), comment,
                optionalText(json, "reviewId"), optionalText(json, "alertId"));
            respond(ex, result, "Defense posted successfully");
        });
    }

    public void confirm(HttpServerExchange exchange) {
        String alertId = HttpJson.pathParam(exchange, "alertId");
        Optional<Alert> alert = alertRepo.findById(alertId);
        if (alert.isEmpty()) {
            HttpJson.error(exchange, StatusCodes.NOT_FOUND, "Alert not found");
            return;
        }
        DefenseResult result = defenseService.executeDefense(alertId, alert.get().reviewId());
        respond(exchange, result, "Defense confirmed and posted");
    }

    public void suggest(HttpServerExchange exchange) {
        int score = HttpJson.queryInt(exchange, "score", DefenseTemplates.DEFAULT_SCORE,
            MIN_SCORE, MAX_SCORE);
        HttpJson.ok(exchange, defenseService.suggestDefense(score));
    }

    public void pending(HttpServerExchange exchange) {
        try {
            HttpJson.ok(exchange, defenseService.pendingDefenses());
        } catch (Exception e) {
            log.error("Failed to fetch pending defenses: {}", e.getMessage(), e);
            HttpJson.error(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to fetch pending defenses");
        }
    }

    static int statusFor(DefenseResult.Outcome outcome) {
        return switch (outcome) {
            case POSTED -> StatusCodes.OK;
            case NOT_FOUND -> StatusCodes.NOT_FOUND;
            case INVALID_STATE -> StatusCodes.CONFLICT;
            case CREDENTIAL_EXPIRED -> StatusCodes.UNAUTHORIZED;
            case FAILED -> StatusCodes.BAD_GATEWAY;
        };
    }

    private static void respond(HttpServerExchange exchange, DefenseResult result, String successMessage) {
        if (result.isSuccess()) {
            HttpJson.okMessage(exchange, successMessage, result);
        } else {
            HttpJson.error(exchange, statusFor(result.outcome()), result.error());
        }
    }

    private static String optionalText(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
