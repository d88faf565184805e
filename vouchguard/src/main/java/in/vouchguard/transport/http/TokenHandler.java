package in.vouchguard.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import in.vouchguard.auth.SessionTokenWatchdog;
import in.vouchguard.domain.credential.TokenUpdateResult;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /api/token/status and POST /api/token/update.
 */
public final class TokenHandler {

    private final SessionTokenWatchdog watchdog;

    public TokenHandler(SessionTokenWatchdog watchdog) {
        this.watchdog = watchdog;
    }

    public void status(HttpServerExchange exchange) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", watchdog.getStatus());
        data.put("summary", watchdog.formatStatus());
        HttpJson.ok(exchange, data);
    }

    public void update(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            String token;
            try {
                JsonNode json = HttpJson.MAPPER.readTree(body);
                token = json.path("token").asText("");
            } catch (Exception e) {
                HttpJson.error(ex, StatusCodes.BAD_REQUEST, "Invalid request body");
                return;
            }
            if (token.isBlank()) {
                HttpJson.error(ex, StatusCodes.BAD_REQUEST, "token is required");
                return;
            }

            TokenUpdateResult result = watchdog.updateToken(token);
            if (result.success()) {
                HttpJson.okMessage(ex, result.message(), result.status());
            } else {
                HttpJson.error(ex, StatusCodes.BAD_REQUEST, result.message());
            }
        });
    }
}
