package in.vouchguard.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.Optional;

/**
 * Response envelope and request helpers for the JSON API.
 *
 * Every response is {@code {"success": true, "data": ...}} or
 * {@code {"success": false, "error": "..."}}.
 */
public final class HttpJson {
    private static final Logger log = LoggerFactory.getLogger(HttpJson.class);

    public static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static void ok(HttpServerExchange exchange, Object data) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("success", true);
        body.set("data", MAPPER.valueToTree(data));
        send(exchange, StatusCodes.OK, body);
    }

    public static void okMessage(HttpServerExchange exchange, String message, Object data) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("success", true);
        body.put("message", message);
        if (data != null) {
            body.set("data", MAPPER.valueToTree(data));
        }
        send(exchange, StatusCodes.OK, body);
    }

    public static void error(HttpServerExchange exchange, int status, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("success", false);
        body.put("error", message);
        send(exchange, status, body);
    }

    public static Optional<String> query(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.peekFirst().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(values.peekFirst().trim());
    }

    public static int queryInt(HttpServerExchange exchange, String name, int defaultValue, int min, int max) {
        return query(exchange, name).map(value -> {
            try {
                return Math.max(min, Math.min(max, Integer.parseInt(value)));
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }).orElse(defaultValue);
    }

    public static Optional<Boolean> queryBool(HttpServerExchange exchange, String name) {
        return query(exchange, name).map(Boolean::parseBoolean);
    }

    public static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match != null ? match.getParameters().get(name) : null;
    }

    private static void send(HttpServerExchange exchange, int status, ObjectNode body) {
        try {
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
            exchange.getResponseSender().send(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.endExchange();
        }
    }

    private HttpJson() {}
}
