package in.vouchguard.application.alert.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.vouchguard.application.alert.ChannelDeliveryException;
import in.vouchguard.domain.alert.AlertChannel;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * JSON-over-HTTP transport shared by the channel implementations.
 */
final class ChannelHttp {
    private final AlertChannel channel;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Duration timeout;

    ChannelHttp(AlertChannel channel, ObjectMapper objectMapper, Duration timeout) {
        this.channel = channel;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    JsonNode postJson(String url, JsonNode body) {
        return postJson(url, body, timeout);
    }

    /**
     * @throws ChannelDeliveryException on non-2xx, I/O failure or malformed response
     */
    JsonNode postJson(String url, JsonNode body, Duration requestTimeout) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new ChannelDeliveryException(channel,
                    "HTTP " + response.statusCode() + ": " + response.body());
            }
            String responseBody = response.body();
            return responseBody == null || responseBody.isBlank()
                ? objectMapper.createObjectNode()
                : objectMapper.readTree(responseBody);

        } catch (IOException e) {
            throw new ChannelDeliveryException(channel, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelDeliveryException(channel, "Interrupted", e);
        }
    }

    ObjectMapper mapper() {
        return objectMapper;
    }
}
