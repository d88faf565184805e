package in.vouchguard.network;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.vouchguard.domain.activity.ActivityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Trust network client over the public REST API.
 *
 * All requests carry the client id header and, when a session token is set,
 * a bearer Authorization header. Every request is bounded by the configured timeout.
 */
public final class HttpTrustNetworkClient implements TrustNetworkClient {
    private static final Logger log = LoggerFactory.getLogger(HttpTrustNetworkClient.class);

    private static final String PROFILE_URL_BASE = "https://app.ethos.network/profile/";
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(5);
    private static final int VOUCH_PAGE_LIMIT = 100;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String clientId;
    private final Duration timeout;
    private final CredentialGate credentialGate;

    private volatile String sessionToken;

    public HttpTrustNetworkClient(String baseUrl, String clientId, Duration timeout,
                                  CredentialGate credentialGate, String sessionToken) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.clientId = clientId;
        this.timeout = timeout;
        this.credentialGate = credentialGate;
        this.sessionToken = sessionToken;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public List<NetworkVouch> listVouches(String userKey) {
        if (userKey == null || !userKey.startsWith(PROFILE_ID_PREFIX)) {
            log.warn("[NETWORK] Userkey format not supported for vouch listing: {}", userKey);
            return List.of();
        }
        long profileId;
        try {
            profileId = Long.parseLong(userKey.substring(PROFILE_ID_PREFIX.length()).trim());
        } catch (NumberFormatException e) {
            log.warn("[NETWORK] Invalid profile id in userkey: {}", userKey);
            return List.of();
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("authorProfileIds").add(profileId);
        body.put("limit", VOUCH_PAGE_LIMIT);

        JsonNode response = send(post("/api/v2/vouches", body, timeout));
        JsonNode values = response.has("values") ? response.get("values") : response;

        List<NetworkVouch> vouches = new ArrayList<>();
        if (!values.isArray()) {
            log.warn("[NETWORK] Unexpected vouches payload for {}", userKey);
            return vouches;
        }
        for (JsonNode v : values) {
            long subjectProfileId = v.path("subjectProfileId").asLong();
            long id = v.hasNonNull("id") ? v.get("id").asLong() : subjectProfileId;
            JsonNode subject = v.get("subjectUser");
            Optional<NetworkProfile> subjectUser = subject != null && subject.isObject()
                ? Optional.of(NetworkProfile.fromJson(subject))
                : Optional.empty();
            vouches.add(new NetworkVouch(
                id,
                subjectProfileId,
                v.path("archived").asBoolean(false),
                v.hasNonNull("unvouchedAt") || v.path("unvouched").asBoolean(false),
                subjectUser));
        }
        log.info("[NETWORK] Found {} vouches for profileId {}", vouches.size(), profileId);
        return vouches;
    }

    @Override
    public List<JsonNode> listReceivedActivities(String userKey, List<ActivityType> types, int limit, int offset) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("userkey", userKey);
        ArrayNode typeArray = body.putArray("types");
        types.forEach(t -> typeArray.add(t.wireName()));
        ObjectNode pagination = body.putObject("pagination");
        pagination.put("limit", limit);
        pagination.put("offset", offset);

        JsonNode response = send(post("/api/v2/activities/profile/received", body, timeout));
        JsonNode activities = response.has("values") ? response.get("values") : response.path("activities");

        if (!activities.isArray()) {
            log.warn("[NETWORK] Unexpected activities response for {}", userKey);
            return List.of();
        }
        List<JsonNode> result = new ArrayList<>(activities.size());
        activities.forEach(result::add);
        return result;
    }

    @Override
    public Optional<NetworkProfile> getProfile(String userKey) {
        if (userKey.startsWith(ADDRESS_PREFIX) || userKey.startsWith("0x")) {
            String address = userKey.startsWith(ADDRESS_PREFIX)
                ? userKey.substring(ADDRESS_PREFIX.length())
                : userKey;
            try {
                JsonNode user = send(get("/api/v2/user/by/ethos-everywhere-wallet/" + encode(address), timeout));
                log.info("[NETWORK] Found user by wallet: {}", address);
                return Optional.of(NetworkProfile.fromJson(user));
            } catch (NetworkException e) {
                log.warn("[NETWORK] Wallet lookup failed for {}, trying profiles endpoint: {}",
                    address, e.getMessage());
            }
        }

        try {
            JsonNode profile = send(get("/api/v2/profiles/" + encode(userKey), timeout));
            return Optional.of(NetworkProfile.fromJson(profile));
        } catch (NetworkException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public Optional<NetworkScore> getScore(String userKey) {
        try {
            JsonNode score = send(get("/api/v2/score/" + encode(userKey), timeout));
            return Optional.of(new NetworkScore(
                score.path("profileId").asLong(),
                score.path("score").asInt(),
                score.path("reviewsReceived").asInt(),
                score.path("reviewsGiven").asInt(),
                score.path("vouchesReceived").asInt(),
                score.path("vouchesGiven").asInt()));
        } catch (NetworkException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public ReviewSubmission submitReview(String targetKey, int score, String comment) {
        credentialGate.requireValid();

        ObjectNode body = objectMapper.createObjectNode();
        body.put("target", targetKey);
        body.put("score", score);
        body.put("comment", comment);

        try {
            JsonNode response = send(post("/api/v2/reviews", body, timeout));
            String reviewId = textOrNull(response, "id");
            if (reviewId == null) {
                reviewId = textOrNull(response, "reviewId");
            }
            log.info("[NETWORK] Review posted for {}: score={}", targetKey, score);
            return ReviewSubmission.success(reviewId, textOrNull(response, "txHash"));
        } catch (NetworkException e) {
            log.error("[NETWORK] Failed to post review for {}: {}", targetKey, e.getMessage());
            return ReviewSubmission.failure(e.getMessage());
        }
    }

    @Override
    public boolean healthCheck() {
        try {
            HttpResponse<String> response = httpClient.send(
                get("/api/v2/apps", HEALTH_TIMEOUT), HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.warn("[NETWORK] Health check failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void setSessionToken(String token) {
        this.sessionToken = token;
        log.info("[NETWORK] Session token replaced");
    }

    @Override
    public String profileUrl(String addressOrProfileId) {
        return PROFILE_URL_BASE + addressOrProfileId;
    }

    private HttpRequest get(String path, Duration requestTimeout) {
        return baseRequest(path, requestTimeout).GET().build();
    }

    private HttpRequest post(String path, JsonNode body, Duration requestTimeout) {
        try {
            String payload = objectMapper.writeValueAsString(body);
            return baseRequest(path, requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();
        } catch (IOException e) {
            throw new NetworkException("Failed to serialize request for " + path, e);
        }
    }

    private HttpRequest.Builder baseRequest(String path, Duration requestTimeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("X-Ethos-Client", clientId);
        String token = sessionToken;
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("[NETWORK] No response from {}: {}", request.uri(), e.getMessage());
            throw new NetworkException("No response from " + request.uri().getPath() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Interrupted calling " + request.uri().getPath(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.error("[NETWORK] HTTP {} from {}: {}", status, request.uri().getPath(), response.body());
            throw new NetworkException(status, response.body());
        }

        String body = response.body();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new NetworkException("Malformed JSON from " + request.uri().getPath(), e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
