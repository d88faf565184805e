package in.vouchguard.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.vouchguard.domain.credential.TokenClaims;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Reads the claims of a session JWT without verifying its signature.
 *
 * The token is issued by the network's identity provider; only its expiry is
 * needed locally, to decide whether writes can be attempted.
 */
public final class SessionTokenDecoder {
    private static final String BEARER_PREFIX = "Bearer ";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public Optional<TokenClaims> decode(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String raw = token.trim();
        if (raw.startsWith(BEARER_PREFIX)) {
            raw = raw.substring(BEARER_PREFIX.length()).trim();
        }
        String[] parts = raw.split("\\.");
        if (parts.length != 3) {
            return Optional.empty();
        }

        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode claims = objectMapper.readTree(new String(payload, StandardCharsets.UTF_8));
            if (claims == null || !claims.isObject() || !claims.path("exp").isNumber()) {
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(
                text(claims, "sub"),
                text(claims, "sid"),
                text(claims, "iss"),
                claims.path("iat").isNumber() ? Instant.ofEpochSecond(claims.get("iat").asLong()) : null,
                Instant.ofEpochSecond(claims.get("exp").asLong())
            ));
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
