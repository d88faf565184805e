package in.vouchguard.application.monitoring;

import com.fasterxml.jackson.databind.JsonNode;
import in.vouchguard.domain.activity.ActivityType;
import in.vouchguard.domain.activity.NormalizedActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns raw activity payloads into {@link NormalizedActivity}.
 *
 * Payloads are loosely shaped: ids, scores and timestamps each come in more
 * than one form. Nothing here throws for a missing or odd field.
 */
public final class ActivityNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ActivityNormalizer.class);

    /** Epoch values below this are seconds, at or above it milliseconds. */
    static final long SECONDS_THRESHOLD = 10_000_000_000L;

    public NormalizedActivity normalize(JsonNode activity, Instant ingestionTime) {
        JsonNode data = activity.path("data");
        JsonNode author = activity.path("author");

        ActivityType type = ActivityType.fromWire(activity.path("type").asText(null))
            .orElseGet(() -> {
                log.debug("Unknown activity type '{}', treating as review", activity.path("type").asText(""));
                return ActivityType.REVIEW;
            });

        Instant createdAt = timestamp(activity, data).orElse(ingestionTime);

        String activityId = text(data, "id")
            .or(() -> text(activity, "id"))
            .orElse(type.wireName() + "_" + createdAt.toEpochMilli());

        int score = score(data.path("score"));
        boolean negative = score < 0 || type == ActivityType.SLASH;

        JsonNode profileId = author.path("profileId");
        Long authorProfileId = profileId.isIntegralNumber() ? profileId.asLong() : null;

        return new NormalizedActivity(
            activityId,
            type,
            score,
            negative,
            text(data, "comment").orElse(null),
            createdAt,
            authorProfileId,
            text(author, "name").or(() -> text(author, "username")).orElse(null),
            text(author, "primaryAddress").orElse(null)
        );
    }

    /**
     * Fractional scores are floored, so any value below zero stays negative.
     */
    static int score(JsonNode score) {
        if (score.isNumber()) {
            return (int) Math.floor(score.asDouble());
        }
        if (score.isTextual()) {
            switch (score.asText().trim().toLowerCase(Locale.ROOT)) {
                case "negative":
                    return -1;
                case "positive":
                    return 1;
                default:
                    return 0;
            }
        }
        return 0;
    }

    private static Optional<Instant> timestamp(JsonNode activity, JsonNode data) {
        JsonNode ts = activity.path("timestamp");
        if (ts.isNumber()) {
            return Optional.of(fromEpoch(ts.asLong()));
        }

        JsonNode createdAt = activity.path("createdAt");
        if (createdAt.isTextual()) {
            Optional<Instant> parsed = parseIso(createdAt.asText());
            if (parsed.isPresent()) {
                return parsed;
            }
        }

        JsonNode dataCreatedAt = data.path("createdAt");
        if (dataCreatedAt.isNumber()) {
            return Optional.of(fromEpoch(dataCreatedAt.asLong()));
        }
        if (dataCreatedAt.isTextual()) {
            try {
                return Optional.of(fromEpoch((long) Double.parseDouble(dataCreatedAt.asText().trim())));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Instant fromEpoch(long value) {
        return value < SECONDS_THRESHOLD ? Instant.ofEpochSecond(value) : Instant.ofEpochMilli(value);
    }

    private static Optional<Instant> parseIso(String text) {
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(OffsetDateTime.parse(text).toInstant());
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return Optional.empty();
        }
        String text = value.asText();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }
}
