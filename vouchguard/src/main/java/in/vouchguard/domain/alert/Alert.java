package in.vouchguard.domain.alert;

import java.time.Instant;

/**
 * One delivery of a negative-activity notification to one channel.
 *
 * The id is derived from (reviewId, channel), so there is at most one row per
 * pair and interactive callbacks can name the alert before it is stored.
 */
public record Alert(
    String id,
    String reviewId,
    String relationId,
    AlertType type,
    AlertChannel channel,
    AlertStatus status,
    String messageId,
    Instant sentAt,
    Instant respondedAt
) {
    public static String idFor(String reviewId, AlertChannel channel) {
        return reviewId + "_" + channel.name();
    }

    public static Alert delivered(String reviewId, String relationId, AlertType type,
                                  AlertChannel channel, String messageId, Instant sentAt) {
        return new Alert(idFor(reviewId, channel), reviewId, relationId, type, channel,
            AlertStatus.PENDING, messageId, sentAt, null);
    }

    public boolean isPending() {
        return status == AlertStatus.PENDING;
    }
}
