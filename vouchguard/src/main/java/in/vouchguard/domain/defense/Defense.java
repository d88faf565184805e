package in.vouchguard.domain.defense;

import java.time.Instant;

/**
 * A counter-review prepared in response to a negative activity.
 */
public record Defense(
    String id,
    String reviewId,
    String targetKey,
    int score,
    String comment,
    DefenseStatus status,
    String networkReviewId,
    String txHash,
    String error,
    Instant createdAt,
    Instant postedAt
) {
    public static Defense pending(String id, String reviewId, String targetKey, int score,
                                  String comment, Instant createdAt) {
        return new Defense(id, reviewId, targetKey, score, comment, DefenseStatus.PENDING,
            null, null, null, createdAt, null);
    }

    public boolean isActive() {
        return status.isActive();
    }
}
