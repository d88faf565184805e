package in.vouchguard.domain.activity;

import java.time.Instant;

/**
 * One observed review or slash against a relationship.
 *
 * activityId is the external dedup key. Everything except {@code alerted} is
 * fixed at creation; createdAt comes from the event, not from ingestion.
 */
public record ActivityRecord(
    String id,
    String relationId,
    String activityId,
    ActivityType type,
    String authorKey,
    String authorName,
    String authorAddress,
    int score,
    String comment,
    boolean negative,
    boolean alerted,
    Instant createdAt
) {
    public static String recordId(ActivityType type, String activityId) {
        return type.wireName() + "_" + activityId;
    }

    public ActivityRecord withAlerted() {
        return new ActivityRecord(id, relationId, activityId, type, authorKey, authorName,
            authorAddress, score, comment, negative, true, createdAt);
    }
}
