package in.vouchguard.domain.activity;

import java.time.Instant;

/**
 * Unambiguous view of a raw activity payload.
 *
 * @param activityId source id, or a synthetic type+timestamp id when the source has none
 * @param score      signed score (enumerated strings already mapped to -1/0/+1)
 * @param negative   score &lt; 0, or the activity is a slash
 */
public record NormalizedActivity(
    String activityId,
    ActivityType type,
    int score,
    boolean negative,
    String comment,
    Instant createdAt,
    Long authorProfileId,
    String authorName,
    String authorAddress
) {}
