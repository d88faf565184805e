package in.vouchguard.domain.monitoring;

import java.time.Instant;
import java.util.List;

/**
 * Append-only record of one monitor cycle that actually ran.
 */
public record CycleLog(
    long id,
    int relationsChecked,
    int activitiesFound,
    int newNegative,
    int alertsSent,
    List<String> errors,
    long durationMs,
    Instant runAt
) {
    public static CycleLog of(CycleResult result, Instant runAt) {
        return new CycleLog(0, result.relationsChecked(), result.activitiesFound(),
            result.newNegative(), result.alertsSent(), result.errors(), result.durationMs(), runAt);
    }
}
