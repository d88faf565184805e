package in.vouchguard.domain.monitoring;

import java.util.List;

/**
 * Summary of one monitor cycle.
 *
 * @param skipped true when another cycle was already in flight and nothing ran
 */
public record CycleResult(
    int relationsChecked,
    int activitiesFound,
    int newNegative,
    int alertsSent,
    List<String> errors,
    long durationMs,
    boolean skipped
) {
    public static final String ALREADY_RUNNING = "Cycle already running";

    public CycleResult {
        errors = List.copyOf(errors);
    }

    public static CycleResult alreadyRunning() {
        return new CycleResult(0, 0, 0, 0, List.of(ALREADY_RUNNING), 0, true);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
