package in.vouchguard.infrastructure.metrics;

import in.vouchguard.domain.activity.ActivityType;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.domain.defense.DefenseResult;

import java.time.Duration;

/**
 * Monitor metrics for dashboards and alerting.
 *
 * Key metrics:
 * - Cycle outcomes and durations
 * - New activities by type
 * - Alert deliveries per channel
 * - Defense outcomes
 * - Session credential lifetime
 */
public interface MonitorMetrics {

    /**
     * Record a cycle that ran.
     *
     * @param errorCount per-item errors collected during the cycle
     */
    void recordCycle(Duration duration, int errorCount);

    void recordCycleSkipped();

    void recordActivityIngested(ActivityType type);

    void recordAlertDelivery(AlertChannel channel, boolean delivered);

    void recordDefense(DefenseResult.Outcome outcome);

    void recordSessionRemaining(long seconds);

    /**
     * No-op implementation for tests and wiring without a registry.
     */
    MonitorMetrics NOOP = new MonitorMetrics() {
        @Override public void recordCycle(Duration duration, int errorCount) {}
        @Override public void recordCycleSkipped() {}
        @Override public void recordActivityIngested(ActivityType type) {}
        @Override public void recordAlertDelivery(AlertChannel channel, boolean delivered) {}
        @Override public void recordDefense(DefenseResult.Outcome outcome) {}
        @Override public void recordSessionRemaining(long seconds) {}
    };
}
