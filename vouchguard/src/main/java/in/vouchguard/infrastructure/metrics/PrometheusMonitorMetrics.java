package in.vouchguard.infrastructure.metrics;

import in.vouchguard.domain.activity.ActivityType;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.domain.defense.DefenseResult;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of MonitorMetrics.
 *
 * Key Metrics:
 * - vouchguard_cycles_total{outcome} - ok, errors, skipped
 * - vouchguard_cycle_duration_seconds - cycle wall time
 * - vouchguard_activities_ingested_total{type} - newly stored activities
 * - vouchguard_alerts_total{channel, outcome} - delivered / failed per channel
 * - vouchguard_defenses_total{outcome} - defense submission outcomes
 * - vouchguard_session_seconds_remaining - time left on the session token
 */
public class PrometheusMonitorMetrics implements MonitorMetrics {

    private final CollectorRegistry registry;

    private final Counter cycleCounter;
    private final Histogram cycleDuration;
    private final Counter activityCounter;
    private final Counter alertCounter;
    private final Counter defenseCounter;
    private final Gauge sessionRemaining;

    public PrometheusMonitorMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMonitorMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.cycleCounter = Counter.build()
            .name("vouchguard_cycles_total")
            .help("Total number of monitor cycles")
            .labelNames("outcome")
            .register(registry);

        this.cycleDuration = Histogram.build()
            .name("vouchguard_cycle_duration_seconds")
            .help("Monitor cycle duration in seconds")
            .buckets(0.5, 1.0, 2.5, 5.0, 10.0, 30.0, 60.0, 120.0)
            .register(registry);

        this.activityCounter = Counter.build()
            .name("vouchguard_activities_ingested_total")
            .help("Total number of newly ingested activities")
            .labelNames("type")
            .register(registry);

        this.alertCounter = Counter.build()
            .name("vouchguard_alerts_total")
            .help("Total number of alert deliveries")
            .labelNames("channel", "outcome")
            .register(registry);

        this.defenseCounter = Counter.build()
            .name("vouchguard_defenses_total")
            .help("Total number of defense attempts")
            .labelNames("outcome")
            .register(registry);

        this.sessionRemaining = Gauge.build()
            .name("vouchguard_session_seconds_remaining")
            .help("Seconds until the session token expires (0 when expired)")
            .register(registry);
    }

    @Override
    public void recordCycle(Duration duration, int errorCount) {
        cycleCounter.labels(errorCount == 0 ? "ok" : "errors").inc();
        cycleDuration.observe(duration.toMillis() / 1000.0);
    }

    @Override
    public void recordCycleSkipped() {
        cycleCounter.labels("skipped").inc();
    }

    @Override
    public void recordActivityIngested(ActivityType type) {
        activityCounter.labels(type.wireName()).inc();
    }

    @Override
    public void recordAlertDelivery(AlertChannel channel, boolean delivered) {
        alertCounter.labels(channel.name().toLowerCase(), delivered ? "delivered" : "failed").inc();
    }

    @Override
    public void recordDefense(DefenseResult.Outcome outcome) {
        defenseCounter.labels(outcome.name().toLowerCase()).inc();
    }

    @Override
    public void recordSessionRemaining(long seconds) {
        sessionRemaining.set(seconds);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
