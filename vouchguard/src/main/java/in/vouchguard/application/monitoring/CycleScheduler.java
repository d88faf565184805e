package in.vouchguard.application.monitoring;

import in.vouchguard.config.RuntimeSettings;
import in.vouchguard.domain.monitoring.CycleResult;
import in.vouchguard.repository.AlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives the ingestion engine on a fixed interval and runs daily housekeeping.
 *
 * Overlap protection lives in the engine, so a manual trigger racing a timer
 * tick is safe.
 */
public final class CycleScheduler {
    private static final Logger log = LoggerFactory.getLogger(CycleScheduler.class);

    static final Duration DEFAULT_WARMUP = Duration.ofSeconds(5);

    public record SchedulerStatus(
        boolean monitorScheduled,
        boolean housekeepingScheduled,
        boolean running,
        Instant lastRunAt,
        int intervalMinutes,
        boolean autoDefenseEnabled,
        boolean autoDefenseRequireConfirm
    ) {}

    private final IngestionEngine engine;
    private final AlertRepository alertRepo;
    private final RuntimeSettings runtimeSettings;
    private final int intervalMinutes;
    private final int alertExpiryHours;
    private final Clock clock;
    private final Duration warmup;
    private final ScheduledExecutorService scheduler;

    private volatile ScheduledFuture<?> monitorTask;
    private volatile ScheduledFuture<?> housekeepingTask;

    public CycleScheduler(IngestionEngine engine, AlertRepository alertRepo, RuntimeSettings runtimeSettings,
                          int intervalMinutes, int alertExpiryHours, Clock clock) {
        this(engine, alertRepo, runtimeSettings, intervalMinutes, alertExpiryHours, clock, DEFAULT_WARMUP);
    }

    CycleScheduler(IngestionEngine engine, AlertRepository alertRepo, RuntimeSettings runtimeSettings,
                   int intervalMinutes, int alertExpiryHours, Clock clock, Duration warmup) {
        this.engine = engine;
        this.alertRepo = alertRepo;
        this.runtimeSettings = runtimeSettings;
        this.intervalMinutes = intervalMinutes;
        this.alertExpiryHours = alertExpiryHours;
        this.clock = clock;
        this.warmup = warmup;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "CycleScheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (monitorTask != null) {
            log.warn("[SCHEDULER] Already started");
            return;
        }
        log.info("[SCHEDULER] Monitor every {} minute(s), first run in {}s", intervalMinutes, warmup.toSeconds());
        monitorTask = scheduler.scheduleAtFixedRate(
            this::scheduledCycle,
            warmup.toMillis(),
            TimeUnit.MINUTES.toMillis(intervalMinutes),
            TimeUnit.MILLISECONDS
        );

        long untilMidnight = millisUntilNextMidnight();
        housekeepingTask = scheduler.scheduleAtFixedRate(
            this::scheduledHousekeeping,
            untilMidnight,
            TimeUnit.DAYS.toMillis(1),
            TimeUnit.MILLISECONDS
        );
        log.info("[SCHEDULER] Housekeeping in {} minute(s), then daily", untilMidnight / 60_000);
    }

    public CycleResult triggerManually() {
        log.info("[SCHEDULER] Manual monitor trigger");
        return engine.runCycle();
    }

    /**
     * Expire alerts that were left PENDING past the expiry window.
     *
     * @return number of alerts expired
     */
    public int runHousekeeping() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(alertExpiryHours));
        int expired = alertRepo.expirePendingBefore(cutoff);
        log.info("[SCHEDULER] Housekeeping expired {} alert(s) pending since before {}", expired, cutoff);
        return expired;
    }

    /**
     * Cancel timers. An in-flight cycle is neither awaited nor interrupted.
     */
    public synchronized void stop() {
        if (monitorTask != null) {
            monitorTask.cancel(false);
        }
        if (housekeepingTask != null) {
            housekeepingTask.cancel(false);
        }
        monitorTask = null;
        housekeepingTask = null;
        scheduler.shutdown();
        log.info("[SCHEDULER] Stopped");
    }

    public SchedulerStatus getStatus() {
        RuntimeSettings.AutoDefense autoDefense = runtimeSettings.autoDefense();
        return new SchedulerStatus(
            isActive(monitorTask),
            isActive(housekeepingTask),
            engine.isRunning(),
            engine.lastRunAt().orElse(null),
            intervalMinutes,
            autoDefense.enabled(),
            autoDefense.requireConfirm()
        );
    }

    private void scheduledCycle() {
        try {
            engine.runCycle();
        } catch (Exception e) {
            // A throwing task would cancel the schedule
            log.error("[SCHEDULER] Scheduled cycle failed: {}", e.getMessage(), e);
        }
    }

    private void scheduledHousekeeping() {
        try {
            runHousekeeping();
        } catch (Exception e) {
            log.error("[SCHEDULER] Housekeeping failed: {}", e.getMessage(), e);
        }
    }

    long millisUntilNextMidnight() {
        ZoneId zone = clock.getZone();
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime midnight = LocalDate.now(clock).plusDays(1).atStartOfDay(zone);
        return Math.max(0, Duration.between(now, midnight).toMillis());
    }

    private static boolean isActive(ScheduledFuture<?> task) {
        return task != null && !task.isCancelled() && !task.isDone();
    }
}
