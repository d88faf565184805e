package in.vouchguard.application.monitoring;

import in.vouchguard.config.RuntimeSettings;
import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.domain.alert.AlertStatus;
import in.vouchguard.domain.alert.AlertType;
import in.vouchguard.domain.monitoring.CycleResult;
import in.vouchguard.testsupport.InMemoryRepositories;
import in.vouchguard.testsupport.MutableClock;
import in.vouchguard.testsupport.TestSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CycleSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T23:00:00Z");

    private IngestionEngine engine;
    private InMemoryRepositories.Alerts alerts;
    private RuntimeSettings runtimeSettings;
    private MutableClock clock;
    private CycleScheduler scheduler;

    @BeforeEach
    void setUp() {
        engine = mock(IngestionEngine.class);
        when(engine.runCycle()).thenReturn(new CycleResult(0, 0, 0, 0, List.of(), 1, false));
        when(engine.lastRunAt()).thenReturn(Optional.empty());
        alerts = new InMemoryRepositories.Alerts();
        runtimeSettings = new RuntimeSettings(TestSettings.monitorSettings(), new InMemoryRepositories.Settings());
        clock = new MutableClock(NOW);
        scheduler = new CycleScheduler(engine, alerts, runtimeSettings, 5, 72, clock, Duration.ofMillis(50));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void testFirstCycleRunsAfterWarmup() {
        scheduler.start();

        verify(engine, timeout(2000).atLeastOnce()).runCycle();
        CycleScheduler.SchedulerStatus status = scheduler.getStatus();
        assertTrue(status.monitorScheduled());
        assertTrue(status.housekeepingScheduled());
        assertEquals(5, status.intervalMinutes());
        assertTrue(status.autoDefenseEnabled());
    }

    @Test
    void testStopCancelsSchedules() {
        scheduler.start();
        scheduler.stop();

        CycleScheduler.SchedulerStatus status = scheduler.getStatus();
        assertFalse(status.monitorScheduled());
        assertFalse(status.housekeepingScheduled());
    }

    @Test
    void testStopLetsInFlightCycleFinishUninterrupted() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean(false);
        doAnswer(invocation -> {
            started.countDown();
            try {
                Thread.sleep(500);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
            finished.countDown();
            return new CycleResult(1, 0, 0, 0, List.of(), 500, false);
        }).when(engine).runCycle();

        scheduler.start();
        assertTrue(started.await(2, TimeUnit.SECONDS));
        scheduler.stop();

        assertTrue(finished.await(3, TimeUnit.SECONDS));
        assertFalse(interrupted.get());
        assertFalse(scheduler.getStatus().monitorScheduled());
    }

    @Test
    void testManualTriggerDelegatesToEngine() {
        CycleResult result = scheduler.triggerManually();

        assertFalse(result.skipped());
        verify(engine).runCycle();
    }

    @Test
    void testHousekeepingExpiresOnlyStalePendingAlerts() {
        alerts.insertIfAbsent(Alert.delivered("review_old", "10", AlertType.NEGATIVE_REVIEW,
            AlertChannel.TELEGRAM, "1", NOW.minus(Duration.ofHours(80))));
        alerts.insertIfAbsent(Alert.delivered("review_new", "10", AlertType.NEGATIVE_REVIEW,
            AlertChannel.TELEGRAM, "2", NOW.minus(Duration.ofHours(1))));
        alerts.insertIfAbsent(Alert.delivered("review_done", "10", AlertType.SLASH,
            AlertChannel.DISCORD, "3", NOW.minus(Duration.ofHours(100))));
        alerts.updateStatus("review_done_DISCORD", AlertStatus.CONFIRMED);

        int expired = scheduler.runHousekeeping();

        assertEquals(1, expired);
        assertEquals(AlertStatus.EXPIRED, alerts.findById("review_old_TELEGRAM").orElseThrow().status());
        assertEquals(AlertStatus.PENDING, alerts.findById("review_new_TELEGRAM").orElseThrow().status());
        assertEquals(AlertStatus.CONFIRMED, alerts.findById("review_done_DISCORD").orElseThrow().status());
    }

    @Test
    void testHousekeepingIsAlignedToMidnight() {
        assertEquals(Duration.ofHours(1).toMillis(), scheduler.millisUntilNextMidnight());

        clock.set(Instant.parse("2026-03-01T00:00:00Z"));
        assertEquals(Duration.ofDays(1).toMillis(), scheduler.millisUntilNextMidnight());
    }
}
