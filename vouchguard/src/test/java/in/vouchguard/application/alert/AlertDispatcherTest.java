package in.vouchguard.application.alert;

import in.vouchguard.config.RuntimeSettings;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.domain.alert.AlertType;
import in.vouchguard.infrastructure.metrics.MonitorMetrics;
import in.vouchguard.testsupport.InMemoryRepositories;
import in.vouchguard.testsupport.RecordingChannel;
import in.vouchguard.testsupport.TestSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AlertDispatcherTest {

    private RuntimeSettings runtimeSettings;
    private MonitorMetrics metrics;
    private AlertDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        runtimeSettings = new RuntimeSettings(TestSettings.monitorSettings(), new InMemoryRepositories.Settings());
        metrics = mock(MonitorMetrics.class);
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.stop();
        }
    }

    static AlertPayload payload() {
        return new AlertPayload(
            AlertType.NEGATIVE_REVIEW,
            new AlertPayload.Party("alice", "0xA11CE0000000000000000000000000000000ABCD", "https://p.test/alice", 200L),
            new AlertPayload.Party("mallory", "0xBAD", null, 66L),
            -1,
            "rug",
            Instant.parse("2026-03-01T12:00:00Z"),
            "review_1",
            "10",
            new AlertPayload.AutoDefense(true, 3, "Trusted member"));
    }

    @Test
    void testDeliversToEveryEnabledChannel() {
        RecordingChannel telegram = new RecordingChannel(AlertChannel.TELEGRAM);
        RecordingChannel discord = new RecordingChannel(AlertChannel.DISCORD);
        dispatcher = new AlertDispatcher(List.of(telegram, discord), runtimeSettings, metrics, Duration.ofSeconds(2));

        Map<AlertChannel, String> delivered = dispatcher.sendAlert(payload());

        assertEquals(Map.of(AlertChannel.TELEGRAM, "telegram-1", AlertChannel.DISCORD, "discord-1"), delivered);
        verify(metrics).recordAlertDelivery(AlertChannel.TELEGRAM, true);
        verify(metrics).recordAlertDelivery(AlertChannel.DISCORD, true);
    }

    @Test
    void testFailingChannelDoesNotAffectOthers() {
        RecordingChannel telegram = new RecordingChannel(AlertChannel.TELEGRAM).failing();
        RecordingChannel discord = new RecordingChannel(AlertChannel.DISCORD);
        dispatcher = new AlertDispatcher(List.of(telegram, discord), runtimeSettings, metrics, Duration.ofSeconds(2));

        Map<AlertChannel, String> delivered = dispatcher.sendAlert(payload());

        assertEquals(Map.of(AlertChannel.DISCORD, "discord-1"), delivered);
        verify(metrics).recordAlertDelivery(AlertChannel.TELEGRAM, false);
    }

    @Test
    void testSlowChannelIsCutOffAtTimeout() {
        RecordingChannel telegram = new RecordingChannel(AlertChannel.TELEGRAM).delayedBy(Duration.ofSeconds(3));
        RecordingChannel discord = new RecordingChannel(AlertChannel.DISCORD);
        dispatcher = new AlertDispatcher(List.of(telegram, discord), runtimeSettings, metrics,
            Duration.ofMillis(200));

        long started = System.nanoTime();
        Map<AlertChannel, String> delivered = dispatcher.sendAlert(payload());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertEquals(Map.of(AlertChannel.DISCORD, "discord-1"), delivered);
        assertTrue(elapsedMs < 2500, "dispatch waited " + elapsedMs + "ms");
    }

    @Test
    void testDisabledAndToggledOffChannelsAreSkipped() {
        RecordingChannel telegram = new RecordingChannel(AlertChannel.TELEGRAM).disabled();
        RecordingChannel discord = new RecordingChannel(AlertChannel.DISCORD);
        RecordingChannel twitter = new RecordingChannel(AlertChannel.TWITTER);
        runtimeSettings.setChannelEnabled(AlertChannel.TWITTER, false);
        dispatcher = new AlertDispatcher(List.of(telegram, discord, twitter), runtimeSettings, metrics,
            Duration.ofSeconds(2));

        Map<AlertChannel, String> delivered = dispatcher.sendAlert(payload());

        assertEquals(Map.of(AlertChannel.DISCORD, "discord-1"), delivered);
        assertTrue(telegram.sent.isEmpty());
        assertTrue(twitter.sent.isEmpty());
        assertEquals(Map.of(AlertChannel.TELEGRAM, false, AlertChannel.DISCORD, true, AlertChannel.TWITTER, false),
            dispatcher.channelStatus());
    }

    @Test
    void testNoChannelsMeansNothingDelivered() {
        dispatcher = new AlertDispatcher(List.of(), runtimeSettings, metrics, Duration.ofSeconds(2));

        assertTrue(dispatcher.sendAlert(payload()).isEmpty());
        assertEquals(0, dispatcher.sendNotification("hello"));
    }

    @Test
    void testNotificationCountsAcceptingChannels() {
        RecordingChannel telegram = new RecordingChannel(AlertChannel.TELEGRAM);
        RecordingChannel discord = new RecordingChannel(AlertChannel.DISCORD).failing();
        dispatcher = new AlertDispatcher(List.of(telegram, discord), runtimeSettings, metrics, Duration.ofSeconds(2));

        assertEquals(1, dispatcher.sendNotification("Session token expires soon"));
        assertEquals(List.of("Session token expires soon"), telegram.texts);
    }
}
