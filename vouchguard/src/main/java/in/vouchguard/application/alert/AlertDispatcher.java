package in.vouchguard.application.alert;

import in.vouchguard.config.RuntimeSettings;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.infrastructure.metrics.MonitorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans an alert out to every enabled channel concurrently.
 *
 * Channels are settled independently: a failure, timeout or empty result on one
 * channel only removes that channel from the result.
 */
public final class AlertDispatcher {
    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final List<NotificationChannel> channels;
    private final RuntimeSettings runtimeSettings;
    private final MonitorMetrics metrics;
    private final Duration channelTimeout;
    private final ExecutorService executor;

    public AlertDispatcher(List<NotificationChannel> channels, RuntimeSettings runtimeSettings,
                           MonitorMetrics metrics, Duration channelTimeout) {
        this.channels = List.copyOf(channels);
        this.runtimeSettings = runtimeSettings;
        this.metrics = metrics;
        this.channelTimeout = channelTimeout;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, channels.size()), r -> {
            Thread t = new Thread(r, "alert-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        for (NotificationChannel channel : channels) {
            log.info("[ALERT] Channel {} {}", channel.channel(), channel.isEnabled() ? "enabled" : "disabled");
        }
    }

    /**
     * Deliver to all enabled channels and wait for every one to settle.
     *
     * @return delivery id per channel that delivered; never throws
     */
    public Map<AlertChannel, String> sendAlert(AlertPayload payload) {
        List<NotificationChannel> targets = enabledChannels();
        List<CompletableFuture<Optional<String>>> futures = new ArrayList<>(targets.size());

        for (NotificationChannel channel : targets) {
            futures.add(CompletableFuture
                .supplyAsync(() -> channel.send(payload), executor)
                .completeOnTimeout(Optional.empty(), channelTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error != null) {
                        log.error("[ALERT] {} delivery failed for review {}: {}",
                            channel.channel(), payload.reviewId(), rootMessage(error));
                        return Optional.<String>empty();
                    }
                    return result != null ? result : Optional.<String>empty();
                }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<AlertChannel, String> delivered = new EnumMap<>(AlertChannel.class);
        for (int i = 0; i < targets.size(); i++) {
            AlertChannel channel = targets.get(i).channel();
            Optional<String> id = futures.get(i).join();
            metrics.recordAlertDelivery(channel, id.isPresent());
            id.ifPresent(messageId -> delivered.put(channel, messageId));
        }

        log.info("[ALERT] Review {} delivered to {}/{} channels: {}",
            payload.reviewId(), delivered.size(), targets.size(), delivered.keySet());
        return delivered;
    }

    /**
     * Send a plain notice to all enabled channels.
     *
     * @return number of channels that accepted it
     */
    public int sendNotification(String text) {
        List<NotificationChannel> targets = enabledChannels();
        List<CompletableFuture<Boolean>> futures = new ArrayList<>(targets.size());

        for (NotificationChannel channel : targets) {
            futures.add(CompletableFuture
                .supplyAsync(() -> channel.sendText(text), executor)
                .completeOnTimeout(Boolean.FALSE, channelTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ok, error) -> {
                    if (error != null) {
                        log.error("[ALERT] {} notice failed: {}", channel.channel(), rootMessage(error));
                        return Boolean.FALSE;
                    }
                    return Boolean.TRUE.equals(ok);
                }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        int sent = 0;
        for (CompletableFuture<Boolean> future : futures) {
            if (future.join()) {
                sent++;
            }
        }
        return sent;
    }

    public Map<AlertChannel, Boolean> channelStatus() {
        Map<AlertChannel, Boolean> status = new EnumMap<>(AlertChannel.class);
        for (AlertChannel channel : AlertChannel.values()) {
            status.put(channel, false);
        }
        for (NotificationChannel channel : enabledChannels()) {
            status.put(channel.channel(), true);
        }
        return status;
    }

    public void stop() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (NotificationChannel channel : channels) {
            try {
                channel.close();
            } catch (Exception e) {
                log.warn("[ALERT] Failed to close {}: {}", channel.channel(), e.getMessage());
            }
        }
        log.info("[ALERT] Dispatcher stopped");
    }

    private List<NotificationChannel> enabledChannels() {
        List<NotificationChannel> enabled = new ArrayList<>();
        for (NotificationChannel channel : channels) {
            if (channel.isEnabled() && runtimeSettings.isChannelEnabled(channel.channel())) {
                enabled.add(channel);
            }
        }
        return enabled;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
