package in.vouchguard.application.alert.channel;

import in.vouchguard.application.alert.AlertFormatter;
import in.vouchguard.application.alert.AlertPayload;
import in.vouchguard.application.alert.NotificationChannel;
import in.vouchguard.domain.alert.AlertChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Twitter channel. Direct messages need a recipient id and DM permissions the
 * app does not hold, so the formatted message is logged instead of sent.
 */
public final class TwitterChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(TwitterChannel.class);

    public static final String DM_DISABLED_ID = "twitter_dm_disabled";

    private final boolean configured;
    private final String frontendUrl;

    public TwitterChannel(String apiKey, String apiSecret, String frontendUrl) {
        this.configured = apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
        this.frontendUrl = frontendUrl;
    }

    @Override
    public AlertChannel channel() {
        return AlertChannel.TWITTER;
    }

    @Override
    public boolean isEnabled() {
        return configured;
    }

    @Override
    public Optional<String> send(AlertPayload payload) {
        if (!configured) {
            return Optional.empty();
        }
        String message = AlertFormatter.compactText(payload, frontendUrl);
        log.info("[TWITTER] Alert formatted (DM not sent): {}", AlertFormatter.truncate(message, 100));
        return Optional.of(DM_DISABLED_ID);
    }

    @Override
    public boolean sendText(String text) {
        if (!configured) {
            return false;
        }
        log.info("[TWITTER] Notice formatted (DM not sent): {}", AlertFormatter.truncate(text, 100));
        return false;
    }
}
