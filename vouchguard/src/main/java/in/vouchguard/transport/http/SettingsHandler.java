package in.vouchguard.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import in.vouchguard.config.MonitorSettings;
import in.vouchguard.config.RuntimeSettings;
import in.vouchguard.domain.alert.AlertChannel;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * GET/POST /api/settings. Secrets are only ever returned masked.
 */
public final class SettingsHandler {
    private static final Logger log = LoggerFactory.getLogger(SettingsHandler.class);

    private final MonitorSettings settings;
    private final RuntimeSettings runtimeSettings;

    public SettingsHandler(MonitorSettings settings, RuntimeSettings runtimeSettings) {
        this.settings = settings;
        this.runtimeSettings = runtimeSettings;
    }

    public void get(HttpServerExchange exchange) {
        HttpJson.ok(exchange, snapshot());
    }

    public void update(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            JsonNode json;
            try {
                json = HttpJson.MAPPER.readTree(body);
            } catch (Exception e) {
                HttpJson.error(ex, StatusCodes.BAD_REQUEST, "Invalid request body");
                return;
            }

            JsonNode autoDefense = json.path("autoDefense");
            if (autoDefense.isObject()) {
                RuntimeSettings.AutoDefense current = runtimeSettings.autoDefense();
                int defaultScore = autoDefense.path("defaultScore").asInt(current.defaultScore());
                if (defaultScore < 1 || defaultScore > 5) {
                    HttpJson.error(ex, StatusCodes.BAD_REQUEST, "defaultScore must be between 1 and 5");
                    return;
                }
                runtimeSettings.updateAutoDefense(new RuntimeSettings.AutoDefense(
                    autoDefense.path("enabled").asBoolean(current.enabled()),
                    autoDefense.path("requireConfirm").asBoolean(current.requireConfirm()),
                    defaultScore));
            }

            JsonNode channels = json.path("channels");
            if (channels.isObject()) {
                for (AlertChannel channel : AlertChannel.values()) {
                    JsonNode toggle = channels.get(channel.name().toLowerCase(Locale.ROOT));
                    if (toggle == null) {
                        toggle = channels.get(channel.name());
                    }
                    if (toggle != null && toggle.isBoolean()) {
                        runtimeSettings.setChannelEnabled(channel, toggle.asBoolean());
                    }
                }
            }

            log.info("Settings updated");
            HttpJson.okMessage(ex, "Settings updated", snapshot());
        });
    }

    Map<String, Object> snapshot() {
        Map<String, Object> data = new LinkedHashMap<>();

        Map<String, Object> network = new LinkedHashMap<>();
        network.put("apiUrl", settings.networkApiUrl());
        network.put("userKey", settings.userKey());
        network.put("clientId", settings.clientId());
        data.put("network", network);

        Map<AlertChannel, Object> channels = new EnumMap<>(AlertChannel.class);
        channels.put(AlertChannel.TELEGRAM, channel(settings.telegramConfigured(), AlertChannel.TELEGRAM,
            "botToken", mask(settings.telegramBotToken()), "chatId", settings.telegramChatId()));
        channels.put(AlertChannel.DISCORD, channel(settings.discordConfigured(), AlertChannel.DISCORD,
            "webhookUrl", mask(settings.discordWebhookUrl()), null, null));
        channels.put(AlertChannel.TWITTER, channel(settings.twitterConfigured(), AlertChannel.TWITTER,
            "apiKey", mask(settings.twitterApiKey()), null, null));
        data.put("channels", channels);

        data.put("autoDefense", runtimeSettings.autoDefense());

        Map<String, Object> monitor = new LinkedHashMap<>();
        monitor.put("intervalMinutes", settings.intervalMinutes());
        monitor.put("alertExpiryHours", settings.alertExpiryHours());
        data.put("monitor", monitor);
        data.put("frontendUrl", settings.frontendUrl());
        return data;
    }

    private Map<String, Object> channel(boolean configured, AlertChannel channel,
                                        String secretName, String maskedSecret,
                                        String extraName, String extraValue) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("configured", configured);
        entry.put("enabled", configured && runtimeSettings.isChannelEnabled(channel));
        entry.put(secretName, maskedSecret);
        if (extraName != null) {
            entry.put(extraName, extraValue);
        }
        return entry;
    }

    static String mask(String secret) {
        if (secret == null || secret.isBlank()) {
            return null;
        }
        if (secret.length() <= 8) {
            return "****";
        }
        return secret.substring(0, 4) + "****" + secret.substring(secret.length() - 4);
    }
}
