package in.vouchguard.config;

import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.repository.SettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Operator-adjustable settings, persisted in the app_config table.
 *
 * Channel toggles only narrow what is configured: a channel without
 * credentials stays disabled whatever its toggle says.
 */
public final class RuntimeSettings {
    private static final Logger log = LoggerFactory.getLogger(RuntimeSettings.class);

    static final String KEY_AUTO_DEFENSE_ENABLED = "auto_defense.enabled";
    static final String KEY_AUTO_DEFENSE_REQUIRE_CONFIRM = "auto_defense.require_confirm";
    static final String KEY_AUTO_DEFENSE_DEFAULT_SCORE = "auto_defense.default_score";
    static final String KEY_CHANNEL_PREFIX = "channel.enabled.";

    public record AutoDefense(boolean enabled, boolean requireConfirm, int defaultScore) {}

    private final SettingsRepository settingsRepo;
    private final AtomicReference<AutoDefense> autoDefense;
    private final Map<AlertChannel, Boolean> channelToggles = new ConcurrentHashMap<>();

    public RuntimeSettings(MonitorSettings settings, SettingsRepository settingsRepo) {
        this.settingsRepo = settingsRepo;
        this.autoDefense = new AtomicReference<>(new AutoDefense(
            settings.autoDefenseEnabled(),
            settings.autoDefenseRequireConfirm(),
            settings.autoDefenseDefaultScore()));
    }

    /**
     * Overlay values saved by an earlier process on top of the environment defaults.
     */
    public void loadPersisted() {
        AutoDefense current = autoDefense.get();
        boolean enabled = settingsRepo.get(KEY_AUTO_DEFENSE_ENABLED)
            .map(Boolean::parseBoolean).orElse(current.enabled());
        boolean requireConfirm = settingsRepo.get(KEY_AUTO_DEFENSE_REQUIRE_CONFIRM)
            .map(Boolean::parseBoolean).orElse(current.requireConfirm());
        int defaultScore = settingsRepo.get(KEY_AUTO_DEFENSE_DEFAULT_SCORE)
            .flatMap(RuntimeSettings::parseInt).orElse(current.defaultScore());
        autoDefense.set(new AutoDefense(enabled, requireConfirm, defaultScore));

        for (AlertChannel channel : AlertChannel.values()) {
            settingsRepo.get(KEY_CHANNEL_PREFIX + channel.name())
                .map(Boolean::parseBoolean)
                .ifPresent(on -> channelToggles.put(channel, on));
        }
        log.info("[SETTINGS] Loaded runtime settings: autoDefense={}, channelToggles={}",
            autoDefense.get(), channelToggles);
    }

    public AutoDefense autoDefense() {
        return autoDefense.get();
    }

    public boolean isChannelEnabled(AlertChannel channel) {
        return channelToggles.getOrDefault(channel, Boolean.TRUE);
    }

    public Map<AlertChannel, Boolean> channelToggles() {
        Map<AlertChannel, Boolean> toggles = new EnumMap<>(AlertChannel.class);
        for (AlertChannel channel : AlertChannel.values()) {
            toggles.put(channel, isChannelEnabled(channel));
        }
        return toggles;
    }

    public void updateAutoDefense(AutoDefense updated) {
        autoDefense.set(updated);
        settingsRepo.set(KEY_AUTO_DEFENSE_ENABLED, Boolean.toString(updated.enabled()));
        settingsRepo.set(KEY_AUTO_DEFENSE_REQUIRE_CONFIRM, Boolean.toString(updated.requireConfirm()));
        settingsRepo.set(KEY_AUTO_DEFENSE_DEFAULT_SCORE, Integer.toString(updated.defaultScore()));
        log.info("[SETTINGS] Auto-defense updated: {}", updated);
    }

    public void setChannelEnabled(AlertChannel channel, boolean enabled) {
        channelToggles.put(channel, enabled);
        settingsRepo.set(KEY_CHANNEL_PREFIX + channel.name(), Boolean.toString(enabled));
        log.info("[SETTINGS] Channel {} {}", channel, enabled ? "enabled" : "disabled");
    }

    private static Optional<Integer> parseInt(String value) {
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
