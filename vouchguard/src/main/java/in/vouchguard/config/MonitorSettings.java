package in.vouchguard.config;

import in.vouchguard.util.Env;

import java.time.Duration;

/**
 * Startup configuration snapshot assembled from the environment.
 *
 * Values that can change at runtime (auto-defense flags, channel toggles) are
 * seeded from here into {@link RuntimeSettings}.
 */
public record MonitorSettings(
    int port,

    // Trust network
    String networkApiUrl,
    String sessionToken,
    String userKey,
    String clientId,

    // Channels
    String telegramBotToken,
    String telegramChatId,
    String discordWebhookUrl,
    String twitterApiKey,
    String twitterApiSecret,

    // Scheduler
    int intervalMinutes,
    int alertExpiryHours,

    // Auto-defense
    boolean autoDefenseEnabled,
    boolean autoDefenseRequireConfirm,
    int autoDefenseDefaultScore,

    String frontendUrl,
    Duration httpTimeout,

    // Database
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize
) {
    public static MonitorSettings fromEnv() {
        return new MonitorSettings(
            Env.getInt("PORT", 3001),
            Env.get("NETWORK_API_URL", "https://api.ethos.network"),
            Env.get("NETWORK_SESSION_TOKEN", null),
            Env.require("NETWORK_USER_KEY"),
            Env.get("NETWORK_CLIENT_ID", "vouchguard@1.0.0"),
            Env.get("TELEGRAM_BOT_TOKEN", null),
            Env.get("TELEGRAM_CHAT_ID", null),
            Env.get("DISCORD_WEBHOOK_URL", null),
            Env.get("TWITTER_API_KEY", null),
            Env.get("TWITTER_API_SECRET", null),
            Math.max(1, Env.getInt("MONITOR_INTERVAL_MINUTES", 5)),
            Math.max(1, Env.getInt("ALERT_EXPIRY_HOURS", 72)),
            Env.getBool("AUTO_DEFENSE_ENABLED", true),
            Env.getBool("AUTO_DEFENSE_REQUIRE_CONFIRM", true),
            Env.getInt("AUTO_DEFENSE_DEFAULT_SCORE", 3),
            Env.get("FRONTEND_URL", "http://localhost:3000"),
            Duration.ofSeconds(Env.getLong("HTTP_TIMEOUT_SECONDS", 30)),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/vouchguard"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 5)
        );
    }

    public boolean telegramConfigured() {
        return notBlank(telegramBotToken) && notBlank(telegramChatId);
    }

    public boolean discordConfigured() {
        return notBlank(discordWebhookUrl);
    }

    public boolean twitterConfigured() {
        return notBlank(twitterApiKey) && notBlank(twitterApiSecret);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
