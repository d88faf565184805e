package in.vouchguard.testsupport;

import in.vouchguard.config.MonitorSettings;

import java.time.Duration;

public final class TestSettings {

    private TestSettings() {}

    public static MonitorSettings monitorSettings(boolean autoDefenseEnabled, boolean requireConfirm) {
        return new MonitorSettings(
            3001,
            "http://localhost:1",
            null,
            "profileId:1",
            "vouchguard@test",
            "123456:ABCDEFGHIJKLMNOP",
            "-100200300",
            "https://discord.test/api/webhooks/1/abcdefgh",
            null,
            null,
            5,
            72,
            autoDefenseEnabled,
            requireConfirm,
            3,
            "http://dash.test",
            Duration.ofSeconds(2),
            "jdbc:postgresql://localhost:5432/test",
            "postgres",
            "postgres",
            2
        );
    }

    public static MonitorSettings monitorSettings() {
        return monitorSettings(true, true);
    }
}
