package in.vouchguard.transport.http;

import in.vouchguard.config.RuntimeSettings;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.domain.defense.DefenseResult;
import in.vouchguard.testsupport.InMemoryRepositories;
import in.vouchguard.testsupport.TestSettings;
import io.undertow.util.StatusCodes;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SettingsHandlerTest {

    @Test
    void testSecretsAreMasked() {
        assertEquals("1234****MNOP", SettingsHandler.mask("123456:ABCDEFGHIJKLMNOP"));
        assertEquals("****", SettingsHandler.mask("short"));
        assertNull(SettingsHandler.mask(null));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSnapshotNeverExposesRawSecrets() throws Exception {
        RuntimeSettings runtime = new RuntimeSettings(TestSettings.monitorSettings(),
            new InMemoryRepositories.Settings());
        runtime.setChannelEnabled(AlertChannel.DISCORD, false);
        SettingsHandler handler = new SettingsHandler(TestSettings.monitorSettings(), runtime);

        Map<String, Object> snapshot = handler.snapshot();
        String json = HttpJson.MAPPER.writeValueAsString(snapshot);

        assertFalse(json.contains("ABCDEFGHIJKLMNOP"));
        assertFalse(json.contains("abcdefgh"));
        Map<AlertChannel, Object> channels = (Map<AlertChannel, Object>) snapshot.get("channels");
        Map<String, Object> discord = (Map<String, Object>) channels.get(AlertChannel.DISCORD);
        assertEquals(true, discord.get("configured"));
        assertEquals(false, discord.get("enabled"));
        Map<String, Object> twitter = (Map<String, Object>) channels.get(AlertChannel.TWITTER);
        assertEquals(false, twitter.get("configured"));
    }

    @Test
    void testDefenseOutcomesMapToHttpStatus() {
        assertEquals(StatusCodes.OK, DefenseHandler.statusFor(DefenseResult.Outcome.POSTED));
        assertEquals(StatusCodes.UNAUTHORIZED, DefenseHandler.statusFor(DefenseResult.Outcome.CREDENTIAL_EXPIRED));
        assertEquals(StatusCodes.NOT_FOUND, DefenseHandler.statusFor(DefenseResult.Outcome.NOT_FOUND));
        assertEquals(StatusCodes.CONFLICT, DefenseHandler.statusFor(DefenseResult.Outcome.INVALID_STATE));
        assertEquals(StatusCodes.BAD_GATEWAY, DefenseHandler.statusFor(DefenseResult.Outcome.FAILED));
    }
}
