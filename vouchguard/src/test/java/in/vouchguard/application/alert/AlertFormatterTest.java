package in.vouchguard.application.alert;

import in.vouchguard.domain.alert.AlertType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AlertFormatterTest {

    @Test
    void testShortensLongAddresses() {
        assertEquals("0xA11C...ABCD", AlertFormatter.shortAddress("0xA11CE0000000000000000000000000000000ABCD"));
        assertEquals("0xBAD", AlertFormatter.shortAddress("0xBAD"));
        assertEquals("unknown", AlertFormatter.shortAddress(null));
    }

    @Test
    void testTruncateMarksCutText() {
        assertEquals("abc...", AlertFormatter.truncate("abcdef", 3));
        assertEquals("abc", AlertFormatter.truncate("abc", 3));
        assertEquals("abc", AlertFormatter.cut("abcdef", 3));
    }

    @Test
    void testTelegramMessageEscapesUserText() {
        AlertPayload payload = new AlertPayload(
            AlertType.NEGATIVE_REVIEW,
            new AlertPayload.Party("<alice>", "0xA11CE0000000000000000000000000000000ABCD", "https://p.test/a", 1L),
            new AlertPayload.Party(null, null, null, null),
            -1,
            "x".repeat(250) + "<script>",
            Instant.parse("2026-03-01T12:00:00Z"),
            "review_1",
            "10",
            null);

        String html = AlertFormatter.telegramHtml(payload);

        assertTrue(html.contains("&lt;alice&gt;"));
        assertFalse(html.contains("<script>"));
        assertTrue(html.contains("x".repeat(200) + "..."));
        assertTrue(html.contains("Attacker:</b> Unknown"));
        assertTrue(html.contains("2026-03-01 12:00:00 UTC"));
        assertFalse(html.contains("Suggested defense"));
    }

    @Test
    void testSlashUsesItsOwnLabel() {
        AlertPayload payload = new AlertPayload(AlertType.SLASH,
            new AlertPayload.Party("alice", "0x1", null, 1L),
            new AlertPayload.Party("bob", "0x2", null, 2L),
            0, null, Instant.EPOCH, "slash_1", "10",
            new AlertPayload.AutoDefense(false, 3, "Solid reputation"));

        String html = AlertFormatter.telegramHtml(payload);

        assertTrue(html.startsWith("⚡"));
        assertTrue(html.contains("SLASH DETECTED"));
        assertTrue(html.contains("Score: +3"));
        assertTrue(AlertFormatter.compactText(payload, "http://dash.test").endsWith("http://dash.test/defend/slash_1"));
    }
}
