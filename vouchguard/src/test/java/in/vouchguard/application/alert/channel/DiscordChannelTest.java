package in.vouchguard.application.alert.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.vouchguard.application.alert.AlertPayload;
import in.vouchguard.application.alert.ChannelDeliveryException;
import in.vouchguard.domain.alert.AlertType;
import in.vouchguard.testsupport.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DiscordChannelTest {

    private static final int TEST_PORT = 19182;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StubHttpServer server;
    private DiscordChannel channel;

    @BeforeEach
    void setUp() {
        server = new StubHttpServer(TEST_PORT, req -> StubHttpServer.Response.json("{\"id\":\"1122334455\"}"));
        channel = new DiscordChannel(server.baseUrl() + "/api/webhooks/1/token", "http://dash.test",
            Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static AlertPayload slash(String comment) {
        return new AlertPayload(AlertType.SLASH,
            new AlertPayload.Party("alice", "0xA11CE", "https://p.test/a", 200L),
            new AlertPayload.Party(null, "0xBAD", null, null),
            0, comment, Instant.parse("2026-03-01T12:00:00Z"), "slash_s1", "10", null);
    }

    @Test
    void testPostsEmbedAndWaitsForMessageId() throws Exception {
        Optional<String> id = channel.send(slash("slashed for spam"));

        assertEquals(Optional.of("1122334455"), id);
        StubHttpServer.Request request = server.lastRequest();
        assertEquals("/api/webhooks/1/token", request.path());
        assertEquals("wait=true", request.query());

        JsonNode body = MAPPER.readTree(request.body());
        JsonNode embed = body.path("embeds").get(0);
        assertEquals(0xFF0000, embed.path("color").asInt());
        assertTrue(embed.path("title").asText().contains("SLASH"));
        assertEquals("Unknown\n`0xBAD`", embed.path("fields").get(1).path("value").asText());

        JsonNode buttons = body.path("components").get(0).path("components");
        assertEquals("c|slash_s1|D", buttons.get(0).path("custom_id").asText());
        assertEquals("i|slash_s1|D", buttons.get(2).path("custom_id").asText());
        assertEquals("http://dash.test/defend/slash_s1",
            body.path("components").get(1).path("components").get(0).path("url").asText());
    }

    @Test
    void testLongCommentIsCutToFieldLimit() {
        JsonNode fields = channel.embed(slash("y".repeat(1500))).path("fields");

        assertEquals(DiscordChannel.FIELD_LIMIT, fields.get(3).path("value").asText().length());
    }

    @Test
    void testMissingIdIsADeliveryFailure() {
        server.respondWith(req -> StubHttpServer.Response.json("{}"));

        assertThrows(ChannelDeliveryException.class, () -> channel.send(slash("x")));
    }

    @Test
    void testPlainNoticeUsesContent() throws Exception {
        assertTrue(channel.sendText("Session token expires soon"));

        JsonNode body = MAPPER.readTree(server.lastRequest().body());
        assertEquals("Session token expires soon", body.path("content").asText());
        assertNull(server.lastRequest().query());
    }
}
