package in.vouchguard.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import in.vouchguard.application.defense.DefenseService;
import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.domain.alert.AlertType;
import in.vouchguard.domain.defense.DefenseResult;
import in.vouchguard.domain.defense.DefenseSuggestion;
import in.vouchguard.testsupport.InMemoryRepositories;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DefenseHandlerTest {

    private static final int TEST_PORT = 19184;

    private DefenseService defenseService;
    private InMemoryRepositories.Alerts alerts;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        defenseService = mock(DefenseService.class);
        alerts = new InMemoryRepositories.Alerts();
        DefenseHandler handler = new DefenseHandler(defenseService, alerts);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(new BlockingHandler(Handlers.routing()
                .post("/api/defend", handler::defend)
                .post("/api/defend/confirm/{alertId}", handler::confirm)
                .get("/api/defend/suggest", handler::suggest)))
            .build();
        server.start();
        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return HttpJson.MAPPER.readTree(response.body());
    }

    @Test
    void testValidDefenseIsPosted() throws Exception {
        when(defenseService.postCustomDefense("profileId:200", 4, "Known them for years", "review_1", null))
            .thenReturn(DefenseResult.posted("d-1", "net-1", "0xtx"));

        HttpResponse<String> response = post("/api/defend", """
            {"targetUserkey":"profileId:200","score":4,"comment":"Known them for years","reviewId":"review_1"}
            """);

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertTrue(body.path("success").asBoolean());
        assertEquals("net-1", body.path("data").path("networkReviewId").asText());
    }

    @Test
    void testOutOfRangeScoreIsRejected() throws Exception {
        HttpResponse<String> response = post("/api/defend", """
            {"targetUserkey":"profileId:200","score":6,"comment":"x"}
            """);

        assertEquals(400, response.statusCode());
        assertFalse(json(response).path("success").asBoolean());
        verifyNoInteractions(defenseService);
    }

    @Test
    void testScoreBeyondIntRangeIsRejected() throws Exception {
        // 2^32 + 1 would wrap to 1 if narrowed
        HttpResponse<String> response = post("/api/defend", """
            {"targetUserkey":"profileId:200","score":4294967297,"comment":"x"}
            """);

        assertEquals(400, response.statusCode());
        verifyNoInteractions(defenseService);
    }

    @Test
    void testMissingTargetAndOverlongCommentAreRejected() throws Exception {
        assertEquals(400, post("/api/defend", "{\"score\":3,\"comment\":\"x\"}").statusCode());
        assertEquals(400, post("/api/defend",
            "{\"targetUserkey\":\"profileId:1\",\"score\":3,\"comment\":\"" + "c".repeat(1001) + "\"}").statusCode());
        assertEquals(400, post("/api/defend", "not json").statusCode());
        verifyNoInteractions(defenseService);
    }

    @Test
    void testExpiredCredentialIsUnauthorized() throws Exception {
        when(defenseService.postCustomDefense(anyString(), anyInt(), anyString(), any(), any()))
            .thenReturn(DefenseResult.credentialExpired());

        HttpResponse<String> response = post("/api/defend", """
            {"targetUserkey":"profileId:200","score":3,"comment":"ok"}
            """);

        assertEquals(401, response.statusCode());
        assertTrue(json(response).path("error").asText().contains("/api/token/update"));
    }

    @Test
    void testConfirmLooksUpAlertReview() throws Exception {
        alerts.insertIfAbsent(Alert.delivered("review_1", "10", AlertType.NEGATIVE_REVIEW, AlertChannel.TELEGRAM,
            "m", Instant.parse("2026-03-01T12:00:00Z")));
        when(defenseService.executeDefense("review_1_TELEGRAM", "review_1"))
            .thenReturn(DefenseResult.posted("d-1", "net-1", null));

        assertEquals(200, post("/api/defend/confirm/review_1_TELEGRAM", "").statusCode());
        assertEquals(404, post("/api/defend/confirm/unknown", "").statusCode());
    }

    @Test
    void testSuggestReturnsTemplate() throws Exception {
        when(defenseService.suggestDefense(2)).thenReturn(new DefenseSuggestion(2, "Good standing member"));

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/api/defend/suggest?score=2"))
            .GET()
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertEquals("Good standing member", json(response).path("data").path("comment").asText());
    }
}
