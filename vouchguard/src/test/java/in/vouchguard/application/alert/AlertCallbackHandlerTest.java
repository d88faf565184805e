package in.vouchguard.application.alert;

import in.vouchguard.application.defense.DefenseService;
import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.domain.alert.AlertStatus;
import in.vouchguard.domain.alert.AlertType;
import in.vouchguard.domain.defense.DefenseResult;
import in.vouchguard.testsupport.InMemoryRepositories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertCallbackHandlerTest {

    @Mock
    private DefenseService defenseService;

    private InMemoryRepositories.Alerts alerts;
    private AlertCallbackHandler handler;

    @BeforeEach
    void setUp() {
        alerts = new InMemoryRepositories.Alerts();
        alerts.insertIfAbsent(Alert.delivered("review_1", "10", AlertType.NEGATIVE_REVIEW,
            AlertChannel.TELEGRAM, "77", Instant.parse("2026-03-01T12:00:00Z")));
        handler = new AlertCallbackHandler(defenseService, alerts);
    }

    @Test
    void testConfirmExecutesDefense() {
        when(defenseService.executeDefense("review_1_TELEGRAM", "review_1"))
            .thenReturn(DefenseResult.posted("d-1", "net-9", "0xtx"));

        AlertCallbackHandler.CallbackOutcome outcome = handler.handle("c|review_1|T");

        assertTrue(outcome.handled());
        assertEquals("Defense posted", outcome.message());
    }

    @Test
    void testConfirmReportsExpiredSession() {
        when(defenseService.executeDefense(anyString(), anyString()))
            .thenReturn(DefenseResult.credentialExpired());

        AlertCallbackHandler.CallbackOutcome outcome = handler.handle("c|review_1|T");

        assertTrue(outcome.message().startsWith("Session expired"));
    }

    @Test
    void testIgnoreMarksAlertIgnored() {
        AlertCallbackHandler.CallbackOutcome outcome = handler.handle("i|review_1|T");

        assertEquals("Alert ignored", outcome.message());
        assertEquals(AlertStatus.IGNORED, alerts.findById("review_1_TELEGRAM").orElseThrow().status());
        verifyNoInteractions(defenseService);
    }

    @Test
    void testIgnoreOfUnknownAlertIsReported() {
        assertEquals("Alert not found", handler.handle("i|review_1|D").message());
    }

    @Test
    void testEditOnlyAcknowledges() {
        AlertCallbackHandler.CallbackOutcome outcome = handler.handle("e|review_1|T");

        assertTrue(outcome.handled());
        assertEquals(AlertStatus.PENDING, alerts.findById("review_1_TELEGRAM").orElseThrow().status());
        verifyNoInteractions(defenseService);
    }

    @Test
    void testMalformedDataIsIgnored() {
        AlertCallbackHandler.CallbackOutcome outcome = handler.handle("d|review_1|T");

        assertFalse(outcome.handled());
        assertEquals("Unknown action", outcome.message());
    }

    @Test
    void testServiceFailureIsContained() {
        when(defenseService.executeDefense(anyString(), anyString())).thenThrow(new IllegalStateException("db"));

        AlertCallbackHandler.CallbackOutcome outcome = handler.handle("c|review_1|T");

        assertFalse(outcome.handled());
        assertEquals("Error processing action", outcome.message());
    }
}
