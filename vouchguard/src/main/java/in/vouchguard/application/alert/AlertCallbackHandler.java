package in.vouchguard.application.alert;

import in.vouchguard.application.defense.DefenseService;
import in.vouchguard.domain.alert.AlertStatus;
import in.vouchguard.domain.alert.CallbackData;
import in.vouchguard.domain.defense.DefenseResult;
import in.vouchguard.repository.AlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves an operator's button press on an alert.
 *
 * Every press gets an acknowledgement text; unknown or malformed data is
 * acknowledged without side effects.
 */
public final class AlertCallbackHandler {
    private static final Logger log = LoggerFactory.getLogger(AlertCallbackHandler.class);

    public record CallbackOutcome(boolean handled, String message) {
        static CallbackOutcome ack(String message) {
            return new CallbackOutcome(true, message);
        }

        static CallbackOutcome ignored(String message) {
            return new CallbackOutcome(false, message);
        }
    }

    private final DefenseService defenseService;
    private final AlertRepository alertRepo;

    public AlertCallbackHandler(DefenseService defenseService, AlertRepository alertRepo) {
        this.defenseService = defenseService;
        this.alertRepo = alertRepo;
    }

    public CallbackOutcome handle(String rawData) {
        Optional<CallbackData> parsed = CallbackData.parse(rawData);
        if (parsed.isEmpty()) {
            log.warn("[ALERT] Unknown callback data: {}", rawData);
            return CallbackOutcome.ignored("Unknown action");
        }

        CallbackData data = parsed.get();
        try {
            return switch (data.action()) {
                case CONFIRM -> confirm(data);
                case IGNORE -> ignore(data);
                case EDIT -> {
                    log.info("[ALERT] Edit requested for review {}", data.reviewId());
                    yield CallbackOutcome.ack("Open the dashboard to edit the defense");
                }
            };
        } catch (Exception e) {
            log.error("[ALERT] Callback {} failed for alert {}: {}", data.action(), data.alertId(), e.getMessage(), e);
            return CallbackOutcome.ignored("Error processing action");
        }
    }

    private CallbackOutcome confirm(CallbackData data) {
        log.info("[ALERT] Defense confirmed for review {}", data.reviewId());
        DefenseResult result = defenseService.executeDefense(data.alertId(), data.reviewId());
        return switch (result.outcome()) {
            case POSTED -> CallbackOutcome.ack("Defense posted");
            case CREDENTIAL_EXPIRED -> CallbackOutcome.ack("Session expired - update the token first");
            case NOT_FOUND, INVALID_STATE -> CallbackOutcome.ack("Nothing to confirm: " + result.error());
            case FAILED -> CallbackOutcome.ack("Defense failed: " + result.error());
        };
    }

    private CallbackOutcome ignore(CallbackData data) {
        log.info("[ALERT] Alert ignored for review {}", data.reviewId());
        if (!alertRepo.updateStatus(data.alertId(), AlertStatus.IGNORED)) {
            return CallbackOutcome.ack("Alert not found");
        }
        return CallbackOutcome.ack("Alert ignored");
    }
}
