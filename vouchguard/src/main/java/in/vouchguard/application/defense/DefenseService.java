package in.vouchguard.application.defense;

import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.alert.AlertStatus;
import in.vouchguard.domain.defense.Defense;
import in.vouchguard.domain.defense.DefenseResult;
import in.vouchguard.domain.defense.DefenseSuggestion;
import in.vouchguard.infrastructure.metrics.MonitorMetrics;
import in.vouchguard.network.CredentialGate;
import in.vouchguard.network.ReviewSubmission;
import in.vouchguard.network.TrustNetworkClient;
import in.vouchguard.repository.AlertRepository;
import in.vouchguard.repository.DefenseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prepares, confirms and submits defenses.
 *
 * The credential is checked before any record is touched, and every state
 * change goes through a status-guarded update, so a refused request leaves the
 * store as it was.
 */
public final class DefenseService {
    private static final Logger log = LoggerFactory.getLogger(DefenseService.class);

    static final int PENDING_LIST_LIMIT = 100;

    private final DefenseRepository defenseRepo;
    private final AlertRepository alertRepo;
    private final TrustNetworkClient networkClient;
    private final CredentialGate credentialGate;
    private final DefenseTemplates templates;
    private final MonitorMetrics metrics;
    private final Clock clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public DefenseService(DefenseRepository defenseRepo, AlertRepository alertRepo,
                          TrustNetworkClient networkClient, CredentialGate credentialGate,
                          DefenseTemplates templates, MonitorMetrics metrics, Clock clock) {
        this.defenseRepo = defenseRepo;
        this.alertRepo = alertRepo;
        this.networkClient = networkClient;
        this.credentialGate = credentialGate;
        this.templates = templates;
        this.metrics = metrics;
        this.clock = clock;
    }

    public DefenseSuggestion suggestDefense(int requestedScore) {
        return templates.suggestDefense(requestedScore);
    }

    /**
     * Record a PENDING defense for the review unless one is already active.
     *
     * @return true if a new defense was created
     */
    public boolean createPendingDefense(String reviewId, String targetKey, DefenseSuggestion suggestion) {
        if (defenseRepo.findActiveByReviewId(reviewId).isPresent()) {
            log.debug("[DEFENSE] Active defense already exists for review {}", reviewId);
            return false;
        }
        Defense defense = Defense.pending(UUID.randomUUID().toString(), reviewId, targetKey,
            suggestion.score(), suggestion.comment(), clock.instant());
        boolean created = defenseRepo.insertIfNoActive(defense);
        if (created) {
            log.info("[DEFENSE] Pending defense {} created for review {}", defense.id(), reviewId);
        }
        return created;
    }

    /**
     * Confirm and submit the active defense prepared for a review.
     */
    public DefenseResult executeDefense(String alertId, String reviewId) {
        DefenseResult result = doExecute(alertId, reviewId);
        metrics.recordDefense(result.outcome());
        return result;
    }

    private DefenseResult doExecute(String alertId, String reviewId) {
        Optional<Alert> alert = alertRepo.findById(alertId);
        if (alert.isEmpty()) {
            log.warn("[DEFENSE] Alert not found: {}", alertId);
            return DefenseResult.notFound("Alert not found: " + alertId);
        }

        Optional<Defense> active = defenseRepo.findActiveByReviewId(reviewId);
        if (active.isEmpty()) {
            log.warn("[DEFENSE] No pending defense for review: {}", reviewId);
            return DefenseResult.notFound("No pending defense for review: " + reviewId);
        }

        if (!credentialGate.isCredentialValid()) {
            log.warn("[DEFENSE] Session expired; defense for review {} not submitted", reviewId);
            return DefenseResult.credentialExpired();
        }

        Defense defense = active.get();
        if (!inFlight.add(defense.id())) {
            return DefenseResult.invalidState(defense.id(), "Defense is already being submitted");
        }
        try {
            if (!defenseRepo.confirm(defense.id())) {
                log.warn("[DEFENSE] Defense {} is no longer active", defense.id());
                return DefenseResult.invalidState(defense.id(), "Defense is no longer pending");
            }

            ReviewSubmission submission = submit(defense.targetKey(), defense.score(), defense.comment());
            if (!submission.success()) {
                defenseRepo.markFailed(defense.id(), submission.error());
                log.error("[DEFENSE] Defense failed for {}: {}", defense.targetKey(), submission.error());
                return DefenseResult.failed(defense.id(), submission.error());
            }

            if (!defenseRepo.markPosted(defense.id(), defense.score(), defense.comment(),
                    submission.reviewId(), submission.txHash())) {
                log.warn("[DEFENSE] Defense {} posted but its status had already moved on", defense.id());
            }
            alertRepo.updateStatus(alertId, AlertStatus.CONFIRMED);
            alertRepo.confirmPendingByReviewId(reviewId);
            log.info("[DEFENSE] Defense posted for {} (review {})", defense.targetKey(), submission.reviewId());
            return DefenseResult.posted(defense.id(), submission.reviewId(), submission.txHash());
        } finally {
            inFlight.remove(defense.id());
        }
    }

    /**
     * Submit an operator-written review. When it answers a review with an active
     * defense, that defense is closed as POSTED with the submitted score and comment.
     */
    public DefenseResult postCustomDefense(String targetKey, int score, String comment,
                                           String reviewId, String alertId) {
        DefenseResult result = doPostCustom(targetKey, score, comment, reviewId, alertId);
        metrics.recordDefense(result.outcome());
        return result;
    }

    private DefenseResult doPostCustom(String targetKey, int score, String comment,
                                       String reviewId, String alertId) {
        if (!credentialGate.isCredentialValid()) {
            log.warn("[DEFENSE] Session expired; custom defense for {} not submitted", targetKey);
            return DefenseResult.credentialExpired();
        }

        ReviewSubmission submission = submit(targetKey, score, comment);
        if (!submission.success()) {
            log.error("[DEFENSE] Custom defense failed for {}: {}", targetKey, submission.error());
            return DefenseResult.failed(null, submission.error());
        }

        String defenseId = null;
        if (reviewId != null) {
            Optional<Defense> active = defenseRepo.findActiveByReviewId(reviewId);
            if (active.isPresent()) {
                defenseId = active.get().id();
                defenseRepo.markPosted(defenseId, score, comment, submission.reviewId(), submission.txHash());
            }
        }
        if (alertId != null) {
            alertRepo.updateStatus(alertId, AlertStatus.CONFIRMED);
        }

        log.info("[DEFENSE] Custom defense posted for {}: score={}", targetKey, score);
        return DefenseResult.posted(defenseId, submission.reviewId(), submission.txHash());
    }

    public List<PendingDefense> pendingDefenses() {
        List<PendingDefense> pending = new ArrayList<>();
        for (Alert alert : alertRepo.find(AlertStatus.PENDING, null, PENDING_LIST_LIMIT, 0)) {
            defenseRepo.findActiveByReviewId(alert.reviewId())
                .ifPresent(defense -> pending.add(new PendingDefense(alert, defense)));
        }
        return pending;
    }

    private ReviewSubmission submit(String targetKey, int score, String comment) {
        try {
            return networkClient.submitReview(targetKey, score, comment);
        } catch (Exception e) {
            log.error("[DEFENSE] Review submission for {} threw: {}", targetKey, e.getMessage());
            return ReviewSubmission.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
