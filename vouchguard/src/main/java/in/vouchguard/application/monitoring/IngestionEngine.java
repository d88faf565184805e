package in.vouchguard.application.monitoring;

import com.fasterxml.jackson.databind.JsonNode;
import in.vouchguard.application.alert.AlertDispatcher;
import in.vouchguard.application.alert.AlertPayload;
import in.vouchguard.application.defense.DefenseService;
import in.vouchguard.config.RuntimeSettings;
import in.vouchguard.domain.activity.ActivityRecord;
import in.vouchguard.domain.activity.ActivityType;
import in.vouchguard.domain.activity.NormalizedActivity;
import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.domain.alert.AlertType;
import in.vouchguard.domain.defense.DefenseSuggestion;
import in.vouchguard.domain.monitoring.CycleLog;
import in.vouchguard.domain.monitoring.CycleResult;
import in.vouchguard.domain.relation.Relationship;
import in.vouchguard.infrastructure.metrics.MonitorMetrics;
import in.vouchguard.network.NetworkProfile;
import in.vouchguard.network.NetworkVouch;
import in.vouchguard.network.TrustNetworkClient;
import in.vouchguard.repository.ActivityRepository;
import in.vouchguard.repository.AlertRepository;
import in.vouchguard.repository.CycleLogRepository;
import in.vouchguard.repository.RelationshipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One monitor cycle: list vouched relationships, fetch what they received,
 * store new activities and alert on the negative ones.
 *
 * Cycles never overlap. Relationships are processed one at a time, and a
 * failure on one relationship or activity is recorded in the cycle's errors
 * without stopping the rest.
 */
public final class IngestionEngine {
    private static final Logger log = LoggerFactory.getLogger(IngestionEngine.class);

    static final int ACTIVITY_PAGE_LIMIT = 50;
    private static final List<ActivityType> MONITORED_TYPES = List.of(ActivityType.REVIEW, ActivityType.SLASH);

    private final TrustNetworkClient networkClient;
    private final RelationshipRepository relationshipRepo;
    private final ActivityRepository activityRepo;
    private final AlertRepository alertRepo;
    private final CycleLogRepository cycleLogRepo;
    private final AlertDispatcher dispatcher;
    private final DefenseService defenseService;
    private final RuntimeSettings runtimeSettings;
    private final ActivityNormalizer normalizer;
    private final MonitorMetrics metrics;
    private final Clock clock;
    private final String operatorUserKey;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant lastRunAt;

    public IngestionEngine(TrustNetworkClient networkClient,
                           RelationshipRepository relationshipRepo,
                           ActivityRepository activityRepo,
                           AlertRepository alertRepo,
                           CycleLogRepository cycleLogRepo,
                           AlertDispatcher dispatcher,
                           DefenseService defenseService,
                           RuntimeSettings runtimeSettings,
                           ActivityNormalizer normalizer,
                           MonitorMetrics metrics,
                           Clock clock,
                           String operatorUserKey) {
        this.networkClient = networkClient;
        this.relationshipRepo = relationshipRepo;
        this.activityRepo = activityRepo;
        this.alertRepo = alertRepo;
        this.cycleLogRepo = cycleLogRepo;
        this.dispatcher = dispatcher;
        this.defenseService = defenseService;
        this.runtimeSettings = runtimeSettings;
        this.normalizer = normalizer;
        this.metrics = metrics;
        this.clock = clock;
        this.operatorUserKey = operatorUserKey;
    }

    /** Mutable counters for one cycle. */
    private static final class Tally {
        int relationsChecked;
        int activitiesFound;
        int newNegative;
        int alertsSent;
        final List<String> errors = new ArrayList<>();
    }

    /**
     * Run one cycle. Returns immediately with {@link CycleResult#alreadyRunning()}
     * if another cycle is in flight. Never throws.
     */
    public CycleResult runCycle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("[MONITOR] Monitor cycle already running, skipping");
            metrics.recordCycleSkipped();
            return CycleResult.alreadyRunning();
        }

        Instant startedAt = clock.instant();
        Tally tally = new Tally();
        try {
            log.info("[MONITOR] Starting monitor cycle");
            List<NetworkVouch> vouches = listVouches(tally);
            log.info("[MONITOR] Found {} relations to monitor", vouches.size());

            for (NetworkVouch vouch : vouches) {
                try {
                    processRelationship(vouch, tally);
                } catch (Exception e) {
                    String error = "Error processing relation " + vouch.subjectProfileId() + ": " + e.getMessage();
                    log.error("[MONITOR] {}", error);
                    tally.errors.add(error);
                }
            }
        } catch (Exception e) {
            log.error("[MONITOR] Monitor cycle failed: {}", e.getMessage(), e);
            tally.errors.add("Cycle failed: " + e.getMessage());
        } finally {
            running.set(false);
        }

        Instant finishedAt = clock.instant();
        long durationMs = Duration.between(startedAt, finishedAt).toMillis();
        CycleResult result = new CycleResult(tally.relationsChecked, tally.activitiesFound, tally.newNegative,
            tally.alertsSent, tally.errors, durationMs, false);
        lastRunAt = finishedAt;

        try {
            cycleLogRepo.insert(CycleLog.of(result, startedAt));
        } catch (Exception e) {
            log.error("[MONITOR] Failed to write cycle log: {}", e.getMessage());
        }
        metrics.recordCycle(Duration.ofMillis(durationMs), result.errors().size());

        log.info("[MONITOR] Monitor cycle completed in {}ms: {} relations, {} new negative, {} alerts sent, {} errors",
            durationMs, result.relationsChecked(), result.newNegative(), result.alertsSent(), result.errors().size());
        if (result.hasErrors()) {
            log.warn("[MONITOR] Cycle errors: {}", result.errors());
        }
        return result;
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<Instant> lastRunAt() {
        return Optional.ofNullable(lastRunAt);
    }

    private List<NetworkVouch> listVouches(Tally tally) {
        try {
            return networkClient.listVouches(operatorUserKey);
        } catch (Exception e) {
            String error = "Failed to list vouches: " + e.getMessage();
            log.error("[MONITOR] {}", error);
            tally.errors.add(error);
            return List.of();
        }
    }

    private void processRelationship(NetworkVouch vouch, Tally tally) {
        tally.relationsChecked++;
        String relationUserKey = TrustNetworkClient.profileIdToUserKey(vouch.subjectProfileId());

        Optional<NetworkProfile> profile = vouch.subjectUser().filter(NetworkProfile::hasAddress);
        if (profile.isEmpty()) {
            profile = networkClient.getProfile(relationUserKey).filter(NetworkProfile::hasAddress);
        }
        if (profile.isEmpty()) {
            log.debug("[MONITOR] No address for relation {}, skipping", relationUserKey);
            return;
        }

        Relationship relationship = Relationship.observed(
            Long.toString(vouch.id()),
            relationUserKey,
            profile.get().name(),
            profile.get().address(),
            profile.get().avatarUrl(),
            vouch.isActive());
        relationshipRepo.upsert(relationship);

        if (!relationship.active()) {
            log.debug("[MONITOR] Relation {} is no longer vouched, not fetching activities", relationUserKey);
            return;
        }

        List<JsonNode> activities = networkClient.listReceivedActivities(
            relationUserKey, MONITORED_TYPES, ACTIVITY_PAGE_LIMIT, 0);
        tally.activitiesFound += activities.size();

        for (JsonNode activity : activities) {
            try {
                processActivity(activity, relationship, vouch.subjectProfileId(), tally);
            } catch (Exception e) {
                String error = "Error processing activity for relation " + relationship.id() + ": " + e.getMessage();
                log.error("[MONITOR] {}", error);
                tally.errors.add(error);
            }
        }
    }

    private void processActivity(JsonNode raw, Relationship relationship, long subjectProfileId, Tally tally) {
        Instant now = clock.instant();
        NormalizedActivity activity = normalizer.normalize(raw, now);

        if (activityRepo.findByActivityId(activity.activityId()).isPresent()) {
            return;
        }

        String authorKey = activity.authorProfileId() != null
            ? TrustNetworkClient.profileIdToUserKey(activity.authorProfileId())
            : activity.authorAddress() != null ? TrustNetworkClient.ADDRESS_PREFIX + activity.authorAddress() : null;

        ActivityRecord record = new ActivityRecord(
            ActivityRecord.recordId(activity.type(), activity.activityId()),
            relationship.id(),
            activity.activityId(),
            activity.type(),
            authorKey,
            activity.authorName(),
            activity.authorAddress(),
            activity.score(),
            activity.comment(),
            activity.negative(),
            false,
            activity.createdAt());

        if (!activityRepo.insertIfAbsent(record)) {
            return;
        }
        metrics.recordActivityIngested(activity.type());

        if (!activity.negative()) {
            return;
        }
        tally.newNegative++;
        log.info("[MONITOR] New negative {} on {} by {} (score {})",
            activity.type().wireName(), relationship.name(), activity.authorName(), activity.score());

        RuntimeSettings.AutoDefense autoDefense = runtimeSettings.autoDefense();
        DefenseSuggestion suggestion = defenseService.suggestDefense(autoDefense.defaultScore());
        AlertType alertType = AlertType.forActivity(activity.type());

        AlertPayload payload = new AlertPayload(
            alertType,
            new AlertPayload.Party(relationship.name(), relationship.address(),
                networkClient.profileUrl(relationship.address()), subjectProfileId),
            new AlertPayload.Party(activity.authorName(), activity.authorAddress(), null,
                activity.authorProfileId()),
            activity.score(),
            activity.comment(),
            now,
            record.id(),
            relationship.id(),
            autoDefense.enabled()
                ? new AlertPayload.AutoDefense(autoDefense.requireConfirm(), suggestion.score(), suggestion.comment())
                : null);

        Map<AlertChannel, String> delivered = dispatcher.sendAlert(payload);
        for (Map.Entry<AlertChannel, String> entry : delivered.entrySet()) {
            alertRepo.insertIfAbsent(Alert.delivered(record.id(), relationship.id(), alertType,
                entry.getKey(), entry.getValue(), now));
            tally.alertsSent++;
        }

        if (autoDefense.enabled()) {
            defenseService.createPendingDefense(record.id(), relationship.userKey(), suggestion);
        }

        activityRepo.markAlerted(record.id());
    }
}
