package in.vouchguard.testsupport;

import in.vouchguard.domain.activity.ActivityRecord;
import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.alert.AlertStatus;
import in.vouchguard.domain.defense.Defense;
import in.vouchguard.domain.defense.DefenseStatus;
import in.vouchguard.domain.monitoring.CycleLog;
import in.vouchguard.domain.relation.Relationship;
import in.vouchguard.repository.ActivityRepository;
import in.vouchguard.repository.AlertRepository;
import in.vouchguard.repository.CycleLogRepository;
import in.vouchguard.repository.DefenseRepository;
import in.vouchguard.repository.RelationshipRepository;
import in.vouchguard.repository.SettingsRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed repositories with the same conflict and guard rules as the
 * Postgres implementations.
 */
public final class InMemoryRepositories {

    private InMemoryRepositories() {}

    public static class Settings implements SettingsRepository {
        public final Map<String, String> values = new ConcurrentHashMap<>();

        @Override
        public Optional<String> get(String key) {
            return Optional.ofNullable(values.get(key));
        }

        @Override
        public void set(String key, String value) {
            values.put(key, value);
        }
    }

    public static final class Relationships implements RelationshipRepository {
        public final Map<String, Relationship> rows = new ConcurrentHashMap<>();

        @Override
        public synchronized void upsert(Relationship r) {
            Relationship existing = rows.get(r.id());
            Instant now = Instant.now();
            if (existing == null) {
                rows.put(r.id(), new Relationship(r.id(), r.userKey(), r.name(), r.address(), r.avatarUrl(),
                    r.active(), null, now, now));
            } else {
                rows.put(r.id(), new Relationship(r.id(), r.userKey(), r.name(), r.address(), r.avatarUrl(),
                    r.active(), existing.score(), existing.createdAt(), now));
            }
        }

        @Override
        public Optional<Relationship> findById(String id) {
            return Optional.ofNullable(rows.get(id));
        }

        @Override
        public List<Relationship> findAll(Boolean active) {
            return rows.values().stream()
                .filter(r -> active == null || r.active() == active)
                .toList();
        }

        @Override
        public synchronized void updateScore(String id, int score) {
            Relationship r = rows.get(id);
            if (r != null) {
                rows.put(id, new Relationship(r.id(), r.userKey(), r.name(), r.address(), r.avatarUrl(),
                    r.active(), score, r.createdAt(), Instant.now()));
            }
        }

        @Override
        public int count() {
            return rows.size();
        }

        @Override
        public int countActive() {
            return (int) rows.values().stream().filter(Relationship::active).count();
        }
    }

    public static final class Activities implements ActivityRepository {
        public final Map<String, ActivityRecord> rows = new ConcurrentHashMap<>();

        @Override
        public synchronized boolean insertIfAbsent(ActivityRecord record) {
            boolean duplicate = rows.containsKey(record.id())
                || rows.values().stream().anyMatch(r -> r.activityId().equals(record.activityId()));
            if (duplicate) {
                return false;
            }
            rows.put(record.id(), record);
            return true;
        }

        @Override
        public Optional<ActivityRecord> findByActivityId(String activityId) {
            return rows.values().stream().filter(r -> r.activityId().equals(activityId)).findFirst();
        }

        @Override
        public synchronized void markAlerted(String id) {
            rows.computeIfPresent(id, (k, r) -> r.withAlerted());
        }

        @Override
        public List<ActivityRecord> find(Boolean negative, String relationId, int limit, int offset) {
            return rows.values().stream()
                .filter(r -> negative == null || r.negative() == negative)
                .filter(r -> relationId == null || r.relationId().equals(relationId))
                .sorted(Comparator.comparing(ActivityRecord::createdAt).reversed())
                .skip(offset)
                .limit(limit)
                .toList();
        }

        @Override
        public int count() {
            return rows.size();
        }

        @Override
        public int countNegative() {
            return (int) rows.values().stream().filter(ActivityRecord::negative).count();
        }
    }

    public static final class Alerts implements AlertRepository {
        public final Map<String, Alert> rows = new ConcurrentHashMap<>();

        @Override
        public synchronized boolean insertIfAbsent(Alert alert) {
            return rows.putIfAbsent(alert.id(), alert) == null;
        }

        @Override
        public Optional<Alert> findById(String id) {
            return Optional.ofNullable(rows.get(id));
        }

        @Override
        public List<Alert> find(AlertStatus status, String relationId, int limit, int offset) {
            return rows.values().stream()
                .filter(a -> status == null || a.status() == status)
                .filter(a -> relationId == null || a.relationId().equals(relationId))
                .sorted(Comparator.comparing(Alert::sentAt).reversed())
                .skip(offset)
                .limit(limit)
                .toList();
        }

        @Override
        public synchronized boolean updateStatus(String id, AlertStatus status) {
            Alert a = rows.get(id);
            if (a == null) {
                return false;
            }
            rows.put(id, withStatus(a, status));
            return true;
        }

        @Override
        public synchronized int confirmPendingByReviewId(String reviewId) {
            int updated = 0;
            for (Alert a : new ArrayList<>(rows.values())) {
                if (a.reviewId().equals(reviewId) && a.isPending()) {
                    rows.put(a.id(), withStatus(a, AlertStatus.CONFIRMED));
                    updated++;
                }
            }
            return updated;
        }

        @Override
        public synchronized int expirePendingBefore(Instant cutoff) {
            int updated = 0;
            for (Alert a : new ArrayList<>(rows.values())) {
                if (a.isPending() && a.sentAt().isBefore(cutoff)) {
                    rows.put(a.id(), withStatus(a, AlertStatus.EXPIRED));
                    updated++;
                }
            }
            return updated;
        }

        @Override
        public int count() {
            return rows.size();
        }

        @Override
        public int countByStatus(AlertStatus status) {
            return (int) rows.values().stream().filter(a -> a.status() == status).count();
        }

        private static Alert withStatus(Alert a, AlertStatus status) {
            return new Alert(a.id(), a.reviewId(), a.relationId(), a.type(), a.channel(), status,
                a.messageId(), a.sentAt(), Instant.now());
        }
    }

    public static final class Defenses implements DefenseRepository {
        public final Map<String, Defense> rows = new ConcurrentHashMap<>();

        @Override
        public synchronized boolean insertIfNoActive(Defense defense) {
            if (findActiveByReviewId(defense.reviewId()).isPresent() || rows.containsKey(defense.id())) {
                return false;
            }
            rows.put(defense.id(), defense);
            return true;
        }

        @Override
        public Optional<Defense> findById(String id) {
            return Optional.ofNullable(rows.get(id));
        }

        @Override
        public Optional<Defense> findActiveByReviewId(String reviewId) {
            return rows.values().stream()
                .filter(d -> d.reviewId().equals(reviewId) && d.isActive())
                .max(Comparator.comparing(Defense::createdAt));
        }

        @Override
        public synchronized boolean confirm(String id) {
            Defense d = rows.get(id);
            if (d == null || !d.isActive()) {
                return false;
            }
            rows.put(id, new Defense(d.id(), d.reviewId(), d.targetKey(), d.score(), d.comment(),
                DefenseStatus.CONFIRMED, d.networkReviewId(), d.txHash(), d.error(), d.createdAt(), d.postedAt()));
            return true;
        }

        @Override
        public synchronized boolean markPosted(String id, int score, String comment,
                                               String networkReviewId, String txHash) {
            Defense d = rows.get(id);
            if (d == null || !d.isActive()) {
                return false;
            }
            rows.put(id, new Defense(d.id(), d.reviewId(), d.targetKey(), score, comment,
                DefenseStatus.POSTED, networkReviewId, txHash, null, d.createdAt(), Instant.now()));
            return true;
        }

        @Override
        public synchronized boolean markFailed(String id, String error) {
            Defense d = rows.get(id);
            if (d == null || !d.isActive()) {
                return false;
            }
            rows.put(id, new Defense(d.id(), d.reviewId(), d.targetKey(), d.score(), d.comment(),
                DefenseStatus.FAILED, d.networkReviewId(), d.txHash(), error, d.createdAt(), d.postedAt()));
            return true;
        }

        @Override
        public int countByStatus(DefenseStatus status) {
            return (int) rows.values().stream().filter(d -> d.status() == status).count();
        }
    }

    public static final class CycleLogs implements CycleLogRepository {
        private final AtomicLong sequence = new AtomicLong();
        public final List<CycleLog> rows = new CopyOnWriteArrayList<>();

        @Override
        public void insert(CycleLog c) {
            rows.add(new CycleLog(sequence.incrementAndGet(), c.relationsChecked(), c.activitiesFound(),
                c.newNegative(), c.alertsSent(), c.errors(), c.durationMs(), c.runAt()));
        }

        @Override
        public List<CycleLog> findRecent(int limit) {
            return rows.stream()
                .sorted(Comparator.comparing(CycleLog::runAt).reversed())
                .limit(limit)
                .toList();
        }
    }
}
