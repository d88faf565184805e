package in.vouchguard.repository;

import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.alert.AlertStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AlertRepository {
    /**
     * Insert unless the (reviewId, channel) pair is already recorded.
     */
    boolean insertIfAbsent(Alert alert);

    Optional<Alert> findById(String id);

    List<Alert> find(AlertStatus status, String relationId, int limit, int offset);

    /**
     * Set status and stamp respondedAt.
     *
     * @return false if no alert has that id
     */
    boolean updateStatus(String id, AlertStatus status);

    /**
     * Mark the review's still-PENDING alerts CONFIRMED, across channels.
     * Alerts the operator already answered keep their status.
     */
    int confirmPendingByReviewId(String reviewId);

    /**
     * PENDING alerts sent before the cutoff become EXPIRED.
     */
    int expirePendingBefore(Instant cutoff);

    int count();

    int countByStatus(AlertStatus status);
}
