package in.vouchguard.repository;

import in.vouchguard.domain.defense.Defense;
import in.vouchguard.domain.defense.DefenseStatus;

import java.util.Optional;

/**
 * Defense persistence. Every transition is guarded by the current status,
 * so a concurrent caller that lost the race sees false instead of overwriting.
 */
public interface DefenseRepository {
    /**
     * @return false if an active defense already exists for the review
     */
    boolean insertIfNoActive(Defense defense);

    Optional<Defense> findById(String id);

    Optional<Defense> findActiveByReviewId(String reviewId);

    /**
     * PENDING|CONFIRMED → CONFIRMED.
     */
    boolean confirm(String id);

    /**
     * Active → POSTED, recording the score and comment actually submitted.
     */
    boolean markPosted(String id, int score, String comment, String networkReviewId, String txHash);

    /**
     * Active → FAILED.
     */
    boolean markFailed(String id, String error);

    int countByStatus(DefenseStatus status);
}
