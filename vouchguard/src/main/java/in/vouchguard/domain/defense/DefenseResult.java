package in.vouchguard.domain.defense;

/**
 * Outcome of a defense submission attempt.
 *
 * Only POSTED and FAILED reflect a call to the network; the other outcomes
 * leave every stored record untouched.
 */
public record DefenseResult(
    Outcome outcome,
    String defenseId,
    String networkReviewId,
    String txHash,
    String error
) {
    public enum Outcome {
        POSTED,
        FAILED,
        NOT_FOUND,
        INVALID_STATE,
        CREDENTIAL_EXPIRED
    }

    public static DefenseResult posted(String defenseId, String networkReviewId, String txHash) {
        return new DefenseResult(Outcome.POSTED, defenseId, networkReviewId, txHash, null);
    }

    public static DefenseResult failed(String defenseId, String error) {
        return new DefenseResult(Outcome.FAILED, defenseId, null, null, error);
    }

    public static DefenseResult notFound(String error) {
        return new DefenseResult(Outcome.NOT_FOUND, null, null, null, error);
    }

    public static DefenseResult invalidState(String defenseId, String error) {
        return new DefenseResult(Outcome.INVALID_STATE, defenseId, null, null, error);
    }

    public static DefenseResult credentialExpired() {
        return new DefenseResult(Outcome.CREDENTIAL_EXPIRED, null, null, null,
            "Session token expired. Update it via POST /api/token/update.");
    }

    public boolean isSuccess() {
        return outcome == Outcome.POSTED;
    }
}
