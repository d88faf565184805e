package in.vouchguard.network;

/**
 * Outcome of posting a review to the network.
 */
public record ReviewSubmission(boolean success, String reviewId, String txHash, String error) {

    public static ReviewSubmission success(String reviewId, String txHash) {
        return new ReviewSubmission(true, reviewId, txHash, null);
    }

    public static ReviewSubmission failure(String error) {
        return new ReviewSubmission(false, null, null, error);
    }
}
