package in.vouchguard.domain.credential;

/**
 * Result of replacing the session token.
 */
public record TokenUpdateResult(boolean success, Failure failure, CredentialStatus status) {

    public enum Failure {
        INVALID_FORMAT,
        ALREADY_EXPIRED
    }

    public static TokenUpdateResult success(CredentialStatus status) {
        return new TokenUpdateResult(true, null, status);
    }

    public static TokenUpdateResult failure(Failure failure, CredentialStatus status) {
        return new TokenUpdateResult(false, failure, status);
    }

    public String message() {
        if (success) {
            return "Token updated";
        }
        return switch (failure) {
            case INVALID_FORMAT -> "Invalid token format";
            case ALREADY_EXPIRED -> "Token is already expired";
        };
    }
}
