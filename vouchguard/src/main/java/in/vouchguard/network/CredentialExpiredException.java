package in.vouchguard.network;

/**
 * A write was attempted while the session credential is missing or expired.
 */
public class CredentialExpiredException extends RuntimeException {

    public CredentialExpiredException(String message) {
        super(message);
    }
}
