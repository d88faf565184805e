package in.vouchguard.auth;

/**
 * Notified after the session token has been replaced.
 */
@FunctionalInterface
public interface CredentialListener {
    void onTokenUpdated(String newToken);
}
