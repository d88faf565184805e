package in.vouchguard.domain.credential;

import java.time.Instant;

/**
 * Derived view of the current session credential.
 */
public record CredentialStatus(
    boolean valid,
    Instant expiresAt,
    long expiresInSeconds,
    boolean expired,
    boolean expiringSoon,
    String subject,
    String sessionId
) {
    public static CredentialStatus missing() {
        return new CredentialStatus(false, null, 0, true, true, null, null);
    }
}
