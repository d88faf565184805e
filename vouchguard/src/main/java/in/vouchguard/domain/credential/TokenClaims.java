package in.vouchguard.domain.credential;

import java.time.Instant;

/**
 * Claims read from an (unverified) session token payload.
 */
public record TokenClaims(
    String subject,
    String sessionId,
    String issuer,
    Instant issuedAt,
    Instant expiresAt
) {}
