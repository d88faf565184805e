package in.vouchguard.network;

/**
 * Reports whether the current session credential may be used for writes.
 */
@FunctionalInterface
public interface CredentialGate {
    boolean isCredentialValid();

    /**
     * @throws CredentialExpiredException if the current credential cannot be used for writes
     */
    default void requireValid() {
        if (!isCredentialValid()) {
            throw new CredentialExpiredException(
                "Session token expired or missing. Update it via POST /api/token/update.");
        }
    }
}
