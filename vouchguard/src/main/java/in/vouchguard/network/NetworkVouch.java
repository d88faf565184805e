package in.vouchguard.network;

import java.util.Optional;

/**
 * A vouch given by the operator. The subject is the monitored relationship.
 */
public record NetworkVouch(
    long id,
    long subjectProfileId,
    boolean archived,
    boolean unvouched,
    Optional<NetworkProfile> subjectUser
) {
    public boolean isActive() {
        return !archived && !unvouched;
    }
}
