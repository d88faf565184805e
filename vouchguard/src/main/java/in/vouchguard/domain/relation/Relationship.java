package in.vouchguard.domain.relation;

import java.time.Instant;

/**
 * A vouched counterparty whose received activities are monitored.
 *
 * Upserted by id on every cycle; never deleted, only deactivated.
 */
public record Relationship(
    String id,
    String userKey,
    String name,
    String address,
    String avatarUrl,
    boolean active,
    Integer score,
    Instant createdAt,
    Instant updatedAt
) {
    /**
     * Fresh observation from a monitor cycle (timestamps are assigned by the store).
     */
    public static Relationship observed(String id, String userKey, String name, String address,
                                        String avatarUrl, boolean active) {
        return new Relationship(id, userKey, name, address, avatarUrl, active, null, null, null);
    }
}
