package in.vouchguard.domain.alert;

/**
 * Operator-facing state of a delivered alert.
 */
public enum AlertStatus {
    /** Delivered, no decision yet. */
    PENDING,
    /** Defense posted for the underlying review. */
    CONFIRMED,
    /** Operator chose not to respond. */
    IGNORED,
    /** Left pending past the housekeeping window. */
    EXPIRED
}
