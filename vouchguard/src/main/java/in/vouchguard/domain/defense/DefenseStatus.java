package in.vouchguard.domain.defense;

/**
 * Defense lifecycle. Transitions only move forward:
 * PENDING → CONFIRMED → POSTED | FAILED.
 */
public enum DefenseStatus {
    PENDING,
    CONFIRMED,
    POSTED,
    FAILED;

    public boolean isActive() {
        return this == PENDING || this == CONFIRMED;
    }
}
