package in.vouchguard.domain.activity;

import java.util.Locale;
import java.util.Optional;

/**
 * Activity kinds fetched from the trust network.
 */
public enum ActivityType {
    REVIEW("review"),
    SLASH("slash");

    private final String wireName;

    ActivityType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ActivityType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ActivityType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
