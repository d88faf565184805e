package in.vouchguard.domain.alert;

import java.util.Optional;

/**
 * Interactive controls attached to an alert.
 */
public enum AlertAction {
    CONFIRM("confirm"),
    EDIT("edit"),
    IGNORE("ignore");

    private final String wireName;

    AlertAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * One-letter code used in callback data.
     */
    public String code() {
        return wireName.substring(0, 1);
    }

    public static Optional<AlertAction> fromCode(String value) {
        for (AlertAction action : values()) {
            if (action.code().equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
