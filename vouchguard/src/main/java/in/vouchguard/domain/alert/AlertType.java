package in.vouchguard.domain.alert;

import in.vouchguard.domain.activity.ActivityType;

/**
 * Kind of event an alert reports.
 */
public enum AlertType {
    NEGATIVE_REVIEW,
    SLASH,
    UNVOUCH;

    public static AlertType forActivity(ActivityType type) {
        return type == ActivityType.SLASH ? SLASH : NEGATIVE_REVIEW;
    }
}
