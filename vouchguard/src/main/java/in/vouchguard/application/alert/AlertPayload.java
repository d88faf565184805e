package in.vouchguard.application.alert;

import in.vouchguard.domain.alert.AlertType;

import java.time.Instant;

/**
 * Everything a channel needs to render one alert.
 *
 * @param autoDefense suggested response, or null when auto-defense is off
 */
public record AlertPayload(
    AlertType type,
    Party target,
    Party attacker,
    int score,
    String comment,
    Instant detectedAt,
    String reviewId,
    String relationId,
    AutoDefense autoDefense
) {
    public record Party(String name, String address, String profileUrl, Long profileId) {
        public String displayName() {
            return name != null && !name.isBlank() ? name : "Unknown";
        }
    }

    public record AutoDefense(boolean requireConfirm, int suggestedScore, String suggestedComment) {}

    public boolean isSlash() {
        return type == AlertType.SLASH;
    }

    public boolean hasAutoDefense() {
        return autoDefense != null;
    }
}
