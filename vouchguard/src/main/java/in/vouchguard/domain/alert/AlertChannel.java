package in.vouchguard.domain.alert;

import java.util.Optional;

/**
 * Notification channels an alert can be delivered to.
 */
public enum AlertChannel {
    TELEGRAM("T"),
    DISCORD("D"),
    TWITTER("X");

    private final String code;

    AlertChannel(String code) {
        this.code = code;
    }

    /**
     * One-letter code used in callback data.
     */
    public String code() {
        return code;
    }

    public static Optional<AlertChannel> fromCode(String value) {
        for (AlertChannel channel : values()) {
            if (channel.code.equals(value)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }
}
