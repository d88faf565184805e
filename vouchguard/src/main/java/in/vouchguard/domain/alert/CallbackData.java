package in.vouchguard.domain.alert;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Correlation data carried by an interactive control.
 *
 * Encoded as {@code <action code>|<reviewId>|<channel code>}, e.g. {@code c|review_42|T}.
 * The alert id is not carried; it is rebuilt with {@link Alert#idFor}.
 */
public record CallbackData(AlertAction action, String reviewId, AlertChannel channel) {
    private static final String SEPARATOR = "|";

    public String alertId() {
        return Alert.idFor(reviewId, channel);
    }

    public String encode() {
        return action.code() + SEPARATOR + reviewId + SEPARATOR + channel.code();
    }

    public int encodedBytes() {
        return encode().getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Parse raw control data. Returns empty for malformed data, an unknown action or an unknown channel.
     */
    public static Optional<CallbackData> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String[] parts = raw.split("\\|", -1);
        if (parts.length != 3 || parts[1].isEmpty()) {
            return Optional.empty();
        }
        Optional<AlertAction> action = AlertAction.fromCode(parts[0]);
        Optional<AlertChannel> channel = AlertChannel.fromCode(parts[2]);
        if (action.isEmpty() || channel.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CallbackData(action.get(), parts[1], channel.get()));
    }
}
