package in.vouchguard.application.alert;

import in.vouchguard.domain.alert.AlertChannel;

/**
 * A channel transport rejected or failed a delivery.
 */
public class ChannelDeliveryException extends RuntimeException {

    private final AlertChannel channel;

    public ChannelDeliveryException(AlertChannel channel, String message) {
        super(String.format("[%s] %s", channel, message));
        this.channel = channel;
    }

    public ChannelDeliveryException(AlertChannel channel, String message, Throwable cause) {
        super(String.format("[%s] %s", channel, message), cause);
        this.channel = channel;
    }

    public AlertChannel getChannel() {
        return channel;
    }
}
