package in.vouchguard.application.alert;

import in.vouchguard.domain.alert.AlertChannel;

import java.util.Optional;

/**
 * One outbound alert destination.
 *
 * Implementations may throw on transport failure; the dispatcher isolates it.
 */
public interface NotificationChannel extends AutoCloseable {

    AlertChannel channel();

    /**
     * True when the channel has the credentials it needs.
     */
    boolean isEnabled();

    /**
     * Deliver an alert.
     *
     * @return the channel's message id, or empty if nothing was delivered
     */
    Optional<String> send(AlertPayload payload);

    /**
     * Deliver a plain notice with no interactive controls.
     */
    boolean sendText(String text);

    @Override
    default void close() {}
}
