package io.shiftwatch.notify;

import io.shiftwatch.core.DeliveryException;

import java.util.List;

/**
 * Outbound chat delivery. Implementations retry transient rate limiting themselves.
 */
public interface Notifier {

    /**
     * Send a production or alert message routed by chat label; unknown labels go to the main chat.
     *
     * @throws DeliveryException when the message could not be delivered
     */
    void send(String chat, String text);

    /**
     * Send a shift report to the report channel, with optional attachments.
     *
     * @throws DeliveryException when the report could not be delivered
     */
    void sendReport(String text, List<Attachment> attachments);
}
