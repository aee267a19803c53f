package io.shiftwatch.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes notifications to the log. Used when no chat channel is configured.
 */
public class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void send(String chat, String text) {
        log.info("shiftwatch notification chat={} text={}", chat, text);
    }

    @Override
    public void sendReport(String text, List<Attachment> attachments) {
        log.info("shiftwatch report attachments={} text={}", attachments == null ? 0 : attachments.size(), text);
    }
}
