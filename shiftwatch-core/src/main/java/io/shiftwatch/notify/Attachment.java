package io.shiftwatch.notify;

import java.util.Objects;

/**
 * Binary file sent along with a report, e.g. a rendered chart.
 */
public record Attachment(String fileName, String contentType, byte[] content) {

    public Attachment {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (contentType == null) {
            contentType = "image/png";
        }
    }
}
