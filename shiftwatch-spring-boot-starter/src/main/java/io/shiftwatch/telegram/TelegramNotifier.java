package io.shiftwatch.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shiftwatch.config.TelegramProperties;
import io.shiftwatch.core.DeliveryException;
import io.shiftwatch.notify.Attachment;
import io.shiftwatch.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Notifier} backed by the Telegram Bot HTTP API.
 *
 * <p>All messages go to one group chat. Production messages are routed to a forum thread looked up
 * by chat label, reports go to the report thread. HTTP 429 answers are retried after the
 * {@code retry_after} the API asks for, up to {@link TelegramProperties#getMaxAttempts()} attempts.
 */
public class TelegramNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    static final int CAPTION_LIMIT = 1024;
    static final int MEDIA_GROUP_LIMIT = 10;
    private static final String PARSE_MODE = "HTML";

    private final TelegramProperties props;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public TelegramNotifier(TelegramProperties props, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        if (props.getToken() == null || props.getToken().isBlank()) {
            throw new IllegalArgumentException("shiftwatch.telegram.token must be set");
        }
        if (props.getChatId() == null) {
            throw new IllegalArgumentException("shiftwatch.telegram.chat-id must be set");
        }
    }

    @Override
    public void send(String chat, String text) {
        Integer thread = chat == null ? null : props.getThreads().get(chat);
        sendMessage(text, thread);
    }

    @Override
    public void sendReport(String text, List<Attachment> attachments) {
        Integer thread = props.getReportThreadId();
        if (attachments == null || attachments.isEmpty()) {
            sendMessage(text, thread);
            return;
        }

        String caption = text;
        if (text != null && text.length() > CAPTION_LIMIT) {
            sendMessage(text, thread);
            caption = null;
        }

        if (attachments.size() == 1) {
            sendPhoto(attachments.get(0), caption, thread);
        } else {
            List<Attachment> group = attachments;
            if (group.size() > MEDIA_GROUP_LIMIT) {
                log.warn("shiftwatch telegram report has {} attachments, only the first {} are sent",
                        group.size(), MEDIA_GROUP_LIMIT);
                group = group.subList(0, MEDIA_GROUP_LIMIT);
            }
            sendMediaGroup(group, caption, thread);
        }
    }

    private void sendMessage(String text, Integer thread) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", props.getChatId());
        body.put("text", text);
        body.put("parse_mode", PARSE_MODE);
        if (thread != null) {
            body.put("message_thread_id", thread);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        call("sendMessage", new HttpEntity<>(toJson(body), headers));
    }

    private void sendPhoto(Attachment attachment, String caption, Integer thread) {
        MultiValueMap<String, Object> parts = baseMultipart(thread);
        if (caption != null) {
            parts.add("caption", caption);
            parts.add("parse_mode", PARSE_MODE);
        }
        addFile(parts, "photo", attachment);
        call("sendPhoto", multipartEntity(parts));
    }

    private void sendMediaGroup(List<Attachment> attachments, String caption, Integer thread) {
        MultiValueMap<String, Object> parts = baseMultipart(thread);
        List<Map<String, Object>> media = new ArrayList<>();
        for (int i = 0; i < attachments.size(); i++) {
            String partName = "file" + i;
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type", "photo");
            item.put("media", "attach://" + partName);
            if (i == 0 && caption != null) {
                item.put("caption", caption);
                item.put("parse_mode", PARSE_MODE);
            }
            media.add(item);
            addFile(parts, partName, attachments.get(i));
        }
        parts.add("media", new String(toJson(media), StandardCharsets.UTF_8));
        call("sendMediaGroup", multipartEntity(parts));
    }

    private MultiValueMap<String, Object> baseMultipart(Integer thread) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("chat_id", String.valueOf(props.getChatId()));
        if (thread != null) {
            parts.add("message_thread_id", String.valueOf(thread));
        }
        return parts;
    }

    private static void addFile(MultiValueMap<String, Object> parts, String partName, Attachment attachment) {
        ByteArrayResource resource = new ByteArrayResource(attachment.content()) {
            @Override
            public String getFilename() {
                return attachment.fileName();
            }
        };
        HttpHeaders partHeaders = new HttpHeaders();
        partHeaders.setContentDisposition(ContentDisposition.formData()
                .name(partName)
                .filename(attachment.fileName())
                .build());
        partHeaders.setContentType(MediaType.parseMediaType(attachment.contentType()));
        parts.add(partName, new HttpEntity<>(resource, partHeaders));
    }

    private static HttpEntity<MultiValueMap<String, Object>> multipartEntity(MultiValueMap<String, Object> parts) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        return new HttpEntity<>(parts, headers);
    }

    private void call(String method, HttpEntity<?> request) {
        String url = props.getApiUrl() + "/bot" + props.getToken() + "/" + method;
        int maxAttempts = Math.max(1, props.getMaxAttempts());

        for (int attempt = 1; ; attempt++) {
            try {
                restTemplate.postForEntity(url, request, String.class);
                return;
            } catch (HttpClientErrorException.TooManyRequests e) {
                if (attempt >= maxAttempts) {
                    throw new DeliveryException("telegram " + method + " still rate limited after "
                            + attempt + " attempts", e);
                }
                Duration wait = retryAfter(e.getResponseBodyAsString());
                log.warn("shiftwatch telegram rate limited method={} attempt={} retryIn={}", method, attempt, wait);
                sleep(wait);
            } catch (RestClientException e) {
                throw new DeliveryException("telegram " + method + " failed: " + redact(e.getMessage()), e);
            }
        }
    }

    private String redact(String message) {
        return message == null ? null : message.replace(props.getToken(), "<token>");
    }

    Duration retryAfter(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return props.getDefaultRetryAfter();
        }
        try {
            JsonNode seconds = objectMapper.readTree(responseBody).path("parameters").path("retry_after");
            return seconds.canConvertToLong() ? Duration.ofSeconds(seconds.asLong()) : props.getDefaultRetryAfter();
        } catch (IOException e) {
            log.debug("shiftwatch telegram unreadable 429 body: {}", e.getMessage());
            return props.getDefaultRetryAfter();
        }
    }

    protected void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("interrupted while waiting for telegram rate limit", e);
        }
    }

    private byte[] toJson(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("failed to serialize telegram request", e);
        }
    }
}
