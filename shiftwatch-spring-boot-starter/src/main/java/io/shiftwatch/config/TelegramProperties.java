package io.shiftwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telegram delivery settings. Messages go to one group chat, routed to forum threads by chat label.
 */
@ConfigurationProperties(prefix = "shiftwatch.telegram")
public class TelegramProperties {
    private boolean enabled = false;
    private String apiUrl = "https://api.telegram.org";
    private String token;
    private Long chatId;
    private Integer reportThreadId;
    private Map<String, Integer> threads = new LinkedHashMap<>(); // chat label -> message_thread_id
    private int maxAttempts = 3;
    private Duration defaultRetryAfter = Duration.ofSeconds(5);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(30);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
        this.apiUrl = apiUrl;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public Long getChatId() {
        return chatId;
    }

    public void setChatId(Long chatId) {
        this.chatId = chatId;
    }

    public Integer getReportThreadId() {
        return reportThreadId;
    }

    public void setReportThreadId(Integer reportThreadId) {
        this.reportThreadId = reportThreadId;
    }

    public Map<String, Integer> getThreads() {
        return threads;
    }

    public void setThreads(Map<String, Integer> threads) {
        this.threads = threads;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getDefaultRetryAfter() {
        return defaultRetryAfter;
    }

    public void setDefaultRetryAfter(Duration defaultRetryAfter) {
        this.defaultRetryAfter = defaultRetryAfter;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }
}
