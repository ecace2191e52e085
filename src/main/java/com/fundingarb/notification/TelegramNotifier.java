package com.fundingarb.notification;

import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.port.NotificationPort;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link NotificationPort} over the Telegram Bot API.
 *
 * <p>Sends are limited to {@code max-messages-per-minute}. Messages over the limit are queued and
 * drained every second, most severe first. CRITICAL messages skip the limiter.
 */
@Component
public class TelegramNotifier implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private static final String TELEGRAM_API_URL = "https://api.telegram.org/bot%s/sendMessage";

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;
    private final Semaphore rateLimiter;
    private final long releaseDelayMs;

    private final BlockingQueue<QueuedMessage> messageQueue = new PriorityBlockingQueue<>(
            100, Comparator.comparingInt((QueuedMessage m) -> -m.getLevel().ordinal()));

    public TelegramNotifier(TelegramConfig telegramConfig) {
        this(telegramConfig, new RestTemplate());
    }

    TelegramNotifier(TelegramConfig telegramConfig, RestTemplate restTemplate) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
        int perMinute = Math.max(1, telegramConfig.getMaxMessagesPerMinute());
        this.rateLimiter = new Semaphore(perMinute);
        this.releaseDelayMs = 60_000L / perMinute;
    }

    @Override
    public boolean sendMessage(String text) {
        return send(text, AlertLevel.INFO);
    }

    /**
     * Sends or queues a message.
     *
     * @return true when delivered now, false when disabled, queued or failed
     */
    public boolean send(String text, AlertLevel level) {
        if (!telegramConfig.isEnabled()) {
            log.debug("Telegram disabled, dropping: {}", text);
            return false;
        }
        QueuedMessage message = QueuedMessage.builder().text(text).level(level).build();
        if (level == AlertLevel.CRITICAL) {
            return post(message);
        }
        if (rateLimiter.tryAcquire()) {
            boolean sent = post(message);
            scheduleRelease();
            return sent;
        }
        messageQueue.offer(message);
        log.warn("Telegram rate limit reached, message queued. Queue size: {}", messageQueue.size());
        return false;
    }

    @Scheduled(fixedRate = 1000)
    public void processQueue() {
        while (!messageQueue.isEmpty() && rateLimiter.tryAcquire()) {
            QueuedMessage message = messageQueue.poll();
            if (message == null) {
                rateLimiter.release();
                return;
            }
            post(message);
            scheduleRelease();
        }
    }

    private boolean post(QueuedMessage message) {
        String url = String.format(TELEGRAM_API_URL, telegramConfig.getBotToken());
        Map<String, Object> payload = Map.of(
                "chat_id", telegramConfig.getChatId(),
                "text", prefix(message.getLevel()) + " " + message.getText(),
                "disable_web_page_preview", true);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            log.debug("Telegram message sent");
            return true;
        } catch (RestClientException e) {
            log.error("Failed to send Telegram message: {}", e.getMessage());
            return false;
        }
    }

    private static String prefix(AlertLevel level) {
        return switch (level) {
            case CRITICAL -> "⚠️ CRITICAL";
            case ERROR -> "❌";
            case WARNING -> "⚡";
            case INFO -> "ℹ️";
        };
    }

    private void scheduleRelease() {
        CompletableFuture.delayedExecutor(releaseDelayMs, TimeUnit.MILLISECONDS).execute(rateLimiter::release);
    }

    @Data
    @Builder
    static class QueuedMessage {

        private String text;
        private AlertLevel level;
    }
}
