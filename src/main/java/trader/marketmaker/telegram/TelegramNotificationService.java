package trader.marketmaker.telegram;

import io.github.cdimascio.dotenv.Dotenv;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import trader.marketmaker.model.TradeResult;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Service
public class TelegramNotificationService {

    private final WebClient telegramWebClient;
    private final Dotenv dotenv;
    private final Counter telegramNotificationsCounter;
    private final Clock clock;

    @Value("${telegram.enabled:false}")
    private boolean telegramEnabled;

    @Value("${telegram.retry.max-attempts:3}")
    private int maxRetryAttempts;

    @Value("${telegram.retry.initial-backoff:1000}")
    private long initialBackoffMillis;

    @Value("${telegram.retry.max-backoff:10000}")
    private long maxBackoffMillis;

    @Value("${telegram.rate-limit.messages-per-minute:20}")
    private int maxMessagesPerMinute;

    private final AtomicInteger messagesSentInCurrentMinute = new AtomicInteger(0);
    private volatile long currentMinuteStartTime;

    public TelegramNotificationService(WebClient telegramWebClient,
                                       Dotenv dotenv,
                                       @Qualifier("telegramNotificationsCounter") Counter telegramNotificationsCounter,
                                       Clock clock) {
        this.telegramWebClient = telegramWebClient;
        this.dotenv = dotenv;
        this.telegramNotificationsCounter = telegramNotificationsCounter;
        this.clock = clock;
        this.currentMinuteStartTime = clock.millis();
    }

    /**
     * Sends a trade outcome to the configured chat.
     *
     * @return Mono<Boolean> indicating whether the message was delivered
     */
    public Mono<Boolean> sendTradeNotification(String pair, TradeResult result) {
        return sendMessage(formatTradeMessage(pair, result), pair);
    }

    /**
     * Sends a plain alert, e.g. when the price feed gave up reconnecting.
     */
    public Mono<Boolean> sendAlert(String text) {
        return sendMessage("⚠️ <b>MARKET MAKER ALERT</b>\n\n" + text, "alert");
    }

    private Mono<Boolean> sendMessage(String message, String subject) {
        if (!telegramEnabled) {
            log.debug("Telegram notifications are disabled");
            return Mono.just(false);
        }

        if (!checkAndUpdateRateLimit()) {
            log.warn("Telegram rate limit reached. Skipping notification for {}", subject);
            return Mono.just(false);
        }

        String chatId = dotenv.get("TELEGRAM_CHAT_ID", "");
        // текст передаём как переменную шаблона: ошибки RPC содержат фигурные скобки
        return telegramWebClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/sendMessage")
                        .queryParam("chat_id", "{chatId}")
                        .queryParam("text", "{text}")
                        .queryParam("parse_mode", "HTML")
                        .build(chatId, message))
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(createRetrySpec())
                .map(response -> {
                    log.info("Telegram notification sent for {}", subject);
                    telegramNotificationsCounter.increment();
                    return true;
                })
                .onErrorResume(e -> {
                    log.error("Failed to send Telegram notification for {}: {}", subject, e.getMessage());
                    return Mono.just(false);
                });
    }

    String formatTradeMessage(String pair, TradeResult result) {
        if (result.isSuccess()) {
            return String.format(
                    "✅ <b>TRADE EXECUTED</b>\n\n" +
                            "💱 <b>Pair</b>: %s\n" +
                            "🔀 <b>Router</b>: %s\n" +
                            "📦 <b>Expected output</b>: %s\n" +
                            "🔗 <b>Tx</b>: %s\n" +
                            "⏰ <b>Timestamp</b>: %s",
                    pair,
                    result.getQuote().getVersion(),
                    result.getExpectedOutput(),
                    result.getTxHash(),
                    Instant.ofEpochMilli(result.getExecutedAtMs())
            );
        }
        return String.format(
                "❌ <b>TRADE FAILED</b>\n\n" +
                        "💱 <b>Pair</b>: %s\n" +
                        "🧾 <b>Reason</b>: %s\n" +
                        "📝 <b>Error</b>: %s\n" +
                        "⏰ <b>Timestamp</b>: %s",
                pair,
                result.getFailureReason(),
                result.getError(),
                Instant.ofEpochMilli(result.getExecutedAtMs())
        );
    }

    /**
     * @return true if message can be sent, false if rate limit is reached
     */
    private synchronized boolean checkAndUpdateRateLimit() {
        long currentTime = clock.millis();
        if (currentTime - currentMinuteStartTime >= 60_000) {
            log.debug("Resetting Telegram rate limit counter. Previous count: {}", messagesSentInCurrentMinute.get());
            messagesSentInCurrentMinute.set(0);
            currentMinuteStartTime = currentTime;
        }
        return messagesSentInCurrentMinute.incrementAndGet() <= maxMessagesPerMinute;
    }

    private Retry createRetrySpec() {
        return Retry.backoff(maxRetryAttempts, Duration.ofMillis(initialBackoffMillis))
                .maxBackoff(Duration.ofMillis(maxBackoffMillis))
                .filter(this::shouldRetry)
                .doBeforeRetry(retrySignal ->
                        log.info("Retrying Telegram notification after error. Attempt {}/{}",
                                retrySignal.totalRetries() + 1, maxRetryAttempts)
                );
    }

    /**
     * Retry on 429, 5xx and connection problems.
     */
    private boolean shouldRetry(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            HttpStatus status = HttpStatus.valueOf(((WebClientResponseException) throwable).getStatusCode().value());
            return status.equals(HttpStatus.TOO_MANY_REQUESTS) || status.is5xxServerError();
        }
        return throwable instanceof IOException;
    }
}
