package trader.marketmaker.service.telemetry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import trader.marketmaker.model.FeedEvent;
import trader.marketmaker.model.PairSummary;
import trader.marketmaker.model.TelemetryEvent;
import trader.marketmaker.model.TradeResult;
import trader.marketmaker.model.TradeValuation;
import trader.marketmaker.telegram.TelegramNotificationService;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured telemetry: trade outcomes, selector snapshots and feed health, published on a hot
 * stream and logged. Trade outcomes and terminal feed failures also go to Telegram.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelemetryPublisher {
    private final TelegramNotificationService telegramService;
    private final Clock clock;
    private final Sinks.Many<TelemetryEvent> sink = Sinks.many().multicast().directBestEffort();

    public void publishTradeOutcome(String pair, TradeResult result, TradeValuation valuation) {
        TelemetryEvent.TelemetryEventBuilder event = TelemetryEvent.builder()
                .type(TelemetryEvent.Type.TRADE_OUTCOME)
                .timestamp(clock.instant())
                .attribute("pair", pair)
                .attribute("success", result.isSuccess());
        if (result.isSuccess()) {
            event.attribute("txHash", result.getTxHash())
                    .attribute("router", result.getQuote().getVersion().name())
                    .attribute("expectedOutput", result.getExpectedOutput().toString());
        } else {
            event.attribute("failureReason", String.valueOf(result.getFailureReason()))
                    .attribute("error", String.valueOf(result.getError()));
        }
        if (valuation.getVolumeUsd() != null) {
            event.attribute("volumeUsd", valuation.getVolumeUsd());
        }
        if (valuation.getPnlUsd() != null) {
            event.attribute("pnlUsd", valuation.getPnlUsd());
        }
        emit(event.build());

        Mono.defer(() -> telegramService.sendTradeNotification(pair, result))
                .subscribe(
                        sent -> log.debug("Trade notification for {} delivered: {}", pair, sent),
                        error -> log.error("Error sending Telegram notification: {}", error.getMessage())
                );
    }

    public void publishMetricsSnapshot(List<PairSummary> pairs) {
        emit(TelemetryEvent.builder()
                .type(TelemetryEvent.Type.METRICS_SNAPSHOT)
                .timestamp(clock.instant())
                .attribute("activePairs", pairs.stream()
                        .filter(PairSummary::isActive)
                        .map(PairSummary::getSymbol)
                        .collect(Collectors.toList()))
                .attribute("pairs", pairs)
                .build());
    }

    public void publishFeedHealth(FeedEvent feedEvent) {
        TelemetryEvent.TelemetryEventBuilder event = TelemetryEvent.builder()
                .type(TelemetryEvent.Type.FEED_HEALTH)
                .timestamp(clock.instant())
                .attribute("event", feedEvent.getType().name());
        if (feedEvent.getReason() != null) {
            event.attribute("reason", feedEvent.getReason());
        }
        if (feedEvent.getAttempt() != null) {
            event.attribute("attempt", feedEvent.getAttempt());
        }
        if (feedEvent.getDelayMs() != null) {
            event.attribute("delayMs", feedEvent.getDelayMs());
        }
        emit(event.build());

        if (feedEvent.getType() == FeedEvent.Type.TERMINAL_FAILURE) {
            String alert = "HyperLiquid price feed gave up after "
                    + feedEvent.getAttempt() + " reconnect attempts: " + feedEvent.getReason();
            Mono.defer(() -> telegramService.sendAlert(alert))
                    .subscribe(
                            sent -> log.debug("Feed alert delivered: {}", sent),
                            error -> log.error("Error sending Telegram alert: {}", error.getMessage())
                    );
        }
    }

    public Flux<TelemetryEvent> events() {
        return sink.asFlux();
    }

    private void emit(TelemetryEvent event) {
        log.debug("Telemetry {}: {}", event.getType(), event.getAttributes());
        synchronized (sink) {
            sink.tryEmitNext(event);
        }
    }
}
