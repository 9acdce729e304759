package trader.marketmaker.service;

import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import trader.marketmaker.client.PriceFeed;
import trader.marketmaker.config.DexProperties;
import trader.marketmaker.config.FeedProperties;
import trader.marketmaker.config.TradingProperties;
import trader.marketmaker.model.FeedEvent;
import trader.marketmaker.model.PairPerformance;
import trader.marketmaker.model.TokenInfo;
import trader.marketmaker.model.TradeResult;
import trader.marketmaker.model.TradeValuation;
import trader.marketmaker.model.TradingPair;
import trader.marketmaker.service.execution.TradeExecutionService;
import trader.marketmaker.service.selection.PairSelectionService;
import trader.marketmaker.service.telemetry.TelemetryPublisher;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The control loop: price feed -> pair selection -> best quote -> swap.
 * <p>
 * Each active pair alternates direction (sell base, then buy it back) with the configured
 * per-token trade size. Minimum output is the feed-implied output less the max slippage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketMakingService {
    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

    private final PriceFeed priceFeed;
    private final PairSelectionService pairSelector;
    private final TradeExecutionService executionService;
    private final TokenValuationService valuationService;
    private final TelemetryPublisher telemetry;
    private final TradingProperties tradingProperties;
    private final DexProperties dexProperties;
    private final FeedProperties feedProperties;
    private final Clock clock;

    private final Map<String, Long> lastTradeTime = new ConcurrentHashMap<>();
    private final Map<String, Long> cooldowns = new ConcurrentHashMap<>();
    private final Map<String, Boolean> sellBaseNext = new ConcurrentHashMap<>();
    private Disposable feedSubscription;

    @EventListener(ApplicationReadyEvent.class)
    public void initAfterStartup() {
        try {
            log.info("Initializing market maker (trading {})...", tradingProperties.isEnabled() ? "enabled" : "disabled");
            feedSubscription = priceFeed.events()
                    .filter(event -> event.getType() != FeedEvent.Type.PRICE_UPDATE)
                    .subscribe(
                            this::onFeedEvent,
                            error -> log.error("Error in feed event subscription: {}", error.getMessage())
                    );
            if (feedProperties.isEnabled()) {
                priceFeed.connect();
            }
            pairSelector.evaluateAndSelect();
            log.info("Market maker initialization completed");
        } catch (Exception e) {
            log.error("Failed to initialize market maker: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void stop() {
        if (feedSubscription != null) {
            feedSubscription.dispose();
        }
    }

    void onFeedEvent(FeedEvent event) {
        telemetry.publishFeedHealth(event);
        if (event.getType() == FeedEvent.Type.TERMINAL_FAILURE && feedProperties.isRestartOnTerminalFailure()) {
            log.warn("Price feed failed permanently, restarting in {}", feedProperties.getRestartDelay());
            Mono.delay(feedProperties.getRestartDelay())
                    .subscribe(
                            tick -> priceFeed.reconnect(),
                            error -> log.error("Feed restart failed: {}", error.getMessage())
                    );
        }
    }

    @Scheduled(fixedDelayString = "${trading.loop-interval-ms:10000}",
            initialDelayString = "${trading.loop-interval-ms:10000}")
    @Observed(name = "market.making.cycle", contextualName = "market-making-cycle")
    public void runCycle() {
        try {
            if (pairSelector.shouldReEvaluate()) {
                pairSelector.evaluateAndSelect();
            } else {
                pairSelector.maybeRotate();
            }
            telemetry.publishMetricsSnapshot(pairSelector.getPairsSummary());

            if (!tradingProperties.isEnabled()) {
                log.debug("Trading disabled, selection only");
                return;
            }

            List<TradingPair> active = pairSelector.getActiveTradingPairs();
            if (active.isEmpty()) {
                log.warn("No active pairs available for trading");
                return;
            }

            int traded = 0;
            for (TradingPair pair : active) {
                if (traded >= tradingProperties.getConcurrentTradeLimit()) {
                    break;
                }
                if (!canTradePair(pair.getSymbol())) {
                    continue;
                }
                if (tradePair(pair).isPresent()) {
                    traded++;
                }
            }
        } catch (RuntimeException e) {
            log.error("Market making cycle failed: {}", e.getMessage(), e);
        }
    }

    boolean canTradePair(String symbol) {
        Long last = lastTradeTime.get(symbol);
        if (last == null) {
            return true;
        }
        long cooldown = cooldowns.getOrDefault(symbol, tradingProperties.getTradingInterval().toMillis());
        return clock.millis() - last >= cooldown;
    }

    /**
     * @return the trade result, or empty when the trade was skipped before reaching the engine
     */
    Optional<TradeResult> tradePair(TradingPair pair) {
        String symbol = pair.getSymbol();
        boolean sellBase = sellBaseNext.getOrDefault(symbol, true);

        Optional<TokenInfo> tokenIn = dexProperties.findToken(sellBase ? pair.getBaseToken() : pair.getQuoteToken());
        Optional<TokenInfo> tokenOut = dexProperties.findToken(sellBase ? pair.getQuoteToken() : pair.getBaseToken());
        if (tokenIn.isEmpty() || tokenOut.isEmpty()) {
            log.warn("Skipping {}: token not configured", symbol);
            return Optional.empty();
        }

        BigDecimal size = tokenIn.get().getTradeSize();
        if (size == null || size.signum() <= 0) {
            log.debug("Skipping {}: no trade size configured for {}", symbol, tokenIn.get().getSymbol());
            return Optional.empty();
        }

        Optional<BigDecimal> inPrice = valuationService.usdPrice(tokenIn.get().getSymbol());
        Optional<BigDecimal> outPrice = valuationService.usdPrice(tokenOut.get().getSymbol());
        if (inPrice.isEmpty() || outPrice.isEmpty()) {
            log.warn("Skipping {}: no recent price for {}", symbol,
                    inPrice.isEmpty() ? tokenIn.get().getSymbol() : tokenOut.get().getSymbol());
            return Optional.empty();
        }

        BigDecimal volumeUsd = size.multiply(inPrice.get());
        BigDecimal expectedOut = volumeUsd.divide(outPrice.get(), MathContext.DECIMAL64);
        BigDecimal minOut = expectedOut.multiply(BPS.subtract(BigDecimal.valueOf(tradingProperties.getMaxSlippageBps())))
                .divide(BPS, MathContext.DECIMAL64);

        TradeResult result = executionService.executeBestTrade(
                tokenIn.get().getAddress(),
                tokenOut.get().getAddress(),
                valuationService.toRaw(tokenIn.get(), size),
                valuationService.toRaw(tokenOut.get(), minOut),
                pair.getFee(),
                "Market making - " + symbol);

        TradeValuation valuation = valuate(result, tokenOut.get(), volumeUsd, expectedOut, outPrice.get());
        pairSelector.recordTradeOutcome(symbol, result, valuation);

        sellBaseNext.put(symbol, !sellBase);
        lastTradeTime.put(symbol, clock.millis());
        updateCooldown(symbol);

        try {
            telemetry.publishTradeOutcome(symbol, result, valuation);
        } catch (RuntimeException e) {
            log.error("Could not publish trade outcome for {}: {}", symbol, e.getMessage(), e);
        }
        return Optional.of(result);
    }

    private TradeValuation valuate(TradeResult result, TokenInfo tokenOut, BigDecimal volumeUsd,
                                   BigDecimal expectedOut, BigDecimal outPrice) {
        if (!result.isSuccess() || result.getExpectedOutput() == null) {
            return TradeValuation.NONE;
        }
        BigDecimal quotedOut = valuationService.fromRaw(tokenOut, result.getExpectedOutput());
        BigDecimal pnlUsd = quotedOut.multiply(outPrice).subtract(volumeUsd);
        // насколько исполнение хуже (или лучше) цены фида
        BigDecimal spreadBps = expectedOut.subtract(quotedOut)
                .divide(expectedOut, MathContext.DECIMAL64)
                .multiply(BPS);
        return new TradeValuation(volumeUsd.doubleValue(), pnlUsd.doubleValue(), spreadBps.doubleValue());
    }

    private void updateCooldown(String symbol) {
        long base = tradingProperties.getTradingInterval().toMillis();
        double successRate = pairSelector.getPerformance(symbol)
                .map(PairPerformance::successRate)
                .orElse(0.5);
        long cooldown = base;
        if (successRate < 0.5) {
            cooldown = base * 2;
        } else if (successRate > 0.8) {
            cooldown = base / 2;
        }
        cooldowns.put(symbol, cooldown);
    }
}
