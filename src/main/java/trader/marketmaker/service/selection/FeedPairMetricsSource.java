package trader.marketmaker.service.selection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import trader.marketmaker.config.TradingProperties;
import trader.marketmaker.model.MarketSnapshot;
import trader.marketmaker.model.TradingPair;
import trader.marketmaker.service.TokenValuationService;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pool depth, volume and target spread from configuration; volatility realized from the
 * pair's feed price, sampled at most once per {@code volatilitySampleInterval} whatever the
 * call rate, so active and inactive pairs are measured over the same horizon.
 */
@Slf4j
@Component
public class FeedPairMetricsSource implements PairMetricsSource {
    private static final int MIN_SAMPLES = 3;

    private final TokenValuationService valuationService;
    private final Clock clock;
    private final int window;
    private final long sampleIntervalMs;
    private final Map<String, Deque<Double>> samples = new ConcurrentHashMap<>();
    private final Map<String, Long> lastSampleMs = new ConcurrentHashMap<>();

    public FeedPairMetricsSource(TokenValuationService valuationService, TradingProperties tradingProperties,
                                 Clock clock) {
        this.valuationService = valuationService;
        this.clock = clock;
        this.window = Math.max(MIN_SAMPLES, tradingProperties.getVolatilityWindow());
        this.sampleIntervalMs = tradingProperties.getVolatilitySampleInterval().toMillis();
    }

    @Override
    public MarketSnapshot fetch(TradingPair pair) {
        return MarketSnapshot.builder()
                .liquidity(positiveOrNull(pair.getLiquidityUsd()))
                .volume24h(positiveOrNull(pair.getVolume24hUsd()))
                .spread(positiveOrNull(pair.getTargetSpreadBps()))
                .volatility(sampleVolatility(pair))
                .build();
    }

    private Double sampleVolatility(TradingPair pair) {
        Deque<Double> history = samples.computeIfAbsent(pair.getSymbol(), key -> new ArrayDeque<>());
        synchronized (history) {
            long now = clock.millis();
            Long last = lastSampleMs.get(pair.getSymbol());
            if (last == null || now - last >= sampleIntervalMs) {
                valuationService.pairPrice(pair)
                        .map(BigDecimal::doubleValue)
                        .ifPresent(price -> {
                            history.addLast(price);
                            while (history.size() > window) {
                                history.removeFirst();
                            }
                            lastSampleMs.put(pair.getSymbol(), now);
                        });
            }
            if (history.size() < MIN_SAMPLES) {
                log.debug("Not enough price samples for {} volatility yet ({})", pair.getSymbol(), history.size());
                return null;
            }
            return stdDevOfReturns(history);
        }
    }

    int sampleCount(String symbol) {
        Deque<Double> history = samples.get(symbol);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }

    /**
     * Standard deviation of simple returns between consecutive samples.
     */
    static double stdDevOfReturns(Deque<Double> prices) {
        Iterator<Double> it = prices.iterator();
        double previous = it.next();
        double sum = 0;
        double sumSquares = 0;
        int n = 0;
        while (it.hasNext()) {
            double current = it.next();
            double r = (current - previous) / previous;
            sum += r;
            sumSquares += r * r;
            n++;
            previous = current;
        }
        double mean = sum / n;
        return Math.sqrt(Math.max(0, sumSquares / n - mean * mean));
    }

    private static Double positiveOrNull(double value) {
        return value > 0 ? value : null;
    }
}
