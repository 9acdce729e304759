package trader.marketmaker.service.selection;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import trader.marketmaker.config.TradingProperties;
import trader.marketmaker.model.MarketSnapshot;
import trader.marketmaker.model.PairMetrics;
import trader.marketmaker.model.PairPerformance;
import trader.marketmaker.model.PairSummary;
import trader.marketmaker.model.TradeResult;
import trader.marketmaker.model.TradeValuation;
import trader.marketmaker.model.TradingPair;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Scores the configured pairs, keeps the active set and accumulates per-pair trade performance.
 * <p>
 * The active set only changes inside {@link #evaluateAndSelect()} and {@link #maybeRotate()};
 * readers always see an immutable snapshot.
 */
@Slf4j
@Service
public class PairSelectionService {
    // нейтральный спред, если источник его не дал: половина веса в LIQUIDITY
    private static final double NEUTRAL_SPREAD_BPS = 100;

    private final TradingProperties props;
    private final PairMetricsSource metricsSource;
    private final Clock clock;

    private final List<TradingPair> pairs;
    private final Map<String, TradingPair> pairsBySymbol = new LinkedHashMap<>();
    private final Map<String, PairMetrics> metrics = new LinkedHashMap<>();
    private final Map<String, PairPerformance> performance = new LinkedHashMap<>();
    private final Map<String, Double> lastScores = new LinkedHashMap<>();
    private final AtomicBoolean busy = new AtomicBoolean();

    private volatile Set<String> activePairs = Collections.emptySet();
    private volatile long lastEvaluationMs = -1;

    public PairSelectionService(TradingProperties props, PairMetricsSource metricsSource, Clock clock) {
        this.props = props;
        this.metricsSource = metricsSource;
        this.clock = clock;
        this.pairs = props.getPairs().stream()
                .filter(TradingPair::isEnabled)
                .collect(Collectors.toUnmodifiableList());

        for (TradingPair pair : pairs) {
            pairsBySymbol.put(pair.getSymbol(), pair);
            metrics.put(pair.getSymbol(), new PairMetrics());
            performance.put(pair.getSymbol(), new PairPerformance());
        }
        log.info("Pair selector initialized with {} enabled pairs, strategy {}, max active {}",
                pairs.size(), props.getStrategy(), props.getMaxActivePairs());
    }

    /**
     * Refreshes metrics of every enabled pair, scores them with the configured strategy and
     * activates the top {@code maxActivePairs}. Skipped if an evaluation or rotation is running.
     */
    public void evaluateAndSelect() {
        if (!busy.compareAndSet(false, true)) {
            log.debug("Pair evaluation already in progress, skipping");
            return;
        }
        try {
            synchronized (this) {
                ScoringStrategy strategy = props.getStrategy();
                log.info("Evaluating {} pairs using {} strategy...", pairs.size(), strategy);

                pairs.forEach(this::refreshMetrics);
                List<ScoredPair> ranking = rank(pairs, strategy);

                Set<String> selected = ranking.stream()
                        .limit(Math.max(0, props.getMaxActivePairs()))
                        .map(ScoredPair::getSymbol)
                        .collect(Collectors.toCollection(LinkedHashSet::new));
                applyActiveSet(selected);
                lastEvaluationMs = clock.millis();

                ranking.stream()
                        .filter(scored -> selected.contains(scored.getSymbol()))
                        .forEach(scored -> log.info("  selected {} (score {})",
                                scored.getSymbol(), String.format("%.2f", scored.getScore())));
                log.info("Active pairs: {}", selected);
            }
        } finally {
            busy.set(false);
        }
    }

    /**
     * Swaps the weakest active pair for the strongest inactive one when the candidate beats
     * the incumbent by more than the rotation margin.
     */
    public void maybeRotate() {
        if (!props.isRotationEnabled() || pairs.size() <= props.getMaxActivePairs()) {
            return;
        }
        if (!busy.compareAndSet(false, true)) {
            log.debug("Pair evaluation in progress, skipping rotation");
            return;
        }
        try {
            synchronized (this) {
                Set<String> current = activePairs;
                List<TradingPair> inactive = pairs.stream()
                        .filter(pair -> !current.contains(pair.getSymbol()))
                        .collect(Collectors.toList());
                if (current.isEmpty() || inactive.isEmpty()) {
                    return;
                }

                inactive.forEach(this::refreshMetrics);
                ScoringStrategy strategy = props.getStrategy();

                ScoredPair weakest = null;
                for (TradingPair pair : pairs) {
                    if (current.contains(pair.getSymbol())) {
                        ScoredPair scored = score(pair, strategy);
                        if (weakest == null || scored.getScore() < weakest.getScore()) {
                            weakest = scored;
                        }
                    }
                }
                ScoredPair strongest = null;
                for (TradingPair pair : inactive) {
                    ScoredPair scored = score(pair, strategy);
                    if (strongest == null || scored.getScore() > strongest.getScore()) {
                        strongest = scored;
                    }
                }

                if (strongest.getScore() > weakest.getScore() * (1 + props.getRotationMargin())) {
                    Set<String> rotated = new LinkedHashSet<>(current);
                    rotated.remove(weakest.getSymbol());
                    rotated.add(strongest.getSymbol());
                    applyActiveSet(rotated);
                    log.info("Rotated {} (score {}) -> {} (score {})",
                            weakest.getSymbol(), String.format("%.2f", weakest.getScore()),
                            strongest.getSymbol(), String.format("%.2f", strongest.getScore()));
                } else {
                    log.debug("No rotation: best candidate {} ({}) does not beat {} ({}) by {}%",
                            strongest.getSymbol(), strongest.getScore(), weakest.getSymbol(), weakest.getScore(),
                            props.getRotationMargin() * 100);
                }
            }
        } finally {
            busy.set(false);
        }
    }

    public boolean shouldReEvaluate() {
        long last = lastEvaluationMs;
        return last < 0 || clock.millis() - last >= props.getEvaluationInterval().toMillis();
    }

    public Set<String> getActivePairs() {
        return activePairs;
    }

    /**
     * Active pairs in selection order.
     */
    public List<TradingPair> getActiveTradingPairs() {
        return activePairs.stream()
                .map(pairsBySymbol::get)
                .collect(Collectors.toList());
    }

    public void recordTradeOutcome(String symbol, TradeResult result) {
        recordTradeOutcome(symbol, result, TradeValuation.NONE);
    }

    public void recordTradeOutcome(String symbol, TradeResult result, TradeValuation valuation) {
        PairPerformance perf;
        synchronized (this) {
            perf = performance.get(symbol);
        }
        if (perf == null) {
            log.warn("Trade outcome for unknown pair {} ignored", symbol);
            return;
        }
        perf.record(result.isSuccess(), valuation != null ? valuation : TradeValuation.NONE,
                result.getExecutedAtMs() > 0 ? result.getExecutedAtMs() : clock.millis());
    }

    public synchronized Optional<PairPerformance> getPerformance(String symbol) {
        return Optional.ofNullable(performance.get(symbol)).map(PairPerformance::copy);
    }

    public synchronized Optional<PairMetrics> getMetrics(String symbol) {
        return Optional.ofNullable(metrics.get(symbol)).map(m -> m.toBuilder().build());
    }

    public synchronized List<PairSummary> getPairsSummary() {
        List<PairSummary> summary = new ArrayList<>();
        for (TradingPair pair : pairs) {
            PairMetrics m = metrics.get(pair.getSymbol());
            PairPerformance perf = performance.get(pair.getSymbol());
            summary.add(PairSummary.builder()
                    .symbol(pair.getSymbol())
                    .active(activePairs.contains(pair.getSymbol()))
                    .score(lastScores.getOrDefault(pair.getSymbol(), 0.0))
                    .liquidity(m.getLiquidity())
                    .spread(m.getSpread())
                    .volatility(m.getVolatility())
                    .profitability(m.getProfitability())
                    .totalTrades(perf.getTotalTrades())
                    .successRate(perf.successRate())
                    .build());
        }
        return summary;
    }

    // ---- internals, called with the monitor held ----

    private void refreshMetrics(TradingPair pair) {
        MarketSnapshot snapshot;
        try {
            snapshot = metricsSource.fetch(pair);
        } catch (RuntimeException e) {
            log.warn("Could not fetch market data for {}: {}", pair.getSymbol(), e.getMessage());
            snapshot = MarketSnapshot.EMPTY;
        }
        if (snapshot == null) {
            snapshot = MarketSnapshot.EMPTY;
        }

        PairMetrics m = metrics.get(pair.getSymbol());
        PairPerformance perf = performance.get(pair.getSymbol());
        m.setLiquidity(orDefault(snapshot.getLiquidity(), 0));
        m.setVolume24h(orDefault(snapshot.getVolume24h(), 0));
        m.setVolatility(orDefault(snapshot.getVolatility(), 0));
        m.setSpread(orDefault(snapshot.getSpread(), NEUTRAL_SPREAD_BPS));
        m.setProfitability(perf.profitability());
        m.setRiskScore(m.getVolatility() * 100 + m.getSpread() / 10);
        m.setLastUpdateMs(clock.millis());
    }

    private List<ScoredPair> rank(List<TradingPair> candidates, ScoringStrategy strategy) {
        // Stream.sorted is stable: equal scores keep configuration order
        return candidates.stream()
                .map(pair -> score(pair, strategy))
                .sorted(Comparator.comparingDouble(ScoredPair::getScore).reversed())
                .collect(Collectors.toList());
    }

    private ScoredPair score(TradingPair pair, ScoringStrategy strategy) {
        double value = strategy.score(metrics.get(pair.getSymbol()), performance.get(pair.getSymbol()));
        lastScores.put(pair.getSymbol(), value);
        return new ScoredPair(pair.getSymbol(), value);
    }

    private void applyActiveSet(Set<String> selected) {
        metrics.forEach((symbol, m) -> m.setActive(selected.contains(symbol)));
        activePairs = Collections.unmodifiableSet(selected);
    }

    private static double orDefault(Double value, double fallback) {
        return value != null && Double.isFinite(value) ? value : fallback;
    }

    @Value
    private static class ScoredPair {
        String symbol;
        double score;
    }
}
