package trader.marketmaker.service.selection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import trader.marketmaker.config.TradingProperties;
import trader.marketmaker.model.MarketSnapshot;
import trader.marketmaker.model.TradingPair;
import trader.marketmaker.service.TokenValuationService;
import trader.marketmaker.support.MutableClock;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedPairMetricsSourceTest {

    @Mock
    private TokenValuationService valuationService;

    private TradingProperties props;
    private MutableClock clock;
    private TradingPair pair;

    @BeforeEach
    void setUp() {
        props = new TradingProperties();
        props.setVolatilitySampleInterval(Duration.ZERO);
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        pair = TradingPair.builder()
                .symbol("WHYPE/USDT0")
                .baseToken("WHYPE")
                .quoteToken("USDT0")
                .liquidityUsd(6_800_000)
                .volume24hUsd(0)
                .targetSpreadBps(30)
                .build();
    }

    @Test
    @DisplayName("configured depth and spread pass through, zero means unknown")
    void configuredValues() {
        when(valuationService.pairPrice(pair)).thenReturn(Optional.empty());

        MarketSnapshot snapshot = new FeedPairMetricsSource(valuationService, props, clock).fetch(pair);

        assertThat(snapshot.getLiquidity()).isEqualTo(6_800_000.0);
        assertThat(snapshot.getSpread()).isEqualTo(30.0);
        assertThat(snapshot.getVolume24h()).isNull();
        assertThat(snapshot.getVolatility()).isNull();
    }

    @Test
    @DisplayName("volatility needs three samples")
    void volatilityAfterThreeSamples() {
        when(valuationService.pairPrice(pair)).thenReturn(
                Optional.of(new BigDecimal("100")),
                Optional.of(new BigDecimal("110")),
                Optional.of(new BigDecimal("99")));
        FeedPairMetricsSource source = new FeedPairMetricsSource(valuationService, props, clock);

        assertThat(source.fetch(pair).getVolatility()).isNull();
        assertThat(source.fetch(pair).getVolatility()).isNull();
        assertThat(source.fetch(pair).getVolatility()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    @DisplayName("old samples fall out of the window")
    void windowSlides() {
        props.setVolatilityWindow(3);
        when(valuationService.pairPrice(pair)).thenReturn(
                Optional.of(new BigDecimal("100")),
                Optional.of(new BigDecimal("200")),
                Optional.of(new BigDecimal("200")),
                Optional.of(new BigDecimal("200")));
        FeedPairMetricsSource source = new FeedPairMetricsSource(valuationService, props, clock);

        source.fetch(pair);
        source.fetch(pair);
        assertThat(source.fetch(pair).getVolatility()).isGreaterThan(0);
        assertThat(source.fetch(pair).getVolatility()).isZero();
    }

    @Test
    @DisplayName("missing price leaves the history untouched")
    void missingPriceSkipped() {
        when(valuationService.pairPrice(pair)).thenReturn(
                Optional.of(new BigDecimal("100")),
                Optional.empty(),
                Optional.of(new BigDecimal("100")),
                Optional.of(new BigDecimal("100")));
        FeedPairMetricsSource source = new FeedPairMetricsSource(valuationService, props, clock);

        source.fetch(pair);
        assertThat(source.fetch(pair).getVolatility()).isNull();
        assertThat(source.fetch(pair).getVolatility()).isNull();
        assertThat(source.fetch(pair).getVolatility()).isZero();
    }

    @Test
    @DisplayName("calls inside the sample interval reuse the last sample")
    void samplesAreTimeGated() {
        props.setVolatilitySampleInterval(Duration.ofSeconds(30));
        when(valuationService.pairPrice(pair)).thenReturn(
                Optional.of(new BigDecimal("100")),
                Optional.of(new BigDecimal("110")),
                Optional.of(new BigDecimal("99")));
        FeedPairMetricsSource source = new FeedPairMetricsSource(valuationService, props, clock);

        source.fetch(pair);
        clock.advance(Duration.ofSeconds(10));
        source.fetch(pair);
        clock.advance(Duration.ofSeconds(10));
        source.fetch(pair);
        assertThat(source.sampleCount("WHYPE/USDT0")).isEqualTo(1);

        clock.advance(Duration.ofSeconds(10));
        source.fetch(pair);
        clock.advance(Duration.ofSeconds(30));
        assertThat(source.fetch(pair).getVolatility()).isCloseTo(0.1, within(1e-9));
        assertThat(source.sampleCount("WHYPE/USDT0")).isEqualTo(3);
    }

    @Test
    @DisplayName("rotations between evaluations do not give inactive pairs extra samples")
    void rotationDoesNotSkewSampling() {
        props.setVolatilitySampleInterval(Duration.ofSeconds(30));
        props.setEvaluationInterval(Duration.ofSeconds(30));
        props.setMaxActivePairs(1);
        props.setRotationEnabled(true);
        props.getPairs().add(TradingPair.builder().symbol("A/USD").baseToken("A").quoteToken("USD").build());
        props.getPairs().add(TradingPair.builder().symbol("B/USD").baseToken("B").quoteToken("USD").build());
        when(valuationService.pairPrice(any(TradingPair.class))).thenReturn(Optional.of(new BigDecimal("10")));
        FeedPairMetricsSource source = new FeedPairMetricsSource(valuationService, props, clock);
        PairSelectionService selector = new PairSelectionService(props, source, clock);

        selector.evaluateAndSelect();
        clock.advance(Duration.ofSeconds(10));
        selector.maybeRotate();
        clock.advance(Duration.ofSeconds(10));
        selector.maybeRotate();

        assertThat(selector.getActivePairs()).containsExactly("A/USD");
        assertThat(source.sampleCount("A/USD")).isEqualTo(1);
        assertThat(source.sampleCount("B/USD")).isEqualTo(1);

        clock.advance(Duration.ofSeconds(10));
        selector.evaluateAndSelect();
        assertThat(source.sampleCount("A/USD")).isEqualTo(2);
        assertThat(source.sampleCount("B/USD")).isEqualTo(2);
    }

    @Test
    @DisplayName("standard deviation of simple returns")
    void stdDevOfReturns() {
        assertThat(FeedPairMetricsSource.stdDevOfReturns(new ArrayDeque<>(List.of(100.0, 110.0, 99.0))))
                .isCloseTo(0.1, within(1e-9));
        assertThat(FeedPairMetricsSource.stdDevOfReturns(new ArrayDeque<>(List.of(50.0, 50.0, 50.0, 50.0))))
                .isZero();
    }
}
