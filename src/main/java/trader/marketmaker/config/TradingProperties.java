package trader.marketmaker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import trader.marketmaker.model.TradingPair;
import trader.marketmaker.service.selection.ScoringStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {
    /** Swaps are only sent when enabled; otherwise the loop only evaluates pairs. */
    private boolean enabled = false;
    private long loopIntervalMs = 10_000;
    private int maxActivePairs = 3;
    private ScoringStrategy strategy = ScoringStrategy.LIQUIDITY;
    private Duration evaluationInterval = Duration.ofSeconds(30);
    private boolean rotationEnabled = false;
    private double rotationMargin = 0.2;
    private int concurrentTradeLimit = 2;
    private int maxSlippageBps = 100;
    /** Base per-pair cooldown between trades, scaled by the pair's success rate. */
    private Duration tradingInterval = Duration.ofSeconds(5);
    /** Number of mid price samples kept per pair for realized volatility. */
    private int volatilityWindow = 30;
    /** Minimum time between two volatility samples of the same pair. */
    private Duration volatilitySampleInterval = Duration.ofSeconds(30);
    private List<TradingPair> pairs = new ArrayList<>();
}
