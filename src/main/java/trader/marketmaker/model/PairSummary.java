package trader.marketmaker.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PairSummary {
    String symbol;
    boolean active;
    double score;
    double liquidity;
    double spread;
    double volatility;
    double profitability;
    long totalTrades;
    double successRate;
}
