package trader.marketmaker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PairMetrics {
    private double liquidity;
    private double volume24h;
    private double volatility;
    private double spread;
    private double profitability;
    private double riskScore;
    private long lastUpdateMs;
    private boolean active;
}
