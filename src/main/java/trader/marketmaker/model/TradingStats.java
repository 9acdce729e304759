package trader.marketmaker.model;

import lombok.Value;

@Value
public class TradingStats {
    long tradeCount;
    long successfulTrades;
    long failedTrades;
    Long lastTradeTimeMs;
}
