package trader.marketmaker.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw market data for one pair. Null fields mean the source had no data.
 */
@Value
@Builder
public class MarketSnapshot {
    public static final MarketSnapshot EMPTY = MarketSnapshot.builder().build();

    Double liquidity;
    Double volume24h;
    Double volatility;
    Double spread;
}
