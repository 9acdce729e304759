package trader.marketmaker.service.selection;

import trader.marketmaker.model.MarketSnapshot;
import trader.marketmaker.model.TradingPair;

/**
 * Market data used to score a pair. Implementations return nulls for data they don't have.
 */
public interface PairMetricsSource {

    MarketSnapshot fetch(TradingPair pair);
}
