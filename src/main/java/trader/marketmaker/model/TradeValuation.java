package trader.marketmaker.model;

import lombok.Value;

/**
 * USD valuation of an executed trade, derived from feed prices. Any field may be null when
 * the price needed to compute it was not available.
 */
@Value
public class TradeValuation {
    public static final TradeValuation NONE = new TradeValuation(null, null, null);

    Double volumeUsd;
    Double pnlUsd;
    Double spreadBps;
}
