package trader.marketmaker.model;

import lombok.Getter;

/**
 * Running trade statistics of one pair. Writers synchronize on the instance; readers get copies.
 */
@Getter
public class PairPerformance {
    private long totalTrades;
    private long successfulTrades;
    private double totalVolume;
    private double totalPnl;
    private Double avgSpread;
    private Long lastTradeTimeMs;

    public synchronized void record(boolean success, TradeValuation valuation, long timestampMs) {
        totalTrades++;
        lastTradeTimeMs = timestampMs;
        if (!success) {
            return;
        }
        successfulTrades++;
        if (valuation.getVolumeUsd() != null) {
            totalVolume += valuation.getVolumeUsd();
        }
        if (valuation.getPnlUsd() != null) {
            totalPnl += valuation.getPnlUsd();
        }
        Double spread = valuation.getSpreadBps();
        if (spread != null) {
            avgSpread = avgSpread == null ? spread : (avgSpread + spread) / 2;
        }
    }

    /**
     * Success ratio, 0.5 when nothing has been traded yet.
     */
    public synchronized double successRate() {
        return totalTrades > 0 ? (double) successfulTrades / totalTrades : 0.5;
    }

    public synchronized double profitability() {
        return totalVolume > 0 ? totalPnl / totalVolume : 0;
    }

    public synchronized PairPerformance copy() {
        PairPerformance copy = new PairPerformance();
        copy.totalTrades = totalTrades;
        copy.successfulTrades = successfulTrades;
        copy.totalVolume = totalVolume;
        copy.totalPnl = totalPnl;
        copy.avgSpread = avgSpread;
        copy.lastTradeTimeMs = lastTradeTimeMs;
        return copy;
    }
}
