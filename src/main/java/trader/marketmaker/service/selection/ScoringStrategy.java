package trader.marketmaker.service.selection;

import trader.marketmaker.model.PairMetrics;
import trader.marketmaker.model.PairPerformance;

/**
 * Pair scoring formulas. Every score is clamped to [0, 100].
 */
public enum ScoringStrategy {

    /** Deep pools with tight spreads and low risk. */
    LIQUIDITY {
        @Override
        double rawScore(PairMetrics metrics, PairPerformance performance) {
            return Math.min(metrics.getLiquidity() / 1_000_000, 1) * 40
                    + Math.max(0, (200 - metrics.getSpread()) / 200) * 30
                    + Math.max(0, (100 - metrics.getRiskScore()) / 100) * 20
                    + performance.successRate() * 10;
        }
    },

    VOLATILITY {
        @Override
        double rawScore(PairMetrics metrics, PairPerformance performance) {
            return Math.min(metrics.getVolatility() * 100, 50)
                    + Math.min(metrics.getLiquidity() / 500_000, 1) * 25
                    + Math.max(0, metrics.getProfitability()) * 25;
        }
    },

    PROFIT {
        @Override
        double rawScore(PairMetrics metrics, PairPerformance performance) {
            double experience = performance.getTotalTrades() > 10 ? performance.successRate() * 25 : 0;
            return Math.max(0, metrics.getProfitability()) * 50
                    + Math.min(performance.getTotalVolume() / 10_000, 1) * 25
                    + experience;
        }
    },

    COMPOSITE {
        @Override
        double rawScore(PairMetrics metrics, PairPerformance performance) {
            return 0.3 * Math.min(metrics.getLiquidity() / 1_000_000, 1) * 100
                    + 0.3 * Math.max(0, metrics.getProfitability()) * 100
                    + 0.2 * Math.max(0, (100 - metrics.getRiskScore()) / 100) * 100
                    + 0.2 * performance.successRate() * 100;
        }
    };

    abstract double rawScore(PairMetrics metrics, PairPerformance performance);

    public double score(PairMetrics metrics, PairPerformance performance) {
        double raw = rawScore(metrics, performance);
        if (Double.isNaN(raw)) {
            return 0;
        }
        return Math.max(0, Math.min(100, raw));
    }
}
