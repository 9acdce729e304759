package trader.marketmaker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingPair {
    private String symbol;
    private String baseToken;
    private String quoteToken;
    @Builder.Default
    private int fee = 3000;
    private double liquidityUsd;
    private double volume24hUsd;
    private double targetSpreadBps;
    @Builder.Default
    private boolean enabled = true;
}
