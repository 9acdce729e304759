package trader.marketmaker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenInfo {
    private String symbol;
    private String address;
    @Builder.Default
    private int decimals = 18;
    /** Symbol of this token on the HyperLiquid feed, e.g. WHYPE -> HYPE. */
    private String feedSymbol;
    private boolean stable;
    /** Size of one market-making trade in whole tokens. */
    private BigDecimal tradeSize;
}
