package trader.marketmaker.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PriceQuote {
    String symbol;
    BigDecimal price;
    long timestampMs;
    String source;

    public long ageMs(long nowMs) {
        return nowMs - timestampMs;
    }
}
