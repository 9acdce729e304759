package trader.marketmaker.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

@Value
@Builder
public class RouterQuote {
    QuoteRequest request;
    RouterVersion version;
    /** Router the swap must be sent to. */
    String router;
    BigInteger amountOut;
    Integer fee;
    List<String> path;
    BigInteger gasEstimate;
    String source;

    public boolean isPositive() {
        return amountOut != null && amountOut.signum() > 0;
    }
}
