package trader.marketmaker.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class TradeResult {
    boolean success;
    String txHash;
    RouterQuote quote;
    BigInteger expectedOutput;
    String error;
    TradeFailureReason failureReason;
    String reason;
    long executedAtMs;

    public static TradeResult succeeded(RouterQuote quote, String txHash, String reason, long executedAtMs) {
        if (txHash == null || txHash.isBlank()) {
            throw new IllegalArgumentException("Successful trade requires a transaction hash");
        }
        return TradeResult.builder()
                .success(true)
                .txHash(txHash)
                .quote(quote)
                .expectedOutput(quote.getAmountOut())
                .reason(reason)
                .executedAtMs(executedAtMs)
                .build();
    }

    public static TradeResult failed(TradeFailureReason failureReason, String error, RouterQuote quote,
                                     String reason, long executedAtMs) {
        return TradeResult.builder()
                .success(false)
                .quote(quote)
                .expectedOutput(quote != null ? quote.getAmountOut() : null)
                .error(error)
                .failureReason(failureReason)
                .reason(reason)
                .executedAtMs(executedAtMs)
                .build();
    }
}
