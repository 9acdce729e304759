package trader.marketmaker.model;

import lombok.Value;

import java.math.BigInteger;

/**
 * Identity of a quote: amounts are only ever compared between quotes of the same request.
 */
@Value
public class QuoteRequest {
    String tokenIn;
    String tokenOut;
    BigInteger amountIn;
    int feeHint;

    public boolean sameSwap(QuoteRequest other) {
        return other != null
                && tokenIn.equalsIgnoreCase(other.tokenIn)
                && tokenOut.equalsIgnoreCase(other.tokenOut)
                && amountIn.equals(other.amountIn);
    }
}
