package trader.marketmaker.exception;

import trader.marketmaker.model.TradeFailureReason;

public class NoQuoteAvailableException extends TradeExecutionException {

    public NoQuoteAvailableException(String message) {
        super(TradeFailureReason.QUOTE_UNAVAILABLE, message);
    }
}
