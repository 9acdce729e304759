package trader.marketmaker.exception;

import lombok.Getter;
import trader.marketmaker.model.TradeFailureReason;

@Getter
public class TradeExecutionException extends Exception {
    private final TradeFailureReason reason;

    public TradeExecutionException(TradeFailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TradeExecutionException(TradeFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
