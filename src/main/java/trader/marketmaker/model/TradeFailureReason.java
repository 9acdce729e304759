package trader.marketmaker.model;

public enum TradeFailureReason {
    QUOTE_UNAVAILABLE,
    SLIPPAGE_EXCEEDED,
    APPROVAL_FAILED,
    SWAP_SUBMISSION_FAILED,
    SWAP_NOT_CONFIRMED,
    UNEXPECTED
}
