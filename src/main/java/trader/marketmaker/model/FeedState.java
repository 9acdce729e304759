package trader.marketmaker.model;

public enum FeedState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /** Reconnect budget exhausted; only an explicit reconnect leaves this state. */
    FAILED
}
