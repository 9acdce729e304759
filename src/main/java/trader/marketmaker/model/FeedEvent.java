package trader.marketmaker.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FeedEvent {

    public enum Type {
        CONNECTED,
        DISCONNECTED,
        PRICE_UPDATE,
        RECONNECT_SCHEDULED,
        TERMINAL_FAILURE
    }

    Type type;
    String symbol;
    PriceQuote quote;
    Integer attempt;
    Long delayMs;
    String reason;

    public static FeedEvent connected() {
        return FeedEvent.builder().type(Type.CONNECTED).build();
    }

    public static FeedEvent disconnected(String reason) {
        return FeedEvent.builder().type(Type.DISCONNECTED).reason(reason).build();
    }

    public static FeedEvent priceUpdate(PriceQuote quote) {
        return FeedEvent.builder().type(Type.PRICE_UPDATE).symbol(quote.getSymbol()).quote(quote).build();
    }

    public static FeedEvent reconnectScheduled(int attempt, long delayMs, String reason) {
        return FeedEvent.builder()
                .type(Type.RECONNECT_SCHEDULED)
                .attempt(attempt)
                .delayMs(delayMs)
                .reason(reason)
                .build();
    }

    public static FeedEvent terminalFailure(int attempts, String reason) {
        return FeedEvent.builder().type(Type.TERMINAL_FAILURE).attempt(attempts).reason(reason).build();
    }
}
