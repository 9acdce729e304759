package trader.marketmaker.client;

import reactor.core.publisher.Flux;
import trader.marketmaker.model.FeedEvent;
import trader.marketmaker.model.FeedStatus;
import trader.marketmaker.model.PriceQuote;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

public interface PriceFeed {

    void connect();

    void disconnect();

    /**
     * Drops the current connection and starts over with a fresh reconnect budget.
     */
    void reconnect();

    Optional<PriceQuote> getPrice(String symbol);

    boolean hasRecentPrice(String symbol, Duration maxAge);

    Map<String, PriceQuote> getAllPrices();

    FeedStatus getStatus();

    /**
     * Connection lifecycle and accepted price updates. Hot; late subscribers miss earlier events.
     */
    Flux<FeedEvent> events();
}
