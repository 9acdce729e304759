package trader.marketmaker.client;

import lombok.extern.slf4j.Slf4j;
import trader.marketmaker.model.PriceQuote;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest mid price per symbol plus the last value announced in the log.
 */
@Slf4j
public class MidPriceBook {

    public enum UpdateOutcome {
        /** First valid price for the symbol, logged as the baseline. */
        INITIAL,
        /** Moved at least the change threshold since the last announced value. */
        ANNOUNCED,
        /** Stored, but too small a move to announce. */
        RECORDED,
        /** Not a finite positive number; nothing changed. */
        REJECTED
    }

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Map<String, PriceQuote> quotes = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> lastAnnounced = new ConcurrentHashMap<>();
    private final BigDecimal changeThreshold;
    private final Set<String> announcedSymbols;

    public MidPriceBook(BigDecimal changeThreshold, Collection<String> announcedSymbols) {
        this.changeThreshold = changeThreshold;
        this.announcedSymbols = new HashSet<>(announcedSymbols);
    }

    public UpdateOutcome update(String symbol, String rawPrice, long timestampMs, String source) {
        BigDecimal price = parsePositive(rawPrice);
        if (price == null) {
            log.warn("Invalid {} price received: {}", symbol, rawPrice);
            return UpdateOutcome.REJECTED;
        }

        quotes.put(symbol, PriceQuote.builder()
                .symbol(symbol)
                .price(price)
                .timestampMs(timestampMs)
                .source(source)
                .build());

        return announce(symbol, price);
    }

    private UpdateOutcome announce(String symbol, BigDecimal price) {
        BigDecimal last = lastAnnounced.get(symbol);
        if (last == null) {
            lastAnnounced.put(symbol, price);
            if (isAnnounced(symbol)) {
                log.info("{} price: {} (initial)", symbol, price);
            }
            return UpdateOutcome.INITIAL;
        }

        BigDecimal change = price.subtract(last).divide(last, MathContext.DECIMAL64);
        if (change.abs().compareTo(changeThreshold) >= 0) {
            lastAnnounced.put(symbol, price);
            if (isAnnounced(symbol)) {
                log.info("{} price: {} ({}{}%)", symbol, price, change.signum() > 0 ? "+" : "-",
                        change.abs().multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP));
            }
            return UpdateOutcome.ANNOUNCED;
        }

        log.debug("{} price: {} (minor change)", symbol, price);
        return UpdateOutcome.RECORDED;
    }

    private boolean isAnnounced(String symbol) {
        return announcedSymbols.isEmpty() || announcedSymbols.contains(symbol);
    }

    private BigDecimal parsePositive(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(raw.trim());
            return value.signum() > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public Optional<PriceQuote> get(String symbol) {
        return Optional.ofNullable(quotes.get(symbol));
    }

    public boolean isFresh(String symbol, long maxAgeMs, long nowMs) {
        PriceQuote quote = quotes.get(symbol);
        return quote != null && quote.ageMs(nowMs) <= maxAgeMs;
    }

    public Map<String, PriceQuote> snapshot() {
        return Map.copyOf(quotes);
    }

    public int size() {
        return quotes.size();
    }
}
