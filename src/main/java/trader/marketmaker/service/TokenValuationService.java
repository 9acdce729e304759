package trader.marketmaker.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import trader.marketmaker.client.PriceFeed;
import trader.marketmaker.config.DexProperties;
import trader.marketmaker.config.FeedProperties;
import trader.marketmaker.model.PriceQuote;
import trader.marketmaker.model.TokenInfo;
import trader.marketmaker.model.TradingPair;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * USD valuation of configured tokens from HyperLiquid mids. Stablecoins count as one dollar.
 */
@Service
@RequiredArgsConstructor
public class TokenValuationService {
    private final PriceFeed priceFeed;
    private final DexProperties dexProperties;
    private final FeedProperties feedProperties;

    /**
     * USD price of a token, empty when the token is unknown or its feed price is missing or stale.
     */
    public Optional<BigDecimal> usdPrice(String tokenSymbol) {
        Optional<TokenInfo> token = dexProperties.findToken(tokenSymbol);
        if (token.isEmpty()) {
            return Optional.empty();
        }
        if (token.get().isStable()) {
            return Optional.of(BigDecimal.ONE);
        }
        String feedSymbol = token.get().getFeedSymbol();
        if (feedSymbol == null || !priceFeed.hasRecentPrice(feedSymbol, feedProperties.getMaxPriceAge())) {
            return Optional.empty();
        }
        return priceFeed.getPrice(feedSymbol).map(PriceQuote::getPrice);
    }

    /**
     * Price of the base token in quote tokens.
     */
    public Optional<BigDecimal> pairPrice(TradingPair pair) {
        Optional<BigDecimal> base = usdPrice(pair.getBaseToken());
        Optional<BigDecimal> quote = usdPrice(pair.getQuoteToken());
        if (base.isEmpty() || quote.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(base.get().divide(quote.get(), MathContext.DECIMAL64));
    }

    public BigInteger toRaw(TokenInfo token, BigDecimal amount) {
        return amount.movePointRight(token.getDecimals()).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    public BigDecimal fromRaw(TokenInfo token, BigInteger raw) {
        return new BigDecimal(raw).movePointLeft(token.getDecimals());
    }
}
