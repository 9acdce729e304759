package trader.marketmaker.service.quote;

import trader.marketmaker.exception.ChainClientException;
import trader.marketmaker.model.QuoteRequest;
import trader.marketmaker.model.RouterQuote;
import trader.marketmaker.model.RouterVersion;

import java.util.Optional;

/**
 * Quotes one router protocol version.
 */
public interface RouterQuoter {

    RouterVersion getVersion();

    /**
     * Whether this router is configured and can serve the request at all.
     */
    boolean supports(QuoteRequest request);

    /**
     * Best output this router offers, or empty when it has no route with a positive output.
     *
     * @throws ChainClientException when no route could be queried at all
     */
    Optional<RouterQuote> quote(QuoteRequest request) throws ChainClientException;
}
