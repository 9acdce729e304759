package trader.marketmaker.service.quote;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import trader.marketmaker.config.DexProperties;
import trader.marketmaker.config.metrics.TimerUtils;
import trader.marketmaker.exception.NoQuoteAvailableException;
import trader.marketmaker.model.QuoteRequest;
import trader.marketmaker.model.RouterQuote;
import trader.marketmaker.model.RouterVersion;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Asks every router quoter in parallel and keeps the largest output.
 */
@Slf4j
@Service
public class BestQuoteService {

    private static final Comparator<RouterQuote> BY_OUTPUT = Comparator
            .comparing(RouterQuote::getAmountOut)
            // при равенстве V3: дешевле по газу
            .thenComparing(quote -> quote.getVersion() == RouterVersion.V3);

    private final List<RouterQuoter> quoters;
    private final DexProperties props;
    private final MeterRegistry meterRegistry;
    private final Scheduler quoteScheduler;

    public BestQuoteService(List<RouterQuoter> quoters,
                            DexProperties props,
                            MeterRegistry meterRegistry,
                            @Qualifier("quoteScheduler") Scheduler quoteScheduler) {
        this.quoters = quoters;
        this.props = props;
        this.meterRegistry = meterRegistry;
        this.quoteScheduler = quoteScheduler;
    }

    public RouterQuote getBestQuote(String tokenIn, String tokenOut, BigInteger amountIn, int feeHint)
            throws NoQuoteAvailableException {
        QuoteRequest request = new QuoteRequest(
                props.routingAddress(tokenIn), props.routingAddress(tokenOut), amountIn, feeHint);

        List<RouterQuote> quotes = TimerUtils.timedMono(() -> collectQuotes(request), meterRegistry, "quote.best.latency")
                .block();

        RouterQuote best = quotes == null ? null : quotes.stream()
                .filter(quote -> request.sameSwap(quote.getRequest()))
                .filter(RouterQuote::isPositive)
                .max(BY_OUTPUT)
                .orElse(null);

        if (best == null) {
            throw new NoQuoteAvailableException(String.format("No router quoted %s %s -> %s",
                    amountIn, tokenIn, tokenOut));
        }

        log.debug("Best quote {} -> {}: {} via {} ({} candidates)",
                tokenIn, tokenOut, best.getAmountOut(), best.getVersion(), quotes.size());
        return best;
    }

    private Mono<List<RouterQuote>> collectQuotes(QuoteRequest request) {
        return Flux.fromIterable(quoters)
                .filter(quoter -> quoter.supports(request))
                .flatMap(quoter -> Mono.fromCallable(() -> quoter.quote(request))
                        .subscribeOn(quoteScheduler)
                        .timeout(props.getQuoteTimeout())
                        .filter(Optional::isPresent)
                        .map(Optional::get)
                        .onErrorResume(error -> {
                            log.warn("{} quote {} -> {} failed: {}", quoter.getVersion(),
                                    request.getTokenIn(), request.getTokenOut(), error.getMessage());
                            return Mono.empty();
                        }))
                .collectList();
    }
}
