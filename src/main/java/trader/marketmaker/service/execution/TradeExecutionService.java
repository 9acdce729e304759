package trader.marketmaker.service.execution;

import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.web3j.abi.datatypes.Function;
import trader.marketmaker.client.chain.ChainClient;
import trader.marketmaker.client.contracts.HyperSwapContracts;
import trader.marketmaker.config.DexProperties;
import trader.marketmaker.exception.ChainClientException;
import trader.marketmaker.exception.TradeExecutionException;
import trader.marketmaker.model.RouterQuote;
import trader.marketmaker.model.TradeFailureReason;
import trader.marketmaker.model.TradeResult;
import trader.marketmaker.model.TradingStats;
import trader.marketmaker.service.quote.BestQuoteService;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executes a swap through whichever router currently quotes the best output.
 * <p>
 * Never throws: every failure is returned as an unsuccessful {@link TradeResult}.
 * Calls for the same token pair (in either direction) are serialized.
 */
@Slf4j
@Service
public class TradeExecutionService {

    private final BestQuoteService quoteService;
    private final ApprovalGuard approvalGuard;
    private final ChainClient chainClient;
    private final DexProperties props;
    private final Clock clock;
    private final Counter tradesExecutedCounter;
    private final Counter tradesFailedCounter;

    private final Map<String, ReentrantLock> pairLocks = new ConcurrentHashMap<>();
    private final AtomicLong tradeCount = new AtomicLong();
    private final AtomicLong successfulTrades = new AtomicLong();
    private final AtomicLong failedTrades = new AtomicLong();
    private volatile Long lastTradeTimeMs;

    public TradeExecutionService(BestQuoteService quoteService,
                                 ApprovalGuard approvalGuard,
                                 ChainClient chainClient,
                                 DexProperties props,
                                 Clock clock,
                                 @Qualifier("tradesExecutedCounter") Counter tradesExecutedCounter,
                                 @Qualifier("tradesFailedCounter") Counter tradesFailedCounter) {
        this.quoteService = quoteService;
        this.approvalGuard = approvalGuard;
        this.chainClient = chainClient;
        this.props = props;
        this.clock = clock;
        this.tradesExecutedCounter = tradesExecutedCounter;
        this.tradesFailedCounter = tradesFailedCounter;
    }

    public TradeResult executeBestTrade(String tokenIn, String tokenOut, BigInteger amountIn,
                                        BigInteger minAmountOut, String reason) {
        return executeBestTrade(tokenIn, tokenOut, amountIn, minAmountOut, props.getDefaultFee(), reason);
    }

    public TradeResult executeBestTrade(String tokenIn, String tokenOut, BigInteger amountIn,
                                        BigInteger minAmountOut, int feeHint, String reason) {
        String routedIn = props.routingAddress(tokenIn);
        String routedOut = props.routingAddress(tokenOut);

        ReentrantLock lock = pairLocks.computeIfAbsent(pairKey(routedIn, routedOut), key -> new ReentrantLock());
        lock.lock();
        try {
            return execute(routedIn, routedOut, amountIn, minAmountOut, feeHint, reason);
        } finally {
            lock.unlock();
        }
    }

    private TradeResult execute(String tokenIn, String tokenOut, BigInteger amountIn,
                                BigInteger minAmountOut, int feeHint, String reason) {
        log.info("Executing trade [{}]: {} {} -> {} (min out {})", reason, amountIn, tokenIn, tokenOut, minAmountOut);
        tradeCount.incrementAndGet();

        RouterQuote quote = null;
        try {
            quote = quoteService.getBestQuote(tokenIn, tokenOut, amountIn, feeHint);
            if (quote.getAmountOut().compareTo(minAmountOut) < 0) {
                throw new TradeExecutionException(TradeFailureReason.SLIPPAGE_EXCEEDED, String.format(
                        "Best quote %s via %s is below minimum output %s",
                        quote.getAmountOut(), quote.getVersion(), minAmountOut));
            }

            String txHash;
            switch (quote.getVersion()) {
                case V3:
                    txHash = executeV3(quote, amountIn, minAmountOut, feeHint);
                    break;
                case V2:
                    txHash = executeV2(quote, amountIn, minAmountOut);
                    break;
                default:
                    throw new IllegalStateException("Unknown router version " + quote.getVersion());
            }

            long now = clock.millis();
            successfulTrades.incrementAndGet();
            lastTradeTimeMs = now;
            tradesExecutedCounter.increment();
            log.info("Trade executed via {} router {}: expected output {}, tx {}",
                    quote.getVersion(), quote.getRouter(), quote.getAmountOut(), txHash);
            return TradeResult.succeeded(quote, txHash, reason, now);
        } catch (TradeExecutionException e) {
            return failure(e.getReason(), e.getMessage(), quote, reason);
        } catch (RuntimeException e) {
            log.error("Unexpected error executing trade [{}]", reason, e);
            return failure(TradeFailureReason.UNEXPECTED, String.valueOf(e.getMessage()), quote, reason);
        }
    }

    private String executeV3(RouterQuote quote, BigInteger amountIn, BigInteger minAmountOut, int feeHint)
            throws TradeExecutionException {
        String router = quote.getRouter();
        approvalGuard.ensureApproval(quote.getRequest().getTokenIn(), router, amountIn);

        int fee = quote.getFee() != null ? quote.getFee() : feeHint;
        Function swap = HyperSwapContracts.exactInputSingle(
                quote.getRequest().getTokenIn(),
                quote.getRequest().getTokenOut(),
                fee,
                chainClient.getWalletAddress(),
                deadline(),
                amountIn,
                minAmountOut);
        return submitAndConfirm(router, swap, v3GasLimit(quote));
    }

    private String executeV2(RouterQuote quote, BigInteger amountIn, BigInteger minAmountOut)
            throws TradeExecutionException {
        String router = quote.getRouter();
        approvalGuard.ensureApproval(quote.getRequest().getTokenIn(), router, amountIn);

        List<String> path = quote.getPath() != null && quote.getPath().size() >= 2
                ? quote.getPath()
                : List.of(quote.getRequest().getTokenIn(), quote.getRequest().getTokenOut());
        Function swap = HyperSwapContracts.swapExactTokensForTokens(
                amountIn, minAmountOut, path, chainClient.getWalletAddress(), deadline());
        return submitAndConfirm(router, swap, BigInteger.valueOf(props.getV2().getGasLimit()));
    }

    private String submitAndConfirm(String router, Function swap, BigInteger gasLimit) throws TradeExecutionException {
        String txHash;
        try {
            txHash = chainClient.submit(router, swap, gasLimit);
        } catch (ChainClientException e) {
            throw new TradeExecutionException(TradeFailureReason.SWAP_SUBMISSION_FAILED,
                    "Swap submission failed: " + e.getMessage(), e);
        }
        if (txHash == null || txHash.isBlank()) {
            throw new TradeExecutionException(TradeFailureReason.SWAP_SUBMISSION_FAILED,
                    "Node returned no transaction hash");
        }

        try {
            chainClient.awaitConfirmation(txHash);
        } catch (ChainClientException e) {
            throw new TradeExecutionException(TradeFailureReason.SWAP_NOT_CONFIRMED,
                    "Swap " + txHash + " not confirmed: " + e.getMessage(), e);
        }
        return txHash;
    }

    BigInteger v3GasLimit(RouterQuote quote) {
        BigInteger estimate = quote.getGasEstimate();
        if (estimate == null || estimate.signum() <= 0) {
            return BigInteger.valueOf(props.getV3().getDefaultGasLimit());
        }
        return estimate.multiply(BigInteger.valueOf(100L + props.getV3().getGasBufferPercent()))
                .divide(BigInteger.valueOf(100));
    }

    private BigInteger deadline() {
        return BigInteger.valueOf(clock.instant().plus(props.getDeadline()).getEpochSecond());
    }

    private TradeResult failure(TradeFailureReason failureReason, String error, RouterQuote quote, String reason) {
        failedTrades.incrementAndGet();
        tradesFailedCounter.increment();
        log.warn("Trade [{}] failed ({}): {}", reason, failureReason, error);
        return TradeResult.failed(failureReason, error, quote, reason, clock.millis());
    }

    private static String pairKey(String tokenA, String tokenB) {
        String a = tokenA.toLowerCase(Locale.ROOT);
        String b = tokenB.toLowerCase(Locale.ROOT);
        return a.compareTo(b) <= 0 ? a + ":" + b : b + ":" + a;
    }

    public TradingStats getTradingStats() {
        return new TradingStats(tradeCount.get(), successfulTrades.get(), failedTrades.get(), lastTradeTimeMs);
    }
}
