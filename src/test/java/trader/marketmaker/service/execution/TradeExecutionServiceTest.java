package trader.marketmaker.service.execution;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.Type;
import trader.marketmaker.client.chain.ChainClient;
import trader.marketmaker.client.contracts.HyperSwapContracts;
import trader.marketmaker.config.DexProperties;
import trader.marketmaker.exception.ChainClientException;
import trader.marketmaker.exception.NoQuoteAvailableException;
import trader.marketmaker.exception.TradeExecutionException;
import trader.marketmaker.model.QuoteRequest;
import trader.marketmaker.model.RouterQuote;
import trader.marketmaker.model.RouterVersion;
import trader.marketmaker.model.TradeFailureReason;
import trader.marketmaker.model.TradeResult;
import trader.marketmaker.model.TradingStats;
import trader.marketmaker.service.quote.BestQuoteService;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradeExecutionServiceTest {
    private static final String TOKEN_IN = "0x1111111111111111111111111111111111111111";
    private static final String TOKEN_OUT = "0x2222222222222222222222222222222222222222";
    private static final String WALLET = "0x9999999999999999999999999999999999999999";
    private static final String V3_ROUTER = "0x4e2960a8cd19b467b82d26d83facb0fae26b094d";
    private static final String V2_ROUTER = "0x6d99e7f6747af2cdbb5164b6dd50e40d4fde1e77";
    private static final BigInteger AMOUNT_IN = BigInteger.valueOf(1_000_000);
    private static final BigInteger MIN_OUT = BigInteger.valueOf(950);
    private static final long NOW_SECONDS = 1_700_000_000L;

    @Mock
    private BestQuoteService quoteService;
    @Mock
    private ApprovalGuard approvalGuard;
    @Mock
    private ChainClient chainClient;

    private DexProperties props;
    private Counter executed;
    private Counter failed;
    private TradeExecutionService service;

    @BeforeEach
    void setUp() {
        props = new DexProperties();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        executed = registry.counter("trades.executed");
        failed = registry.counter("trades.failed");
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW_SECONDS), ZoneOffset.UTC);
        service = new TradeExecutionService(quoteService, approvalGuard, chainClient, props, clock, executed, failed);
    }

    @Test
    @DisplayName("quote below minimum output fails before approval or swap")
    void slippageExceeded() throws Exception {
        givenQuote(v3Quote(900, BigInteger.valueOf(100_000)));

        TradeResult result = service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "test");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo(TradeFailureReason.SLIPPAGE_EXCEEDED);
        assertThat(result.getExpectedOutput()).isEqualTo(BigInteger.valueOf(900));
        assertThat(result.getTxHash()).isNull();
        verifyNoInteractions(approvalGuard, chainClient);
        assertThat(failed.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("no quote is reported as QUOTE_UNAVAILABLE")
    void noQuote() throws Exception {
        when(quoteService.getBestQuote(anyString(), anyString(), any(BigInteger.class), anyInt()))
                .thenThrow(new NoQuoteAvailableException("No router quoted"));

        TradeResult result = service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, "test");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo(TradeFailureReason.QUOTE_UNAVAILABLE);
        assertThat(result.getQuote()).isNull();
        verifyNoInteractions(approvalGuard, chainClient);
    }

    @Test
    @DisplayName("V3 quote is executed with exactInputSingle to the wallet")
    void executesV3() throws Exception {
        RouterQuote quote = v3Quote(995, BigInteger.valueOf(100_000));
        givenQuote(quote);
        when(chainClient.getWalletAddress()).thenReturn(WALLET);
        when(chainClient.submit(eq(V3_ROUTER), any(Function.class), any(BigInteger.class))).thenReturn("0xswap");

        TradeResult result = service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "test");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTxHash()).isEqualTo("0xswap");
        assertThat(result.getExpectedOutput()).isEqualTo(BigInteger.valueOf(995));
        assertThat(result.getExecutedAtMs()).isEqualTo(NOW_SECONDS * 1000);

        verify(approvalGuard).ensureApproval(TOKEN_IN, V3_ROUTER, AMOUNT_IN);
        ArgumentCaptor<Function> swap = ArgumentCaptor.forClass(Function.class);
        verify(chainClient).submit(eq(V3_ROUTER), swap.capture(), eq(BigInteger.valueOf(120_000)));
        verify(chainClient).awaitConfirmation("0xswap");

        assertThat(swap.getValue().getName()).isEqualTo(HyperSwapContracts.EXACT_INPUT_SINGLE);
        List<Type> params = ((StaticStruct) swap.getValue().getInputParameters().get(0)).getValue();
        assertThat(params.get(2).getValue()).isEqualTo(BigInteger.valueOf(500));
        assertThat(params.get(3).toString()).isEqualTo(WALLET);
        assertThat(params.get(4).getValue()).isEqualTo(BigInteger.valueOf(NOW_SECONDS + 300));
        assertThat(params.get(5).getValue()).isEqualTo(AMOUNT_IN);
        assertThat(params.get(6).getValue()).isEqualTo(MIN_OUT);
        assertThat(executed.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("V2 quote is executed with swapExactTokensForTokens along the quoted path")
    void executesV2() throws Exception {
        String hop = props.getWrappedNative();
        RouterQuote quote = RouterQuote.builder()
                .request(new QuoteRequest(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, 3000))
                .version(RouterVersion.V2)
                .router(V2_ROUTER)
                .amountOut(BigInteger.valueOf(990))
                .path(List.of(TOKEN_IN, hop, TOKEN_OUT))
                .build();
        givenQuote(quote);
        when(chainClient.getWalletAddress()).thenReturn(WALLET);
        when(chainClient.submit(eq(V2_ROUTER), any(Function.class), any(BigInteger.class))).thenReturn("0xswap");

        TradeResult result = service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "test");

        assertThat(result.isSuccess()).isTrue();
        verify(approvalGuard).ensureApproval(TOKEN_IN, V2_ROUTER, AMOUNT_IN);
        ArgumentCaptor<Function> swap = ArgumentCaptor.forClass(Function.class);
        verify(chainClient).submit(eq(V2_ROUTER), swap.capture(), eq(BigInteger.valueOf(250_000)));
        assertThat(swap.getValue().getName()).isEqualTo(HyperSwapContracts.SWAP_EXACT_TOKENS_FOR_TOKENS);
        List<Type> inputs = swap.getValue().getInputParameters();
        assertThat(((List<?>) inputs.get(2).getValue())).hasSize(3);
        assertThat(inputs.get(3).toString()).isEqualTo(WALLET);
    }

    @Test
    @DisplayName("failed approval stops the trade before the swap")
    void approvalFails() throws Exception {
        givenQuote(v3Quote(995, null));
        doThrow(new TradeExecutionException(TradeFailureReason.APPROVAL_FAILED, "Approval reverted"))
                .when(approvalGuard).ensureApproval(anyString(), anyString(), any(BigInteger.class));

        TradeResult result = service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "test");

        assertThat(result.getFailureReason()).isEqualTo(TradeFailureReason.APPROVAL_FAILED);
        assertThat(result.getError()).contains("Approval reverted");
        verify(chainClient, never()).submit(anyString(), any(Function.class), any(BigInteger.class));
    }

    @Test
    @DisplayName("rejected submission is SWAP_SUBMISSION_FAILED")
    void submissionFails() throws Exception {
        givenQuote(v3Quote(995, null));
        when(chainClient.getWalletAddress()).thenReturn(WALLET);
        when(chainClient.submit(anyString(), any(Function.class), any(BigInteger.class)))
                .thenThrow(new ChainClientException("insufficient funds for gas"));

        TradeResult result = service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "test");

        assertThat(result.getFailureReason()).isEqualTo(TradeFailureReason.SWAP_SUBMISSION_FAILED);
        assertThat(result.getTxHash()).isNull();
    }

    @Test
    @DisplayName("missing transaction hash is never reported as success")
    void blankHash() throws Exception {
        givenQuote(v3Quote(995, null));
        when(chainClient.getWalletAddress()).thenReturn(WALLET);
        when(chainClient.submit(anyString(), any(Function.class), any(BigInteger.class))).thenReturn("");

        TradeResult result = service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "test");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo(TradeFailureReason.SWAP_SUBMISSION_FAILED);
        verify(chainClient, never()).awaitConfirmation(anyString());
    }

    @Test
    @DisplayName("reverted swap is SWAP_NOT_CONFIRMED")
    void swapReverts() throws Exception {
        givenQuote(v3Quote(995, null));
        when(chainClient.getWalletAddress()).thenReturn(WALLET);
        when(chainClient.submit(anyString(), any(Function.class), any(BigInteger.class))).thenReturn("0xswap");
        when(chainClient.awaitConfirmation("0xswap")).thenThrow(new ChainClientException("Transaction reverted"));

        TradeResult result = service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "test");

        assertThat(result.getFailureReason()).isEqualTo(TradeFailureReason.SWAP_NOT_CONFIRMED);
        assertThat(result.getExpectedOutput()).isEqualTo(BigInteger.valueOf(995));
    }

    @Test
    @DisplayName("runtime errors are returned, not thrown")
    void unexpectedError() throws Exception {
        when(quoteService.getBestQuote(anyString(), anyString(), any(BigInteger.class), anyInt()))
                .thenThrow(new IllegalStateException("boom"));

        TradeResult result = service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "test");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo(TradeFailureReason.UNEXPECTED);
        assertThat(result.getError()).isEqualTo("boom");
    }

    @Test
    @DisplayName("native input is quoted as wrapped native")
    void nativeInputRouted() throws Exception {
        when(quoteService.getBestQuote(anyString(), anyString(), any(BigInteger.class), anyInt()))
                .thenThrow(new NoQuoteAvailableException("No router quoted"));

        service.executeBestTrade(DexProperties.NATIVE_TOKEN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 500, "test");

        verify(quoteService).getBestQuote(props.getWrappedNative(), TOKEN_OUT, AMOUNT_IN, 500);
    }

    @Test
    @DisplayName("stats count every attempt")
    void statsCountAttempts() throws Exception {
        when(quoteService.getBestQuote(anyString(), anyString(), any(BigInteger.class), anyInt()))
                .thenReturn(v3Quote(900, null), v3Quote(995, null));
        when(chainClient.getWalletAddress()).thenReturn(WALLET);
        when(chainClient.submit(anyString(), any(Function.class), any(BigInteger.class))).thenReturn("0xswap");

        service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "first");
        service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "second");

        TradingStats stats = service.getTradingStats();
        assertThat(stats.getTradeCount()).isEqualTo(2);
        assertThat(stats.getSuccessfulTrades()).isEqualTo(1);
        assertThat(stats.getFailedTrades()).isEqualTo(1);
        assertThat(stats.getLastTradeTimeMs()).isEqualTo(NOW_SECONDS * 1000);
    }

    @Test
    @DisplayName("gas limit is the estimate plus buffer, or the default without one")
    void v3GasLimit() {
        assertThat(service.v3GasLimit(v3Quote(995, BigInteger.valueOf(150_000)))).isEqualTo(BigInteger.valueOf(180_000));
        assertThat(service.v3GasLimit(v3Quote(995, null))).isEqualTo(BigInteger.valueOf(300_000));
        assertThat(service.v3GasLimit(v3Quote(995, BigInteger.ZERO))).isEqualTo(BigInteger.valueOf(300_000));
    }

    @Test
    @DisplayName("trades on the same pair never overlap, whatever the direction")
    void samePairSerialized() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(quoteService.getBestQuote(anyString(), anyString(), any(BigInteger.class), anyInt())).thenAnswer(invocation -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(100);
            inFlight.decrementAndGet();
            throw new NoQuoteAvailableException("No router quoted");
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch start = new CountDownLatch(1);
            Future<TradeResult> forward = executor.submit(() -> {
                start.await();
                return service.executeBestTrade(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, MIN_OUT, 3000, "forward");
            });
            Future<TradeResult> backward = executor.submit(() -> {
                start.await();
                return service.executeBestTrade(TOKEN_OUT.toUpperCase().replace("0X", "0x"), TOKEN_IN,
                        AMOUNT_IN, MIN_OUT, 3000, "backward");
            });
            start.countDown();

            assertThat(forward.get(5, TimeUnit.SECONDS).isSuccess()).isFalse();
            assertThat(backward.get(5, TimeUnit.SECONDS).isSuccess()).isFalse();
        } finally {
            executor.shutdownNow();
        }
        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    private void givenQuote(RouterQuote quote) throws Exception {
        when(quoteService.getBestQuote(anyString(), anyString(), any(BigInteger.class), anyInt())).thenReturn(quote);
    }

    private static RouterQuote v3Quote(long amountOut, BigInteger gasEstimate) {
        return RouterQuote.builder()
                .request(new QuoteRequest(TOKEN_IN, TOKEN_OUT, AMOUNT_IN, 3000))
                .version(RouterVersion.V3)
                .router(V3_ROUTER)
                .amountOut(BigInteger.valueOf(amountOut))
                .fee(500)
                .path(List.of(TOKEN_IN, TOKEN_OUT))
                .gasEstimate(gasEstimate)
                .build();
    }
}
