package trader.marketmaker.service.quote;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import trader.marketmaker.client.chain.ChainClient;
import trader.marketmaker.config.DexProperties;
import trader.marketmaker.exception.ChainClientException;
import trader.marketmaker.model.QuoteRequest;
import trader.marketmaker.model.RouterQuote;
import trader.marketmaker.model.RouterVersion;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HyperSwapV2QuoterTest {
    private static final String TOKEN_IN = "0x1111111111111111111111111111111111111111";
    private static final String TOKEN_OUT = "0x2222222222222222222222222222222222222222";
    private static final BigInteger AMOUNT_IN = BigInteger.valueOf(1000);

    @Mock
    private ChainClient chainClient;

    private DexProperties props;
    private HyperSwapV2Quoter quoter;

    @BeforeEach
    void setUp() {
        props = new DexProperties();
        quoter = new HyperSwapV2Quoter(chainClient, props);
    }

    @Test
    @DisplayName("direct path plus a hop through wrapped native")
    void candidatePathsWithHop() {
        List<List<String>> paths = quoter.candidatePaths(request(TOKEN_IN, TOKEN_OUT));

        assertThat(paths).containsExactly(
                List.of(TOKEN_IN, TOKEN_OUT),
                List.of(TOKEN_IN, props.getWrappedNative(), TOKEN_OUT));
    }

    @Test
    @DisplayName("no hop when one side already is wrapped native")
    void candidatePathsWithWrappedNative() {
        String wrapped = props.getWrappedNative().toUpperCase().replace("0X", "0x");

        assertThat(quoter.candidatePaths(request(wrapped, TOKEN_OUT))).hasSize(1);
        assertThat(quoter.candidatePaths(request(TOKEN_IN, wrapped))).hasSize(1);
    }

    @Test
    @DisplayName("no hop when disabled")
    void candidatePathsHopDisabled() {
        props.getV2().setRouteViaWrappedNative(false);

        assertThat(quoter.candidatePaths(request(TOKEN_IN, TOKEN_OUT)))
                .containsExactly(List.of(TOKEN_IN, TOKEN_OUT));
    }

    @Test
    @DisplayName("keeps the path with the larger final amount")
    void picksBetterPath() throws Exception {
        when(chainClient.call(eq(props.getV2().getRouter()), any(Function.class))).thenAnswer(invocation ->
                pathLength(invocation.getArgument(1)) == 2
                        ? amounts(1000, 980)
                        : amounts(1000, 40, 990));

        Optional<RouterQuote> quote = quoter.quote(request(TOKEN_IN, TOKEN_OUT));

        assertThat(quote).hasValueSatisfying(q -> {
            assertThat(q.getVersion()).isEqualTo(RouterVersion.V2);
            assertThat(q.getAmountOut()).isEqualTo(BigInteger.valueOf(990));
            assertThat(q.getPath()).hasSize(3);
            assertThat(q.getRouter()).isEqualTo(props.getV2().getRouter());
            assertThat(q.getFee()).isNull();
        });
    }

    @Test
    @DisplayName("a missing pair on one path does not fail the quote")
    void onePathReverts() throws Exception {
        when(chainClient.call(eq(props.getV2().getRouter()), any(Function.class))).thenAnswer(invocation -> {
            if (pathLength(invocation.getArgument(1)) == 2) {
                throw new ChainClientException("execution reverted: INSUFFICIENT_LIQUIDITY");
            }
            return amounts(1000, 40, 990);
        });

        assertThat(quoter.quote(request(TOKEN_IN, TOKEN_OUT)))
                .map(RouterQuote::getAmountOut)
                .contains(BigInteger.valueOf(990));
    }

    @Test
    @DisplayName("fails when no path could be quoted")
    void allPathsFail() throws Exception {
        when(chainClient.call(eq(props.getV2().getRouter()), any(Function.class)))
                .thenThrow(new ChainClientException("execution reverted"));

        assertThatThrownBy(() -> quoter.quote(request(TOKEN_IN, TOKEN_OUT)))
                .isInstanceOf(ChainClientException.class);
    }

    @Test
    @DisplayName("zero amounts on every path is no quote")
    void zeroOutput() throws Exception {
        when(chainClient.call(eq(props.getV2().getRouter()), any(Function.class)))
                .thenReturn(amounts(1000, 0));

        assertThat(quoter.quote(request(TOKEN_IN, TOKEN_OUT))).isEmpty();
    }

    private static QuoteRequest request(String tokenIn, String tokenOut) {
        return new QuoteRequest(tokenIn, tokenOut, AMOUNT_IN, 3000);
    }

    private static int pathLength(Function function) {
        return ((DynamicArray<?>) function.getInputParameters().get(1)).getValue().size();
    }

    private static List<Type> amounts(long... values) {
        List<Uint256> amounts = Arrays.stream(values)
                .mapToObj(value -> new Uint256(BigInteger.valueOf(value)))
                .collect(Collectors.toList());
        return List.<Type>of(new DynamicArray<>(Uint256.class, amounts));
    }
}
