package trader.marketmaker.service.quote;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import trader.marketmaker.client.chain.ChainClient;
import trader.marketmaker.client.contracts.HyperSwapContracts;
import trader.marketmaker.config.DexProperties;
import trader.marketmaker.exception.ChainClientException;
import trader.marketmaker.model.QuoteRequest;
import trader.marketmaker.model.RouterQuote;
import trader.marketmaker.model.RouterVersion;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class HyperSwapV2Quoter implements RouterQuoter {
    private final ChainClient chainClient;
    private final DexProperties props;

    @Override
    public RouterVersion getVersion() {
        return RouterVersion.V2;
    }

    @Override
    public boolean supports(QuoteRequest request) {
        String router = props.getV2().getRouter();
        return router != null && !router.isBlank();
    }

    @Override
    public Optional<RouterQuote> quote(QuoteRequest request) throws ChainClientException {
        List<List<String>> paths = candidatePaths(request);

        RouterQuote best = null;
        ChainClientException lastError = null;
        int failures = 0;

        for (List<String> path : paths) {
            try {
                BigInteger amountOut = quotePath(request.getAmountIn(), path);
                log.debug("V2 quote via {}: {}", path, amountOut);
                if (amountOut.signum() > 0 && (best == null || amountOut.compareTo(best.getAmountOut()) > 0)) {
                    best = RouterQuote.builder()
                            .request(request)
                            .version(RouterVersion.V2)
                            .router(props.getV2().getRouter())
                            .amountOut(amountOut)
                            .path(path)
                            .source("HyperSwap V2 Router02")
                            .build();
                }
            } catch (ChainClientException e) {
                log.debug("V2 quote via {} failed: {}", path, e.getMessage());
                lastError = e;
                failures++;
            }
        }

        if (best == null && failures == paths.size()) {
            throw lastError;
        }
        return Optional.ofNullable(best);
    }

    List<List<String>> candidatePaths(QuoteRequest request) {
        List<List<String>> paths = new ArrayList<>();
        paths.add(List.of(request.getTokenIn(), request.getTokenOut()));

        String wrapped = props.getWrappedNative();
        if (props.getV2().isRouteViaWrappedNative()
                && !wrapped.equalsIgnoreCase(request.getTokenIn())
                && !wrapped.equalsIgnoreCase(request.getTokenOut())) {
            paths.add(List.of(request.getTokenIn(), wrapped, request.getTokenOut()));
        }
        return paths;
    }

    @SuppressWarnings("unchecked")
    private BigInteger quotePath(BigInteger amountIn, List<String> path) throws ChainClientException {
        List<Type> result = chainClient.call(props.getV2().getRouter(), HyperSwapContracts.getAmountsOut(amountIn, path));
        List<Uint256> amounts = ((DynamicArray<Uint256>) result.get(0)).getValue();
        if (amounts.isEmpty()) {
            throw new ChainClientException("getAmountsOut returned no amounts for " + path);
        }
        return amounts.get(amounts.size() - 1).getValue();
    }
}
