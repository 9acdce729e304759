package trader.marketmaker.service.quote;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.datatypes.Type;
import trader.marketmaker.client.chain.ChainClient;
import trader.marketmaker.client.contracts.HyperSwapContracts;
import trader.marketmaker.config.DexProperties;
import trader.marketmaker.exception.ChainClientException;
import trader.marketmaker.model.QuoteRequest;
import trader.marketmaker.model.RouterQuote;
import trader.marketmaker.model.RouterVersion;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class HyperSwapV3Quoter implements RouterQuoter {
    private final ChainClient chainClient;
    private final DexProperties props;

    @Override
    public RouterVersion getVersion() {
        return RouterVersion.V3;
    }

    @Override
    public boolean supports(QuoteRequest request) {
        DexProperties.V3 v3 = props.getV3();
        return hasText(v3.getQuoter()) && hasText(v3.getSwapRouter());
    }

    @Override
    public Optional<RouterQuote> quote(QuoteRequest request) throws ChainClientException {
        Set<Integer> feeTiers = new LinkedHashSet<>();
        feeTiers.add(request.getFeeHint());
        feeTiers.addAll(props.getV3().getExtraFeeTiers());

        RouterQuote best = null;
        ChainClientException lastError = null;
        int failures = 0;

        for (int fee : feeTiers) {
            try {
                RouterQuote quote = quoteTier(request, fee);
                log.debug("V3 quote {} -> {} fee {}: {}", request.getTokenIn(), request.getTokenOut(), fee,
                        quote.getAmountOut());
                if (quote.isPositive() && (best == null || quote.getAmountOut().compareTo(best.getAmountOut()) > 0)) {
                    best = quote;
                }
            } catch (ChainClientException e) {
                // у пула с таким fee может не быть ликвидности
                log.debug("V3 quote for fee {} failed: {}", fee, e.getMessage());
                lastError = e;
                failures++;
            }
        }

        if (best == null && failures == feeTiers.size()) {
            throw lastError;
        }
        return Optional.ofNullable(best);
    }

    private RouterQuote quoteTier(QuoteRequest request, int fee) throws ChainClientException {
        List<Type> result = chainClient.call(
                props.getV3().getQuoter(),
                HyperSwapContracts.quoteExactInputSingle(
                        request.getTokenIn(), request.getTokenOut(), request.getAmountIn(), fee));

        BigInteger amountOut = (BigInteger) result.get(0).getValue();
        BigInteger gasEstimate = result.size() > 3 ? (BigInteger) result.get(3).getValue() : null;

        return RouterQuote.builder()
                .request(request)
                .version(RouterVersion.V3)
                .router(props.getV3().getSwapRouter())
                .amountOut(amountOut)
                .fee(fee)
                .path(List.of(request.getTokenIn(), request.getTokenOut()))
                .gasEstimate(gasEstimate)
                .source("HyperSwap V3 QuoterV2")
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
