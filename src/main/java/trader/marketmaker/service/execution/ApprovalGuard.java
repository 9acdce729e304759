package trader.marketmaker.service.execution;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.datatypes.Type;
import trader.marketmaker.client.chain.ChainClient;
import trader.marketmaker.client.contracts.HyperSwapContracts;
import trader.marketmaker.config.DexProperties;
import trader.marketmaker.exception.ChainClientException;
import trader.marketmaker.exception.TradeExecutionException;
import trader.marketmaker.model.TradeFailureReason;

import java.math.BigInteger;
import java.util.List;

/**
 * Makes sure a router may pull the input token before a swap is sent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalGuard {
    private final ChainClient chainClient;
    private final DexProperties props;

    /**
     * The native token has no allowance and is skipped. Swaps never reach that branch because
     * {@link TradeExecutionService} routes native as wrapped native first; it is for direct callers.
     */
    public void ensureApproval(String token, String spender, BigInteger amount) throws TradeExecutionException {
        if (props.isNative(token)) {
            return;
        }
        try {
            BigInteger allowance = allowance(token, spender);
            if (allowance.compareTo(amount) >= 0) {
                log.debug("Allowance of {} for {} is sufficient: {}", token, spender, allowance);
                return;
            }

            log.info("Approving {} for router {} (allowance {} < {})", token, spender, allowance, amount);
            String txHash = chainClient.submit(
                    token,
                    HyperSwapContracts.approve(spender, HyperSwapContracts.MAX_UINT256),
                    BigInteger.valueOf(props.getApprovalGasLimit()));
            chainClient.awaitConfirmation(txHash);
            log.info("Approval confirmed: {}", txHash);
        } catch (ChainClientException e) {
            throw new TradeExecutionException(TradeFailureReason.APPROVAL_FAILED,
                    "Approval of " + token + " for " + spender + " failed: " + e.getMessage(), e);
        }
    }

    private BigInteger allowance(String token, String spender) throws ChainClientException {
        List<Type> result = chainClient.call(token,
                HyperSwapContracts.allowance(chainClient.getWalletAddress(), spender));
        return (BigInteger) result.get(0).getValue();
    }
}
