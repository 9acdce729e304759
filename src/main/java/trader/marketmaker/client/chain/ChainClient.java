package trader.marketmaker.client.chain;

import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import trader.marketmaker.exception.ChainClientException;

import java.math.BigInteger;
import java.util.List;

/**
 * Minimal chain capability the quoting and execution code depends on.
 */
public interface ChainClient {

    /**
     * Address that signs transactions and receives swap output.
     */
    String getWalletAddress();

    /**
     * eth_call against the latest block, decoded with the function's output types.
     */
    List<Type> call(String contractAddress, Function function) throws ChainClientException;

    /**
     * Signs and submits a transaction, returning its hash without waiting for inclusion.
     */
    String submit(String contractAddress, Function function, BigInteger gasLimit) throws ChainClientException;

    /**
     * Blocks until the transaction is mined. A reverted receipt is a failure.
     */
    TransactionReceipt awaitConfirmation(String txHash) throws ChainClientException;
}
