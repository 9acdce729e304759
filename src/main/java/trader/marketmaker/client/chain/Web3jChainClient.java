package trader.marketmaker.client.chain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.TransactionReceiptProcessor;
import trader.marketmaker.exception.ChainClientException;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class Web3jChainClient implements ChainClient {
    private final Web3j web3j;
    private final TransactionManager txManager;
    private final TransactionReceiptProcessor receiptProcessor;

    @Override
    public String getWalletAddress() {
        return txManager.getFromAddress();
    }

    @Override
    public List<Type> call(String contractAddress, Function function) throws ChainClientException {
        String data = FunctionEncoder.encode(function);
        try {
            EthCall response = web3j.ethCall(
                    Transaction.createEthCallTransaction(getWalletAddress(), contractAddress, data),
                    DefaultBlockParameterName.LATEST
            ).send();

            if (response.hasError()) {
                throw new ChainClientException(String.format("eth_call %s on %s failed: %s",
                        function.getName(), contractAddress, response.getError().getMessage()));
            }
            if (response.isReverted()) {
                throw new ChainClientException(String.format("eth_call %s on %s reverted: %s",
                        function.getName(), contractAddress, response.getRevertReason()));
            }

            List<Type> decoded = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
            if (decoded.isEmpty() && !function.getOutputParameters().isEmpty()) {
                throw new ChainClientException(String.format("eth_call %s on %s returned no data",
                        function.getName(), contractAddress));
            }
            return decoded;
        } catch (IOException e) {
            throw new ChainClientException("RPC error during eth_call " + function.getName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String submit(String contractAddress, Function function, BigInteger gasLimit) throws ChainClientException {
        try {
            EthGasPrice gasPrice = web3j.ethGasPrice().send();
            if (gasPrice.hasError()) {
                throw new ChainClientException("eth_gasPrice failed: " + gasPrice.getError().getMessage());
            }

            EthSendTransaction tx = txManager.sendTransaction(
                    gasPrice.getGasPrice(),
                    gasLimit,
                    contractAddress,
                    FunctionEncoder.encode(function),
                    BigInteger.ZERO
            );
            if (tx.hasError()) {
                throw new ChainClientException(String.format("Transaction %s to %s rejected: %s",
                        function.getName(), contractAddress, tx.getError().getMessage()));
            }

            log.info("Submitted {} to {} (gas limit {}): {}",
                    function.getName(), contractAddress, gasLimit, tx.getTransactionHash());
            return tx.getTransactionHash();
        } catch (IOException e) {
            throw new ChainClientException("RPC error submitting " + function.getName() + ": " + e.getMessage(), e);
        } catch (UnsupportedOperationException e) {
            // ReadonlyTransactionManager
            throw new ChainClientException("Wallet is read-only, cannot submit " + function.getName(), e);
        }
    }

    @Override
    public TransactionReceipt awaitConfirmation(String txHash) throws ChainClientException {
        try {
            TransactionReceipt receipt = receiptProcessor.waitForTransactionReceipt(txHash);
            if (!receipt.isStatusOK()) {
                throw new ChainClientException(String.format("Transaction %s reverted (status %s)",
                        txHash, receipt.getStatus()));
            }
            log.debug("Transaction {} confirmed in block {}", txHash, receipt.getBlockNumber());
            return receipt;
        } catch (IOException | TransactionException e) {
            throw new ChainClientException("Transaction " + txHash + " not confirmed: " + e.getMessage(), e);
        }
    }
}
