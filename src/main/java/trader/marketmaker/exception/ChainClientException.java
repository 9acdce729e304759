package trader.marketmaker.exception;

/**
 * RPC-level failure talking to the chain: transport error, JSON-RPC error, revert or failed receipt.
 */
public class ChainClientException extends Exception {

    public ChainClientException(String message) {
        super(message);
    }

    public ChainClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
