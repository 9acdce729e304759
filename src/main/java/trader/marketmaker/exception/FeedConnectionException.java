package trader.marketmaker.exception;

public class FeedConnectionException extends RuntimeException {

    public FeedConnectionException(String message) {
        super(message);
    }

    public FeedConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
