package trader.marketmaker.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FeedStatus {
    FeedState state;
    int reconnectAttempts;
    Long lastUpdateMs;
    Long lastMessageMs;
    int priceCount;
    boolean hasRecentData;
}
