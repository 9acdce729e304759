package trader.marketmaker.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class TelemetryEvent {

    public enum Type {
        TRADE_OUTCOME,
        METRICS_SNAPSHOT,
        FEED_HEALTH
    }

    Type type;
    Instant timestamp;
    @Singular
    Map<String, Object> attributes;
}
