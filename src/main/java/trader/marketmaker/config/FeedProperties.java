package trader.marketmaker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "hyperliquid")
public class FeedProperties {
    private boolean enabled = true;
    private String wsUrl = "wss://api.hyperliquid.xyz/ws";
    // сервер рвёт соединение после 60 сек тишины
    private Duration pingInterval = Duration.ofSeconds(30);
    private Duration pongTimeout = Duration.ofSeconds(30);
    private Duration staleDataThreshold = Duration.ofSeconds(60);
    private Duration reconnectDelayFloor = Duration.ofSeconds(1);
    private Duration reconnectDelayCeiling = Duration.ofSeconds(30);
    private int maxReconnectAttempts = 10;
    private BigDecimal priceChangeThreshold = new BigDecimal("0.001");
    /** Symbols whose moves are logged at INFO; empty means all. */
    private List<String> announcedSymbols = new ArrayList<>();
    /** Prices older than this are not used for trading decisions. */
    private Duration maxPriceAge = Duration.ofSeconds(60);
    private boolean restartOnTerminalFailure = true;
    private Duration restartDelay = Duration.ofMinutes(1);
}
