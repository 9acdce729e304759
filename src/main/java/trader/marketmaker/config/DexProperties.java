package trader.marketmaker.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import trader.marketmaker.model.TokenInfo;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Configuration
@ConfigurationProperties(prefix = "hyperswap")
public class DexProperties {
    public static final String NATIVE_TOKEN = "0x0000000000000000000000000000000000000000";

    private String rpcUrl = "https://rpc.hyperliquid.xyz/evm";
    private long chainId = 999;
    /** Used as sender of read-only calls when no private key is configured. */
    private String walletAddress = NATIVE_TOKEN;
    private String wrappedNative = "0x5555555555555555555555555555555555555555";
    private int defaultFee = 3000;
    private Duration deadline = Duration.ofSeconds(300);
    private long approvalGasLimit = 100_000;
    private Duration quoteTimeout = Duration.ofSeconds(10);
    private Duration receiptPollInterval = Duration.ofSeconds(1);
    private int receiptPollAttempts = 60;
    private V3 v3 = new V3();
    private V2 v2 = new V2();
    private Map<String, TokenInfo> tokens = new LinkedHashMap<>();      // symbol -> token

    @Data
    public static class V3 {
        private String quoter = "0x03A918028f22D9E1473B7959C927AD7425A45C7C";
        private String swapRouter = "0x4E2960a8cd19B467b82d26D83fAcb0fAE26b094D";
        private List<Integer> extraFeeTiers = new ArrayList<>();
        private long defaultGasLimit = 300_000;
        private int gasBufferPercent = 20;
    }

    @Data
    public static class V2 {
        private String router = "0x6D99e7f6747AF2cDbB5164b6DD50e40D4fDe1e77";
        private boolean routeViaWrappedNative = true;
        private long gasLimit = 250_000;
    }

    public boolean isNative(String address) {
        return NATIVE_TOKEN.equalsIgnoreCase(address);
    }

    /**
     * Routers only know ERC-20s, so the native token is routed as its wrapped version.
     */
    public String routingAddress(String address) {
        return isNative(address) ? wrappedNative : address;
    }

    public Optional<TokenInfo> findToken(String symbol) {
        return Optional.ofNullable(tokens.get(symbol));
    }

    @PostConstruct
    public void init() {
        tokens.forEach((symbol, token) -> token.setSymbol(symbol));
    }
}
