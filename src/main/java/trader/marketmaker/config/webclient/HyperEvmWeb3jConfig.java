package trader.marketmaker.config.webclient;

import io.github.cdimascio.dotenv.Dotenv;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.ReadonlyTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;
import trader.marketmaker.config.DexProperties;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HyperEvmWeb3jConfig {
    private final DexProperties props;
    private final Dotenv dotenv;

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j() {
        log.info("Using HyperEVM RPC {} (chain id {})", props.getRpcUrl(), props.getChainId());
        return Web3j.build(new HttpService(props.getRpcUrl()));
    }

    @Bean
    public TransactionManager txManager(Web3j web3j) {
        String privateKey = dotenv.get("PRIVATE_KEY", "");
        if (privateKey.isBlank()) {
            // без ключа доступны только eth_call котировки
            log.warn("PRIVATE_KEY is not set, running in read-only mode, swaps and approvals are disabled");
            return new ReadonlyTransactionManager(web3j, props.getWalletAddress());
        }
        Credentials credentials = Credentials.create(privateKey);
        log.info("Trading wallet: {}", credentials.getAddress());
        return new RawTransactionManager(web3j, credentials, props.getChainId());
    }

    @Bean
    public TransactionReceiptProcessor receiptProcessor(Web3j web3j) {
        return new PollingTransactionReceiptProcessor(
                web3j,
                props.getReceiptPollInterval().toMillis(),
                props.getReceiptPollAttempts()
        );
    }
}
