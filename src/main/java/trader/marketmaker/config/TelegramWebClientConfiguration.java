package trader.marketmaker.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Slf4j
@Configuration
public class TelegramWebClientConfiguration {

    @Bean
    public WebClient telegramWebClient(WebClient.Builder builder,
                                       Dotenv dotenv,
                                       @Value("${telegram.api.url:https://api.telegram.org/bot}") String baseUrl,
                                       @Value("${telegram.api.connect-timeout:3000}") int connectTimeoutMillis,
                                       @Value("${telegram.api.response-timeout:5000}") int responseTimeoutMillis) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(Duration.ofMillis(responseTimeoutMillis));

        return builder
                .baseUrl(baseUrl + dotenv.get("TELEGRAM_BOT_TOKEN", ""))
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(logRequest())
                .build();
    }

    // в URL токен бота, логируем только метод и путь без него
    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            log.debug("Telegram request: {} {}", request.method(),
                    request.url().getPath().replaceAll("/bot[^/]+", "/bot***"));
            return Mono.just(request);
        });
    }
}
