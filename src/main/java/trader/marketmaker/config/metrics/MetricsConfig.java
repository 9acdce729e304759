package trader.marketmaker.config.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import trader.marketmaker.service.selection.PairSelectionService;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter tradesExecutedCounter(MeterRegistry registry) {
        return Counter.builder("trades.executed")
                .description("Number of swaps confirmed on chain")
                .register(registry);
    }

    @Bean
    public Counter tradesFailedCounter(MeterRegistry registry) {
        return Counter.builder("trades.failed")
                .description("Number of trade attempts that did not produce a confirmed swap")
                .register(registry);
    }

    @Bean
    public Counter feedReconnectsCounter(MeterRegistry registry) {
        return Counter.builder("feed.reconnects.scheduled")
                .description("Number of HyperLiquid WebSocket reconnects scheduled")
                .register(registry);
    }

    @Bean
    public Gauge activePairsGauge(MeterRegistry registry, PairSelectionService pairSelectionService) {
        return Gauge.builder("pairs.active",
                        () -> pairSelectionService.getActivePairs().size())
                .description("Current number of actively traded pairs")
                .register(registry);
    }

    @Bean
    public Counter telegramNotificationsCounter(MeterRegistry registry) {
        return Counter.builder("telegram.notifications.sent")
                .description("Number of Telegram notifications sent")
                .register(registry);
    }
}
