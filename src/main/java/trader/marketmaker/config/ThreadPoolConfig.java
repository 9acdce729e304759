package trader.marketmaker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class ThreadPoolConfig {

    /**
     * Single thread for the feed's heartbeat, pong and reconnect timers.
     */
    @Bean(name = "feedScheduler", destroyMethod = "dispose")
    public Scheduler feedScheduler() {
        return Schedulers.newSingle("hyperliquid-feed");
    }

    /**
     * Blocking eth_call quotes run here, one task per router.
     */
    @Bean(name = "quoteScheduler", destroyMethod = "dispose")
    public Scheduler quoteScheduler() {
        return Schedulers.newBoundedElastic(8, 256, "router-quotes");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
