package trader.marketmaker.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;
import trader.marketmaker.client.PriceFeed;
import trader.marketmaker.service.execution.TradeExecutionService;
import trader.marketmaker.service.selection.PairSelectionService;

@Configuration
@RequiredArgsConstructor
public class StatusController {
    private final PriceFeed priceFeed;
    private final PairSelectionService pairSelector;
    private final TradeExecutionService executionService;

    @Bean
    public RouterFunction<ServerResponse> statusRoutes() {
        return RouterFunctions.route()
                .path("/status", this::buildStatusRoutes)
                .build();
    }

    private RouterFunction<ServerResponse> buildStatusRoutes() {
        return RouterFunctions.route()
                .GET("/feed", this::handleFeedStatus)
                .GET("/prices", this::handleLatestPrice)
                .GET("/pairs", this::handlePairs)
                .GET("/trades", this::handleTradingStats)
                .build();
    }

    private Mono<ServerResponse> handleFeedStatus(ServerRequest request) {
        return ServerResponse.ok().bodyValue(priceFeed.getStatus());
    }

    private Mono<ServerResponse> handleLatestPrice(ServerRequest request) {
        return request.queryParam("symbol")
                .map(symbol -> priceFeed.getPrice(symbol)
                        .map(price -> ServerResponse.ok().bodyValue(price))
                        .orElseGet(() -> ServerResponse.notFound().build()))
                .orElseGet(() -> ServerResponse.badRequest().bodyValue("symbol query parameter is required"));
    }

    private Mono<ServerResponse> handlePairs(ServerRequest request) {
        return ServerResponse.ok().bodyValue(pairSelector.getPairsSummary());
    }

    private Mono<ServerResponse> handleTradingStats(ServerRequest request) {
        return ServerResponse.ok().bodyValue(executionService.getTradingStats());
    }
}
