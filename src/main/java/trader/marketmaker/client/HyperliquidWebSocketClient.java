package trader.marketmaker.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import trader.marketmaker.config.FeedProperties;
import trader.marketmaker.exception.FeedConnectionException;
import trader.marketmaker.model.FeedEvent;
import trader.marketmaker.model.FeedState;
import trader.marketmaker.model.FeedStatus;
import trader.marketmaker.model.PriceQuote;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * HyperLiquid allMids subscription with heartbeat and exponential-backoff reconnect.
 * <p>
 * Every connection attempt gets a generation number; callbacks from an older generation
 * (a late close of a connection we already gave up on) are ignored. All timers run on the
 * injected scheduler and are cancelled on disconnect.
 */
@Slf4j
@Service
public class HyperliquidWebSocketClient implements PriceFeed {

    static final String SOURCE = "hyperliquid";
    static final String SUBSCRIBE_ALL_MIDS = "{\"method\":\"subscribe\",\"subscription\":{\"type\":\"allMids\"}}";
    static final String PING = "{\"method\":\"ping\"}";

    private final WebSocketClient client;
    private final ObjectMapper objectMapper;
    private final FeedProperties props;
    private final Scheduler scheduler;
    private final Counter feedReconnectsCounter;
    private final MidPriceBook priceBook;
    private final Sinks.Many<FeedEvent> events = Sinks.many().multicast().directBestEffort();

    // guarded by this
    private FeedState state = FeedState.DISCONNECTED;
    private volatile long generation;
    private boolean stopped = true;
    private int reconnectAttempts;
    private long reconnectDelayMs;
    private Disposable connection;
    private Disposable heartbeat;
    private Disposable reconnectTask;
    private final Disposable.Swap pongCheck = Disposables.swap();
    private long awaitingPongSince = -1;

    private volatile WebSocketSession session;
    private volatile long lastMessageAt = -1;
    private volatile long lastPongAt = -1;
    private volatile long lastUpdateAt = -1;

    public HyperliquidWebSocketClient(WebSocketClient feedWebSocketClient,
                                      ObjectMapper objectMapper,
                                      FeedProperties props,
                                      @Qualifier("feedScheduler") Scheduler feedScheduler,
                                      @Qualifier("feedReconnectsCounter") Counter feedReconnectsCounter) {
        this.client = feedWebSocketClient;
        this.objectMapper = objectMapper;
        this.props = props;
        this.scheduler = feedScheduler;
        this.feedReconnectsCounter = feedReconnectsCounter;
        this.priceBook = new MidPriceBook(props.getPriceChangeThreshold(), props.getAnnouncedSymbols());
        this.reconnectDelayMs = props.getReconnectDelayFloor().toMillis();
    }

    @Override
    public synchronized void connect() {
        if (state == FeedState.CONNECTING || state == FeedState.CONNECTED) {
            log.debug("WebSocket already {}, ignoring connect()", state);
            return;
        }
        stopped = false;
        openConnection();
    }

    private synchronized void openConnection() {
        long gen = ++generation;
        state = FeedState.CONNECTING;
        URI uri = URI.create(props.getWsUrl());
        log.info("Connecting to HyperLiquid WebSocket... {}", uri);

        connection = client.execute(uri, wsSession -> handleSession(wsSession, gen))
                .subscribe(
                        null,
                        error -> onConnectionLost(gen,
                                new FeedConnectionException("WebSocket error: " + error.getMessage(), error)),
                        () -> onConnectionLost(gen, new FeedConnectionException("WebSocket connection closed"))
                );
    }

    private Mono<Void> handleSession(WebSocketSession wsSession, long gen) {
        if (!onConnected(wsSession, gen)) {
            return wsSession.close();
        }
        return wsSession.receive()
                .doOnNext(message -> handleMessage(message, gen))
                .then();
    }

    private synchronized boolean onConnected(WebSocketSession wsSession, long gen) {
        if (gen != generation || stopped) {
            return false;
        }
        state = FeedState.CONNECTED;
        reconnectAttempts = 0;
        reconnectDelayMs = props.getReconnectDelayFloor().toMillis();
        session = wsSession;
        lastPongAt = now();
        log.info("Connected to HyperLiquid WebSocket");
        emit(FeedEvent.connected());

        send(SUBSCRIBE_ALL_MIDS);
        startHeartbeat(gen);
        return true;
    }

    private void send(String text) {
        WebSocketSession current = session;
        if (current == null) {
            return;
        }
        current.send(Mono.just(current.textMessage(text)))
                .subscribe(
                        null,
                        error -> log.error("Error sending {}: {}", text, error.getMessage())
                );
    }

    // ---- incoming messages ----

    private void handleMessage(WebSocketMessage message, long gen) {
        if (gen != generation) {
            return;
        }
        lastMessageAt = now();
        if (message.getType() == WebSocketMessage.Type.PONG) {
            lastPongAt = lastMessageAt;
            return;
        }
        if (message.getType() != WebSocketMessage.Type.TEXT) {
            return;
        }
        handlePayload(message.getPayloadAsText());
    }

    private void handlePayload(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed message: {}", e.getOriginalMessage());
            return;
        }

        String channel = root.path("channel").asText("");
        switch (channel) {
            case "allMids":
                handleAllMids(root.path("data").path("mids"));
                break;
            case "pong":
                lastPongAt = now();
                log.debug("Received pong response");
                break;
            case "subscriptionResponse":
                log.debug("Subscription confirmed: {}", root.path("data"));
                break;
            case "error":
                log.warn("HyperLiquid reported an error: {}", root.path("data").asText());
                break;
            default:
                log.debug("Ignoring message on channel '{}'", channel);
        }
    }

    private void handleAllMids(JsonNode mids) {
        if (!mids.isObject()) {
            log.warn("Dropping allMids message without a mids object");
            return;
        }
        long receivedAt = now();
        lastUpdateAt = receivedAt;

        mids.fields().forEachRemaining(entry -> {
            String symbol = entry.getKey();
            MidPriceBook.UpdateOutcome outcome = priceBook.update(
                    symbol, entry.getValue().asText(), receivedAt, SOURCE);
            if (outcome != MidPriceBook.UpdateOutcome.REJECTED) {
                priceBook.get(symbol).ifPresent(quote -> emit(FeedEvent.priceUpdate(quote)));
            }
        });
    }

    // ---- heartbeat ----

    private synchronized void startHeartbeat(long gen) {
        stopHeartbeat();
        Duration interval = props.getPingInterval();
        heartbeat = Flux.interval(interval, interval, scheduler)
                .subscribe(
                        tick -> sendPing(gen),
                        error -> log.error("Heartbeat failed: {}", error.getMessage())
                );
    }

    private synchronized void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.dispose();
            heartbeat = null;
        }
        pongCheck.update(Disposables.disposed());
        awaitingPongSince = -1;
    }

    private synchronized void sendPing(long gen) {
        if (gen != generation || state != FeedState.CONNECTED) {
            return;
        }
        warnIfStale();

        long sentAt = now();
        send(PING);
        log.debug("Ping sent");
        // a pending check for an earlier ping keeps running, otherwise it could be postponed forever
        if (awaitingPongSince < 0) {
            awaitingPongSince = sentAt;
            pongCheck.update(scheduler.schedule(() -> checkPong(gen, sentAt),
                    props.getPongTimeout().toMillis(), TimeUnit.MILLISECONDS));
        }
    }

    private synchronized void checkPong(long gen, long sentAt) {
        if (gen != generation) {
            return;
        }
        awaitingPongSince = -1;
        if (lastPongAt >= sentAt) {
            return;
        }
        log.warn("WebSocket health check failed - no pong within {} ms", props.getPongTimeout().toMillis());
        onConnectionLost(gen, new FeedConnectionException("Heartbeat timeout"));
    }

    private void warnIfStale() {
        long updatedAt = lastUpdateAt;
        if (updatedAt < 0) {
            return;
        }
        long silence = now() - updatedAt;
        if (silence > props.getStaleDataThreshold().toMillis()) {
            log.warn("No price data received for {} seconds", silence / 1000);
        }
    }

    // ---- reconnect ----

    private void onConnectionLost(long gen, FeedConnectionException cause) {
        Disposable previous;
        synchronized (this) {
            if (gen != generation || stopped) {
                return;
            }
            generation++;
            stopHeartbeat();
            previous = connection;
            connection = null;
            session = null;
            state = FeedState.DISCONNECTED;

            log.warn("WebSocket disconnected: {}", cause.getMessage());
            emit(FeedEvent.disconnected(cause.getMessage()));

            if (reconnectAttempts < props.getMaxReconnectAttempts()) {
                scheduleReconnect(cause.getMessage());
            } else {
                state = FeedState.FAILED;
                log.error("Max reconnection attempts ({}) reached, giving up", props.getMaxReconnectAttempts(), cause);
                emit(FeedEvent.terminalFailure(reconnectAttempts, cause.getMessage()));
            }
        }
        if (previous != null) {
            previous.dispose();
        }
    }

    private synchronized void scheduleReconnect(String reason) {
        reconnectAttempts++;
        long delay = reconnectDelayMs;
        log.info("Scheduling reconnection attempt {}/{} in {}ms",
                reconnectAttempts, props.getMaxReconnectAttempts(), delay);
        feedReconnectsCounter.increment();
        emit(FeedEvent.reconnectScheduled(reconnectAttempts, delay, reason));

        reconnectTask = scheduler.schedule(this::reconnectNow, delay, TimeUnit.MILLISECONDS);
        reconnectDelayMs = Math.min(delay * 2, props.getReconnectDelayCeiling().toMillis());
    }

    private synchronized void reconnectNow() {
        reconnectTask = null;
        if (stopped || state != FeedState.DISCONNECTED) {
            return;
        }
        openConnection();
    }

    @Override
    public void disconnect() {
        Disposable previous;
        synchronized (this) {
            boolean wasLive = state == FeedState.CONNECTED || state == FeedState.CONNECTING;
            log.info("Disconnecting from WebSocket...");
            stopped = true;
            generation++;
            stopHeartbeat();
            if (reconnectTask != null) {
                reconnectTask.dispose();
                reconnectTask = null;
            }
            previous = connection;
            connection = null;
            session = null;
            state = FeedState.DISCONNECTED;
            if (wasLive) {
                emit(FeedEvent.disconnected("Client disconnect"));
            }
        }
        if (previous != null) {
            previous.dispose();
        }
    }

    @Override
    public synchronized void reconnect() {
        log.info("Restarting WebSocket connection with a fresh reconnect budget");
        disconnect();
        reconnectAttempts = 0;
        reconnectDelayMs = props.getReconnectDelayFloor().toMillis();
        connect();
    }

    @PreDestroy
    public void shutdown() {
        disconnect();
        synchronized (events) {
            events.tryEmitComplete();
        }
    }

    private void emit(FeedEvent event) {
        // несколько потоков (netty и таймеры) пишут в один sink
        synchronized (events) {
            events.tryEmitNext(event);
        }
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    // ---- queries ----

    @Override
    public Optional<PriceQuote> getPrice(String symbol) {
        return priceBook.get(symbol);
    }

    @Override
    public boolean hasRecentPrice(String symbol, Duration maxAge) {
        return priceBook.isFresh(symbol, maxAge.toMillis(), now());
    }

    @Override
    public Map<String, PriceQuote> getAllPrices() {
        return priceBook.snapshot();
    }

    @Override
    public synchronized FeedStatus getStatus() {
        long updatedAt = lastUpdateAt;
        long messageAt = lastMessageAt;
        return FeedStatus.builder()
                .state(state)
                .reconnectAttempts(reconnectAttempts)
                .lastUpdateMs(updatedAt < 0 ? null : updatedAt)
                .lastMessageMs(messageAt < 0 ? null : messageAt)
                .priceCount(priceBook.size())
                .hasRecentData(updatedAt >= 0 && now() - updatedAt <= props.getStaleDataThreshold().toMillis())
                .build();
    }

    @Override
    public Flux<FeedEvent> events() {
        return events.asFlux();
    }
}
