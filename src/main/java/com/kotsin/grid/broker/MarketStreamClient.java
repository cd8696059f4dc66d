package com.kotsin.grid.broker;

import com.kotsin.grid.config.BinanceProps;
import com.kotsin.grid.config.GridProps;
import com.kotsin.grid.config.ProtectionProps;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One combined WebSocket carrying book ticker, bar and user-data events.
 * Reconnects after a fixed delay, forever, until stopped.
 */
@Component
@Slf4j
public class MarketStreamClient {

    private final OkHttpClient http;
    private final BinanceProps props;
    private final String symbol;
    private final String barTimeframe;
    private final MarketGateway gateway;
    private final BinanceStreamParser parser;
    private final TaskScheduler scheduler;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean reconnectPending = new AtomicBoolean(false);
    private final AtomicInteger generation = new AtomicInteger();

    private volatile MarketEventListener listener;
    private volatile WebSocket socket;
    private volatile String listenKey;
    private volatile ScheduledFuture<?> keepaliveTask;

    public MarketStreamClient(OkHttpClient exchangeHttpClient,
                              BinanceProps props,
                              GridProps gridProps,
                              ProtectionProps protectionProps,
                              MarketGateway gateway,
                              BinanceStreamParser parser,
                              TaskScheduler gridTaskScheduler) {
        this.http = exchangeHttpClient;
        this.props = props;
        this.symbol = gridProps.symbol().toLowerCase(Locale.ROOT);
        this.barTimeframe = protectionProps.barTimeframe();
        this.gateway = gateway;
        this.parser = parser;
        this.scheduler = gridTaskScheduler;
    }

    public void start(MarketEventListener listener) {
        if (!running.compareAndSet(false, true)) {
            log.warn("STREAM_ALREADY_RUNNING");
            return;
        }
        this.listener = listener;
        keepaliveTask = scheduler.scheduleWithFixedDelay(this::keepAlive,
                Instant.now().plus(props.listenKeyKeepalive()), props.listenKeyKeepalive());
        connect();
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        ScheduledFuture<?> task = keepaliveTask;
        if (task != null) task.cancel(false);
        WebSocket ws = socket;
        if (ws != null) {
            ws.close(1000, "shutdown");
        }
        log.info("STREAM_STOPPED");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void connect() {
        reconnectPending.set(false);
        if (!running.get()) return;
        try {
            if (listenKey == null) {
                listenKey = gateway.openUserDataStream();
            }
            String streams = symbol + "@bookTicker/" + symbol + "@kline_" + barTimeframe + "/" + listenKey;
            Request req = new Request.Builder().url(props.wsBaseUrl() + "/stream?streams=" + streams).build();
            final int gen = generation.incrementAndGet();
            socket = http.newWebSocket(req, new WebSocketListener() {
                @Override
                public void onOpen(WebSocket ws, Response response) {
                    log.info("STREAM_CONNECTED symbol={} timeframe={}", symbol, barTimeframe);
                    notifyConnected();
                }

                @Override
                public void onMessage(WebSocket ws, String text) {
                    if (gen == generation.get()) handleFrame(text);
                }

                @Override
                public void onClosed(WebSocket ws, int code, String reason) {
                    if (gen != generation.get()) return;
                    log.warn("STREAM_CLOSED code={} reason={}", code, reason);
                    onDisconnect("closed: " + reason);
                }

                @Override
                public void onFailure(WebSocket ws, Throwable t, Response r) {
                    if (gen != generation.get()) return;
                    log.error("STREAM_FAILURE error={}", t.toString());
                    onDisconnect("failure: " + t.getMessage());
                }
            });
        } catch (Exception e) {
            log.warn("STREAM_CONNECT_FAILED error={}", e.toString());
            scheduleReconnect();
        }
    }

    private void handleFrame(String text) {
        try {
            String type = parser.dispatch(text, listener);
            if (BinanceStreamParser.LISTEN_KEY_EXPIRED.equals(type)) {
                log.warn("LISTEN_KEY_EXPIRED reconnecting with a fresh key");
                listenKey = null;
                forceReconnect();
            }
        } catch (Exception e) {
            // the reader thread must survive a bad frame or a failing handler
            log.error("STREAM_HANDLER_ERROR error={}", e.toString(), e);
        }
    }

    private void notifyConnected() {
        try {
            listener.onStreamConnected();
        } catch (Exception e) {
            log.error("STREAM_CONNECT_HANDLER_ERROR error={}", e.toString());
        }
    }

    private void onDisconnect(String reason) {
        try {
            listener.onStreamDisconnected(reason);
        } catch (Exception e) {
            log.error("STREAM_DISCONNECT_HANDLER_ERROR error={}", e.toString());
        }
        scheduleReconnect();
    }

    private void forceReconnect() {
        generation.incrementAndGet();
        WebSocket ws = socket;
        if (ws != null) ws.cancel();
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!running.get() || !reconnectPending.compareAndSet(false, true)) return;
        log.info("STREAM_RECONNECT_SCHEDULED in={}s", props.reconnectDelay().toSeconds());
        scheduler.schedule(this::connect, Instant.now().plus(props.reconnectDelay()));
    }

    // ---------------------------------------------------------------------
    // Listen-key keepalive: one retry, then renew the key
    // ---------------------------------------------------------------------
    void keepAlive() {
        String key = listenKey;
        if (key == null || !running.get()) return;
        try {
            gateway.keepAliveUserDataStream(key);
        } catch (GatewayException e) {
            log.warn("LISTEN_KEY_KEEPALIVE_FAILED retryIn={}s error={}", props.keepaliveRetry().toSeconds(), e.getMessage());
            scheduler.schedule(() -> retryKeepAlive(key), Instant.now().plus(props.keepaliveRetry()));
        }
    }

    private void retryKeepAlive(String key) {
        if (!running.get() || !key.equals(listenKey)) return;
        try {
            gateway.keepAliveUserDataStream(key);
            log.info("LISTEN_KEY_KEEPALIVE_RECOVERED");
        } catch (GatewayException e) {
            log.error("LISTEN_KEY_KEEPALIVE_RETRY_FAILED renewing key error={}", e.getMessage());
            listenKey = null;
            forceReconnect();
        }
    }
}
