package com.kotsin.grid.broker;

import com.kotsin.grid.config.BinanceProps;
import com.kotsin.grid.config.GridProps;
import com.kotsin.grid.config.ProtectionProps;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MarketStreamClientTest {

    private OkHttpClient http;
    private MarketGateway gateway;
    private TaskScheduler scheduler;
    private MarketEventListener listener;
    private MarketStreamClient client;

    @BeforeEach
    void setUp() {
        http = mock(OkHttpClient.class);
        gateway = mock(MarketGateway.class);
        scheduler = mock(TaskScheduler.class);
        listener = mock(MarketEventListener.class);
        when(http.newWebSocket(any(Request.class), any(WebSocketListener.class))).thenReturn(mock(WebSocket.class));
        when(gateway.openUserDataStream()).thenReturn("key-1", "key-2");

        BinanceProps props = new BinanceProps("k", "s", "https://fapi.example", "wss://fstream.example", 5000,
                Duration.ofMinutes(30), Duration.ofMinutes(1), Duration.ofSeconds(5));
        GridProps gridProps = new GridProps("XRPUSDC", 3, 0.001, 500, 200, 15,
                Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(30),
                Duration.ofSeconds(60), Duration.ofSeconds(300), 0.10, 10);
        ProtectionProps protectionProps = new ProtectionProps(11.0, 24, 1.5,
                Duration.ofSeconds(30), Duration.ofSeconds(1), Duration.ofSeconds(60),
                14, 20, "memory", "unused", Duration.ofSeconds(300), "1h");
        client = new MarketStreamClient(http, props, gridProps, protectionProps, gateway,
                new BinanceStreamParser(), scheduler);
    }

    @Test
    @DisplayName("Start subscribes to ticker, bars and user data on one socket")
    void testStartSubscribes() {
        client.start(listener);

        ArgumentCaptor<Request> request = ArgumentCaptor.forClass(Request.class);
        verify(http).newWebSocket(request.capture(), any(WebSocketListener.class));
        String url = request.getValue().url().toString();
        assertTrue(url.contains("xrpusdc@bookTicker"), url);
        assertTrue(url.contains("xrpusdc@kline_1h"), url);
        assertTrue(url.contains("key-1"), url);
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofMinutes(30)));
        assertTrue(client.isRunning());
    }

    @Test
    @DisplayName("Second start is ignored")
    void testSingleStart() {
        client.start(listener);
        client.start(listener);
        verify(http, times(1)).newWebSocket(any(Request.class), any(WebSocketListener.class));
    }

    @Test
    @DisplayName("Keepalive failure is retried once, then the key is renewed and the stream reconnects")
    void testKeepAliveRetryThenRenew() {
        client.start(listener);
        doThrow(new GatewayException("expired")).when(gateway).keepAliveUserDataStream("key-1");

        client.keepAlive();

        ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(retry.capture(), any(Instant.class));
        retry.getValue().run();

        ArgumentCaptor<Runnable> reconnect = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, times(2)).schedule(reconnect.capture(), any(Instant.class));
        reconnect.getAllValues().get(1).run();

        verify(gateway, times(2)).openUserDataStream();
        ArgumentCaptor<Request> request = ArgumentCaptor.forClass(Request.class);
        verify(http, times(2)).newWebSocket(request.capture(), any(WebSocketListener.class));
        assertTrue(request.getAllValues().get(1).url().toString().contains("key-2"));
    }

    @Test
    @DisplayName("Successful keepalive schedules nothing")
    void testKeepAliveOk() {
        client.start(listener);
        client.keepAlive();
        verify(gateway).keepAliveUserDataStream("key-1");
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("Stop closes the socket and cancels keepalive")
    void testStop() {
        client.start(listener);
        client.stop();
        assertFalse(client.isRunning());
        client.keepAlive();
        verify(gateway, never()).keepAliveUserDataStream(any());
    }
}
