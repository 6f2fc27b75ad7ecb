package com.tradewatch.feed;

import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Connection handling against a local stream server.
 */
class MarketDataClientReconnectTest {

    private final BlockingQueue<String> handshakes = new LinkedBlockingQueue<>();
    private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
    private final BlockingQueue<WebSocket> connections = new LinkedBlockingQueue<>();
    private final CountDownLatch started = new CountDownLatch(1);

    private WebSocketServer server;
    private MarketDataClient client;

    @BeforeEach
    void setUp() throws InterruptedException {
        server = new WebSocketServer(new InetSocketAddress("localhost", 0)) {
            @Override
            public void onOpen(WebSocket conn, ClientHandshake handshake) {
                handshakes.add(handshake.getResourceDescriptor());
                connections.add(conn);
            }

            @Override
            public void onClose(WebSocket conn, int code, String reason, boolean remote) {
            }

            @Override
            public void onMessage(WebSocket conn, String message) {
                frames.add(message);
            }

            @Override
            public void onError(WebSocket conn, Exception ex) {
            }

            @Override
            public void onStart() {
                started.countDown();
            }
        };
        server.setReuseAddr(true);
        server.start();
        assertTrue(started.await(5, TimeUnit.SECONDS), "stream server did not start");

        FeedSettings settings = new FeedSettings("ws://localhost:" + server.getPort(), "http://localhost", 100,
            Duration.ofMillis(1_000), Duration.ofSeconds(4), Duration.ofSeconds(30));
        client = new MarketDataClient(List.of("BTCUSDT"), List.of("1m"), settings);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        client.shutdown();
        server.stop(1_000);
    }

    private static void await(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail(message);
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("Connects with the combined stream URL")
    void connects() throws InterruptedException {
        client.connect();

        assertEquals("/stream?streams=btcusdt@ticker/btcusdt@kline_1m", handshakes.poll(5, TimeUnit.SECONDS));
        await(() -> client.getState() == ConnectionState.CONNECTED, "client never reported CONNECTED");
    }

    @Test
    @DisplayName("Server close schedules a reconnect that re-subscribes the full current set")
    void reconnectsWithFullSet() throws InterruptedException {
        client.connect();
        assertNotNull(handshakes.poll(5, TimeUnit.SECONDS));
        WebSocket first = connections.poll(5, TimeUnit.SECONDS);
        await(() -> client.getState() == ConnectionState.CONNECTED, "client never reported CONNECTED");

        client.updateSubscriptions(List.of("BTCUSDT", "ETHUSDT"), List.of("1m"));
        String subscribe = frames.poll(5, TimeUnit.SECONDS);
        assertNotNull(subscribe);
        assertTrue(subscribe.contains("\"SUBSCRIBE\""), subscribe);
        assertTrue(subscribe.contains("ethusdt@kline_1m"), subscribe);

        first.close(1001, "going away");

        await(() -> client.getState() != ConnectionState.CONNECTED, "client never noticed the close");
        await(client::isReconnectPending, "no reconnect was scheduled");
        assertEquals(1, client.stats().reconnects());

        String resubscribed = handshakes.poll(5, TimeUnit.SECONDS);
        assertNotNull(resubscribed, "client did not reconnect");
        assertTrue(resubscribed.contains("btcusdt@kline_1m"), resubscribed);
        assertTrue(resubscribed.contains("ethusdt@ticker"), resubscribed);
        assertTrue(resubscribed.contains("ethusdt@kline_1m"), resubscribed);
        await(() -> client.getState() == ConnectionState.CONNECTED, "client did not come back");
        assertFalse(client.isReconnectPending());
    }

    @Test
    @DisplayName("Shutdown after a close cancels the pending reconnect")
    void shutdownCancelsReconnect() throws InterruptedException {
        client.connect();
        WebSocket first = connections.poll(5, TimeUnit.SECONDS);
        assertNotNull(first);
        await(() -> client.getState() == ConnectionState.CONNECTED, "client never reported CONNECTED");
        handshakes.clear();

        first.close(1001, "going away");
        await(client::isReconnectPending, "no reconnect was scheduled");
        client.shutdown();

        assertFalse(client.isReconnectPending());
        assertEquals(ConnectionState.DISCONNECTED, client.getState());
        assertNull(handshakes.poll(1_500, TimeUnit.MILLISECONDS));
    }
}
