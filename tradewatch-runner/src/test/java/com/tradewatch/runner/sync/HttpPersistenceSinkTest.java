package com.tradewatch.runner.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HttpPersistenceSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, String> bodies = new ConcurrentHashMap<>();
    private final Map<String, String> auth = new ConcurrentHashMap<>();
    private final AtomicInteger status = new AtomicInteger(201);

    private Javalin collaborator;
    private HttpPersistenceSink sink;

    @BeforeEach
    void setUp() {
        collaborator = Javalin.create(config -> config.showJavalinBanner = false);
        for (String path : List.of("/signals", "/metrics", "/events", "/heartbeats")) {
            collaborator.post(path, ctx -> {
                bodies.put(path, ctx.body());
                String header = ctx.header("Authorization");
                if (header != null) {
                    auth.put(path, header);
                }
                ctx.status(status.get());
            });
        }
        collaborator.start(0);
        sink = new HttpPersistenceSink("http://localhost:" + collaborator.port() + "/", "secret",
            new OkHttpClient(), mapper);
    }

    @AfterEach
    void tearDown() {
        collaborator.stop();
    }

    @Test
    @DisplayName("Signal batches are posted as a JSON array with snake_case fields")
    void postsSignals() throws Exception {
        sink.writeSignals(List.of(
            new SignalRecord("s1", "t1", "BTCUSDT", 1000L, "{}"),
            new SignalRecord("s2", "t1", "ETHUSDT", 2000L, "{\"a\":1}")));

        JsonNode body = mapper.readTree(bodies.get("/signals"));
        assertEquals(2, body.size());
        assertEquals("t1", body.get(0).get("trader_id").asText());
        assertEquals("{\"a\":1}", body.get(1).get("metadata_json").asText());
        assertEquals("Bearer secret", auth.get("/signals"));
    }

    @Test
    @DisplayName("Events use lowercase type and severity names")
    void postsEvents() throws Exception {
        sink.writeEvents(List.of(new EventRecord("machine-1", EventType.PERSISTENCE_DEGRADED, Severity.ERROR,
            5000L, "failing", "{}")));

        JsonNode event = mapper.readTree(bodies.get("/events")).get(0);
        assertEquals("persistence_degraded", event.get("type").asText());
        assertEquals("error", event.get("severity").asText());
    }

    @Test
    @DisplayName("Heartbeat is posted as a one-element batch")
    void postsHeartbeat() throws Exception {
        sink.writeHeartbeat(new HeartbeatRecord("machine-1", 7000L, "ok", Map.of("uptime_ms", 10L)));

        assertEquals(1, mapper.readTree(bodies.get("/heartbeats")).size());
    }

    @Test
    @DisplayName("Non-2xx answers fail the batch")
    void serverErrorFails() {
        status.set(503);

        SinkException e = assertThrows(SinkException.class,
            () -> sink.writeMetrics(List.of(new MetricRecord("machine-1", 1000L, Map.of("ticks", 1L)))));
        assertTrue(e.getMessage().contains("503"));
    }

    @Test
    @DisplayName("Unreachable collaborator fails with SinkException")
    void unreachableFails() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        HttpPersistenceSink offline = new HttpPersistenceSink("http://localhost:" + port, null,
            new OkHttpClient(), mapper);

        assertThrows(SinkException.class,
            () -> offline.writeSignals(List.of(new SignalRecord("s1", "t1", "BTCUSDT", 1L, "{}"))));
    }
}
