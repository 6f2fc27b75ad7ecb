package com.tradewatch.runner.traders;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradewatch.core.model.Trader;
import io.javalin.Javalin;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpTraderSourceTest {

    private final AtomicReference<String> payload = new AtomicReference<>("[]");
    private final AtomicReference<String> authorization = new AtomicReference<>();

    private Javalin collaborator;
    private HttpTraderSource source;

    @BeforeEach
    void setUp() {
        collaborator = Javalin.create(config -> config.showJavalinBanner = false);
        collaborator.get("/traders", ctx -> {
            authorization.set(ctx.header("Authorization"));
            ctx.contentType("application/json").result(payload.get());
        });
        collaborator.get("/broken", ctx -> ctx.status(500));
        collaborator.start(0);
        source = new HttpTraderSource("http://localhost:" + collaborator.port() + "/traders", "key-1",
            new OkHttpClient(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        collaborator.stop();
    }

    @Test
    @DisplayName("Valid traders are returned and names default to the id")
    void loadsTraders() throws IOException {
        payload.set("""
            [{"id":"t1","filterCode":"close > 100","refreshInterval":"5m","extra":true},
             {"id":"t2","name":"Second","filterCode":"rsi(14) < 30"}]""");

        List<Trader> traders = source.loadTraders();

        assertEquals(2, traders.size());
        assertEquals("t1", traders.get(0).getName());
        assertEquals("5m", traders.get(0).getRefreshInterval());
        assertEquals("Second", traders.get(1).getName());
        assertEquals("Bearer key-1", authorization.get());
    }

    @Test
    @DisplayName("Traders without id or filter are skipped")
    void skipsInvalid() throws IOException {
        payload.set("""
            [{"name":"anonymous","filterCode":"close > 1"},
             {"id":"empty"},
             {"id":"ok","filterCode":"close > 1"}]""");

        List<Trader> traders = source.loadTraders();

        assertEquals(1, traders.size());
        assertEquals("ok", traders.get(0).getId());
    }

    @Test
    @DisplayName("HTTP errors surface as IOException")
    void httpError() {
        HttpTraderSource broken = new HttpTraderSource("http://localhost:" + collaborator.port() + "/broken",
            null, new OkHttpClient(), new ObjectMapper());

        IOException e = assertThrows(IOException.class, broken::loadTraders);
        assertTrue(e.getMessage().contains("500"));
    }

    @Test
    @DisplayName("Malformed JSON surfaces as IOException")
    void malformedPayload() {
        payload.set("{not an array");

        assertThrows(IOException.class, source::loadTraders);
    }
}
