package com.tradewatch.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradewatch.core.model.Candle;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches recent klines over REST so indicators are warm before the first screening tick.
 */
public class HistoricalKlineLoader {

    private static final Logger log = LoggerFactory.getLogger(HistoricalKlineLoader.class);
    private static final int MAX_KLINES_PER_REQUEST = 1000;

    private final String restUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public HistoricalKlineLoader(String restUrl) {
        this(restUrl, HttpClientFactory.getClient(), HttpClientFactory.getMapper());
    }

    public HistoricalKlineLoader(String restUrl, OkHttpClient client, ObjectMapper mapper) {
        this.restUrl = restUrl;
        this.client = client;
        this.mapper = mapper;
    }

    /**
     * Fetch the most recent klines, oldest first. The last one is marked forming if its close
     * time is still in the future.
     *
     * @param limit number of klines, capped at 1000
     */
    public List<Candle> load(String symbol, String interval, int limit) throws IOException {
        HttpUrl base = HttpUrl.parse(restUrl);
        if (base == null) {
            throw new IOException("Invalid REST URL: " + restUrl);
        }
        HttpUrl url = base.newBuilder()
            .addPathSegments("api/v3/klines")
            .addQueryParameter("symbol", symbol)
            .addQueryParameter("interval", interval)
            .addQueryParameter("limit", String.valueOf(Math.min(limit, MAX_KLINES_PER_REQUEST)))
            .build();

        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Kline request failed: HTTP " + response.code() + " for " + symbol + " " + interval);
            }
            List<Candle> candles = parseKlines(mapper.readTree(body.string()), System.currentTimeMillis());
            log.debug("Loaded {} {} klines for {}", candles.size(), interval, symbol);
            return candles;
        }
    }

    /**
     * Parse the REST kline array format:
     * {@code [[openTime, "o", "h", "l", "c", "v", closeTime, "q", trades, ...], ...]}.
     *
     * @throws IOException if the payload is not a kline array
     */
    public static List<Candle> parseKlines(JsonNode root, long nowMs) throws IOException {
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of klines");
        }
        List<Candle> candles = new ArrayList<>(root.size());
        for (JsonNode k : root) {
            if (!k.isArray() || k.size() < 7) {
                throw new IOException("Malformed kline entry: " + k);
            }
            try {
                long closeTime = k.get(6).asLong();
                candles.add(new Candle(
                    k.get(0).asLong(),
                    KlineMessage.number("open", k.get(1).asText()),
                    KlineMessage.number("high", k.get(2).asText()),
                    KlineMessage.number("low", k.get(3).asText()),
                    KlineMessage.number("close", k.get(4).asText()),
                    KlineMessage.number("volume", k.get(5).asText()),
                    closeTime,
                    closeTime < nowMs,
                    k.has(7) ? KlineMessage.number("quoteVolume", k.get(7).asText()) : -1,
                    k.has(8) ? k.get(8).asInt() : -1
                ));
            } catch (IllegalArgumentException e) {
                throw new IOException("Malformed kline entry: " + e.getMessage(), e);
            }
        }
        return candles;
    }
}
