package com.tradewatch.runner.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Posts record batches as JSON arrays to {@code <baseUrl>/signals}, {@code /metrics},
 * {@code /events} and {@code /heartbeats}. Any non-2xx answer fails the batch.
 */
public class HttpPersistenceSink implements PersistenceSink {

    private static final Logger log = LoggerFactory.getLogger(HttpPersistenceSink.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String baseUrl;
    private final String apiKey;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public HttpPersistenceSink(String baseUrl, String apiKey, OkHttpClient client, ObjectMapper mapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public void writeSignals(List<SignalRecord> signals) throws SinkException {
        post("/signals", signals);
    }

    @Override
    public void writeMetrics(List<MetricRecord> metrics) throws SinkException {
        post("/metrics", metrics);
    }

    @Override
    public void writeEvents(List<EventRecord> events) throws SinkException {
        post("/events", events);
    }

    @Override
    public void writeHeartbeat(HeartbeatRecord heartbeat) throws SinkException {
        post("/heartbeats", List.of(heartbeat));
    }

    private void post(String path, List<?> batch) throws SinkException {
        String body;
        try {
            body = mapper.writeValueAsString(batch);
        } catch (JsonProcessingException e) {
            throw new SinkException("Failed to encode batch for " + path, e);
        }

        Request.Builder request = new Request.Builder()
            .url(baseUrl + path)
            .post(RequestBody.create(body, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = client.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new SinkException("POST " + path + " failed: HTTP " + response.code());
            }
            log.debug("Wrote {} records to {}", batch.size(), path);
        } catch (SinkException e) {
            throw e;
        } catch (IOException e) {
            throw new SinkException("POST " + path + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return baseUrl;
    }
}
