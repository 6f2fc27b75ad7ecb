package com.tradewatch.runner.traders;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradewatch.core.model.Trader;
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
 * Fetches the trader set as a JSON array from a remote collaborator.
 */
public class HttpTraderSource implements TraderSource {

    private static final Logger log = LoggerFactory.getLogger(HttpTraderSource.class);

    private final String url;
    private final String apiKey;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public HttpTraderSource(String url, String apiKey, OkHttpClient client, ObjectMapper mapper) {
        this.url = url;
        this.apiKey = apiKey;
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public List<Trader> loadTraders() throws IOException {
        Request.Builder request = new Request.Builder().url(url).get();
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = client.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("GET " + url + " failed: HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("GET " + url + " returned no body");
            }
            List<Trader> fetched = mapper.readValue(body.string(), new TypeReference<List<Trader>>() {});
            List<Trader> traders = new ArrayList<>();
            for (Trader trader : fetched) {
                if (trader == null || trader.getId() == null || trader.getId().isBlank()) {
                    log.warn("Skipping trader without id from {}", url);
                    continue;
                }
                if (trader.getName() == null || trader.getName().isBlank()) {
                    trader.setName(trader.getId());
                }
                String problem = DirectoryTraderSource.problem(trader);
                if (problem != null) {
                    log.warn("Skipping trader {} from {}: {}", trader.getId(), url, problem);
                    continue;
                }
                traders.add(trader);
            }
            return traders;
        }
    }

    @Override
    public String describe() {
        return "http " + url;
    }
}
