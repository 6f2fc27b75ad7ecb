package com.tradewatch.feed;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp client and JSON mapper for the REST calls of the feed and the runner.
 */
public final class HttpClientFactory {

    private static final OkHttpClient SHARED_CLIENT = new OkHttpClient.Builder()
        .connectionPool(new ConnectionPool(5, 5, TimeUnit.MINUTES))
        .connectTimeout(15, TimeUnit.SECONDS)
        .readTimeout(30, TimeUnit.SECONDS)
        .writeTimeout(30, TimeUnit.SECONDS)
        .retryOnConnectionFailure(true)
        .build();

    private static final ObjectMapper SHARED_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private HttpClientFactory() {
    }

    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
