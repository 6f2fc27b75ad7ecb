package com.tradewatch.runner;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradewatch.feed.HttpClientFactory;
import com.tradewatch.runner.api.EvaluationServer;
import com.tradewatch.runner.config.ConfigException;
import com.tradewatch.runner.config.TradeWatchConfig;
import com.tradewatch.runner.sync.HttpPersistenceSink;
import com.tradewatch.runner.sync.LoggingPersistenceSink;
import com.tradewatch.runner.sync.PersistenceSink;
import com.tradewatch.runner.traders.DirectoryTraderSource;
import com.tradewatch.runner.traders.HttpTraderSource;
import com.tradewatch.runner.traders.TraderSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * TradeWatch screener daemon.
 *
 * Exits with status 1 when the configuration is invalid; every later failure is handled
 * inside the orchestrator and the process keeps running until it is signalled.
 */
public class TradeWatchApp {
    private static final Logger LOG = LoggerFactory.getLogger(TradeWatchApp.class);

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private static Orchestrator orchestrator;
    private static EvaluationServer server;

    public static void main(String[] args) {
        LOG.info("Starting TradeWatch...");

        TradeWatchConfig config;
        try {
            config = TradeWatchConfig.load();
        } catch (ConfigException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        try {
            ObjectMapper mapper = createObjectMapper();
            PersistenceSink sink = createSink(config, mapper);
            TraderSource traderSource = createTraderSource(config, mapper);
            LOG.info("Persistence: {}, traders: {}", sink.describe(), traderSource.describe());

            orchestrator = new Orchestrator(config, traderSource, sink, mapper);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down TradeWatch...");
                cleanup();
                shutdownLatch.countDown();
            }, "shutdown-hook"));

            orchestrator.start();

            if (config.getApi().isEnabled()) {
                server = new EvaluationServer(orchestrator.getSandbox(), orchestrator, mapper, config.getApi().getPort());
                server.start();
            }

            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cleanup();
        } catch (Exception e) {
            LOG.error("Failed to start TradeWatch", e);
            cleanup();
            System.exit(1);
        }
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    static PersistenceSink createSink(TradeWatchConfig config, ObjectMapper mapper) {
        String url = config.getSync().getSinkUrl();
        if (url != null && !url.isBlank()) {
            return new HttpPersistenceSink(url, config.getSync().getSinkKey(), HttpClientFactory.getClient(), mapper);
        }
        return new LoggingPersistenceSink(mapper);
    }

    static TraderSource createTraderSource(TradeWatchConfig config, ObjectMapper mapper) {
        TradeWatchConfig.TradersConfig traders = config.getTraders();
        if ("http".equals(traders.getSource())) {
            return new HttpTraderSource(traders.getUrl(), config.getSync().getSinkKey(), HttpClientFactory.getClient(), mapper);
        }
        return new DirectoryTraderSource(traders.directoryPath());
    }

    private static synchronized void cleanup() {
        if (server != null) {
            server.stop();
            server = null;
        }
        if (orchestrator != null) {
            orchestrator.stop();
        }
    }
}
