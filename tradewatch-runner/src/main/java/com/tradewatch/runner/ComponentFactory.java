package com.tradewatch.runner;

import com.tradewatch.engine.sandbox.StrategySandbox;
import com.tradewatch.engine.screener.ParallelScreener;
import com.tradewatch.feed.HistoricalKlineLoader;
import com.tradewatch.feed.MarketDataClient;
import com.tradewatch.runner.config.TradeWatchConfig;

import java.time.Duration;
import java.util.Collection;

/**
 * Builds the restartable components. The supervisor calls these again to replace a
 * component that has failed.
 */
public interface ComponentFactory {

    MarketDataClient createFeed(Collection<String> symbols, Collection<String> intervals);

    ParallelScreener createScreener(StrategySandbox sandbox);

    HistoricalKlineLoader createKlineLoader();

    /**
     * Components as configured, talking to the real exchange.
     */
    static ComponentFactory fromConfig(TradeWatchConfig config) {
        return new ComponentFactory() {
            @Override
            public MarketDataClient createFeed(Collection<String> symbols, Collection<String> intervals) {
                return new MarketDataClient(symbols, intervals, config.toFeedSettings());
            }

            @Override
            public ParallelScreener createScreener(StrategySandbox sandbox) {
                TradeWatchConfig.ScreenerConfig screener = config.getScreener();
                return new ParallelScreener(sandbox, screener.getWorkers(), Duration.ofMillis(screener.getTickBudgetMs()));
            }

            @Override
            public HistoricalKlineLoader createKlineLoader() {
                return new HistoricalKlineLoader(config.getMarketData().getRestUrl());
            }
        };
    }
}
