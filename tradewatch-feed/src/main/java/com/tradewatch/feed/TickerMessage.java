package com.tradewatch.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradewatch.core.model.Ticker;

/**
 * Binance 24h rolling ticker payload ({@code "e": "24hrTicker"}). Only the fields used for
 * screening are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TickerMessage {

    @JsonProperty("E")
    private long eventTime;

    @JsonProperty("s")
    private String symbol;

    @JsonProperty("c")
    private String lastPrice;

    @JsonProperty("P")
    private String priceChangePercent;

    @JsonProperty("q")
    private String quoteVolume;

    public String getSymbol() {
        return symbol;
    }

    /**
     * @throws IllegalArgumentException if required fields are missing or not numeric
     */
    public Ticker toTicker() {
        if (symbol == null) {
            throw new IllegalArgumentException("ticker without symbol");
        }
        return new Ticker(symbol,
            KlineMessage.number("c", lastPrice),
            KlineMessage.number("P", priceChangePercent),
            KlineMessage.number("q", quoteVolume),
            eventTime);
    }
}
