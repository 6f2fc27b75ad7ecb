package com.tradewatch.core.dsl;

/**
 * Token types for the strategy language.
 */
public enum TokenType {
    INDICATOR,      // SMA, EMA, RSI, MACD, BBANDS, ATR, STOCHASTIC
    RANGE_FUNC,     // HIGH_OF, LOW_OF
    VOLUME_FUNC,    // AVG_VOLUME, VWAP
    MATH_FUNC,      // abs, min, max
    PATTERN_FUNC,   // ENGULFING
    PRICE,          // price, open, high, low, close, volume
    TICKER,         // last_price, change_pct, quote_volume
    PROPERTY,       // line, signal, histogram, upper, middle, lower, width, k, d
    LOGICAL,        // AND, OR
    NOT,
    CROSS_OP,       // crosses_above, crosses_below
    OPERATOR,       // > < >= <= ==
    BOOLEAN,        // true, false
    NUMBER,
    TIMEFRAME,      // @4h
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    DOT,
    PLUS,
    MINUS,
    MULTIPLY,
    DIVIDE,
    EOF
}
