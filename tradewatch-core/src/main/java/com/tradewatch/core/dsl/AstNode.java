package com.tradewatch.core.dsl;

import java.util.List;

/**
 * AST node types for the strategy language.
 */
public sealed interface AstNode {

    /**
     * Comparison: left > right, left < right, etc.
     */
    record Comparison(AstNode left, String operator, AstNode right) implements AstNode {}

    /**
     * Cross comparison: left crosses_above right, left crosses_below right
     */
    record CrossComparison(AstNode left, String operator, AstNode right) implements AstNode {}

    /**
     * Logical expression: left AND right, left OR right
     */
    record LogicalExpression(String operator, AstNode left, AstNode right) implements AstNode {}

    /**
     * Negation: NOT expr
     */
    record NotExpression(AstNode expression) implements AstNode {}

    /**
     * Arithmetic expression: left * right, left / right, etc.
     */
    record ArithmeticExpression(String operator, AstNode left, AstNode right) implements AstNode {}

    /**
     * Indicator call: SMA(14), RSI(14), MACD(12, 26, 9), etc.
     */
    record IndicatorCall(String indicator, List<Double> params) implements AstNode {}

    /**
     * Property access: MACD(12,26,9).signal, BBANDS(20,2).upper
     */
    record PropertyAccess(IndicatorCall object, String property) implements AstNode {}

    /**
     * Range function call: HIGH_OF(20), LOW_OF(20)
     */
    record RangeFunctionCall(String func, int period) implements AstNode {}

    /**
     * Volume function call: AVG_VOLUME(20), VWAP (period is null)
     */
    record VolumeFunctionCall(String func, Integer period) implements AstNode {}

    /**
     * Math function call: abs(expr), min(a, b), max(a, b)
     */
    record MathFunctionCall(String func, List<AstNode> args) implements AstNode {}

    /**
     * Candle pattern: ENGULFING. Evaluates to +1 bullish, -1 bearish, 0 none.
     */
    record CandlePatternCall(String func) implements AstNode {}

    /**
     * Price reference: close, open, high, low, volume, price
     */
    record PriceReference(String field) implements AstNode {}

    /**
     * Ticker reference: last_price, change_pct, quote_volume.
     * Ticker values are current; lookback does not apply to them.
     */
    record TickerReference(String field) implements AstNode {}

    /**
     * Number literal: 14, 1.5, 200
     */
    record NumberLiteral(double value) implements AstNode {}

    /**
     * Boolean literal: true, false
     */
    record BooleanLiteral(boolean value) implements AstNode {}

    /**
     * Lookback access: expr[n] - value of the expression n bars ago
     */
    record LookbackAccess(AstNode expression, int barsAgo) implements AstNode {}

    /**
     * Timeframe scope: expr@4h - expression evaluated on the candles of another interval
     */
    record TimeframeScope(AstNode expression, String interval) implements AstNode {}
}
