package com.tradewatch.engine;

import com.tradewatch.core.dsl.AstNode;
import com.tradewatch.core.indicators.IndicatorEngine;
import com.tradewatch.core.model.Candle;
import com.tradewatch.core.model.MarketSnapshot;
import com.tradewatch.core.model.Ticker;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates strategy AST nodes against one symbol's market snapshot.
 *
 * Evaluation starts on the primary interval. {@code expr@interval} switches to another
 * interval's candles while keeping the bars-ago offset, so {@code RSI(14)@4h} at the newest
 * 15m bar reads the newest 4h bar.
 */
public class ConditionEvaluator {

    private static final double EPSILON = 0.0000001;

    private final MarketSnapshot snapshot;
    private final String primaryInterval;
    private final Map<String, IndicatorEngine> engines = new HashMap<>();

    public ConditionEvaluator(MarketSnapshot snapshot, String primaryInterval) {
        this.snapshot = snapshot;
        this.primaryInterval = primaryInterval;
    }

    /**
     * Number of bars available on the primary interval.
     */
    public int barCount() {
        return engine(primaryInterval).getBarCount();
    }

    public List<Candle> primaryCandles() {
        return engine(primaryInterval).getCandles();
    }

    /**
     * Evaluate a condition at the newest bar of the primary interval.
     */
    public boolean evaluate(AstNode node) {
        return evaluateAt(node, barCount() - 1);
    }

    /**
     * Evaluate a condition at a bar of the primary interval.
     * Returns true if the condition is met, false otherwise.
     */
    public boolean evaluateAt(AstNode node, int barIndex) {
        Object result = evaluateNode(node, primaryInterval, barIndex);
        if (result instanceof Boolean b) {
            return b;
        }
        throw new EvaluationException("Expected boolean result, got " + describe(result));
    }

    /**
     * Evaluate an expression as a number at a bar of the primary interval.
     * Booleans become 1 or 0.
     */
    public double evaluateValue(AstNode node, int barIndex) {
        Object result = evaluateNode(node, primaryInterval, barIndex);
        if (result instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        return toDouble(result);
    }

    private IndicatorEngine engine(String interval) {
        return engines.computeIfAbsent(interval, i -> new IndicatorEngine(snapshot.candles(i), i));
    }

    /**
     * Evaluate a node and return the result (boolean or double)
     */
    private Object evaluateNode(AstNode node, String interval, int barIndex) {
        // Cancellation point for the sandbox timeout
        if (Thread.currentThread().isInterrupted()) {
            throw new EvaluationException("Evaluation interrupted");
        }

        if (node instanceof AstNode.Comparison c) {
            return evaluateComparison(c, interval, barIndex);
        }
        if (node instanceof AstNode.CrossComparison c) {
            return evaluateCrossComparison(c, interval, barIndex);
        }
        if (node instanceof AstNode.LogicalExpression l) {
            return evaluateLogical(l, interval, barIndex);
        }
        if (node instanceof AstNode.NotExpression n) {
            return !toBoolean(evaluateNode(n.expression(), interval, barIndex));
        }
        if (node instanceof AstNode.ArithmeticExpression a) {
            return evaluateArithmetic(a, interval, barIndex);
        }
        if (node instanceof AstNode.IndicatorCall i) {
            return evaluateIndicator(i, engine(interval), barIndex);
        }
        if (node instanceof AstNode.PropertyAccess p) {
            return evaluateProperty(p, engine(interval), barIndex);
        }
        if (node instanceof AstNode.RangeFunctionCall r) {
            return evaluateRangeFunction(r, engine(interval), barIndex);
        }
        if (node instanceof AstNode.VolumeFunctionCall v) {
            return evaluateVolumeFunction(v, engine(interval), barIndex);
        }
        if (node instanceof AstNode.MathFunctionCall m) {
            return evaluateMathFunction(m, interval, barIndex);
        }
        if (node instanceof AstNode.CandlePatternCall p) {
            return evaluateCandlePattern(p, engine(interval), barIndex);
        }
        if (node instanceof AstNode.PriceReference p) {
            return evaluatePrice(p, engine(interval), barIndex);
        }
        if (node instanceof AstNode.TickerReference t) {
            return evaluateTicker(t);
        }
        if (node instanceof AstNode.NumberLiteral n) {
            return n.value();
        }
        if (node instanceof AstNode.BooleanLiteral b) {
            return b.value();
        }
        if (node instanceof AstNode.LookbackAccess l) {
            return evaluateLookback(l, interval, barIndex);
        }
        if (node instanceof AstNode.TimeframeScope t) {
            return evaluateTimeframe(t, interval, barIndex);
        }
        throw new EvaluationException("Unknown node type: " + node.getClass().getSimpleName());
    }

    private boolean evaluateComparison(AstNode.Comparison node, String interval, int barIndex) {
        double left = toDouble(evaluateNode(node.left(), interval, barIndex));
        double right = toDouble(evaluateNode(node.right(), interval, barIndex));

        if (Double.isNaN(left) || Double.isNaN(right)) {
            return false;
        }

        return switch (node.operator()) {
            case ">" -> left > right;
            case "<" -> left < right;
            case ">=" -> left >= right;
            case "<=" -> left <= right;
            case "==" -> Math.abs(left - right) < EPSILON;
            default -> throw new EvaluationException("Unknown operator: " + node.operator());
        };
    }

    private boolean evaluateCrossComparison(AstNode.CrossComparison node, String interval, int barIndex) {
        if (barIndex < 1) {
            return false;
        }

        double leftCurrent = toDouble(evaluateNode(node.left(), interval, barIndex));
        double leftPrev = toDouble(evaluateNode(node.left(), interval, barIndex - 1));
        double rightCurrent = toDouble(evaluateNode(node.right(), interval, barIndex));
        double rightPrev = toDouble(evaluateNode(node.right(), interval, barIndex - 1));

        if (Double.isNaN(leftCurrent) || Double.isNaN(leftPrev) ||
            Double.isNaN(rightCurrent) || Double.isNaN(rightPrev)) {
            return false;
        }

        return switch (node.operator()) {
            case "crosses_above" -> leftPrev <= rightPrev && leftCurrent > rightCurrent;
            case "crosses_below" -> leftPrev >= rightPrev && leftCurrent < rightCurrent;
            default -> throw new EvaluationException("Unknown cross operator: " + node.operator());
        };
    }

    private boolean evaluateLogical(AstNode.LogicalExpression node, String interval, int barIndex) {
        boolean left = toBoolean(evaluateNode(node.left(), interval, barIndex));

        // Short-circuit evaluation
        if ("AND".equals(node.operator()) && !left) {
            return false;
        }
        if ("OR".equals(node.operator()) && left) {
            return true;
        }

        return toBoolean(evaluateNode(node.right(), interval, barIndex));
    }

    private double evaluateArithmetic(AstNode.ArithmeticExpression node, String interval, int barIndex) {
        double left = toDouble(evaluateNode(node.left(), interval, barIndex));
        double right = toDouble(evaluateNode(node.right(), interval, barIndex));

        return switch (node.operator()) {
            case "*" -> left * right;
            case "/" -> right != 0 ? left / right : Double.NaN;
            case "+" -> left + right;
            case "-" -> left - right;
            default -> throw new EvaluationException("Unknown arithmetic operator: " + node.operator());
        };
    }

    private double evaluateIndicator(AstNode.IndicatorCall node, IndicatorEngine engine, int barIndex) {
        List<Double> params = node.params();

        return switch (node.indicator()) {
            case "SMA" -> engine.getSMAAt(params.get(0).intValue(), barIndex);
            case "EMA" -> engine.getEMAAt(params.get(0).intValue(), barIndex);
            case "RSI" -> engine.getRSIAt(params.get(0).intValue(), barIndex);
            case "ATR" -> engine.getATRAt(params.get(0).intValue(), barIndex);
            // Without property access MACD is its line and BBANDS its middle band
            case "MACD" -> engine.getMACDLineAt(
                params.get(0).intValue(),
                params.get(1).intValue(),
                params.get(2).intValue(),
                barIndex
            );
            case "BBANDS" -> engine.getBollingerMiddleAt(params.get(0).intValue(), params.get(1), barIndex);
            case "STOCHASTIC" -> engine.getStochasticKAt(params.get(0).intValue(), stochDPeriod(params), barIndex);
            default -> throw new EvaluationException("Unknown indicator: " + node.indicator());
        };
    }

    private double evaluateProperty(AstNode.PropertyAccess node, IndicatorEngine engine, int barIndex) {
        AstNode.IndicatorCall indicator = node.object();
        String property = node.property();
        List<Double> params = indicator.params();

        return switch (indicator.indicator()) {
            case "MACD" -> {
                int fast = params.get(0).intValue();
                int slow = params.get(1).intValue();
                int signal = params.get(2).intValue();
                yield switch (property) {
                    case "line" -> engine.getMACDLineAt(fast, slow, signal, barIndex);
                    case "signal" -> engine.getMACDSignalAt(fast, slow, signal, barIndex);
                    case "histogram" -> engine.getMACDHistogramAt(fast, slow, signal, barIndex);
                    default -> throw new EvaluationException("Unknown MACD property: " + property);
                };
            }
            case "BBANDS" -> {
                int period = params.get(0).intValue();
                double stdDev = params.get(1);
                yield switch (property) {
                    case "upper" -> engine.getBollingerUpperAt(period, stdDev, barIndex);
                    case "middle" -> engine.getBollingerMiddleAt(period, stdDev, barIndex);
                    case "lower" -> engine.getBollingerLowerAt(period, stdDev, barIndex);
                    case "width" -> engine.getBollingerWidthAt(period, stdDev, barIndex);
                    default -> throw new EvaluationException("Unknown BBANDS property: " + property);
                };
            }
            case "STOCHASTIC" -> {
                int kPeriod = params.get(0).intValue();
                int dPeriod = stochDPeriod(params);
                yield switch (property) {
                    case "k" -> engine.getStochasticKAt(kPeriod, dPeriod, barIndex);
                    case "d" -> engine.getStochasticDAt(kPeriod, dPeriod, barIndex);
                    default -> throw new EvaluationException("Unknown STOCHASTIC property: " + property);
                };
            }
            default -> throw new EvaluationException(indicator.indicator() + " does not have properties");
        };
    }

    private static int stochDPeriod(List<Double> params) {
        return params.size() > 1 ? params.get(1).intValue() : 3;
    }

    private double evaluateRangeFunction(AstNode.RangeFunctionCall node, IndicatorEngine engine, int barIndex) {
        return switch (node.func()) {
            case "HIGH_OF" -> engine.getHighOfAt(node.period(), barIndex);
            case "LOW_OF" -> engine.getLowOfAt(node.period(), barIndex);
            default -> throw new EvaluationException("Unknown range function: " + node.func());
        };
    }

    private double evaluateVolumeFunction(AstNode.VolumeFunctionCall node, IndicatorEngine engine, int barIndex) {
        return switch (node.func()) {
            case "AVG_VOLUME" -> engine.getAvgVolumeAt(node.period(), barIndex);
            case "VWAP" -> engine.getVWAPAt(barIndex);
            default -> throw new EvaluationException("Unknown volume function: " + node.func());
        };
    }

    private double evaluateMathFunction(AstNode.MathFunctionCall node, String interval, int barIndex) {
        List<AstNode> args = node.args();

        return switch (node.func()) {
            case "abs" -> Math.abs(toDouble(evaluateNode(args.get(0), interval, barIndex)));
            case "min" -> Math.min(
                toDouble(evaluateNode(args.get(0), interval, barIndex)),
                toDouble(evaluateNode(args.get(1), interval, barIndex)));
            case "max" -> Math.max(
                toDouble(evaluateNode(args.get(0), interval, barIndex)),
                toDouble(evaluateNode(args.get(1), interval, barIndex)));
            default -> throw new EvaluationException("Unknown math function: " + node.func());
        };
    }

    private double evaluateCandlePattern(AstNode.CandlePatternCall node, IndicatorEngine engine, int barIndex) {
        if ("ENGULFING".equals(node.func())) {
            return engine.getEngulfingAt(barIndex);
        }
        throw new EvaluationException("Unknown candle pattern: " + node.func());
    }

    private double evaluatePrice(AstNode.PriceReference node, IndicatorEngine engine, int barIndex) {
        Candle candle = engine.getCandleAt(barIndex);
        if (candle == null) {
            return Double.NaN;
        }

        return switch (node.field()) {
            case "price", "close" -> candle.close();
            case "open" -> candle.open();
            case "high" -> candle.high();
            case "low" -> candle.low();
            case "volume" -> candle.volume();
            default -> throw new EvaluationException("Unknown price field: " + node.field());
        };
    }

    private double evaluateTicker(AstNode.TickerReference node) {
        Ticker ticker = snapshot.ticker();
        if (ticker == null) {
            return Double.NaN;
        }

        return switch (node.field()) {
            case "last_price" -> ticker.lastPrice();
            case "change_pct" -> ticker.priceChangePercent();
            case "quote_volume" -> ticker.quoteVolume();
            default -> throw new EvaluationException("Unknown ticker field: " + node.field());
        };
    }

    /**
     * Evaluate lookback access: expr[n] returns value n bars ago
     */
    private Object evaluateLookback(AstNode.LookbackAccess node, String interval, int barIndex) {
        // Before the first bar every leaf reads NaN, so conditions stay false. Long math so
        // stacked offsets near Integer.MAX_VALUE cannot wrap around to a real bar.
        int targetBar = (int) Math.max((long) barIndex - node.barsAgo(), -1L);
        return evaluateNode(node.expression(), interval, targetBar);
    }

    private Object evaluateTimeframe(AstNode.TimeframeScope node, String interval, int barIndex) {
        int barsAgo = engine(interval).getBarCount() - 1 - barIndex;
        int targetBar = Math.max(engine(node.interval()).getBarCount() - 1 - barsAgo, -1);
        return evaluateNode(node.expression(), node.interval(), targetBar);
    }

    private double toDouble(Object value) {
        if (value instanceof Double d) {
            return d;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new EvaluationException("Cannot use " + describe(value) + " as a number");
    }

    private boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new EvaluationException("Cannot use " + describe(value) + " as a condition");
    }

    private static String describe(Object value) {
        return value instanceof Boolean ? "boolean" : value instanceof Number ? "number" : String.valueOf(value);
    }

    public static class EvaluationException extends RuntimeException {
        public EvaluationException(String message) {
            super(message);
        }
    }
}
