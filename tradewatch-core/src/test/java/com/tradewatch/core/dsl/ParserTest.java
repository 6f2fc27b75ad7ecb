package com.tradewatch.core.dsl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the strategy language parser.
 */
class ParserTest {

    private Parser parser;

    @BeforeEach
    void setUp() {
        parser = new Parser();
    }

    @Nested
    @DisplayName("Comparisons")
    class ComparisonTests {

        @Test
        @DisplayName("Parses RSI comparison")
        void parsesRsiComparison() {
            Parser.ParseResult result = parser.parse("RSI(14) < 30");

            assertTrue(result.success());
            AstNode.Comparison comp = assertInstanceOf(AstNode.Comparison.class, result.ast());
            assertEquals("<", comp.operator());

            AstNode.IndicatorCall indicator = assertInstanceOf(AstNode.IndicatorCall.class, comp.left());
            assertEquals("RSI", indicator.indicator());
            assertEquals(List.of(14.0), indicator.params());
            assertEquals(30.0, assertInstanceOf(AstNode.NumberLiteral.class, comp.right()).value());
        }

        @Test
        @DisplayName("Parses all comparison operators")
        void parsesAllComparisonOperators() {
            for (String op : new String[]{">", "<", ">=", "<=", "=="}) {
                Parser.ParseResult result = parser.parse("close " + op + " 100");
                assertTrue(result.success(), "Should parse operator: " + op);
                assertEquals(op, ((AstNode.Comparison) result.ast()).operator());
            }
        }

        @Test
        @DisplayName("Parses cross operators")
        void parsesCrossOperators() {
            Parser.ParseResult result = parser.parse("EMA(9) crosses_above EMA(21)");

            assertTrue(result.success());
            AstNode.CrossComparison cross = assertInstanceOf(AstNode.CrossComparison.class, result.ast());
            assertEquals("crosses_above", cross.operator());
        }

        @Test
        @DisplayName("Parses ticker fields")
        void parsesTickerFields() {
            Parser.ParseResult result = parser.parse("change_pct > 5 AND quote_volume > 1000000");

            assertTrue(result.success());
            AstNode.LogicalExpression and = assertInstanceOf(AstNode.LogicalExpression.class, result.ast());
            AstNode.Comparison left = (AstNode.Comparison) and.left();
            assertEquals("change_pct", assertInstanceOf(AstNode.TickerReference.class, left.left()).field());
        }
    }

    @Nested
    @DisplayName("Logical and arithmetic")
    class LogicalTests {

        @Test
        @DisplayName("AND binds tighter than OR")
        void andBindsTighterThanOr() {
            Parser.ParseResult result = parser.parse("close > 1 OR close > 2 AND close > 3");

            assertTrue(result.success());
            AstNode.LogicalExpression or = assertInstanceOf(AstNode.LogicalExpression.class, result.ast());
            assertEquals("OR", or.operator());
            assertEquals("AND", assertInstanceOf(AstNode.LogicalExpression.class, or.right()).operator());
        }

        @Test
        @DisplayName("Parses NOT")
        void parsesNot() {
            Parser.ParseResult result = parser.parse("NOT (close > open)");

            assertTrue(result.success());
            AstNode.NotExpression not = assertInstanceOf(AstNode.NotExpression.class, result.ast());
            assertInstanceOf(AstNode.Comparison.class, not.expression());
        }

        @Test
        @DisplayName("Minus after an operand is subtraction")
        void minusAfterOperandIsSubtraction() {
            Parser.ParseResult result = parser.parse("close -5 > 0");

            assertTrue(result.success());
            AstNode.Comparison comp = (AstNode.Comparison) result.ast();
            AstNode.ArithmeticExpression arith = assertInstanceOf(AstNode.ArithmeticExpression.class, comp.left());
            assertEquals("-", arith.operator());
        }

        @Test
        @DisplayName("Negative literal after an operator")
        void negativeLiteral() {
            Parser.ParseResult result = parser.parse("MACD(12, 26, 9).histogram > -0.5");

            assertTrue(result.success());
            AstNode.Comparison comp = (AstNode.Comparison) result.ast();
            assertEquals(-0.5, assertInstanceOf(AstNode.NumberLiteral.class, comp.right()).value());
        }

        @Test
        @DisplayName("Parses math functions")
        void parsesMathFunctions() {
            Parser.ParseResult result = parser.parse("abs(close - open) > max(ATR(14), 1)");

            assertTrue(result.success());
            AstNode.Comparison comp = (AstNode.Comparison) result.ast();
            assertEquals("abs", assertInstanceOf(AstNode.MathFunctionCall.class, comp.left()).func());
            assertEquals(2, ((AstNode.MathFunctionCall) comp.right()).args().size());
        }
    }

    @Nested
    @DisplayName("Postfix: lookback and timeframe")
    class PostfixTests {

        @Test
        @DisplayName("Parses lookback")
        void parsesLookback() {
            Parser.ParseResult result = parser.parse("close[1] < close");

            assertTrue(result.success());
            AstNode.Comparison comp = (AstNode.Comparison) result.ast();
            AstNode.LookbackAccess lookback = assertInstanceOf(AstNode.LookbackAccess.class, comp.left());
            assertEquals(1, lookback.barsAgo());
        }

        @Test
        @DisplayName("Parses timeframe suffix")
        void parsesTimeframe() {
            Parser.ParseResult result = parser.parse("RSI(14)@4h < 30 AND close > SMA(50)");

            assertTrue(result.success());
            AstNode.LogicalExpression and = (AstNode.LogicalExpression) result.ast();
            AstNode.Comparison comp = (AstNode.Comparison) and.left();
            AstNode.TimeframeScope scope = assertInstanceOf(AstNode.TimeframeScope.class, comp.left());
            assertEquals("4h", scope.interval());
            assertInstanceOf(AstNode.IndicatorCall.class, scope.expression());
        }

        @Test
        @DisplayName("Lookback then timeframe")
        void lookbackThenTimeframe() {
            Parser.ParseResult result = parser.parse("close[2]@1h > 0");

            assertTrue(result.success());
            AstNode.TimeframeScope scope = (AstNode.TimeframeScope) ((AstNode.Comparison) result.ast()).left();
            assertInstanceOf(AstNode.LookbackAccess.class, scope.expression());
        }

        @Test
        @DisplayName("Rejects lookback on ticker fields")
        void rejectsTickerLookback() {
            Parser.ParseResult result = parser.parse("last_price[1] > 0");

            assertFalse(result.success());
            assertTrue(result.error().contains("ticker"));
        }
    }

    @Nested
    @DisplayName("Indicators and properties")
    class IndicatorTests {

        @Test
        @DisplayName("Parses MACD property")
        void parsesMacdProperty() {
            Parser.ParseResult result = parser.parse("MACD(12, 26, 9).signal > 0");

            assertTrue(result.success());
            AstNode.PropertyAccess prop = assertInstanceOf(AstNode.PropertyAccess.class,
                ((AstNode.Comparison) result.ast()).left());
            assertEquals("signal", prop.property());
            assertEquals(List.of(12.0, 26.0, 9.0), prop.object().params());
        }

        @Test
        @DisplayName("Parses VWAP, AVG_VOLUME, HIGH_OF and ENGULFING")
        void parsesOtherFunctions() {
            assertTrue(parser.parse("close > VWAP").success());
            assertTrue(parser.parse("volume > AVG_VOLUME(20) * 2").success());
            assertTrue(parser.parse("close >= HIGH_OF(20)").success());
            assertTrue(parser.parse("ENGULFING == 1").success());
            assertTrue(parser.parse("STOCHASTIC(14, 3).k crosses_above STOCHASTIC(14, 3).d").success());
            assertTrue(parser.parse("close < BBANDS(20, 2.5).lower").success());
        }

        @Test
        @DisplayName("Rejects wrong parameter count")
        void rejectsWrongParameterCount() {
            Parser.ParseResult result = parser.parse("MACD(12, 26) > 0");

            assertFalse(result.success());
            assertTrue(result.error().contains("MACD requires 3 parameters"));
        }

        @Test
        @DisplayName("Rejects non-integer period")
        void rejectsFractionalPeriod() {
            Parser.ParseResult result = parser.parse("RSI(14.5) < 30");

            assertFalse(result.success());
            assertTrue(result.error().contains("positive integer"));
        }

        @Test
        @DisplayName("Rejects invalid property")
        void rejectsInvalidProperty() {
            Parser.ParseResult result = parser.parse("MACD(12, 26, 9).upper > 0");

            assertFalse(result.success());
            assertTrue(result.error().contains("MACD only has properties"));
        }

        @Test
        @DisplayName("Rejects property on single-value indicator")
        void rejectsPropertyOnRsi() {
            assertFalse(parser.parse("RSI(14).signal > 0").success());
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Unknown identifier reports its position")
        void unknownIdentifier() {
            Parser.ParseResult result = parser.parse("RSI(14) < foo");

            assertFalse(result.success());
            assertTrue(result.error().contains("Unknown identifier 'foo'"));
            assertEquals(10, result.errorPosition());
        }

        @Test
        @DisplayName("Invalid interval is rejected")
        void invalidInterval() {
            Parser.ParseResult result = parser.parse("RSI(14)@7x < 30");

            assertFalse(result.success());
            assertEquals(7, result.errorPosition());
        }

        @Test
        @DisplayName("Empty source")
        void emptySource() {
            assertFalse(parser.parse("").success());
            assertFalse(parser.parse(null).success());
        }

        @Test
        @DisplayName("Trailing tokens")
        void trailingTokens() {
            Parser.ParseResult result = parser.parse("close > 1 2");

            assertFalse(result.success());
            assertTrue(result.error().contains("Unexpected token"));
        }

        @Test
        @DisplayName("Missing closing parenthesis")
        void missingParen() {
            assertFalse(parser.parse("(close > 1").success());
        }
    }

    @Nested
    @DisplayName("Printing")
    class PrinterTests {

        @Test
        @DisplayName("Conjuncts print back to source form")
        void conjunctsPrint() {
            Parser.ParseResult result = parser.parse("RSI(14)@15m < 30 AND close > SMA(50) AND (volume > 1 OR close > 2)");

            List<String> printed = ExpressionPrinter.conjuncts(result.ast()).stream()
                .map(ExpressionPrinter::print)
                .toList();

            assertEquals(List.of("RSI(14)@15m < 30", "close > SMA(50)", "volume > 1 OR close > 2"), printed);
        }

        @Test
        @DisplayName("Printed expression parses to the same tree")
        void printedReparses() {
            String source = "NOT (close[1] > open) AND BBANDS(20, 2.5).upper - close > 0.5 * ATR(14)@1h";
            AstNode ast = parser.parse(source).ast();

            Parser.ParseResult again = new Parser().parse(ExpressionPrinter.print(ast));

            assertTrue(again.success(), again.error());
            assertEquals(ast, again.ast());
        }

        @Test
        @DisplayName("Collects referenced intervals")
        void collectsIntervals() {
            AstNode ast = parser.parse("RSI(14)@4h < 30 AND EMA(9)@1d > close AND close > 0").ast();

            assertEquals(List.of("4h", "1d"), List.copyOf(ExpressionPrinter.referencedIntervals(ast)));
        }
    }

    @Nested
    @DisplayName("Nesting limits")
    class NestingLimitTests {

        @Test
        @DisplayName("Deeply parenthesized source is rejected as a parse error")
        void deepParentheses() {
            String source = "(".repeat(50_000) + "close > 1" + ")".repeat(50_000);

            Parser.ParseResult result = parser.parse(source);

            assertFalse(result.success());
            assertTrue(result.error().contains("nested too deeply"), result.error());
        }

        @Test
        @DisplayName("Long NOT chains and operator chains are rejected")
        void longChains() {
            assertFalse(parser.parse("NOT ".repeat(10_000) + "close > 1").success());
            assertFalse(parser.parse("close > 1" + " AND close > 1".repeat(10_000)).success());
            assertFalse(parser.parse("close" + " + 1".repeat(10_000) + " > 0").success());
        }

        @Test
        @DisplayName("Nested function arguments count towards the limit")
        void nestedArguments() {
            String source = "abs(".repeat(5_000) + "close" + ")".repeat(5_000) + " > 0";

            assertFalse(parser.parse(source).success());
        }

        @Test
        @DisplayName("Realistic nesting stays well within the limit")
        void realisticNesting() {
            String source = "(".repeat(40) + "close > 1" + ")".repeat(40)
                + " AND close > 2".repeat(30) + " OR NOT NOT (close + 1 + 2 + 3 > 4)";

            Parser.ParseResult result = parser.parse(source);

            assertTrue(result.success(), result.error());
        }

        @Test
        @DisplayName("Parser is reusable after hitting the limit")
        void reusableAfterLimit() {
            parser.parse("(".repeat(1_000) + "close > 1" + ")".repeat(1_000));

            assertTrue(parser.parse("close > 1").success());
        }
    }
}
