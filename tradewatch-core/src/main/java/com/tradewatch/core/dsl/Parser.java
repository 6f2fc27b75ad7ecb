package com.tradewatch.core.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for the strategy language.
 *
 * Grammar (lowest to highest precedence):
 * expression     = logical_or
 * logical_or     = logical_and ( "OR" logical_and )*
 * logical_and    = comparison ( "AND" comparison )*
 * comparison     = arithmetic ( OPERATOR arithmetic | CROSS_OP arithmetic )?
 * arithmetic     = term ( (MULTIPLY | DIVIDE | PLUS | MINUS) term )*
 * term           = ( "NOT" term | primary ) ( "[" NUMBER "]" )? TIMEFRAME?
 * primary        = function_call | price_ref | ticker_ref | number | boolean | "(" expression ")"
 */
public class Parser {

    private static final Set<String> MACD_PROPS = Set.of("line", "signal", "histogram");
    private static final Set<String> BBANDS_PROPS = Set.of("upper", "middle", "lower", "width");
    private static final Set<String> STOCH_PROPS = Set.of("k", "d");

    /** Limit on nesting plus chained operators, which bounds the depth of the tree. */
    public static final int MAX_DEPTH = 256;

    private List<Token> tokens = new ArrayList<>();
    private int position = 0;
    private int depth = 0;

    /**
     * Parse source string into an AST
     */
    public ParseResult parse(String source) {
        if (source == null || source.isBlank()) {
            return new ParseResult(false, null, "Empty expression", 0);
        }
        try {
            this.tokens = Lexer.tokenize(source);
            this.position = 0;
            this.depth = 0;

            AstNode ast = expression();

            if (current().type() != TokenType.EOF) {
                throw new ParserException("Unexpected token '" + current().value() +
                    "' at position " + current().position());
            }

            return new ParseResult(true, ast, null, null);
        } catch (Lexer.LexerException e) {
            return new ParseResult(false, null, e.getMessage(), e.getPosition());
        } catch (ParserException e) {
            return new ParseResult(false, null, e.getMessage(), current().position());
        }
    }

    // ========== Parser Methods ==========

    private AstNode expression() {
        descend();
        AstNode result = logicalOr();
        depth--;
        return result;
    }

    /**
     * Every nested expression and every chained operator costs one level.
     */
    private void descend() {
        if (++depth > MAX_DEPTH) {
            throw new ParserException("Expression nested too deeply (more than " + MAX_DEPTH + " levels)");
        }
    }

    private AstNode logicalOr() {
        int entryDepth = depth;
        AstNode left = logicalAnd();

        while (check(TokenType.LOGICAL) && "OR".equals(current().value())) {
            advance();
            descend();
            AstNode right = logicalAnd();
            left = new AstNode.LogicalExpression("OR", left, right);
        }

        depth = entryDepth;
        return left;
    }

    private AstNode logicalAnd() {
        int entryDepth = depth;
        AstNode left = comparison();

        while (check(TokenType.LOGICAL) && "AND".equals(current().value())) {
            advance();
            descend();
            AstNode right = comparison();
            left = new AstNode.LogicalExpression("AND", left, right);
        }

        depth = entryDepth;
        return left;
    }

    private AstNode comparison() {
        AstNode left = arithmetic();

        if (check(TokenType.OPERATOR)) {
            String operator = current().value();
            advance();
            AstNode right = arithmetic();
            return new AstNode.Comparison(left, operator, right);
        }

        if (check(TokenType.CROSS_OP)) {
            String operator = current().value();
            advance();
            AstNode right = arithmetic();
            return new AstNode.CrossComparison(left, operator, right);
        }

        return left;
    }

    private AstNode arithmetic() {
        int entryDepth = depth;
        AstNode left = term();

        while (check(TokenType.MULTIPLY) || check(TokenType.DIVIDE) ||
               check(TokenType.PLUS) || check(TokenType.MINUS)) {
            String operator = current().value();
            advance();
            descend();
            AstNode right = term();
            left = new AstNode.ArithmeticExpression(operator, left, right);
        }

        depth = entryDepth;
        return left;
    }

    private AstNode term() {
        if (check(TokenType.NOT)) {
            advance();
            descend();
            AstNode negated = new AstNode.NotExpression(term());
            depth--;
            return negated;
        }
        return postfix(primary());
    }

    /**
     * Optional lookback [n] followed by an optional @interval.
     */
    private AstNode postfix(AstNode node) {
        AstNode result = node;

        if (check(TokenType.LBRACKET)) {
            if (node instanceof AstNode.TickerReference) {
                throw new ParserException("Lookback is not supported on ticker field '" +
                    ((AstNode.TickerReference) node).field() + "'");
            }
            advance();
            if (!check(TokenType.NUMBER)) {
                throw new ParserException("Expected number in lookback [], got '" + current().value() + "'");
            }
            double barsAgo = Double.parseDouble(current().value());
            if (barsAgo < 0 || barsAgo != Math.floor(barsAgo)) {
                throw new ParserException("Lookback must be a non-negative integer, got '" + current().value() + "'");
            }
            advance();
            expect(TokenType.RBRACKET, "Expected ']' after lookback number");
            result = new AstNode.LookbackAccess(result, (int) barsAgo);
        }

        if (check(TokenType.TIMEFRAME)) {
            String interval = current().value();
            advance();
            result = new AstNode.TimeframeScope(result, interval);
        }

        return result;
    }

    private AstNode primary() {
        if (check(TokenType.LPAREN)) {
            advance();
            AstNode expr = expression();
            expect(TokenType.RPAREN, "Expected ')' after expression");
            return expr;
        }

        if (check(TokenType.BOOLEAN)) {
            boolean value = "true".equals(current().value());
            advance();
            return new AstNode.BooleanLiteral(value);
        }

        if (check(TokenType.NUMBER)) {
            double value = Double.parseDouble(current().value());
            advance();
            return new AstNode.NumberLiteral(value);
        }

        if (check(TokenType.PRICE)) {
            String field = current().value();
            advance();
            return new AstNode.PriceReference(field);
        }

        if (check(TokenType.TICKER)) {
            String field = current().value();
            advance();
            return new AstNode.TickerReference(field);
        }

        if (check(TokenType.INDICATOR)) {
            return indicatorCall();
        }

        if (check(TokenType.RANGE_FUNC)) {
            return rangeFunctionCall();
        }

        if (check(TokenType.VOLUME_FUNC)) {
            return volumeFunctionCall();
        }

        if (check(TokenType.MATH_FUNC)) {
            return mathFunctionCall();
        }

        if (check(TokenType.PATTERN_FUNC)) {
            String func = current().value();
            advance();
            return new AstNode.CandlePatternCall(func);
        }

        throw new ParserException("Unexpected token '" + current().value() +
            "' at position " + current().position());
    }

    private AstNode indicatorCall() {
        String indicator = current().value();
        advance();

        expect(TokenType.LPAREN, "Expected '(' after " + indicator);
        List<Double> params = parseNumberList();
        expect(TokenType.RPAREN, "Expected ')' after " + indicator + " parameters");

        validateIndicatorParams(indicator, params);

        AstNode.IndicatorCall indicatorNode = new AstNode.IndicatorCall(indicator, params);

        if (check(TokenType.DOT)) {
            advance();
            if (!check(TokenType.PROPERTY)) {
                throw new ParserException("Expected property name after '.', got '" + current().value() + "'");
            }
            String property = current().value();
            advance();

            validateProperty(indicator, property);

            return new AstNode.PropertyAccess(indicatorNode, property);
        }

        return indicatorNode;
    }

    private void validateIndicatorParams(String indicator, List<Double> params) {
        switch (indicator) {
            case "MACD" -> {
                if (params.size() != 3) {
                    throw new ParserException("MACD requires 3 parameters (fast, slow, signal), got " + params.size());
                }
            }
            case "BBANDS" -> {
                if (params.size() != 2) {
                    throw new ParserException("BBANDS requires 2 parameters (period, stdDev), got " + params.size());
                }
            }
            case "STOCHASTIC" -> {
                if (params.size() < 1 || params.size() > 2) {
                    throw new ParserException("STOCHASTIC requires 1-2 parameters (kPeriod, dPeriod), got " + params.size());
                }
            }
            default -> {
                if (params.size() != 1) {
                    throw new ParserException(indicator + " requires 1 parameter (period), got " + params.size());
                }
            }
        }

        // Every indicator except the BBANDS multiplier takes whole positive periods
        for (int i = 0; i < params.size(); i++) {
            double p = params.get(i);
            boolean multiplier = "BBANDS".equals(indicator) && i == 1;
            if (p <= 0 || (!multiplier && p != Math.floor(p))) {
                throw new ParserException(indicator + " parameter " + (i + 1) + " must be a positive " +
                    (multiplier ? "number" : "integer") + ", got " + formatNumber(p));
            }
        }
    }

    private void validateProperty(String indicator, String property) {
        switch (indicator) {
            case "MACD" -> {
                if (!MACD_PROPS.contains(property)) {
                    throw new ParserException("MACD only has properties: line, signal, histogram");
                }
            }
            case "BBANDS" -> {
                if (!BBANDS_PROPS.contains(property)) {
                    throw new ParserException("BBANDS only has properties: upper, middle, lower, width");
                }
            }
            case "STOCHASTIC" -> {
                if (!STOCH_PROPS.contains(property)) {
                    throw new ParserException("STOCHASTIC only has properties: k, d");
                }
            }
            default -> throw new ParserException(indicator + " does not have properties");
        }
    }

    private AstNode.RangeFunctionCall rangeFunctionCall() {
        String func = current().value();
        advance();

        expect(TokenType.LPAREN, "Expected '(' after " + func);
        List<Double> params = parseNumberList();
        expect(TokenType.RPAREN, "Expected ')' after " + func + " parameters");

        if (params.size() != 1) {
            throw new ParserException(func + " requires 1 parameter (period), got " + params.size());
        }

        return new AstNode.RangeFunctionCall(func, positivePeriod(func, params.get(0)));
    }

    private AstNode.VolumeFunctionCall volumeFunctionCall() {
        String func = current().value();
        advance();

        // VWAP takes no parameters
        if ("VWAP".equals(func)) {
            return new AstNode.VolumeFunctionCall(func, null);
        }

        expect(TokenType.LPAREN, "Expected '(' after " + func);
        List<Double> params = parseNumberList();
        expect(TokenType.RPAREN, "Expected ')' after " + func + " parameters");

        if (params.size() != 1) {
            throw new ParserException(func + " requires 1 parameter (period), got " + params.size());
        }

        return new AstNode.VolumeFunctionCall(func, positivePeriod(func, params.get(0)));
    }

    private AstNode.MathFunctionCall mathFunctionCall() {
        String func = current().value();
        advance();

        expect(TokenType.LPAREN, "Expected '(' after " + func);

        List<AstNode> args = new ArrayList<>();
        args.add(expression());

        // min() and max() take 2 arguments, abs() one
        if ("min".equals(func) || "max".equals(func)) {
            expect(TokenType.COMMA, "Expected ',' after first argument in " + func);
            args.add(expression());
        }

        expect(TokenType.RPAREN, "Expected ')' after " + func + " arguments");

        return new AstNode.MathFunctionCall(func, args);
    }

    private List<Double> parseNumberList() {
        List<Double> numbers = new ArrayList<>();

        if (check(TokenType.NUMBER)) {
            numbers.add(Double.parseDouble(current().value()));
            advance();

            while (check(TokenType.COMMA)) {
                advance();
                if (!check(TokenType.NUMBER)) {
                    throw new ParserException("Expected number after ',', got '" + current().value() + "'");
                }
                numbers.add(Double.parseDouble(current().value()));
                advance();
            }
        }

        return numbers;
    }

    private int positivePeriod(String func, double value) {
        if (value <= 0 || value != Math.floor(value)) {
            throw new ParserException(func + " period must be a positive integer, got " + formatNumber(value));
        }
        return (int) value;
    }

    private static String formatNumber(double value) {
        return value == Math.floor(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    // ========== Helper Methods ==========

    private Token current() {
        if (position >= tokens.size()) {
            return Token.eof(position);
        }
        return tokens.get(position);
    }

    private boolean check(TokenType type) {
        return current().type() == type;
    }

    private Token advance() {
        Token token = current();
        if (token.type() != TokenType.EOF) {
            position++;
        }
        return token;
    }

    private void expect(TokenType type, String message) {
        if (!check(type)) {
            throw new ParserException(message + ", got '" + current().value() +
                "' at position " + current().position());
        }
        advance();
    }

    // ========== Result Types ==========

    /**
     * Result of parsing. On failure {@code errorPosition} is the character offset of the problem.
     */
    public record ParseResult(boolean success, AstNode ast, String error, Integer errorPosition) {}

    /**
     * Exception thrown during parsing
     */
    public static class ParserException extends RuntimeException {
        public ParserException(String message) {
            super(message);
        }
    }
}
