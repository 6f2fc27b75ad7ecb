package com.tradewatch.core.dsl;

import com.tradewatch.core.model.Interval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tokenizes strategy expressions.
 *
 * Identifiers must be known keywords; there is no way to name anything outside the
 * candle, ticker and indicator vocabulary.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        // Indicators
        Map.entry("SMA", TokenType.INDICATOR),
        Map.entry("EMA", TokenType.INDICATOR),
        Map.entry("RSI", TokenType.INDICATOR),
        Map.entry("ATR", TokenType.INDICATOR),
        Map.entry("MACD", TokenType.INDICATOR),
        Map.entry("BBANDS", TokenType.INDICATOR),
        Map.entry("STOCHASTIC", TokenType.INDICATOR),

        // Range functions
        Map.entry("HIGH_OF", TokenType.RANGE_FUNC),
        Map.entry("LOW_OF", TokenType.RANGE_FUNC),

        // Volume functions
        Map.entry("AVG_VOLUME", TokenType.VOLUME_FUNC),
        Map.entry("VWAP", TokenType.VOLUME_FUNC),

        // Math functions
        Map.entry("abs", TokenType.MATH_FUNC),
        Map.entry("min", TokenType.MATH_FUNC),
        Map.entry("max", TokenType.MATH_FUNC),

        // Candle patterns
        Map.entry("ENGULFING", TokenType.PATTERN_FUNC),

        // Price references
        Map.entry("price", TokenType.PRICE),
        Map.entry("open", TokenType.PRICE),
        Map.entry("high", TokenType.PRICE),
        Map.entry("low", TokenType.PRICE),
        Map.entry("close", TokenType.PRICE),
        Map.entry("volume", TokenType.PRICE),

        // Ticker references
        Map.entry("last_price", TokenType.TICKER),
        Map.entry("change_pct", TokenType.TICKER),
        Map.entry("quote_volume", TokenType.TICKER),

        // Logical operators
        Map.entry("AND", TokenType.LOGICAL),
        Map.entry("OR", TokenType.LOGICAL),
        Map.entry("NOT", TokenType.NOT),

        // Cross operators
        Map.entry("crosses_above", TokenType.CROSS_OP),
        Map.entry("crosses_below", TokenType.CROSS_OP),

        // Boolean literals
        Map.entry("true", TokenType.BOOLEAN),
        Map.entry("false", TokenType.BOOLEAN),

        // Properties
        Map.entry("line", TokenType.PROPERTY),
        Map.entry("signal", TokenType.PROPERTY),
        Map.entry("histogram", TokenType.PROPERTY),
        Map.entry("upper", TokenType.PROPERTY),
        Map.entry("middle", TokenType.PROPERTY),
        Map.entry("lower", TokenType.PROPERTY),
        Map.entry("width", TokenType.PROPERTY),
        Map.entry("k", TokenType.PROPERTY),
        Map.entry("d", TokenType.PROPERTY)
    );

    private final String source;
    private int position = 0;
    private int line = 1;
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Tokenize the source string
     */
    public List<Token> tokenize() {
        tokens.clear();
        position = 0;
        line = 1;

        while (position < source.length()) {
            skipWhitespace();

            if (position >= source.length()) {
                break;
            }

            char c = source.charAt(position);

            switch (c) {
                case '(' -> { addToken(TokenType.LPAREN, "("); position++; continue; }
                case ')' -> { addToken(TokenType.RPAREN, ")"); position++; continue; }
                case '[' -> { addToken(TokenType.LBRACKET, "["); position++; continue; }
                case ']' -> { addToken(TokenType.RBRACKET, "]"); position++; continue; }
                case ',' -> { addToken(TokenType.COMMA, ","); position++; continue; }
                case '.' -> { addToken(TokenType.DOT, "."); position++; continue; }
                case '*' -> { addToken(TokenType.MULTIPLY, "*"); position++; continue; }
                case '/' -> { addToken(TokenType.DIVIDE, "/"); position++; continue; }
                case '+' -> { addToken(TokenType.PLUS, "+"); position++; continue; }
                default -> { }
            }

            // Minus or negative number. A minus right after an operand is subtraction.
            if (c == '-') {
                if (position + 1 < source.length() && Character.isDigit(source.charAt(position + 1))
                        && !previousIsOperand()) {
                    readNumber();
                } else {
                    addToken(TokenType.MINUS, "-");
                    position++;
                }
                continue;
            }

            if (c == '>' || c == '<') {
                if (peek(1) == '=') {
                    addToken(TokenType.OPERATOR, c + "=");
                    position += 2;
                } else {
                    addToken(TokenType.OPERATOR, String.valueOf(c));
                    position++;
                }
                continue;
            }

            if (c == '=' && peek(1) == '=') {
                addToken(TokenType.OPERATOR, "==");
                position += 2;
                continue;
            }

            if (c == '@') {
                readTimeframe();
                continue;
            }

            if (Character.isDigit(c)) {
                readNumber();
                continue;
            }

            if (Character.isLetter(c) || c == '_') {
                readIdentifier();
                continue;
            }

            throw new LexerException("Unexpected character '" + c + "' at position " + position, position);
        }

        tokens.add(Token.eof(position));
        return tokens;
    }

    private void skipWhitespace() {
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == ' ' || c == '\t' || c == '\r') {
                position++;
            } else if (c == '\n') {
                line++;
                position++;
            } else {
                break;
            }
        }
    }

    private char peek(int offset) {
        int pos = position + offset;
        if (pos >= source.length()) {
            return '\0';
        }
        return source.charAt(pos);
    }

    private boolean previousIsOperand() {
        if (tokens.isEmpty()) {
            return false;
        }
        TokenType type = tokens.get(tokens.size() - 1).type();
        return type == TokenType.NUMBER || type == TokenType.RPAREN || type == TokenType.RBRACKET
            || type == TokenType.PRICE || type == TokenType.TICKER || type == TokenType.PROPERTY
            || type == TokenType.TIMEFRAME || type == TokenType.VOLUME_FUNC || type == TokenType.PATTERN_FUNC;
    }

    private void readNumber() {
        int start = position;
        boolean hasDecimal = false;

        if (source.charAt(position) == '-') {
            position++;
        }

        while (position < source.length()) {
            char c = source.charAt(position);
            if (Character.isDigit(c)) {
                position++;
            } else if (c == '.' && !hasDecimal && Character.isDigit(peek(1))) {
                hasDecimal = true;
                position++;
            } else {
                break;
            }
        }

        String value = source.substring(start, position);
        tokens.add(new Token(TokenType.NUMBER, value, start, line));
    }

    private void readTimeframe() {
        int start = position;
        position++; // skip '@'

        while (position < source.length() && Character.isLetterOrDigit(source.charAt(position))) {
            position++;
        }

        String interval = source.substring(start + 1, position);
        if (!Interval.isValid(interval)) {
            throw new LexerException("Invalid interval '@" + interval + "' at position " + start, start);
        }
        tokens.add(new Token(TokenType.TIMEFRAME, interval, start, line));
    }

    private void readIdentifier() {
        int start = position;

        while (position < source.length()) {
            char c = source.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_') {
                position++;
            } else {
                break;
            }
        }

        String value = source.substring(start, position);
        TokenType type = KEYWORDS.get(value);

        if (type == null) {
            throw new LexerException("Unknown identifier '" + value + "' at position " + start, start);
        }
        tokens.add(new Token(type, value, start, line));
    }

    private void addToken(TokenType type, String value) {
        tokens.add(new Token(type, value, position, line));
    }

    /**
     * Convenience function to tokenize a string
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    /**
     * Exception thrown when lexer encounters an error
     */
    public static class LexerException extends RuntimeException {
        private final int position;

        public LexerException(String message, int position) {
            super(message);
            this.position = position;
        }

        public int getPosition() {
            return position;
        }
    }
}
