package com.tradewatch.engine.sandbox;

import com.tradewatch.core.dsl.AstNode;
import com.tradewatch.core.dsl.ExpressionPrinter;
import com.tradewatch.core.dsl.Parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiled series code.
 *
 * <pre>
 * # comment
 * rsi: RSI(14)
 * bands: BBANDS(20, 2).upper, BBANDS(20, 2).middle, BBANDS(20, 2).lower
 * </pre>
 *
 * Each line plots up to three expressions under a name.
 */
public final class SeriesProgram {

    public static final int MAX_EXPRESSIONS = 3;

    /**
     * One named line with 1-3 parsed expressions.
     */
    public record Line(String name, List<AstNode> expressions) {
        public Line {
            expressions = List.copyOf(expressions);
        }

        public List<String> sources() {
            return expressions.stream().map(ExpressionPrinter::print).toList();
        }
    }

    private final List<Line> lines;

    private SeriesProgram(List<Line> lines) {
        this.lines = List.copyOf(lines);
    }

    public List<Line> lines() {
        return lines;
    }

    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        lines.forEach(l -> names.add(l.name()));
        return names;
    }

    /**
     * Parse series code.
     *
     * @throws CompileException with a character offset into {@code code}
     */
    public static SeriesProgram compile(String code) {
        List<Line> lines = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Parser parser = new Parser();

        int offset = 0;
        for (String raw : code.split("\n", -1)) {
            int lineStart = offset;
            offset += raw.length() + 1;

            String text = stripComment(raw);
            if (text.isBlank()) {
                continue;
            }

            int colon = text.indexOf(':');
            if (colon < 0) {
                throw new CompileException("series", "Expected 'name: expression' but got '" + text.trim() + "'",
                    lineStart + leadingSpaces(text));
            }

            String name = text.substring(0, colon).trim();
            if (!isValidName(name)) {
                throw new CompileException("series", "Invalid series name '" + name + "'", lineStart + leadingSpaces(text));
            }
            if (!seen.add(name)) {
                throw new CompileException("series", "Duplicate series name '" + name + "'", lineStart + leadingSpaces(text));
            }

            List<AstNode> expressions = new ArrayList<>();
            int exprStart = colon + 1;
            for (String part : splitTopLevel(text.substring(exprStart))) {
                if (expressions.size() == MAX_EXPRESSIONS) {
                    throw new CompileException("series", "Series '" + name + "' has more than " +
                        MAX_EXPRESSIONS + " expressions", lineStart + exprStart);
                }
                Parser.ParseResult result = parser.parse(part);
                if (!result.success()) {
                    int pos = lineStart + exprStart + (result.errorPosition() != null ? result.errorPosition() : 0);
                    throw new CompileException("series", name + ": " + result.error(), pos);
                }
                expressions.add(result.ast());
                exprStart += part.length() + 1;
            }

            lines.add(new Line(name, expressions));
        }

        if (lines.isEmpty()) {
            throw new CompileException("series", "Series code defines no lines", 0);
        }
        return new SeriesProgram(lines);
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }

    private static int leadingSpaces(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isValidName(String name) {
        if (name.isEmpty() || !(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
            return false;
        }
        for (char c : name.toCharArray()) {
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    /**
     * Split on commas outside parentheses, so "BBANDS(20, 2).upper, SMA(20)" gives two parts.
     */
    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }
}
