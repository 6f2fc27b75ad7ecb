package com.tradewatch.core.dsl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders AST nodes back to source text and answers structural questions about them.
 */
public final class ExpressionPrinter {

    private ExpressionPrinter() {}

    public static String print(AstNode node) {
        if (node instanceof AstNode.Comparison c) {
            return print(c.left()) + " " + c.operator() + " " + print(c.right());
        }
        if (node instanceof AstNode.CrossComparison c) {
            return print(c.left()) + " " + c.operator() + " " + print(c.right());
        }
        if (node instanceof AstNode.LogicalExpression l) {
            return wrap(l.left(), l) + " " + l.operator() + " " + wrap(l.right(), l);
        }
        if (node instanceof AstNode.NotExpression n) {
            return "NOT " + wrapOperand(n.expression());
        }
        if (node instanceof AstNode.ArithmeticExpression a) {
            return wrapOperand(a.left()) + " " + a.operator() + " " + wrapOperand(a.right());
        }
        if (node instanceof AstNode.IndicatorCall i) {
            return i.indicator() + "(" + params(i.params()) + ")";
        }
        if (node instanceof AstNode.PropertyAccess p) {
            return print(p.object()) + "." + p.property();
        }
        if (node instanceof AstNode.RangeFunctionCall r) {
            return r.func() + "(" + r.period() + ")";
        }
        if (node instanceof AstNode.VolumeFunctionCall v) {
            return v.period() == null ? v.func() : v.func() + "(" + v.period() + ")";
        }
        if (node instanceof AstNode.MathFunctionCall m) {
            return m.func() + "(" + m.args().stream().map(ExpressionPrinter::print)
                .collect(Collectors.joining(", ")) + ")";
        }
        if (node instanceof AstNode.CandlePatternCall p) {
            return p.func();
        }
        if (node instanceof AstNode.PriceReference p) {
            return p.field();
        }
        if (node instanceof AstNode.TickerReference t) {
            return t.field();
        }
        if (node instanceof AstNode.NumberLiteral n) {
            return number(n.value());
        }
        if (node instanceof AstNode.BooleanLiteral b) {
            return String.valueOf(b.value());
        }
        if (node instanceof AstNode.LookbackAccess l) {
            return wrapOperand(l.expression()) + "[" + l.barsAgo() + "]";
        }
        if (node instanceof AstNode.TimeframeScope t) {
            return wrapOperand(t.expression()) + "@" + t.interval();
        }
        throw new IllegalArgumentException("Unknown node type: " + node.getClass().getSimpleName());
    }

    /**
     * Top-level AND operands, left to right. A node that is not an AND yields itself.
     */
    public static List<AstNode> conjuncts(AstNode node) {
        List<AstNode> result = new ArrayList<>();
        collectConjuncts(node, result);
        return result;
    }

    /**
     * Every interval named with {@code @interval} anywhere in the expression.
     */
    public static Set<String> referencedIntervals(AstNode node) {
        Set<String> intervals = new LinkedHashSet<>();
        collectIntervals(node, intervals);
        return intervals;
    }

    private static void collectConjuncts(AstNode node, List<AstNode> out) {
        if (node instanceof AstNode.LogicalExpression l && "AND".equals(l.operator())) {
            collectConjuncts(l.left(), out);
            collectConjuncts(l.right(), out);
        } else {
            out.add(node);
        }
    }

    private static void collectIntervals(AstNode node, Set<String> out) {
        if (node instanceof AstNode.TimeframeScope t) {
            out.add(t.interval());
            collectIntervals(t.expression(), out);
        } else if (node instanceof AstNode.Comparison c) {
            collectIntervals(c.left(), out);
            collectIntervals(c.right(), out);
        } else if (node instanceof AstNode.CrossComparison c) {
            collectIntervals(c.left(), out);
            collectIntervals(c.right(), out);
        } else if (node instanceof AstNode.LogicalExpression l) {
            collectIntervals(l.left(), out);
            collectIntervals(l.right(), out);
        } else if (node instanceof AstNode.ArithmeticExpression a) {
            collectIntervals(a.left(), out);
            collectIntervals(a.right(), out);
        } else if (node instanceof AstNode.NotExpression n) {
            collectIntervals(n.expression(), out);
        } else if (node instanceof AstNode.LookbackAccess l) {
            collectIntervals(l.expression(), out);
        } else if (node instanceof AstNode.MathFunctionCall m) {
            m.args().forEach(a -> collectIntervals(a, out));
        }
    }

    private static String wrap(AstNode child, AstNode.LogicalExpression parent) {
        // OR inside AND needs parentheses to keep its meaning
        if (child instanceof AstNode.LogicalExpression l && !l.operator().equals(parent.operator())
                && "OR".equals(l.operator())) {
            return "(" + print(child) + ")";
        }
        return print(child);
    }

    private static String wrapOperand(AstNode node) {
        if (node instanceof AstNode.ArithmeticExpression || node instanceof AstNode.Comparison
                || node instanceof AstNode.CrossComparison || node instanceof AstNode.LogicalExpression) {
            return "(" + print(node) + ")";
        }
        return print(node);
    }

    private static String params(List<Double> params) {
        return params.stream().map(ExpressionPrinter::number).collect(Collectors.joining(", "));
    }

    private static String number(double value) {
        if (value == Math.floor(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
