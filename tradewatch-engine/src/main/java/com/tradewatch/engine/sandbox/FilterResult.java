package com.tradewatch.engine.sandbox;

import java.util.List;

/**
 * Filter verdict with the matched conditions rendered as text (empty when not matched).
 */
public record FilterResult(boolean matched, List<String> reasoning) {

    public FilterResult {
        reasoning = List.copyOf(reasoning);
    }

    public static FilterResult noMatch() {
        return new FilterResult(false, List.of());
    }
}
