package com.tradewatch.engine.sandbox;

/**
 * Strategy source that failed to compile.
 * The phase is "filter" or "series"; the position is a character offset into that source.
 */
public class CompileException extends RuntimeException {

    private final String phase;
    private final Integer position;

    public CompileException(String phase, String message, Integer position) {
        super(message);
        this.phase = phase;
        this.position = position;
    }

    public String getPhase() {
        return phase;
    }

    public Integer getPosition() {
        return position;
    }
}
