package com.tradewatch.engine.signal;

/**
 * How a positive match relates to the previous signal of the same trader and symbol.
 */
public enum Classification {
    /** First match, or the dedupe window has passed: emit a signal. */
    NEW,
    /** Still inside the dedupe window: count it, emit nothing. */
    CONTINUING
}
