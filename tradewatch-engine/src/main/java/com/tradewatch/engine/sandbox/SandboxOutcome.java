package com.tradewatch.engine.sandbox;

import java.time.Duration;

/**
 * Result of running strategy code in the sandbox. No exception from strategy code
 * reaches the caller; every failure is one of these variants.
 */
public sealed interface SandboxOutcome<T> {

    record Success<T>(T value) implements SandboxOutcome<T> {}

    /**
     * Source rejected by the lexer or parser.
     * @param phase    "filter" or "series"
     * @param position character offset into that source, null if unknown
     */
    record CompileFailure<T>(String phase, String message, Integer position) implements SandboxOutcome<T> {}

    record RuntimeFailure<T>(String message) implements SandboxOutcome<T> {}

    record TimedOut<T>(Duration elapsed) implements SandboxOutcome<T> {}

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Short label for logs and API responses.
     */
    default String kind() {
        if (this instanceof Success) {
            return "success";
        }
        if (this instanceof CompileFailure) {
            return "compile_error";
        }
        if (this instanceof RuntimeFailure) {
            return "runtime_error";
        }
        return "timeout";
    }

    /**
     * Same failure retyped for another value type. Must not be called on Success.
     */
    default <U> SandboxOutcome<U> retype() {
        if (this instanceof CompileFailure<T> c) {
            return new CompileFailure<>(c.phase(), c.message(), c.position());
        }
        if (this instanceof RuntimeFailure<T> r) {
            return new RuntimeFailure<>(r.message());
        }
        if (this instanceof TimedOut<T> t) {
            return new TimedOut<>(t.elapsed());
        }
        throw new IllegalStateException("Success cannot be retyped");
    }
}
