package com.tradewatch.runner.sync;

import java.io.IOException;

/**
 * A batch could not be written. The synchronizer re-queues the batch and retries.
 */
public class SinkException extends IOException {

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
