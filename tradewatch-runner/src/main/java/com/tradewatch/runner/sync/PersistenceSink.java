package com.tradewatch.runner.sync;

import java.util.List;

/**
 * Write side of the persistence collaborator. Each call writes one batch atomically from the
 * synchronizer's point of view: it either succeeds or the whole batch is retried.
 */
public interface PersistenceSink {

    void writeSignals(List<SignalRecord> signals) throws SinkException;

    void writeMetrics(List<MetricRecord> metrics) throws SinkException;

    void writeEvents(List<EventRecord> events) throws SinkException;

    void writeHeartbeat(HeartbeatRecord heartbeat) throws SinkException;

    /**
     * Short description for logs.
     */
    String describe();
}
