package com.tradewatch.runner.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes every record as one JSON line to the {@code tradewatch.records} logger.
 * Used when no sink URL is configured.
 */
public class LoggingPersistenceSink implements PersistenceSink {

    private static final Logger records = LoggerFactory.getLogger("tradewatch.records");

    private final ObjectMapper mapper;

    public LoggingPersistenceSink(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void writeSignals(List<SignalRecord> signals) throws SinkException {
        writeAll("signal", signals);
    }

    @Override
    public void writeMetrics(List<MetricRecord> metrics) throws SinkException {
        writeAll("metric", metrics);
    }

    @Override
    public void writeEvents(List<EventRecord> events) throws SinkException {
        writeAll("event", events);
    }

    @Override
    public void writeHeartbeat(HeartbeatRecord heartbeat) throws SinkException {
        writeAll("heartbeat", List.of(heartbeat));
    }

    private void writeAll(String kind, List<?> items) throws SinkException {
        for (Object item : items) {
            try {
                String line = "{\"kind\":\"" + kind + "\",\"record\":" + mapper.writeValueAsString(item) + "}";
                records.info("{}", line);
            } catch (JsonProcessingException e) {
                throw new SinkException("Failed to encode " + kind + " record", e);
            }
        }
    }

    @Override
    public String describe() {
        return "log:tradewatch.records";
    }
}
