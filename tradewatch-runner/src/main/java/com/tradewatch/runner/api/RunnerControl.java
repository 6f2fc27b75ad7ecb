package com.tradewatch.runner.api;

import com.tradewatch.runner.OrchestratorStatus;
import com.tradewatch.runner.health.HealthReport;
import com.tradewatch.runner.sync.StateSynchronizer;

/**
 * Operations the HTTP surface may invoke on the running system.
 */
public interface RunnerControl {

    OrchestratorStatus status();

    HealthReport health();

    void pause();

    void resume();

    StateSynchronizer.FlushResult flush();
}
