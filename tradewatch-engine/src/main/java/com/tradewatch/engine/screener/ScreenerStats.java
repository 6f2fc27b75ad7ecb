package com.tradewatch.engine.screener;

public record ScreenerStats(int workers, int activeTasks, long completedTasks, long abandonedTasks) {}
