package com.tradewatch.runner.traders;

import com.tradewatch.core.model.Trader;

import java.io.IOException;
import java.util.List;

/**
 * Where trader definitions come from. Called at startup and on every reload.
 */
public interface TraderSource {

    /**
     * Load the current trader set, disabled traders included.
     *
     * @throws IOException if the source as a whole is unreachable; the caller keeps its last good set
     */
    List<Trader> loadTraders() throws IOException;

    String describe();
}
