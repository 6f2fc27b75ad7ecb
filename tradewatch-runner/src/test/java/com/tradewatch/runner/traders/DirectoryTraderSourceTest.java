package com.tradewatch.runner.traders;

import com.tradewatch.core.model.Trader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryTraderSourceTest {

    @TempDir
    Path dir;

    private DirectoryTraderSource source;

    @BeforeEach
    void setUp() {
        source = new DirectoryTraderSource(dir);
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(dir.resolve(name), content);
    }

    @Test
    @DisplayName("Reads every YAML trader with its fields")
    void readsTraders() throws IOException {
        write("rsi-oversold.yaml", """
            id: rsi-oversold
            name: RSI Oversold
            version: 3
            filterCode: RSI(14) < 30
            refreshInterval: 15m
            requiredTimeframes: [1h]
            maxSignalsPerRun: 5
            """);
        write("volume.yml", """
            filterCode: volume > AVG_VOLUME(20) * 2
            """);
        write("notes.txt", "not a trader");

        List<Trader> traders = source.loadTraders();

        assertEquals(2, traders.size());
        Trader rsi = traders.get(0);
        assertEquals("rsi-oversold", rsi.getId());
        assertEquals(3, rsi.getVersion());
        assertEquals("15m", rsi.primaryInterval());
        assertEquals(List.of("15m", "1h"), List.copyOf(rsi.allIntervals()));
        assertEquals(5, rsi.getMaxSignalsPerRun());

        Trader volume = traders.get(1);
        assertEquals("volume", volume.getId());
        assertEquals("volume", volume.getName());
        assertEquals("1m", volume.primaryInterval());
    }

    @Test
    @DisplayName("Broken files are skipped, the rest still load")
    void skipsBrokenFiles() throws IOException {
        write("a.yaml", "filterCode: close > 1\n");
        write("b.yaml", "filterCode: [unclosed\n");
        write("c.yaml", "name: no filter\n");
        write("d.yaml", "filterCode: close > 1\nrefreshInterval: 7x\n");

        List<Trader> traders = source.loadTraders();

        assertEquals(1, traders.size());
        assertEquals("a", traders.get(0).getId());
    }

    @Test
    @DisplayName("Unknown keys are tolerated")
    void ignoresUnknownKeys() throws IOException {
        write("a.yaml", "filterCode: close > 1\nauthor: someone\n");

        assertEquals(1, source.loadTraders().size());
    }

    @Test
    @DisplayName("Missing directory is an I/O failure")
    void missingDirectory() {
        DirectoryTraderSource missing = new DirectoryTraderSource(dir.resolve("nope"));

        assertThrows(IOException.class, missing::loadTraders);
    }
}
