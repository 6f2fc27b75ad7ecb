package com.tradewatch.runner.traders;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tradewatch.core.model.Interval;
import com.tradewatch.core.model.Trader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads one trader per YAML file from a directory.
 *
 * Layout:
 * <pre>
 * ~/.tradewatch/traders/
 * ├── rsi-oversold.yaml
 * └── volume-spike.yml
 * </pre>
 * A file without an {@code id} uses its file name. Unreadable or invalid files are logged and
 * skipped so one bad file does not take down the rest.
 */
public class DirectoryTraderSource implements TraderSource {

    private static final Logger log = LoggerFactory.getLogger(DirectoryTraderSource.class);

    private final Path directory;
    private final ObjectMapper yaml;

    public DirectoryTraderSource(Path directory) {
        this.directory = directory;
        this.yaml = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<Trader> loadTraders() throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Trader directory not found: " + directory);
        }

        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                .filter(Files::isRegularFile)
                .filter(p -> isYaml(p.getFileName().toString()))
                .sorted()
                .collect(Collectors.toList());
        }

        Map<String, Trader> traders = new LinkedHashMap<>();
        for (Path file : files) {
            Trader trader = readTrader(file);
            if (trader == null) {
                continue;
            }
            Trader previous = traders.put(trader.getId(), trader);
            if (previous != null) {
                log.warn("Duplicate trader id '{}' in {}, replacing earlier definition", trader.getId(), file.getFileName());
            }
        }
        log.debug("Loaded {} traders from {}", traders.size(), directory);
        return new ArrayList<>(traders.values());
    }

    private Trader readTrader(Path file) {
        Trader trader;
        try {
            trader = yaml.readValue(file.toFile(), Trader.class);
        } catch (IOException e) {
            log.warn("Skipping trader file {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
        if (trader == null) {
            log.warn("Skipping empty trader file {}", file.getFileName());
            return null;
        }
        if (trader.getId() == null || trader.getId().isBlank()) {
            trader.setId(stem(file.getFileName().toString()));
        }
        if (trader.getName() == null || trader.getName().isBlank()) {
            trader.setName(trader.getId());
        }
        String problem = problem(trader);
        if (problem != null) {
            log.warn("Skipping trader file {}: {}", file.getFileName(), problem);
            return null;
        }
        return trader;
    }

    /**
     * Structural problems that make a trader unusable before compilation, or null.
     */
    static String problem(Trader trader) {
        if (trader.getFilterCode() == null || trader.getFilterCode().isBlank()) {
            return "filterCode is required";
        }
        for (String interval : trader.allIntervals()) {
            if (!Interval.isValid(interval)) {
                return "unsupported interval '" + interval + "'";
            }
        }
        if (trader.getMaxSignalsPerRun() < 0) {
            return "maxSignalsPerRun must not be negative";
        }
        return null;
    }

    private static boolean isYaml(String name) {
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public String describe() {
        return "directory " + directory;
    }
}
