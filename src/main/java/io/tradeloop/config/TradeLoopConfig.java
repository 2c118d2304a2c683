package io.tradeloop.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TradeLoopConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "tradeloop-settings.json";

    private final Path rootDir;

    public TradeLoopConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TradeLoopConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new TradeLoopConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path sessionDir() {
        return rootDir.resolve("session");
    }

    public Path eventsFile() {
        return sessionDir().resolve("events.jsonl");
    }

    public Path summaryFile() {
        return sessionDir().resolve("summary.json");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
