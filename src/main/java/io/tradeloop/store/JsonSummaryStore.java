package io.tradeloop.store;

import io.tradeloop.model.SessionSummary;
import io.tradeloop.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link SummaryStore} backed by a single JSON file, replaced through a temp
 * file and a rename.
 */
public final class JsonSummaryStore implements SummaryStore {
    private static final Logger log = LoggerFactory.getLogger(JsonSummaryStore.class);

    private final Path summaryFile;
    private final Path tempFile;

    public JsonSummaryStore(Path summaryFile) {
        this.summaryFile = summaryFile;
        this.tempFile = summaryFile.resolveSibling(summaryFile.getFileName() + ".tmp");
    }

    @Override
    public synchronized void write(SessionSummary summary) {
        try {
            replace(Jsons.toJson(summary));
        } catch (RuntimeException e) {
            log.warn("Summary for session {} not written: {}", summary.sessionId(), e.getMessage());
        }
    }

    @Override
    public synchronized Optional<SessionSummary> read() {
        if (!Files.exists(summaryFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().readValue(summaryFile.toFile(), SessionSummary.class));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Summary file {} unreadable: {}", summaryFile, e.getMessage());
            return Optional.empty();
        }
    }

    private void replace(String json) {
        try {
            Path parent = summaryFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(tempFile, json, StandardCharsets.UTF_8);
            try {
                Files.move(tempFile, summaryFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ignored) {
                Files.move(tempFile, summaryFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new SinkWriteException("Failed to replace summary " + summaryFile, e);
        }
    }
}
