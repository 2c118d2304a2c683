package io.tradeloop.store;

import io.tradeloop.model.SessionEvent;
import io.tradeloop.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link EventSink} writing one compact JSON object per line.
 *
 * <p>All appends go through the instance monitor, so the orchestrator thread
 * and the heartbeat thread never interleave partial lines.
 */
public final class JsonlEventSink implements EventSink {
    private static final Logger log = LoggerFactory.getLogger(JsonlEventSink.class);

    private final Path eventsFile;
    private long failedWrites;
    private long skippedLines;

    public JsonlEventSink(Path eventsFile) {
        this.eventsFile = eventsFile;
        try {
            Path parent = eventsFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(eventsFile)) {
                try {
                    Files.createFile(eventsFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another writer created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            log.warn("Event log {} could not be prepared, appends will be retried per event: {}", eventsFile, e.getMessage());
        }
    }

    @Override
    public synchronized void append(SessionEvent event) {
        try {
            writeLine(Jsons.toCompactJson(event));
        } catch (RuntimeException e) {
            failedWrites++;
            log.warn("Dropped {} event for session {} ({} failed writes so far): {}",
                    event.type(), event.sessionId(), failedWrites, e.getMessage());
        }
    }

    @Override
    public synchronized List<SessionEvent> readAll() throws IOException {
        if (!Files.exists(eventsFile)) {
            return List.of();
        }
        List<SessionEvent> events = new ArrayList<>();
        for (String line : Files.readAllLines(eventsFile, StandardCharsets.UTF_8)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                events.add(Jsons.mapper().readValue(line, SessionEvent.class));
            } catch (IOException | IllegalArgumentException e) {
                skippedLines++;
            }
        }
        return events;
    }

    @Override
    public synchronized long failedWrites() {
        return failedWrites;
    }

    public synchronized long skippedLines() {
        return skippedLines;
    }

    private void writeLine(String json) {
        try {
            Files.writeString(eventsFile, json + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new SinkWriteException("Failed to append to event log " + eventsFile, e);
        }
    }
}
