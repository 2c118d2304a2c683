package io.tradeloop.runtime;

import io.tradeloop.config.SessionSettings;
import io.tradeloop.config.TradeLoopConfig;
import io.tradeloop.engine.PhaseSpec;
import io.tradeloop.engine.SessionOrchestrator;
import io.tradeloop.model.SessionEvent;
import io.tradeloop.model.SessionSummary;
import io.tradeloop.sim.SimulatedPipeline;
import io.tradeloop.store.EventSink;
import io.tradeloop.store.JsonSummaryStore;
import io.tradeloop.store.JsonlEventSink;
import io.tradeloop.store.SessionLogValidator;
import io.tradeloop.store.SummaryStore;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class TradeLoopRuntime {
    private final TradeLoopConfig config;
    private final SessionSettings settings;
    private final EventSink eventSink;
    private final SummaryStore summaryStore;

    public TradeLoopRuntime(TradeLoopConfig config) {
        this(config, SessionSettings.load(config.settingsFile()));
    }

    public TradeLoopRuntime(TradeLoopConfig config, SessionSettings settings) {
        this.config = config;
        this.settings = settings;
        this.eventSink = new JsonlEventSink(config.eventsFile());
        this.summaryStore = new JsonSummaryStore(config.summaryFile());
    }

    public void init() {
        try {
            Files.createDirectories(config.sessionDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize session directory: " + config.sessionDir(), e);
        }
    }

    public TradeLoopConfig config() {
        return config;
    }

    public SessionSettings settings() {
        return settings;
    }

    public SessionSummary run(List<PhaseSpec> phases, SessionSettings overrides) {
        SessionOrchestrator orchestrator = new SessionOrchestrator(
                eventSink,
                summaryStore,
                overrides == null ? settings : overrides
        );
        return orchestrator.run(phases);
    }

    public SessionSummary runSimulated(SimulatedRun request) {
        SimulatedPipeline pipeline = new SimulatedPipeline(request.workTime(), request.failPhase(), request.failTimes());
        SimulatedPipeline.Timeouts timeouts = request.totalDuration() == null
                ? SimulatedPipeline.Timeouts.defaults()
                : SimulatedPipeline.Timeouts.fromTotal(request.totalDuration());
        SessionSettings effective = request.heartbeatInterval() == null
                ? settings
                : settings.withHeartbeatInterval(request.heartbeatInterval());
        return run(pipeline.phases(timeouts), effective);
    }

    public List<SessionEvent> events(int tail, String type) throws IOException {
        if (type == null || type.isBlank()) {
            return eventSink.readTail(tail);
        }
        List<SessionEvent> filtered = new ArrayList<>();
        for (SessionEvent event : eventSink.readAll()) {
            if (type.trim().equalsIgnoreCase(event.type())) {
                filtered.add(event);
            }
        }
        if (tail > 0 && filtered.size() > tail) {
            return List.copyOf(filtered.subList(filtered.size() - tail, filtered.size()));
        }
        return filtered;
    }

    public Optional<SessionSummary> summary() {
        return summaryStore.read();
    }

    public SessionLogValidator.Report validate() {
        return SessionLogValidator.validate(config.eventsFile(), config.summaryFile());
    }

    public record SimulatedRun(
            Duration totalDuration,
            Duration heartbeatInterval,
            Duration workTime,
            String failPhase,
            int failTimes
    ) {
    }
}
