package io.tradeloop.cli;

import io.tradeloop.config.TradeLoopConfig;
import io.tradeloop.model.SessionEvent;
import io.tradeloop.model.SessionStatus;
import io.tradeloop.model.SessionSummary;
import io.tradeloop.runtime.TradeLoopRuntime;
import io.tradeloop.store.SessionLogValidator;
import io.tradeloop.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "tradeloop",
        mixinStandardHelpOptions = true,
        description = "TradeLoop session orchestrator CLI",
        subcommands = {
                TradeLoopCommand.RunCommand.class,
                TradeLoopCommand.EventsCommand.class,
                TradeLoopCommand.SummaryCommand.class,
                TradeLoopCommand.ValidateCommand.class
        }
)
public final class TradeLoopCommand implements Runnable {
    @Option(names = {"--root"}, description = "Session data root directory", defaultValue = TradeLoopConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | events | summary | validate");
    }

    TradeLoopRuntime runtime() {
        return new TradeLoopRuntime(TradeLoopConfig.fromRoot(root));
    }

    @Command(name = "run", description = "Run the simulated data -> strategy -> api session")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        TradeLoopCommand parent;

        @Option(names = {"--duration"}, description = "Total time budget in seconds, split 40/40/20 across phases")
        Long durationSeconds;

        @Option(names = {"--heartbeat"}, description = "Heartbeat interval in seconds (overrides settings)")
        Long heartbeatSeconds;

        @Option(names = {"--work-ms"}, defaultValue = "2000", description = "Simulated work per phase in milliseconds")
        long workMs;

        @Option(names = {"--fail-phase"}, description = "Phase that fails its first runs")
        String failPhase;

        @Option(names = {"--fail-times"}, defaultValue = "0", description = "How many runs of --fail-phase fail")
        int failTimes;

        @Override
        public Integer call() {
            TradeLoopRuntime runtime = parent.runtime();
            runtime.init();
            TradeLoopRuntime.SimulatedRun request = new TradeLoopRuntime.SimulatedRun(
                    durationSeconds == null ? null : Duration.ofSeconds(durationSeconds),
                    heartbeatSeconds == null ? null : Duration.ofSeconds(Math.max(1L, heartbeatSeconds)),
                    Duration.ofMillis(Math.max(0L, workMs)),
                    failPhase,
                    failTimes
            );
            SessionSummary summary = runtime.runSimulated(request);
            System.out.println(Jsons.toJson(summary));
            return summary.status() == SessionStatus.SUCCESS ? 0 : 1;
        }
    }

    @Command(name = "events", description = "Print session events from the event log")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        TradeLoopCommand parent;

        @Option(names = {"--tail"}, defaultValue = "0", description = "Only the latest N events (0 = all)")
        int tail;

        @Option(names = {"--type"}, description = "Filter by event type, e.g. heartbeat")
        String type;

        @Override
        public Integer call() {
            TradeLoopRuntime runtime = parent.runtime();
            List<SessionEvent> events;
            try {
                events = runtime.events(tail, type);
            } catch (IOException e) {
                System.err.println("Failed to read events: " + e.getMessage());
                return 1;
            }
            for (SessionEvent event : events) {
                System.out.println(Jsons.toCompactJson(event));
            }
            return 0;
        }
    }

    @Command(name = "summary", description = "Print the current session summary")
    static final class SummaryCommand implements Callable<Integer> {
        @ParentCommand
        TradeLoopCommand parent;

        @Override
        public Integer call() {
            Optional<SessionSummary> summary = parent.runtime().summary();
            if (summary.isEmpty()) {
                System.err.println("No summary found under: " + TradeLoopConfig.fromRoot(parent.root).summaryFile());
                return 1;
            }
            System.out.println(Jsons.toJson(summary.get()));
            return 0;
        }
    }

    @Command(name = "validate", description = "Validate the event log and summary file")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        TradeLoopCommand parent;

        @Override
        public Integer call() {
            SessionLogValidator.Report report = parent.runtime().validate();
            System.out.println(Jsons.toJson(report));
            return report.passed() ? 0 : 1;
        }
    }
}
