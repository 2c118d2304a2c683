package io.tradeloop.sim;

import io.tradeloop.engine.PhaseContext;
import io.tradeloop.engine.PhaseFailureException;
import io.tradeloop.engine.PhaseSpec;
import io.tradeloop.model.PhaseResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stand-in for the trading application's data, strategy and API phases.
 *
 * <p>Each phase waits cooperatively for {@code workTime}, runs one
 * sub-operation through the retry helper and moves session equity the way a
 * dry run would. A phase can be told to fail its first N runs so recovery can
 * be exercised from the command line.
 */
public final class SimulatedPipeline {
    public static final String DATA_PHASE = "data_phase";
    public static final String STRATEGY_PHASE = "strategy_phase";
    public static final String API_PHASE = "api_phase";

    private final Duration workTime;
    private final String failPhase;
    private final int failTimes;
    private final Map<String, AtomicInteger> runs = new ConcurrentHashMap<>();

    public SimulatedPipeline(Duration workTime, String failPhase, int failTimes) {
        this.workTime = workTime == null || workTime.isNegative() ? Duration.ZERO : workTime;
        this.failPhase = failPhase == null || failPhase.isBlank() ? null : failPhase.trim();
        this.failTimes = Math.max(0, failTimes);
    }

    public List<PhaseSpec> phases(Timeouts timeouts) {
        return List.of(
                new PhaseSpec(DATA_PHASE, timeouts.data(), this::dataPhase),
                new PhaseSpec(STRATEGY_PHASE, timeouts.strategy(), this::strategyPhase),
                new PhaseSpec(API_PHASE, timeouts.api(), this::apiPhase)
        );
    }

    public int runs(String phase) {
        AtomicInteger counter = runs.get(phase);
        return counter == null ? 0 : counter.get();
    }

    private PhaseResult dataPhase(PhaseContext ctx) throws Exception {
        enter(ctx);
        ctx.pause(workTime);
        Integer records = ctx.retry("load_market_data", () -> 1000);
        ctx.session().updateEquity(ctx.session().initialCapital() + 50.0);
        return PhaseResult.ok("Data phase completed", Map.of("data_loaded", true, "records", records));
    }

    private PhaseResult strategyPhase(PhaseContext ctx) throws Exception {
        enter(ctx);
        ctx.pause(workTime);
        Integer tested = ctx.retry("evaluate_strategies", () -> 3);
        ctx.session().recordTrade(50.0);
        ctx.session().recordTrade(40.0);
        ctx.session().recordTrade(-15.0);
        return PhaseResult.ok("Strategy phase completed", Map.of("strategies_tested", tested, "strategies_passed", tested));
    }

    private PhaseResult apiPhase(PhaseContext ctx) throws Exception {
        enter(ctx);
        ctx.pause(workTime);
        Boolean reachable = ctx.retry("exchange_connectivity_check", () -> Boolean.TRUE);
        ctx.session().recordTrade(25.0);
        return PhaseResult.ok("API phase completed", Map.of("connectivity", reachable, "dry_run", true));
    }

    private void enter(PhaseContext ctx) throws PhaseFailureException {
        int run = runs.computeIfAbsent(ctx.phase(), ignored -> new AtomicInteger()).incrementAndGet();
        if (ctx.phase().equals(failPhase) && run <= failTimes) {
            throw new PhaseFailureException("simulated failure " + run + "/" + failTimes + " in " + ctx.phase());
        }
    }

    /**
     * Phase time limits. With a total duration the budget is split 40% data,
     * 40% strategy, 20% api; without one the limits are 2h, 2h and 1h.
     */
    public record Timeouts(Duration data, Duration strategy, Duration api) {
        public static Timeouts defaults() {
            return new Timeouts(Duration.ofHours(2), Duration.ofHours(2), Duration.ofHours(1));
        }

        public static Timeouts fromTotal(Duration total) {
            if (total == null || total.isZero() || total.isNegative()) {
                return defaults();
            }
            long ms = total.toMillis();
            return new Timeouts(
                    Duration.ofMillis(Math.max(1L, ms * 40L / 100L)),
                    Duration.ofMillis(Math.max(1L, ms * 40L / 100L)),
                    Duration.ofMillis(Math.max(1L, ms * 20L / 100L))
            );
        }
    }
}
