package refinery.engine.optimizer;

import refinery.engine.harness.Harness;
import refinery.engine.harness.HarnessResult;
import refinery.engine.model.SessionContext;
import refinery.engine.model.SessionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives repeated harness batches over the same inputs, analyzing each one,
 * until a batch converges or the cycle limit is reached.
 */
public class OptimizationLoop<I, A> {

    private final Harness<I, A> harness;
    private final Optimizer optimizer;
    private final Logger log;

    public OptimizationLoop(Harness<I, A> harness, Optimizer optimizer) {
        this(harness, optimizer, LoggerFactory.getLogger(OptimizationLoop.class));
    }

    public OptimizationLoop(Harness<I, A> harness, Optimizer optimizer, Logger log) {
        this.harness = Objects.requireNonNull(harness, "harness is required");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer is required");
        this.log = log;
    }

    public OptimizationRun<A> run(List<I> inputs, int maxCycles) {
        return run(inputs, null, maxCycles);
    }

    /**
     * @throws IllegalArgumentException if {@code maxCycles < 1} or the contexts do not match the inputs
     */
    public OptimizationRun<A> run(List<I> inputs, List<SessionContext<A>> contexts, int maxCycles) {
        if (maxCycles < 1) {
            throw new IllegalArgumentException("maxCycles must be >= 1, got " + maxCycles);
        }

        List<HarnessResult<A>> batches = new ArrayList<>();
        List<OptimizationReport> reports = new ArrayList<>();

        for (int cycle = 1; cycle <= maxCycles; cycle++) {
            HarnessResult<A> batch = harness.runBatch(inputs, contexts);
            OptimizationReport report = optimizer.analyzeBatch(batch);
            batches.add(batch);
            reports.add(report);

            log.info("Cycle {}/{}: average {}, trend {}, {}", cycle, maxCycles,
                    String.format("%.3f", report.averageScore()), report.trend(), report.convergenceStatus());

            if (report.converged()) {
                log.info("Converged after {} cycles", cycle);
                break;
            }
        }

        List<List<SessionResult<A>>> history = new ArrayList<>();
        for (HarnessResult<A> batch : batches) {
            history.add(batch.results());
        }
        return new OptimizationRun<>(batches, reports, optimizer.analyzeTrends(history));
    }
}
