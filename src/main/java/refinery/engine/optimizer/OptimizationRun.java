package refinery.engine.optimizer;

import refinery.engine.harness.HarnessResult;

import java.util.List;

/**
 * Outcome of an {@link OptimizationLoop} run.
 *
 * @param batches     one harness result per cycle
 * @param reports     one batch report per cycle
 * @param trendReport trend analysis over all cycles
 */
public record OptimizationRun<A>(
        List<HarnessResult<A>> batches,
        List<OptimizationReport> reports,
        OptimizationReport trendReport) {

    public OptimizationRun {
        batches = List.copyOf(batches);
        reports = List.copyOf(reports);
    }

    public int cycles() {
        return reports.size();
    }

    public boolean converged() {
        return !reports.isEmpty() && reports.get(reports.size() - 1).converged();
    }

    public OptimizationReport lastReport() {
        return reports.isEmpty() ? null : reports.get(reports.size() - 1);
    }
}
