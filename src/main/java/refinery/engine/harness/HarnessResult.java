package refinery.engine.harness;

import refinery.engine.model.SessionResult;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of one {@code runBatch} call.
 * Score and round statistics cover successful sessions only and are 0 when there are none.
 *
 * @param results one result per input, in input order
 */
public record HarnessResult<A>(
        List<SessionResult<A>> results,
        int totalSessions,
        int successfulSessions,
        int failedSessions,
        int convergedSessions,
        double averageScore,
        double bestScore,
        double worstScore,
        double convergenceRate,
        double averageRounds,
        int minRounds,
        int maxRounds,
        Map<String, Double> dimensionAverages,
        Duration elapsed) {

    public HarnessResult {
        results = List.copyOf(results);
        dimensionAverages = Collections.unmodifiableMap(new TreeMap<>(dimensionAverages));
    }

    /**
     * Aggregate a list of session results.
     */
    public static <A> HarnessResult<A> of(List<SessionResult<A>> results, Duration elapsed) {
        int successful = 0;
        int converged = 0;
        double scoreSum = 0.0;
        double best = 0.0;
        double worst = 0.0;
        long roundSum = 0;
        int minRounds = 0;
        int maxRounds = 0;
        Map<String, Double> dimensionSums = new TreeMap<>();
        Map<String, Integer> dimensionCounts = new TreeMap<>();

        for (SessionResult<A> result : results) {
            if (result.converged()) {
                converged++;
            }
            if (!result.success()) {
                continue;
            }

            double score = result.bestOverall();
            int rounds = result.roundCount();
            if (successful == 0) {
                best = score;
                worst = score;
                minRounds = rounds;
                maxRounds = rounds;
            } else {
                best = Math.max(best, score);
                worst = Math.min(worst, score);
                minRounds = Math.min(minRounds, rounds);
                maxRounds = Math.max(maxRounds, rounds);
            }
            successful++;
            scoreSum += score;
            roundSum += rounds;

            result.bestScore().dimensions().forEach((dimension, value) -> {
                dimensionSums.merge(dimension, value, Double::sum);
                dimensionCounts.merge(dimension, 1, Integer::sum);
            });
        }

        Map<String, Double> dimensionAverages = new TreeMap<>();
        dimensionSums.forEach((dimension, sum) -> dimensionAverages.put(dimension, sum / dimensionCounts.get(dimension)));

        int total = results.size();
        return new HarnessResult<>(
                results,
                total,
                successful,
                total - successful,
                converged,
                successful == 0 ? 0.0 : scoreSum / successful,
                best,
                worst,
                total == 0 ? 0.0 : (double) converged / total,
                successful == 0 ? 0.0 : (double) roundSum / successful,
                minRounds,
                maxRounds,
                dimensionAverages,
                elapsed);
    }

    public String summary() {
        return String.format(
                "%d sessions: %d successful, %d failed, %d converged (%.0f%%); score avg %.3f best %.3f worst %.3f; "
                        + "rounds avg %.1f [%d..%d]; %dms",
                totalSessions, successfulSessions, failedSessions, convergedSessions, convergenceRate * 100,
                averageScore, bestScore, worstScore, averageRounds, minRounds, maxRounds, elapsed.toMillis());
    }
}
