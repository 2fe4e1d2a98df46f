package refinery.engine.optimizer;

import refinery.engine.config.OptimizerConfig;
import refinery.engine.core.Json;
import refinery.engine.harness.HarnessResult;
import refinery.engine.model.Score;
import refinery.engine.model.SessionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Meta-level analyzer of batch quality.
 *
 * <p>{@link #analyzeBatch} appends each batch's mean score to an append-only,
 * timestamped history and classifies the trend over the last
 * {@code windowSize} entries. {@link #analyzeTrends} classifies a list of
 * historical batches without touching that history.
 *
 * <p>Not thread-safe; one caller drives it.
 */
public class Optimizer {

    static final double HIGH_VARIANCE_STD = 0.15;
    static final double URGENT_BELOW = 0.4;
    static final double HIGH_SEVERITY_BELOW = 0.3;
    static final double HARDER_CASES_ABOVE = 0.8;
    static final double STRATEGY_CHANGE_BELOW = 0.8;

    private final OptimizerConfig config;
    private final Logger log;

    private final List<ScoreHistoryEntry> scoreHistory = new ArrayList<>();

    public Optimizer(OptimizerConfig config) {
        this(config, LoggerFactory.getLogger(Optimizer.class));
    }

    public Optimizer(OptimizerConfig config, Logger log) {
        this.config = Objects.requireNonNull(config, "config is required").validate();
        this.log = log;
    }

    public OptimizationReport analyzeBatch(HarnessResult<?> batch) {
        return analyzeBatch(batch.results());
    }

    /**
     * Analyze one batch of session results and record its mean score.
     * Empty batches and batches without a single scored session are reported but not recorded.
     */
    public OptimizationReport analyzeBatch(List<? extends SessionResult<?>> results) {
        Objects.requireNonNull(results, "results is required");
        long start = System.nanoTime();

        if (results.isEmpty()) {
            log.warn("No session results provided for batch analysis");
            OptimizationReport report = emptyReport(0, Trend.INSUFFICIENT_DATA, "Need more sessions to analyze");
            emitSummary(report, "insufficient_data", start);
            return report;
        }

        List<Double> scores = successfulScores(results);
        if (scores.isEmpty()) {
            log.warn("Batch of {} sessions has no scored session", results.size());
            OptimizationReport report = emptyReport(results.size(), Trend.NO_SCORES, "No valid scores found");
            emitSummary(report, "no_scores", start);
            return report;
        }

        double average = mean(scores);
        double std = std(scores, average);
        Double improvementRate = scoreHistory.isEmpty()
                ? null
                : average - scoreHistory.get(scoreHistory.size() - 1).score();

        record(average);
        Trend trend = trendOf(historyScores());

        Map<String, DimensionStats> dimensionStats = dimensionStats(results);
        String topWeakness = topWeakness(results);
        List<String> recommendations = batchRecommendations(average, scores.size(), std, dimensionStats, topWeakness);

        OptimizationReport report = new OptimizationReport(
                average,
                trend,
                convergenceStatus(average, trend),
                recommendations,
                dimensionStats,
                results.size(),
                scores.size(),
                std,
                Collections.max(scores),
                Collections.min(scores),
                improvementRate,
                topWeakness,
                null,
                Instant.now());

        log.info("Batch analysis complete: {} sessions, average {}, trend {}, {} recommendations",
                results.size(), String.format("%.3f", average), trend, recommendations.size());
        emitSummary(report, "ok", start);
        return report;
    }

    /**
     * Classify a list of historical batches: one mean per batch (batches without
     * a scored session are skipped), linear rate {@code (last - first) / count}.
     */
    public OptimizationReport analyzeTrends(List<? extends List<? extends SessionResult<?>>> batches) {
        Objects.requireNonNull(batches, "batches is required");
        List<Double> batchMeans = new ArrayList<>();
        List<SessionResult<?>> all = new ArrayList<>();
        for (List<? extends SessionResult<?>> batch : batches) {
            List<Double> scores = successfulScores(batch);
            if (!scores.isEmpty()) {
                batchMeans.add(mean(scores));
            }
            all.addAll(batch);
        }
        return analyzeTrendScores(batchMeans, batches.size(), dimensionStats(all), topWeakness(all));
    }

    /**
     * Trend analysis over already-computed batch means.
     */
    public OptimizationReport analyzeTrendScores(List<Double> batchMeans) {
        return analyzeTrendScores(batchMeans, batchMeans.size(), Map.of(), null);
    }

    private OptimizationReport analyzeTrendScores(List<Double> batchMeans,
            int batchCount,
            Map<String, DimensionStats> dimensionStats,
            String topWeakness) {
        if (batchMeans.size() < 2) {
            log.info("Insufficient batch history for trend analysis ({} batches)", batchMeans.size());
            double latest = batchMeans.isEmpty() ? 0.0 : batchMeans.get(0);
            return new OptimizationReport(latest, Trend.INSUFFICIENT_DATA, convergenceStatus(latest, Trend.INSUFFICIENT_DATA),
                    List.of("Need more batches to analyze trends"), dimensionStats, batchCount, batchMeans.size(),
                    0.0, latest, latest, null, topWeakness, null, Instant.now());
        }

        double first = batchMeans.get(0);
        double latest = batchMeans.get(batchMeans.size() - 1);
        double rate = (latest - first) / batchMeans.size();
        Trend trend = trendOf(batchMeans);

        Integer estimate = null;
        double target = config.convergenceThreshold();
        if (rate > 0 && latest < target) {
            estimate = (int) Math.ceil((target - latest) / rate);
        }

        List<String> recommendations = new ArrayList<>();
        switch (trend) {
            case DECLINING -> {
                recommendations.add("Consider reverting to previous configuration");
                recommendations.add("Reduce exploration between cycles");
            }
            case STABLE -> {
                if (latest < STRATEGY_CHANGE_BELOW) {
                    recommendations.add("Try different produce strategies");
                    recommendations.add("Increase diversity of inputs");
                }
            }
            case IMPROVING -> recommendations.add("Continue current optimization approach");
            default -> {
            }
        }

        double mean = mean(batchMeans);
        log.info("Trend analysis over {} batches: trend {}, rate {} per batch", batchMeans.size(), trend,
                String.format("%.4f", rate));
        return new OptimizationReport(
                latest,
                trend,
                convergenceStatus(latest, trend),
                recommendations,
                dimensionStats,
                batchCount,
                batchMeans.size(),
                std(batchMeans, mean),
                Collections.max(batchMeans),
                Collections.min(batchMeans),
                rate,
                topWeakness,
                estimate,
                Instant.now());
    }

    // ---- history ----

    /** Append-only, strictly increasing timestamps */
    public List<ScoreHistoryEntry> scoreHistory() {
        return List.copyOf(scoreHistory);
    }

    public HistorySummary historySummary() {
        List<Double> scores = historyScores();
        if (scores.isEmpty()) {
            return new HistorySummary(0, 0.0, 0.0, 0.0, 0.0, Trend.INSUFFICIENT_DATA);
        }
        double mean = mean(scores);
        return new HistorySummary(scores.size(), mean, std(scores, mean),
                Collections.min(scores), Collections.max(scores), trendOf(scores));
    }

    /**
     * Mean of the last {@code n} recorded scores, 0.0 without history.
     *
     * @throws IllegalArgumentException if {@code n < 1}
     */
    public double rollingAverage(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1, got " + n);
        }
        List<Double> scores = historyScores();
        if (scores.isEmpty()) {
            return 0.0;
        }
        return mean(scores.subList(Math.max(0, scores.size() - n), scores.size()));
    }

    public OptimizerConfig config() {
        return config;
    }

    private void record(double score) {
        Instant now = Instant.now();
        if (!scoreHistory.isEmpty()) {
            Instant last = scoreHistory.get(scoreHistory.size() - 1).recordedAt();
            if (!now.isAfter(last)) {
                now = last.plusNanos(1);
            }
        }
        scoreHistory.add(new ScoreHistoryEntry(now, score));
    }

    private List<Double> historyScores() {
        return scoreHistory.stream().map(ScoreHistoryEntry::score).toList();
    }

    // ---- classification ----

    /**
     * Compare first and last of the last {@code windowSize} values.
     */
    Trend trendOf(List<Double> values) {
        if (values.isEmpty()) {
            return Trend.INSUFFICIENT_DATA;
        }
        if (values.size() < 2) {
            return Trend.BASELINE;
        }
        List<Double> window = values.subList(Math.max(0, values.size() - config.windowSize()), values.size());
        double delta = window.get(window.size() - 1) - window.get(0);
        if (delta > config.minImprovementRate()) {
            return Trend.IMPROVING;
        }
        if (delta < -config.minImprovementRate()) {
            return Trend.DECLINING;
        }
        return Trend.STABLE;
    }

    ConvergenceStatus convergenceStatus(double average, Trend trend) {
        if (average >= config.convergenceThreshold()) {
            return ConvergenceStatus.CONVERGED;
        }
        if (trend == Trend.STABLE && average > config.nearConvergenceScore()) {
            return ConvergenceStatus.NEAR_CONVERGENCE;
        }
        return ConvergenceStatus.NOT_CONVERGED;
    }

    private List<String> batchRecommendations(double average,
            int scoredSessions,
            double std,
            Map<String, DimensionStats> dimensionStats,
            String topWeakness) {
        List<String> recommendations = new ArrayList<>();

        if (average < URGENT_BELOW) {
            recommendations.add(String.format(
                    "URGENT: average score %.2f is critically low - revisit the produce strategy", average));
        }

        dimensionStats.forEach((dimension, stats) -> {
            if (stats.mean() < config.dimensionThreshold()) {
                String severity = stats.mean() < HIGH_SEVERITY_BELOW ? "HIGH" : "MEDIUM";
                recommendations.add(String.format("[%s] Improve '%s' (average %.2f)", severity, dimension, stats.mean()));
            }
        });

        if (average > HARDER_CASES_ABOVE) {
            recommendations.add("Quality is high - add harder test cases");
        } else {
            recommendations.add("Continue refining the weakest dimensions");
        }

        if (scoredSessions > 1 && std > HIGH_VARIANCE_STD) {
            recommendations.add("High variance detected - stabilize the produce process");
        }

        if (topWeakness != null) {
            recommendations.add("Most common weakness: '" + topWeakness + "' - prioritise fixing it");
        }

        return recommendations;
    }

    // ---- aggregation ----

    private static List<Double> successfulScores(List<? extends SessionResult<?>> results) {
        List<Double> scores = new ArrayList<>();
        for (SessionResult<?> result : results) {
            if (result.success()) {
                scores.add(result.bestOverall());
            }
        }
        return scores;
    }

    private static Map<String, DimensionStats> dimensionStats(List<? extends SessionResult<?>> results) {
        Map<String, List<Double>> values = new TreeMap<>();
        for (SessionResult<?> result : results) {
            Score score = result.bestScore();
            if (score == null) {
                continue;
            }
            score.dimensions().forEach((dimension, value) ->
                    values.computeIfAbsent(dimension, k -> new ArrayList<>()).add(value));
        }

        Map<String, DimensionStats> stats = new TreeMap<>();
        values.forEach((dimension, list) -> stats.put(dimension, new DimensionStats(
                mean(list), Collections.min(list), Collections.max(list), list.size())));
        return stats;
    }

    /** Most frequent weakness tag; ties go to the one seen first */
    private static String topWeakness(List<? extends SessionResult<?>> results) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (SessionResult<?> result : results) {
            if (result.bestScore() != null) {
                result.bestScore().weaknesses().forEach(w -> counts.merge(w, 1, Integer::sum));
            }
        }
        String top = null;
        int topCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > topCount) {
                top = entry.getKey();
                topCount = entry.getValue();
            }
        }
        return top;
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return values.isEmpty() ? 0.0 : sum / values.size();
    }

    /** Population standard deviation */
    private static double std(List<Double> values, double mean) {
        if (values.size() < 2) {
            return 0.0;
        }
        double sq = 0.0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sq / values.size());
    }

    private OptimizationReport emptyReport(int sessions, Trend trend, String recommendation) {
        return new OptimizationReport(0.0, trend, ConvergenceStatus.NOT_CONVERGED, List.of(recommendation),
                Map.of(), sessions, 0, 0.0, 0.0, 0.0, null, null, null, Instant.now());
    }

    private void emitSummary(OptimizationReport report, String status, long startNanos) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("event", "optimizer.analyze_batch.summary");
        summary.put("session_count", report.sessionCount());
        summary.put("status", status);
        summary.put("average_score", Math.round(report.averageScore() * 1e6) / 1e6);
        summary.put("trend", report.trend().label());
        summary.put("recommendation_count", report.recommendations().size());
        summary.put("duration_ms", Math.round((System.nanoTime() - startNanos) / 1e3) / 1e3);
        log.info("{}", Json.write(summary));
    }
}
