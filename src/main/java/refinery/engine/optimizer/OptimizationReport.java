package refinery.engine.optimizer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import refinery.engine.core.Json;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of one batch or trend analysis.
 *
 * @param averageScore        batch mean (batch analysis) or latest batch mean (trend analysis)
 * @param sessionCount        sessions analyzed (batch) or batches analyzed (trend)
 * @param successfulSessions  sessions or batches that carried a score
 * @param improvementRate     change versus the previous batch, or the linear rate per batch; null without history
 * @param topWeakness         most frequent weakness tag, null if none was reported
 * @param convergenceEstimate cycles left to the convergence threshold at the current rate (trend analysis only)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OptimizationReport(
        @JsonProperty("averageScore") double averageScore,
        @JsonProperty("trend") Trend trend,
        @JsonProperty("convergenceStatus") ConvergenceStatus convergenceStatus,
        @JsonProperty("recommendations") List<String> recommendations,
        @JsonProperty("dimensionStats") Map<String, DimensionStats> dimensionStats,
        @JsonProperty("sessionCount") int sessionCount,
        @JsonProperty("successfulSessions") int successfulSessions,
        @JsonProperty("scoreStd") double scoreStd,
        @JsonProperty("bestScore") double bestScore,
        @JsonProperty("worstScore") double worstScore,
        @JsonProperty("improvementRate") Double improvementRate,
        @JsonProperty("topWeakness") String topWeakness,
        @JsonProperty("convergenceEstimate") Integer convergenceEstimate,
        @JsonProperty("analyzedAt") Instant analyzedAt) {

    public OptimizationReport {
        recommendations = List.copyOf(recommendations);
        dimensionStats = Collections.unmodifiableMap(new TreeMap<>(dimensionStats));
    }

    public boolean converged() {
        return convergenceStatus == ConvergenceStatus.CONVERGED;
    }

    public String toJson() {
        return Json.write(this);
    }
}
