package refinery.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Evaluation of one artifact: an overall value in [0, 1], per-dimension values
 * and free-form feedback.
 */
public record Score(
        @JsonProperty("overall") double overall,
        @JsonProperty("dimensions") Map<String, Double> dimensions,
        @JsonProperty("strengths") List<String> strengths,
        @JsonProperty("weaknesses") List<String> weaknesses,
        @JsonProperty("recommendations") List<String> recommendations) {

    public Score {
        if (Double.isNaN(overall) || overall < 0.0 || overall > 1.0) {
            throw new IllegalArgumentException("overall score must be in [0, 1], got " + overall);
        }
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /** Score with no dimensions or feedback */
    public static Score of(double overall) {
        return new Score(overall, Map.of(), List.of(), List.of(), List.of());
    }

    /** First {@code n} recommendations, in the order the scorer gave them. */
    public List<String> topRecommendations(int n) {
        return recommendations.size() <= n ? recommendations : recommendations.subList(0, n);
    }
}
