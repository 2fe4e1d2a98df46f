package refinery.engine.optimizer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics over the optimizer's whole score history.
 */
public record HistorySummary(
        @JsonProperty("count") int count,
        @JsonProperty("mean") double mean,
        @JsonProperty("std") double std,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max,
        @JsonProperty("trend") Trend trend) {
}
