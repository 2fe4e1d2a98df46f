package refinery.engine.optimizer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate of one scoring dimension across a batch.
 */
public record DimensionStats(
        @JsonProperty("mean") double mean,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max,
        @JsonProperty("count") int count) {
}
