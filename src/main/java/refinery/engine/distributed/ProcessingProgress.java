package refinery.engine.distributed;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time progress of the current (or last) run.
 * {@code pending} includes tasks waiting for a retry.
 */
public record ProcessingProgress(
        @JsonProperty("total") int total,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("running") int running,
        @JsonProperty("pending") int pending,
        @JsonProperty("percentComplete") double percentComplete) {

    public boolean isDone() {
        return completed + failed == total;
    }
}
