package refinery.engine.optimizer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ScoreHistoryEntry(
        @JsonProperty("recordedAt") Instant recordedAt,
        @JsonProperty("score") double score) {
}
