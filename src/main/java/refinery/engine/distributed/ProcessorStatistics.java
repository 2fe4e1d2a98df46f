package refinery.engine.distributed;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import refinery.engine.core.Json;
import refinery.engine.model.Worker;

import java.time.Duration;
import java.util.List;

/**
 * Task counts by status plus per-worker snapshots.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessorStatistics(
        @JsonProperty("totalTasks") int totalTasks,
        @JsonProperty("pendingTasks") int pendingTasks,
        @JsonProperty("runningTasks") int runningTasks,
        @JsonProperty("retryingTasks") int retryingTasks,
        @JsonProperty("completedTasks") int completedTasks,
        @JsonProperty("failedTasks") int failedTasks,
        @JsonProperty("totalRetries") int totalRetries,
        @JsonProperty("averageTaskRuntime") Duration averageTaskRuntime,
        @JsonProperty("workers") List<Worker> workers) {

    public ProcessorStatistics {
        workers = List.copyOf(workers);
    }

    public String toJson() {
        return Json.write(this);
    }
}
