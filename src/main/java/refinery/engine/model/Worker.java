package refinery.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable snapshot of one worker slot. Stores replace the record on every change.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Worker(
        @JsonProperty("id") String id,
        @JsonProperty("status") WorkerStatus status,
        @JsonProperty("completedTasks") int completedTasks,
        @JsonProperty("failedTasks") int failedTasks,
        @JsonProperty("currentTask") String currentTask,
        @JsonProperty("lastHeartbeat") Instant lastHeartbeat) {

    public static Worker idle(String id) {
        return new Worker(id, WorkerStatus.IDLE, 0, 0, null, Instant.now());
    }

    public Worker withStatus(WorkerStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Worker " + id + ": illegal transition " + status + " -> " + next);
        }
        return new Worker(id, next, completedTasks, failedTasks, currentTask, lastHeartbeat);
    }

    public Worker assigned(String taskId) {
        return new Worker(id, status, completedTasks, failedTasks, taskId, lastHeartbeat);
    }

    public Worker released() {
        return new Worker(id, status, completedTasks, failedTasks, null, lastHeartbeat);
    }

    public Worker heartbeat(Instant at) {
        return new Worker(id, status, completedTasks, failedTasks, currentTask, at);
    }

    public Worker countCompleted() {
        return new Worker(id, status, completedTasks + 1, failedTasks, currentTask, lastHeartbeat);
    }

    public Worker countFailed() {
        return new Worker(id, status, completedTasks, failedTasks + 1, currentTask, lastHeartbeat);
    }
}
