package refinery.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable model of one unit of fan-out work.
 * Stores swap in a new instance (via {@link #toBuilder()}) for every state change.
 */
public final class Task {
    private final String id;
    private final int index; // position in the submitted item list
    private final TaskStatus status;
    private final String assignedWorker; // worker ID or null
    private final long attempt; // claim token, 0 until first claimed
    private final int retryCount;
    private final int maxRetries;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.index = builder.index;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.assignedWorker = builder.assignedWorker;
        this.attempt = builder.attempt;
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.errorMessage = builder.errorMessage;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        if (retryCount > maxRetries) {
            throw new IllegalStateException(
                    "Task " + id + ": retryCount " + retryCount + " exceeds maxRetries " + maxRetries);
        }
    }

    // Getters
    public String id() {
        return id;
    }

    public int index() {
        return index;
    }

    public TaskStatus status() {
        return status;
    }

    public String assignedWorker() {
        return assignedWorker;
    }

    /** Token of the claim that last moved this task to RUNNING */
    public long attempt() {
        return attempt;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    /** Check if task can be retried */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Runtime of the last attempt, if it has finished */
    public Duration runtime() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }

    /**
     * Builder seeded with this task, moved to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public Builder transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Task " + id + ": illegal transition " + status + " -> " + next);
        }
        return toBuilder().status(next);
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .index(index)
                .status(status)
                .assignedWorker(assignedWorker)
                .attempt(attempt)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private int index;
        private TaskStatus status = TaskStatus.PENDING;
        private String assignedWorker;
        private long attempt;
        private int retryCount = 0;
        private int maxRetries = 3;
        private String errorMessage;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder assignedWorker(String assignedWorker) {
            this.assignedWorker = assignedWorker;
            return this;
        }

        public Builder attempt(long attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", assignedWorker='" + assignedWorker +
                "', attempt=" + attempt + ", retries=" + retryCount + "/" + maxRetries + "}";
    }
}
