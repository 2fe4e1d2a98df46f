package refinery.engine.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Task execution status.
 * Legal transitions are listed in one table instead of being spread across callers.
 */
public enum TaskStatus {
    /** Task enqueued, waiting to be claimed */
    PENDING,
    /** Task claimed by a worker and being executed */
    RUNNING,
    /** Task failed or stalled and was put back on the queue */
    RETRYING,
    /** Task completed successfully */
    COMPLETED,
    /** Task failed permanently (retries exhausted or fault tolerance off) */
    FAILED;

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS = new EnumMap<>(TaskStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(RUNNING));
        TRANSITIONS.put(RUNNING, EnumSet.of(COMPLETED, RETRYING, FAILED));
        TRANSITIONS.put(RETRYING, EnumSet.of(RUNNING));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(TaskStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(TaskStatus.class));
    }

    public boolean canTransitionTo(TaskStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
