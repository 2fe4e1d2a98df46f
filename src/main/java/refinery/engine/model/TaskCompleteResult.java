package refinery.engine.model;

/**
 * Result of completing a task.
 */
public enum TaskCompleteResult {
    /** Task was successfully completed */
    COMPLETED,

    /** Task was already in a terminal state - idempotent success */
    ALREADY_TERMINAL,

    /** Task not found */
    NOT_FOUND,

    /**
     * Caller no longer owns the attempt (stall detector re-dispatched it);
     * the late result is discarded
     */
    NOT_OWNER
}
