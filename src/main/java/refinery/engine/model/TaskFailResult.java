package refinery.engine.model;

/**
 * Result of failing a task.
 */
public enum TaskFailResult {
    /** Task failed and was put back for retry */
    RETRIED,

    /** Task failed permanently (max retries reached or not retriable) */
    FAILED,

    /** Task was already in a terminal state - idempotent success */
    ALREADY_TERMINAL,

    /** Task not found */
    NOT_FOUND,

    /** Caller no longer owns the attempt */
    NOT_OWNER
}
