package refinery.engine.repository;

import refinery.engine.model.Task;
import refinery.engine.model.TaskCompleteResult;
import refinery.engine.model.TaskFailResult;
import refinery.engine.model.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Task state.
 * Every transition that touches a task also updates the owning worker record,
 * atomically with respect to all other transitions.
 */
public interface TaskRepository {

    /**
     * Save tasks, replacing any task with the same ID.
     *
     * @param tasks the tasks to save
     */
    void saveAll(List<Task> tasks);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Find tasks in the order of the given IDs, skipping unknown IDs.
     */
    List<Task> findByIds(List<String> taskIds);

    /**
     * All tasks, in submission order.
     */
    List<Task> findAll();

    /**
     * Find tasks by status.
     */
    List<Task> findByStatus(TaskStatus status);

    /**
     * Claim a queued task for a worker.
     * Moves the task from PENDING or RETRYING to RUNNING, marks the worker BUSY
     * and stamps the task with a fresh {@link Task#attempt() attempt} token.
     * Tokens are never reused by the same repository, across runs or clears.
     *
     * @param taskId   the task popped from the queue
     * @param workerId the claiming worker
     * @return the claimed task, or empty if the task is unknown or not claimable
     */
    Optional<Task> claim(String taskId, String workerId);

    /**
     * Complete a task successfully.
     * Only succeeds if the task is RUNNING under the given worker and attempt.
     * A rejected call leaves the worker record untouched.
     */
    TaskCompleteResult complete(String taskId, String workerId, long attempt);

    /**
     * Report a failed attempt.
     * If retriable and retryCount < maxRetries, moves to RETRYING (caller re-enqueues).
     * Otherwise, marks as FAILED.
     * Same ownership rule as {@link #complete}.
     */
    TaskFailResult fail(String taskId, String workerId, long attempt, String errorMessage, boolean retriable);

    /**
     * Find tasks that have been RUNNING since before the given instant.
     *
     * @param startedBefore tasks started before this timestamp are considered stuck
     * @return list of stuck tasks
     */
    List<Task> findStuckRunning(Instant startedBefore);

    /**
     * Take a stuck task away from its worker and apply the retry-or-fail decision.
     * Re-checks under the state lock that the task is still RUNNING and started before the cutoff.
     *
     * @return RETRIED or FAILED if reaped, ALREADY_TERMINAL / NOT_OWNER if it moved on meanwhile
     */
    TaskFailResult reapStuck(String taskId, Instant startedBefore, String reason, boolean retriable);

    /**
     * Block until every listed task is terminal or the wait elapses.
     *
     * @return true if all tasks are terminal
     */
    boolean awaitTerminal(Collection<String> taskIds, Duration maxWait) throws InterruptedException;

    /**
     * Count tasks by status.
     */
    int countByStatus(TaskStatus status);

    /**
     * Drop every task.
     */
    void clear();
}
