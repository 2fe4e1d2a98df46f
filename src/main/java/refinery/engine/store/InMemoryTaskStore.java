package refinery.engine.store;

import refinery.engine.model.Task;
import refinery.engine.model.TaskCompleteResult;
import refinery.engine.model.TaskFailResult;
import refinery.engine.model.TaskStatus;
import refinery.engine.model.Worker;
import refinery.engine.model.WorkerStatus;
import refinery.engine.repository.TaskRepository;
import refinery.engine.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of the task and worker repositories.
 * One lock guards every task and worker record; a condition on that lock
 * is signalled whenever a task reaches a terminal state.
 */
public class InMemoryTaskStore implements TaskRepository, WorkerRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition terminalReached = stateLock.newCondition();

    // insertion order = submission order
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, Worker> workers = new TreeMap<>();

    private long lastAttempt;

    @Override
    public void saveAll(List<Task> batch) {
        stateLock.lock();
        try {
            for (Task task : batch) {
                tasks.remove(task.id());
                tasks.put(task.id(), task);
            }
            log.debug("Saved {} tasks", batch.size());
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        stateLock.lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public List<Task> findByIds(List<String> taskIds) {
        stateLock.lock();
        try {
            List<Task> found = new ArrayList<>(taskIds.size());
            for (String id : taskIds) {
                Task task = tasks.get(id);
                if (task != null) {
                    found.add(task);
                }
            }
            return found;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public List<Task> findAll() {
        stateLock.lock();
        try {
            return new ArrayList<>(tasks.values());
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public List<Task> findByStatus(TaskStatus status) {
        stateLock.lock();
        try {
            return tasks.values().stream().filter(t -> t.status() == status).toList();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        stateLock.lock();
        try {
            return (int) tasks.values().stream().filter(t -> t.status() == status).count();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public Optional<Task> claim(String taskId, String workerId) {
        stateLock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                log.warn("Worker {} popped unknown task {}", workerId, taskId);
                return Optional.empty();
            }
            if (!task.status().canTransitionTo(TaskStatus.RUNNING)) {
                log.debug("Task {} not claimable in status {}", taskId, task.status());
                return Optional.empty();
            }

            Task claimed = task.transitionTo(TaskStatus.RUNNING)
                    .assignedWorker(workerId)
                    .attempt(++lastAttempt)
                    .startedAt(Instant.now())
                    .completedAt(null)
                    .build();
            tasks.put(taskId, claimed);
            updateWorker(workerId, w -> w.withStatus(WorkerStatus.BUSY).assigned(taskId).heartbeat(Instant.now()));
            return Optional.of(claimed);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public TaskCompleteResult complete(String taskId, String workerId, long attempt) {
        stateLock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                return TaskCompleteResult.NOT_FOUND;
            }
            if (!owns(task, workerId, attempt)) {
                // Late result from a worker the stall detector gave up on
                return task.isTerminal() ? TaskCompleteResult.ALREADY_TERMINAL : TaskCompleteResult.NOT_OWNER;
            }

            tasks.put(taskId, task.transitionTo(TaskStatus.COMPLETED)
                    .errorMessage(null)
                    .completedAt(Instant.now())
                    .build());
            updateWorker(workerId, w -> w.countCompleted().released().withStatus(WorkerStatus.IDLE));
            terminalReached.signalAll();
            return TaskCompleteResult.COMPLETED;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public TaskFailResult fail(String taskId, String workerId, long attempt, String errorMessage,
            boolean retriable) {
        stateLock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                return TaskFailResult.NOT_FOUND;
            }
            if (!owns(task, workerId, attempt)) {
                return task.isTerminal() ? TaskFailResult.ALREADY_TERMINAL : TaskFailResult.NOT_OWNER;
            }

            TaskFailResult outcome = retryOrFail(task, errorMessage, retriable);
            updateWorker(workerId, w -> w.countFailed().released().withStatus(WorkerStatus.IDLE));
            return outcome;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public List<Task> findStuckRunning(Instant startedBefore) {
        stateLock.lock();
        try {
            return tasks.values().stream()
                    .filter(t -> t.status() == TaskStatus.RUNNING)
                    .filter(t -> t.startedAt() != null && t.startedAt().isBefore(startedBefore))
                    .sorted(Comparator.comparing(Task::startedAt))
                    .toList();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public TaskFailResult reapStuck(String taskId, Instant startedBefore, String reason, boolean retriable) {
        stateLock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                return TaskFailResult.NOT_FOUND;
            }
            if (task.isTerminal()) {
                return TaskFailResult.ALREADY_TERMINAL;
            }
            if (task.status() != TaskStatus.RUNNING || !task.startedAt().isBefore(startedBefore)) {
                return TaskFailResult.NOT_OWNER;
            }

            String owner = task.assignedWorker();
            TaskFailResult outcome = retryOrFail(task, reason, retriable);
            if (owner != null) {
                // Detach so the re-dispatched attempt is the only owner
                updateWorker(owner, w -> w.countFailed().released().withStatus(WorkerStatus.STALLED));
            }
            return outcome;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public boolean awaitTerminal(Collection<String> taskIds, Duration maxWait) throws InterruptedException {
        long remaining = maxWait.toNanos();
        stateLock.lock();
        try {
            while (!allTerminal(taskIds)) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = terminalReached.awaitNanos(remaining);
            }
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void clear() {
        stateLock.lock();
        try {
            tasks.clear();
            terminalReached.signalAll();
        } finally {
            stateLock.unlock();
        }
    }

    // ---- workers ----

    @Override
    public List<String> resetWorkers(int count) {
        stateLock.lock();
        try {
            workers.clear();
            List<String> ids = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                String id = String.format("worker-%02d", i);
                workers.put(id, Worker.idle(id));
                ids.add(id);
            }
            return ids;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void heartbeat(String workerId) {
        stateLock.lock();
        try {
            updateWorker(workerId, w -> w.heartbeat(Instant.now()));
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void markStopped(String workerId) {
        stateLock.lock();
        try {
            updateWorker(workerId, w -> w.released().withStatus(WorkerStatus.STOPPED));
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void markIdle(String workerId) {
        stateLock.lock();
        try {
            updateWorker(workerId, w -> w.released().withStatus(WorkerStatus.IDLE).heartbeat(Instant.now()));
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public Optional<Worker> findWorker(String workerId) {
        stateLock.lock();
        try {
            return Optional.ofNullable(workers.get(workerId));
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public List<Worker> findAllWorkers() {
        stateLock.lock();
        try {
            return new ArrayList<>(workers.values());
        } finally {
            stateLock.unlock();
        }
    }

    // ---- helpers (callers hold stateLock) ----

    private TaskFailResult retryOrFail(Task task, String errorMessage, boolean retriable) {
        if (retriable && task.canRetry()) {
            tasks.put(task.id(), task.transitionTo(TaskStatus.RETRYING)
                    .retryCount(task.retryCount() + 1)
                    .assignedWorker(null)
                    .errorMessage(errorMessage)
                    .build());
            return TaskFailResult.RETRIED;
        }

        tasks.put(task.id(), task.transitionTo(TaskStatus.FAILED)
                .errorMessage(errorMessage)
                .completedAt(Instant.now())
                .build());
        terminalReached.signalAll();
        return TaskFailResult.FAILED;
    }

    private static boolean owns(Task task, String workerId, long attempt) {
        return task.status() == TaskStatus.RUNNING
                && task.attempt() == attempt
                && workerId.equals(task.assignedWorker());
    }

    private boolean allTerminal(Collection<String> taskIds) {
        for (String id : taskIds) {
            Task task = tasks.get(id);
            if (task != null && !task.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    private void updateWorker(String workerId, UnaryOperator<Worker> change) {
        Worker worker = workers.get(workerId);
        if (worker == null) {
            log.warn("Unknown worker {}", workerId);
            return;
        }
        workers.put(workerId, change.apply(worker));
    }
}
