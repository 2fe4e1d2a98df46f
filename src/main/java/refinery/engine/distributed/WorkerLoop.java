package refinery.engine.distributed;

import refinery.engine.config.ProcessorConfig;
import refinery.engine.model.Task;
import refinery.engine.model.TaskCompleteResult;
import refinery.engine.model.TaskFailResult;
import refinery.engine.repository.TaskRepository;
import refinery.engine.repository.WorkerRepository;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * A single worker slot.
 * Loops: heartbeat → pop task ID → claim → run → complete/fail.
 * Stops when {@link #shutdown()} is called or the thread is interrupted.
 *
 * <p>Once the store rejects one of its reports, the loop has lost its slot
 * (the stall detector handed the task to a fresh attempt) and exits without
 * touching the worker record again.
 */
final class WorkerLoop<T, R> implements Runnable {

    private final String workerId;
    private final BlockingQueue<String> queue;
    private final TaskRepository taskRepository;
    private final WorkerRepository workerRepository;
    private final List<T> items;
    private final Function<? super T, ? extends R> processFn;
    private final Map<Long, R> outputs;
    private final ProcessorConfig config;
    private final Runnable onTerminal;
    private final Logger log;

    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile boolean shutdown;
    private volatile boolean detached;

    WorkerLoop(String workerId,
            BlockingQueue<String> queue,
            TaskRepository taskRepository,
            WorkerRepository workerRepository,
            List<T> items,
            Function<? super T, ? extends R> processFn,
            Map<Long, R> outputs,
            ProcessorConfig config,
            Runnable onTerminal,
            Logger log) {
        this.workerId = workerId;
        this.queue = queue;
        this.taskRepository = taskRepository;
        this.workerRepository = workerRepository;
        this.items = items;
        this.processFn = processFn;
        this.outputs = outputs;
        this.config = config;
        this.onTerminal = onTerminal;
        this.log = log;
    }

    void shutdown() {
        shutdown = true;
    }

    /**
     * Give up the slot: the loop exits as soon as its current call returns.
     */
    void detach() {
        detached = true;
        shutdown = true;
    }

    boolean isDetached() {
        return detached;
    }

    String workerId() {
        return workerId;
    }

    boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    @Override
    public void run() {
        Thread.currentThread().setName("refinery-" + workerId);
        try {
            loop();
        } finally {
            stopped.countDown();
        }
    }

    private void loop() {
        if (detached) {
            return;
        }
        workerRepository.markIdle(workerId);
        log.debug("Worker {} started", workerId);

        long pollMs = Math.max(1, config.heartbeatInterval().toMillis());

        while (!shutdown && !detached && !Thread.currentThread().isInterrupted()) {
            try {
                workerRepository.heartbeat(workerId);

                // 1. Pop a task ID (bounded so the shutdown flag is observed)
                String taskId = queue.poll(pollMs, TimeUnit.MILLISECONDS);
                if (taskId == null) {
                    continue;
                }
                if (detached) {
                    queue.offer(taskId);
                    break;
                }

                // 2. Take ownership
                Optional<Task> claimed = taskRepository.claim(taskId, workerId);
                if (claimed.isEmpty()) {
                    continue;
                }

                // 3. Run outside the state lock
                execute(claimed.get());

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        if (detached) {
            log.debug("Worker {} loop exited after losing its slot", workerId);
            return;
        }
        workerRepository.markStopped(workerId);
        log.debug("Worker {} stopped", workerId);
    }

    private void execute(Task task) {
        R result;
        try {
            result = processFn.apply(items.get(task.index()));
        } catch (Exception e) {
            handleFailure(task, e);
            return;
        }

        // Keyed by attempt, so only the accepted attempt's output is ever read
        outputs.put(task.attempt(), result);
        TaskCompleteResult res = taskRepository.complete(task.id(), workerId, task.attempt());
        if (res == TaskCompleteResult.COMPLETED) {
            log.debug("Worker {} completed task {}", workerId, task.id());
            onTerminal.run();
        } else {
            outputs.remove(task.attempt());
            detached = true;
            log.info("Worker {} result for task {} discarded: {}", workerId, task.id(), res);
        }
    }

    private void handleFailure(Task task, Exception error) {
        String message = error.getClass().getSimpleName() + ": " + error.getMessage();
        TaskFailResult res = taskRepository.fail(task.id(), workerId, task.attempt(), message,
                config.enableFaultTolerance());

        switch (res) {
            case RETRIED -> {
                // Ownership is released before the ID goes back on the queue
                queue.offer(task.id());
                log.info("Task {} failed on {}, retrying ({}/{}): {}",
                        task.id(), workerId, task.retryCount() + 1, task.maxRetries(), message);
            }
            case FAILED -> {
                log.warn("Task {} permanently failed on {} after {} retries: {}",
                        task.id(), workerId, task.retryCount(), message);
                onTerminal.run();
            }
            default -> {
                detached = true;
                log.info("Worker {} failure for task {} discarded: {}", workerId, task.id(), res);
            }
        }
    }
}
