package refinery.engine.scheduler;

import refinery.engine.config.ProcessorConfig;
import refinery.engine.model.Task;
import refinery.engine.model.TaskFailResult;
import refinery.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * Background check that recovers tasks stuck in RUNNING.
 *
 * Tasks can get stuck if:
 * - the process function hangs
 * - a worker thread died mid-task
 *
 * For each task RUNNING longer than the task timeout:
 * - if fault tolerance is on and retryCount < maxRetries: mark RETRYING and re-enqueue
 * - otherwise: mark FAILED
 *
 * The hung call itself is not interrupted; only a fresh attempt is dispatched.
 * The worker that owned a reaped task is detached from it and reported to
 * {@code onStalled} so a replacement can take over its slot.
 */
public class StallDetector implements Runnable {

    private final TaskRepository taskRepository;
    private final ProcessorConfig config;
    private final Consumer<String> requeue;
    private final Consumer<String> onStalled;
    private final Logger log;

    public StallDetector(TaskRepository taskRepository, ProcessorConfig config, Consumer<String> requeue,
            Consumer<String> onStalled) {
        this(taskRepository, config, requeue, onStalled, LoggerFactory.getLogger(StallDetector.class));
    }

    public StallDetector(TaskRepository taskRepository, ProcessorConfig config, Consumer<String> requeue,
            Consumer<String> onStalled, Logger log) {
        this.taskRepository = taskRepository;
        this.config = config;
        this.requeue = requeue;
        this.onStalled = onStalled;
        this.log = log;
    }

    @Override
    public void run() {
        try {
            reapStuckTasks();
        } catch (Exception e) {
            log.error("Stall detector error", e);
        }
    }

    /**
     * Find and recover stuck RUNNING tasks.
     *
     * @return number of tasks recovered
     */
    public int reapStuckTasks() {
        Instant cutoff = Instant.now().minus(config.taskTimeout());

        List<Task> stuck = taskRepository.findStuckRunning(cutoff);

        if (stuck.isEmpty()) {
            log.debug("No stuck tasks found");
            return 0;
        }

        int retried = 0;
        int failed = 0;

        for (Task task : stuck) {
            String reason = "Task stalled in RUNNING for more than " + config.taskTimeout().toMillis() + "ms"
                    + " on " + task.assignedWorker();
            TaskFailResult res = taskRepository.reapStuck(task.id(), cutoff, reason, config.enableFaultTolerance());

            switch (res) {
                case RETRIED -> {
                    requeue.accept(task.id());
                    retried++;
                    log.warn("Task {} stalled on {}, re-dispatched (retry {} of {})",
                            task.id(), task.assignedWorker(), task.retryCount() + 1, task.maxRetries());
                }
                case FAILED -> {
                    failed++;
                    log.warn("Task {} permanently failed after stalling (retries {}/{})",
                            task.id(), task.retryCount(), task.maxRetries());
                }
                default -> {
                    log.debug("Task {} moved on before it could be reaped: {}", task.id(), res);
                    continue;
                }
            }

            if (task.assignedWorker() != null) {
                onStalled.accept(task.assignedWorker());
            }
        }

        if (retried + failed > 0) {
            log.info("Stall detector: {} retried, {} failed, {} total stuck", retried, failed, stuck.size());
        }

        return retried + failed;
    }
}
