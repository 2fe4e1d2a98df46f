package refinery.engine.distributed;

import refinery.engine.config.ProcessorConfig;
import refinery.engine.model.Task;
import refinery.engine.model.TaskStatus;
import refinery.engine.scheduler.Scheduler;
import refinery.engine.scheduler.StallDetector;
import refinery.engine.store.InMemoryTaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-process fan-out executor: a fixed pool of workers pulls task IDs from a
 * shared FIFO, runs the caller's function and retries failures by putting the
 * task back on the queue.
 *
 * <p>Usage:
 *
 * <pre>
 * DistributedProcessor processor = new DistributedProcessor(ProcessorConfig.defaults().withNumWorkers(2));
 * DistributedResult&lt;List&lt;Integer&gt;&gt; result = processor.processDistributed(List.of(1, 2, 3), x -&gt; x * 2);
 * </pre>
 *
 * One run at a time; calling {@link #processDistributed} or {@link #reset()}
 * while a run is in progress is a usage error.
 */
public class DistributedProcessor {

    private final ProcessorConfig config;
    private final Logger log;

    private final InMemoryTaskStore store = new InMemoryTaskStore();
    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
    private final CopyOnWriteArrayList<Consumer<ProcessingProgress>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final List<String> workerIds;

    public DistributedProcessor(ProcessorConfig config) {
        this(config, LoggerFactory.getLogger(DistributedProcessor.class));
    }

    public DistributedProcessor(ProcessorConfig config, Logger log) {
        this.config = Objects.requireNonNull(config, "config is required").validate();
        this.log = log;
        this.workerIds = store.resetWorkers(config.numWorkers());
        log.info("Distributed processor initialized: {}", config);
    }

    /**
     * Run {@code processFn} over every item and collect completed results in submission order.
     */
    public <T, R> DistributedResult<List<R>> processDistributed(List<T> items, Function<? super T, ? extends R> processFn) {
        return this.<T, R, List<R>>processDistributed(items, processFn, Function.identity());
    }

    /**
     * Run {@code processFn} over every item and reduce the ordered results through {@code aggregateFn}.
     *
     * @throws IllegalStateException if another run is in progress
     */
    public <T, R, G> DistributedResult<G> processDistributed(List<T> items,
            Function<? super T, ? extends R> processFn,
            Function<? super List<R>, ? extends G> aggregateFn) {
        Objects.requireNonNull(items, "items is required");
        Objects.requireNonNull(processFn, "processFn is required");
        Objects.requireNonNull(aggregateFn, "aggregateFn is required");

        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("processDistributed already running");
        }

        try {
            Instant start = Instant.now();
            List<String> taskIds = submit(items);
            // Outputs by attempt token; null results are allowed
            Map<Long, R> outputs = Collections.synchronizedMap(new HashMap<>());
            this.<T, R>runToCompletion(items, taskIds, processFn, outputs);
            return collect(taskIds, outputs, aggregateFn, Duration.between(start, Instant.now()));
        } finally {
            running.set(false);
        }
    }

    /**
     * Task counts by status, retries, worker snapshots and average runtime.
     */
    public ProcessorStatistics getStatistics() {
        List<Task> tasks = store.findAll();

        int[] byStatus = new int[TaskStatus.values().length];
        int retries = 0;
        long runtimeNanos = 0;
        int timed = 0;
        for (Task task : tasks) {
            byStatus[task.status().ordinal()]++;
            retries += task.retryCount();
            if (task.status() == TaskStatus.COMPLETED && task.runtime() != null) {
                runtimeNanos += task.runtime().toNanos();
                timed++;
            }
        }

        return new ProcessorStatistics(
                tasks.size(),
                byStatus[TaskStatus.PENDING.ordinal()],
                byStatus[TaskStatus.RUNNING.ordinal()],
                byStatus[TaskStatus.RETRYING.ordinal()],
                byStatus[TaskStatus.COMPLETED.ordinal()],
                byStatus[TaskStatus.FAILED.ordinal()],
                retries,
                timed == 0 ? Duration.ZERO : Duration.ofNanos(runtimeNanos / timed),
                store.findAllWorkers());
    }

    public ProcessingProgress getProgress() {
        List<Task> tasks = store.findAll();
        int completed = 0;
        int failed = 0;
        int inFlight = 0;
        for (Task task : tasks) {
            switch (task.status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case RUNNING -> inFlight++;
                default -> {
                }
            }
        }
        int total = tasks.size();
        int pending = total - completed - failed - inFlight;
        double percent = total == 0 ? 0.0 : 100.0 * (completed + failed) / total;
        return new ProcessingProgress(total, completed, failed, inFlight, pending, percent);
    }

    /**
     * Drop all task state and recreate the worker slots.
     *
     * @throws IllegalStateException if a run is in progress
     */
    public void reset() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Cannot reset while processDistributed is running");
        }
        try {
            store.clear();
            queue.clear();
            workerIds.clear();
            workerIds.addAll(store.resetWorkers(config.numWorkers()));
            log.info("Distributed processor reset");
        } finally {
            running.set(false);
        }
    }

    /**
     * Called after each task reaches a terminal state (and after each stall sweep that changed something).
     */
    public void addProgressListener(Consumer<ProcessingProgress> listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public boolean isRunning() {
        return running.get();
    }

    public ProcessorConfig config() {
        return config;
    }

    // ---- run phases ----

    private <T> List<String> submit(List<T> items) {
        Instant now = Instant.now();
        List<Task> tasks = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            tasks.add(Task.builder()
                    .id(TaskIds.of(i, item))
                    .index(i)
                    .maxRetries(config.maxRetries())
                    .createdAt(now)
                    .build());
        }

        store.clear();
        queue.clear();
        store.saveAll(tasks);

        List<String> taskIds = tasks.stream().map(Task::id).toList();
        queue.addAll(taskIds);
        log.info("Submitted {} tasks to {} workers", taskIds.size(), workerIds.size());
        return taskIds;
    }

    private <T, R> void runToCompletion(List<T> items,
            List<String> taskIds,
            Function<? super T, ? extends R> processFn,
            Map<Long, R> outputs) {
        if (taskIds.isEmpty()) {
            return;
        }

        WorkerPool<T, R> pool = new WorkerPool<>(queue, store, items, processFn, outputs, config,
                this::fireProgress, log);
        pool.start(workerIds);

        StallDetector detector = new StallDetector(store, config, queue::offer, pool::replace, log);
        Scheduler scheduler = new Scheduler(() -> {
            if (detector.reapStuckTasks() > 0) {
                fireProgress();
            }
        }, config.heartbeatInterval());
        scheduler.start();

        try {
            while (!store.awaitTerminal(taskIds, config.heartbeatInterval())) {
                ProcessingProgress progress = getProgress();
                log.debug("Waiting: {}/{} terminal, {} running",
                        progress.completed() + progress.failed(), progress.total(), progress.running());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for tasks; returning partial result");
        } finally {
            scheduler.stop();
            pool.stop();
        }
    }

    private <R, G> DistributedResult<G> collect(List<String> taskIds,
            Map<Long, R> outputs,
            Function<? super List<R>, ? extends G> aggregateFn,
            Duration elapsed) {
        List<R> results = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();
        int completed = 0;
        int failed = 0;
        int retries = 0;

        // Canonical map, submission order
        for (Task task : store.findByIds(taskIds)) {
            retries += task.retryCount();
            if (task.status() == TaskStatus.COMPLETED) {
                completed++;
                results.add(outputs.get(task.attempt()));
            } else if (task.status() == TaskStatus.FAILED) {
                failed++;
                errors.put(task.id(), task.errorMessage());
            }
        }

        G aggregate = aggregateFn.apply(results);
        log.info("Distributed run finished: {} completed, {} failed, {} retries in {}ms",
                completed, failed, retries, elapsed.toMillis());
        return new DistributedResult<>(taskIds.size(), completed, failed, aggregate, errors, retries, elapsed);
    }

    private void fireProgress() {
        if (listeners.isEmpty()) {
            return;
        }
        ProcessingProgress progress = getProgress();
        for (Consumer<ProcessingProgress> listener : listeners) {
            try {
                listener.accept(progress);
            } catch (Exception e) {
                log.warn("Progress listener failed: {}", e.getMessage());
            }
        }
    }
}
