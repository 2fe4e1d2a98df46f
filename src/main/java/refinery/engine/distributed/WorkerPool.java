package refinery.engine.distributed;

import refinery.engine.config.ProcessorConfig;
import refinery.engine.store.InMemoryTaskStore;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * The worker threads of one {@code processDistributed} run.
 * Each worker slot has exactly one live {@link WorkerLoop}; a loop stuck in
 * the process function is detached and a replacement takes over its slot.
 */
final class WorkerPool<T, R> {

    private static final long STOP_WAIT_SECONDS = 5;

    private final BlockingQueue<String> queue;
    private final InMemoryTaskStore store;
    private final List<T> items;
    private final Function<? super T, ? extends R> processFn;
    private final Map<Long, R> outputs;
    private final ProcessorConfig config;
    private final Runnable onTerminal;
    private final Logger log;

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r);
        t.setDaemon(true);
        return t;
    });

    // guarded by this
    private final Map<String, WorkerLoop<T, R>> live = new HashMap<>();
    private final List<WorkerLoop<T, R>> started = new ArrayList<>();
    private boolean stopped;

    WorkerPool(BlockingQueue<String> queue,
            InMemoryTaskStore store,
            List<T> items,
            Function<? super T, ? extends R> processFn,
            Map<Long, R> outputs,
            ProcessorConfig config,
            Runnable onTerminal,
            Logger log) {
        this.queue = queue;
        this.store = store;
        this.items = items;
        this.processFn = processFn;
        this.outputs = outputs;
        this.config = config;
        this.onTerminal = onTerminal;
        this.log = log;
    }

    synchronized void start(List<String> workerIds) {
        workerIds.forEach(this::launch);
    }

    /**
     * Detach the loop holding {@code workerId} and start a fresh one in its slot.
     */
    synchronized void replace(String workerId) {
        if (stopped) {
            return;
        }
        WorkerLoop<T, R> stuck = live.get(workerId);
        if (stuck != null) {
            stuck.detach();
        }
        launch(workerId);
        log.warn("Worker {} is stuck in the process function; started a replacement loop", workerId);
    }

    /**
     * Stop every loop. Waits up to 5s for loops that still own their slot;
     * detached loops are left to finish their call on their own.
     */
    void stop() {
        List<WorkerLoop<T, R>> loops;
        synchronized (this) {
            stopped = true;
            loops = new ArrayList<>(started);
        }

        loops.forEach(WorkerLoop::shutdown);
        // Interrupts the bounded polls; only stuck loops are still inside processFn
        executor.shutdownNow();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(STOP_WAIT_SECONDS);
        try {
            for (WorkerLoop<T, R> loop : loops) {
                if (loop.isDetached()) {
                    continue;
                }
                long remaining = Math.max(0, deadline - System.nanoTime());
                if (!loop.awaitStopped(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Worker {} did not stop within {}s", loop.workerId(), STOP_WAIT_SECONDS);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void launch(String workerId) {
        WorkerLoop<T, R> loop = new WorkerLoop<>(workerId, queue, store, store, items, processFn, outputs,
                config, onTerminal, log);
        live.put(workerId, loop);
        started.add(loop);
        executor.submit(loop);
    }
}
