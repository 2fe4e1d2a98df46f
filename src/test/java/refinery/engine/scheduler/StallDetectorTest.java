package refinery.engine.scheduler;

import refinery.engine.config.ProcessorConfig;
import refinery.engine.model.Task;
import refinery.engine.model.TaskStatus;
import refinery.engine.model.WorkerStatus;
import refinery.engine.store.InMemoryTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StallDetector functionality.
 */
class StallDetectorTest {

    private InMemoryTaskStore store;
    private ProcessorConfig config;
    private List<String> requeued;
    private List<String> stalledWorkers;

    @BeforeEach
    void setup() {
        // Short timeout for fast tests
        config = ProcessorConfig.defaults().withTaskTimeout(Duration.ofMillis(100));
        store = new InMemoryTaskStore();
        store.resetWorkers(1);
        requeued = new CopyOnWriteArrayList<>();
        stalledWorkers = new CopyOnWriteArrayList<>();
    }

    @Test
    void reapsStuckTaskWithRetryAvailable() throws InterruptedException {
        store.saveAll(List.of(Task.builder().id("task-stuck-retry").maxRetries(3).build()));
        store.claim("task-stuck-retry", "worker-00");

        // Wait for it to become "stuck" (longer than timeout)
        Thread.sleep(150);

        StallDetector detector = new StallDetector(store, config, requeued::add, stalledWorkers::add);
        assertEquals(1, detector.reapStuckTasks());

        Task updated = store.findById("task-stuck-retry").orElseThrow();
        assertEquals(TaskStatus.RETRYING, updated.status());
        assertEquals(1, updated.retryCount());
        assertNull(updated.assignedWorker());
        assertEquals(List.of("task-stuck-retry"), requeued);
        assertEquals(WorkerStatus.STALLED, store.findWorker("worker-00").orElseThrow().status());
        assertEquals(List.of("worker-00"), stalledWorkers);
    }

    @Test
    void reapsStuckTaskWithNoRetryLeft() throws InterruptedException {
        store.saveAll(List.of(Task.builder().id("task-stuck-noretry").maxRetries(0).build()));
        store.claim("task-stuck-noretry", "worker-00");

        Thread.sleep(150);

        StallDetector detector = new StallDetector(store, config, requeued::add, stalledWorkers::add);
        assertEquals(1, detector.reapStuckTasks());

        Task updated = store.findById("task-stuck-noretry").orElseThrow();
        assertEquals(TaskStatus.FAILED, updated.status());
        assertNotNull(updated.errorMessage());
        assertTrue(updated.errorMessage().contains("stalled"));
        assertTrue(requeued.isEmpty());
        // The owner is still stuck in its call, so its slot is reported either way
        assertEquals(List.of("worker-00"), stalledWorkers);
    }

    @Test
    void faultToleranceOffFailsImmediately() throws InterruptedException {
        store.saveAll(List.of(Task.builder().id("task-no-ft").maxRetries(3).build()));
        store.claim("task-no-ft", "worker-00");

        Thread.sleep(150);

        StallDetector detector = new StallDetector(store, config.withFaultTolerance(false), requeued::add,
                stalledWorkers::add);
        assertEquals(1, detector.reapStuckTasks());
        assertEquals(TaskStatus.FAILED, store.findById("task-no-ft").orElseThrow().status());
    }

    @Test
    void doesNotReapRecentlyStartedTasks() {
        store.saveAll(List.of(Task.builder().id("task-recent").build()));
        store.claim("task-recent", "worker-00");

        // Don't wait - run immediately
        StallDetector detector = new StallDetector(store, config, requeued::add, stalledWorkers::add);
        assertEquals(0, detector.reapStuckTasks());
        assertEquals(TaskStatus.RUNNING, store.findById("task-recent").orElseThrow().status());
        assertTrue(stalledWorkers.isEmpty());
    }

    @Test
    void doesNotReapCompletedTasks() throws InterruptedException {
        store.saveAll(List.of(Task.builder().id("task-done").build()));
        long attempt = store.claim("task-done", "worker-00").orElseThrow().attempt();
        store.complete("task-done", "worker-00", attempt);

        Thread.sleep(150);

        StallDetector detector = new StallDetector(store, config, requeued::add, stalledWorkers::add);
        assertEquals(0, detector.reapStuckTasks());
        assertEquals(TaskStatus.COMPLETED, store.findById("task-done").orElseThrow().status());
    }

    @Test
    void schedulerRunsDetectorPeriodically() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        try (Scheduler scheduler = new Scheduler(runs::incrementAndGet, Duration.ofMillis(20))) {
            scheduler.start();
            assertTrue(scheduler.isRunning());
            Thread.sleep(200);
        }
        assertTrue(runs.get() >= 2, "expected several runs, got " + runs.get());
    }

    @Test
    void schedulerSurvivesFailingJob() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        Scheduler scheduler = new Scheduler(() -> {
            runs.incrementAndGet();
            throw new IllegalStateException("boom");
        }, Duration.ofMillis(20));
        scheduler.start();
        Thread.sleep(200);
        scheduler.stop();

        assertFalse(scheduler.isRunning());
        assertTrue(runs.get() >= 2, "failing job should keep being scheduled");
    }
}
