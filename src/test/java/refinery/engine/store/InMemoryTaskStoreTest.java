package refinery.engine.store;

import refinery.engine.model.Task;
import refinery.engine.model.TaskCompleteResult;
import refinery.engine.model.TaskFailResult;
import refinery.engine.model.TaskStatus;
import refinery.engine.model.Worker;
import refinery.engine.model.WorkerStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskStoreTest {

    private InMemoryTaskStore store;

    @BeforeEach
    void setup() {
        store = new InMemoryTaskStore();
        store.resetWorkers(2);
        store.saveAll(List.of(
                Task.builder().id("t1").index(0).maxRetries(1).build(),
                Task.builder().id("t2").index(1).maxRetries(1).build()));
    }

    @Test
    void workersAreCreatedIdleWithStableIds() {
        List<Worker> workers = store.findAllWorkers();
        assertEquals(2, workers.size());
        assertEquals("worker-00", workers.get(0).id());
        assertEquals("worker-01", workers.get(1).id());
        assertTrue(workers.stream().allMatch(w -> w.status() == WorkerStatus.IDLE));
    }

    @Test
    void claimMarksTaskRunningAndWorkerBusy() {
        Task claimed = store.claim("t1", "worker-00").orElseThrow();

        assertEquals(TaskStatus.RUNNING, claimed.status());
        assertEquals("worker-00", claimed.assignedWorker());
        assertNotNull(claimed.startedAt());
        assertTrue(claimed.attempt() > 0);

        Worker worker = store.findWorker("worker-00").orElseThrow();
        assertEquals(WorkerStatus.BUSY, worker.status());
        assertEquals("t1", worker.currentTask());
    }

    @Test
    void secondClaimOfSameTaskFails() {
        assertTrue(store.claim("t1", "worker-00").isPresent());
        assertTrue(store.claim("t1", "worker-01").isEmpty());
        assertTrue(store.claim("missing", "worker-01").isEmpty());
    }

    @Test
    void completeByOwner() {
        long attempt = store.claim("t1", "worker-00").orElseThrow().attempt();

        assertEquals(TaskCompleteResult.COMPLETED, store.complete("t1", "worker-00", attempt));
        Task done = store.findById("t1").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(attempt, done.attempt());
        assertNotNull(done.completedAt());

        Worker worker = store.findWorker("worker-00").orElseThrow();
        assertEquals(WorkerStatus.IDLE, worker.status());
        assertNull(worker.currentTask());
        assertEquals(1, worker.completedTasks());

        // Idempotent
        assertEquals(TaskCompleteResult.ALREADY_TERMINAL, store.complete("t1", "worker-00", attempt));
    }

    @Test
    void completeByNonOwnerIsRejected() {
        long attempt = store.claim("t1", "worker-00").orElseThrow().attempt();
        assertEquals(TaskCompleteResult.NOT_OWNER, store.complete("t1", "worker-01", attempt));
        assertEquals(TaskCompleteResult.NOT_FOUND, store.complete("missing", "worker-01", attempt));
        assertEquals(TaskStatus.RUNNING, store.findById("t1").orElseThrow().status());
    }

    @Test
    @DisplayName("A report from an older attempt is rejected even when the worker ID matches")
    void completeWithOlderAttemptIsRejected() {
        long first = store.claim("t1", "worker-00").orElseThrow().attempt();
        assertEquals(TaskFailResult.RETRIED, store.fail("t1", "worker-00", first, "boom", true));

        // Same worker ID picks the retry up under a new token
        long second = store.claim("t1", "worker-00").orElseThrow().attempt();
        assertNotEquals(first, second);

        assertEquals(TaskCompleteResult.NOT_OWNER, store.complete("t1", "worker-00", first));
        assertEquals(TaskFailResult.NOT_OWNER, store.fail("t1", "worker-00", first, "late", false));
        Worker worker = store.findWorker("worker-00").orElseThrow();
        assertEquals(WorkerStatus.BUSY, worker.status());
        assertEquals("t1", worker.currentTask());

        assertEquals(TaskCompleteResult.COMPLETED, store.complete("t1", "worker-00", second));
    }

    @Test
    void attemptTokensSurviveClear() {
        long before = store.claim("t1", "worker-00").orElseThrow().attempt();

        store.clear();
        store.saveAll(List.of(Task.builder().id("t1").index(0).build()));
        long after = store.claim("t1", "worker-00").orElseThrow().attempt();

        assertTrue(after > before);
        assertEquals(TaskCompleteResult.NOT_OWNER, store.complete("t1", "worker-00", before));
    }

    @Test
    @DisplayName("fail: retried while retries remain, then FAILED")
    void failRetriesThenFails() {
        long first = store.claim("t1", "worker-00").orElseThrow().attempt();
        assertEquals(TaskFailResult.RETRIED, store.fail("t1", "worker-00", first, "boom", true));

        Task retrying = store.findById("t1").orElseThrow();
        assertEquals(TaskStatus.RETRYING, retrying.status());
        assertEquals(1, retrying.retryCount());
        assertNull(retrying.assignedWorker());

        // A different worker may pick the retry up
        long second = store.claim("t1", "worker-01").orElseThrow().attempt();
        assertEquals(TaskFailResult.FAILED, store.fail("t1", "worker-01", second, "boom again", true));

        Task failed = store.findById("t1").orElseThrow();
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(1, failed.retryCount());
        assertEquals("boom again", failed.errorMessage());
    }

    @Test
    void nonRetriableFailureIsFinal() {
        long attempt = store.claim("t2", "worker-00").orElseThrow().attempt();
        assertEquals(TaskFailResult.FAILED, store.fail("t2", "worker-00", attempt, "no", false));
        assertEquals(0, store.findById("t2").orElseThrow().retryCount());
    }

    @Test
    @DisplayName("reapStuck detaches the owner; its late result is discarded")
    void reapStuckDetachesOwner() throws InterruptedException {
        long stale = store.claim("t1", "worker-00").orElseThrow().attempt();
        Thread.sleep(20);
        Instant cutoff = Instant.now();

        assertEquals(List.of("t1"), store.findStuckRunning(cutoff).stream().map(Task::id).toList());
        assertEquals(TaskFailResult.RETRIED, store.reapStuck("t1", cutoff, "stalled", true));

        Worker stalled = store.findWorker("worker-00").orElseThrow();
        assertEquals(WorkerStatus.STALLED, stalled.status());
        assertNull(stalled.currentTask());

        // Fresh attempt on another worker
        long fresh = store.claim("t1", "worker-01").orElseThrow().attempt();
        assertEquals(TaskCompleteResult.NOT_OWNER, store.complete("t1", "worker-00", stale));
        // The rejected report leaves the detached record alone
        assertEquals(WorkerStatus.STALLED, store.findWorker("worker-00").orElseThrow().status());

        assertEquals(TaskCompleteResult.COMPLETED, store.complete("t1", "worker-01", fresh));
        assertEquals(fresh, store.findById("t1").orElseThrow().attempt());
    }

    @Test
    void awaitTerminalWakesOnCompletion() throws InterruptedException {
        long first = store.claim("t1", "worker-00").orElseThrow().attempt();
        long second = store.claim("t2", "worker-01").orElseThrow().attempt();

        assertFalse(store.awaitTerminal(List.of("t1", "t2"), Duration.ofMillis(20)));

        Thread completer = new Thread(() -> {
            store.complete("t1", "worker-00", first);
            store.fail("t2", "worker-01", second, "x", false);
        });
        completer.start();

        assertTrue(store.awaitTerminal(List.of("t1", "t2"), Duration.ofSeconds(5)));
        completer.join();
    }

    @Test
    @DisplayName("Concurrent claims: each task is owned by exactly one worker")
    void noDoubleOwnership() throws InterruptedException {
        store.resetWorkers(8);
        store.clear();
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            tasks.add(Task.builder().id("task-" + i).index(i).build());
        }
        store.saveAll(tasks);

        AtomicInteger claims = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int w = 0; w < 8; w++) {
            String workerId = String.format("worker-%02d", w);
            pool.submit(() -> {
                start.await();
                for (Task t : tasks) {
                    Optional<Task> claimed = store.claim(t.id(), workerId);
                    if (claimed.isPresent()) {
                        claims.incrementAndGet();
                        store.complete(t.id(), workerId, claimed.get().attempt());
                    }
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(50, claims.get());
        assertEquals(50, store.countByStatus(TaskStatus.COMPLETED));
        int completedByWorkers = store.findAllWorkers().stream().mapToInt(Worker::completedTasks).sum();
        assertEquals(50, completedByWorkers);
    }
}
