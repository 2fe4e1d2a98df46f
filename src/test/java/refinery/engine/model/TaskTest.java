package refinery.engine.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void buildMinimalTask() {
        Task task = Task.builder()
                .id("task-1")
                .index(42)
                .build();

        assertEquals("task-1", task.id());
        assertEquals(42, task.index());
        assertEquals(TaskStatus.PENDING, task.status());
        assertNull(task.assignedWorker());
        assertEquals(0, task.retryCount());
        assertEquals(3, task.maxRetries());
        assertEquals(0, task.attempt());
    }

    @Test
    void retryCountAboveMaxIsRejected() {
        assertThrows(IllegalStateException.class, () -> Task.builder()
                .id("t1")
                .retryCount(4)
                .maxRetries(3)
                .build());
    }

    @Test
    void canRetry() {
        Task retriable = Task.builder().id("t1").retryCount(2).maxRetries(3).build();
        assertTrue(retriable.canRetry());

        Task exhausted = Task.builder().id("t2").retryCount(3).maxRetries(3).build();
        assertFalse(exhausted.canRetry());

        Task noRetries = Task.builder().id("t3").maxRetries(0).build();
        assertFalse(noRetries.canRetry());
    }

    @Test
    void transitionFollowsTable() {
        Task pending = Task.builder().id("t1").build();

        Task running = pending.transitionTo(TaskStatus.RUNNING).assignedWorker("worker-00").build();
        assertEquals(TaskStatus.RUNNING, running.status());
        assertEquals("worker-00", running.assignedWorker());

        // PENDING cannot jump straight to COMPLETED
        assertThrows(IllegalStateException.class, () -> pending.transitionTo(TaskStatus.COMPLETED));

        Task done = running.transitionTo(TaskStatus.COMPLETED).build();
        assertTrue(done.isTerminal());
        assertThrows(IllegalStateException.class, () -> done.transitionTo(TaskStatus.RUNNING));
    }

    @Test
    void runtimeNeedsBothTimestamps() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Task running = Task.builder().id("t1").status(TaskStatus.RUNNING).startedAt(start).build();
        assertNull(running.runtime());

        Task done = running.toBuilder()
                .status(TaskStatus.COMPLETED)
                .completedAt(start.plusMillis(250))
                .build();
        assertEquals(Duration.ofMillis(250), done.runtime());
    }

    @Test
    void equalityById() {
        Task a = Task.builder().id("same").index(1).build();
        Task b = Task.builder().id("same").index(2).status(TaskStatus.RUNNING).attempt(7).build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
