package refinery.engine.repository;

import refinery.engine.model.Worker;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for worker slot records.
 */
public interface WorkerRepository {

    /**
     * Replace all workers with {@code count} fresh IDLE workers.
     *
     * @return the new worker IDs
     */
    List<String> resetWorkers(int count);

    /**
     * Record a liveness beat for a worker.
     */
    void heartbeat(String workerId);

    /**
     * Mark a worker whose loop has exited.
     */
    void markStopped(String workerId);

    /**
     * Mark a worker ready for work (used when loops start).
     */
    void markIdle(String workerId);

    Optional<Worker> findWorker(String workerId);

    /**
     * All workers ordered by ID.
     */
    List<Worker> findAllWorkers();
}
