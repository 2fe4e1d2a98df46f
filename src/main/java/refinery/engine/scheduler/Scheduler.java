package refinery.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the stall detector periodically on a single daemon thread.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final Runnable stallDetector;
    private final Duration interval;

    private volatile boolean running = false;

    /**
     * @param stallDetector job to run (typically a {@link StallDetector})
     * @param interval      delay between runs
     */
    public Scheduler(Runnable stallDetector, Duration interval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "refinery-stall-detector");
            t.setDaemon(true);
            return t;
        });
        this.stallDetector = stallDetector;
        this.interval = interval;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = Math.max(1, interval.toMillis());
        executor.scheduleAtFixedRate(
                wrapRunnable("stall-detector", stallDetector),
                intervalMs, // initial delay
                intervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.debug("Stall detector scheduled every {}ms", intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.debug("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Wrap a runnable with error handling so one failure does not cancel the schedule.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
