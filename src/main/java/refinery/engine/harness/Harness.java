package refinery.engine.harness;

import refinery.engine.config.HarnessConfig;
import refinery.engine.config.SessionConfig;
import refinery.engine.model.SessionContext;
import refinery.engine.model.SessionResult;
import refinery.engine.session.ProducerScorer;
import refinery.engine.session.Session;
import refinery.engine.session.SessionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one session per input on a fixed-size thread pool.
 *
 * <p>A session that throws is retried in the same thread after an exponential
 * backoff; if every attempt throws, a failed result stands in for it.
 * Collection of a chunk of {@code n} sessions waits at most
 * {@code timeoutPerSession * n}; sessions still running then are cancelled
 * and counted as failed.
 */
public class Harness<I, A> {

    static final String MDC_SESSION = "session";

    private final SessionRunner<I, A> sessionRunner;
    private final HarnessConfig config;
    private final SessionConfig sessionConfig;
    private final Logger log;

    public Harness(ProducerScorer<I, A> producerScorer, HarnessConfig config, SessionConfig sessionConfig) {
        this(producerScorer, config, sessionConfig, LoggerFactory.getLogger(Harness.class));
    }

    public Harness(ProducerScorer<I, A> producerScorer, HarnessConfig config, SessionConfig sessionConfig,
            Logger log) {
        this(new Session<>(producerScorer, log), config, sessionConfig, log);
    }

    Harness(SessionRunner<I, A> sessionRunner, HarnessConfig config, SessionConfig sessionConfig, Logger log) {
        this.sessionRunner = Objects.requireNonNull(sessionRunner, "sessionRunner is required");
        this.config = Objects.requireNonNull(config, "config is required").validate();
        this.sessionConfig = Objects.requireNonNull(sessionConfig, "sessionConfig is required").validate();
        this.log = log;
    }

    public HarnessResult<A> runBatch(List<I> inputs) {
        return runBatch(inputs, null, sessionConfig);
    }

    public HarnessResult<A> runBatch(List<I> inputs, List<SessionContext<A>> contexts) {
        return runBatch(inputs, contexts, sessionConfig);
    }

    /**
     * Run one session per input.
     *
     * @param contexts optional per-input contexts; must match {@code inputs} in length
     * @param sessionConfig per-call override of the session settings
     * @throws IllegalArgumentException if {@code contexts} and {@code inputs} differ in length
     */
    public HarnessResult<A> runBatch(List<I> inputs, List<SessionContext<A>> contexts, SessionConfig sessionConfig) {
        Objects.requireNonNull(inputs, "inputs is required");
        if (contexts != null && contexts.size() != inputs.size()) {
            throw new IllegalArgumentException(
                    "contexts length " + contexts.size() + " does not match inputs length " + inputs.size());
        }
        SessionConfig effective = Objects.requireNonNull(sessionConfig, "sessionConfig is required").validate();

        Instant start = Instant.now();
        if (inputs.isEmpty()) {
            log.info("Empty batch, nothing to run");
            return HarnessResult.of(List.of(), Duration.ZERO);
        }

        log.info("Running batch of {} sessions (parallelism {}, chunk {})",
                inputs.size(), config.parallelism(), config.batchSize());

        List<SessionResult<A>> results = new ArrayList<>(Collections.nCopies(inputs.size(), null));

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.parallelism(), inputs.size()),
                sessionThreadFactory());
        try {
            for (int from = 0; from < inputs.size() && !Thread.currentThread().isInterrupted();
                    from += config.batchSize()) {
                int to = Math.min(from + config.batchSize(), inputs.size());
                runChunk(pool, inputs, contexts, effective, from, to, results);
            }
        } finally {
            pool.shutdownNow();
        }

        // Left unset only if the caller was interrupted between chunks
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i) == null) {
                results.set(i, SessionResult.failed(Duration.ZERO));
            }
        }

        HarnessResult<A> result = HarnessResult.of(results, Duration.between(start, Instant.now()));
        log.info("Batch finished: {}", result.summary());
        return result;
    }

    private void runChunk(ExecutorService pool,
            List<I> inputs,
            List<SessionContext<A>> contexts,
            SessionConfig sessionConfig,
            int from,
            int to,
            List<SessionResult<A>> results) {
        List<Future<SessionResult<A>>> futures = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            final int index = i;
            final I input = inputs.get(i);
            final SessionContext<A> context = contexts != null ? contexts.get(i) : SessionContext.empty();
            futures.add(pool.submit(() -> runWithRetry(index, input, context, sessionConfig)));
        }

        long deadline = System.nanoTime() + config.timeoutPerSession().multipliedBy(to - from).toNanos();

        for (int k = 0; k < futures.size(); k++) {
            int index = from + k;
            Future<SessionResult<A>> future = futures.get(k);
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                results.set(index, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Session {} did not finish before the batch deadline, cancelled", index);
                results.set(index, SessionResult.failed(config.timeoutPerSession()));
            } catch (ExecutionException e) {
                log.error("Session {} crashed: {}", index, e.getCause() != null ? e.getCause() : e);
                results.set(index, SessionResult.failed(Duration.ZERO));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while collecting sessions; cancelling the rest of the chunk");
                for (int j = k; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    results.set(from + j, SessionResult.failed(Duration.ZERO));
                }
                return;
            }
        }
    }

    /**
     * Call the session up to {@code maxRetries} times, sleeping
     * {@code backoffBase * 2^attempt} after each attempt that throws.
     */
    SessionResult<A> runWithRetry(int index, I input, SessionContext<A> context, SessionConfig sessionConfig) {
        Instant start = Instant.now();
        MDC.put(MDC_SESSION, String.valueOf(index));
        try {
            for (int attempt = 0; attempt < config.maxRetries(); attempt++) {
                try {
                    return sessionRunner.run(input, context, sessionConfig);
                } catch (RuntimeException e) {
                    log.warn("Session {} attempt {}/{} threw: {}", index, attempt + 1, config.maxRetries(),
                            e.toString());
                    if (attempt + 1 < config.maxRetries()) {
                        Thread.sleep(config.backoffFor(attempt).toMillis());
                    }
                }
            }
            log.error("Session {} failed after {} attempts", index, config.maxRetries());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Session {} interrupted during backoff", index);
        } finally {
            MDC.remove(MDC_SESSION);
        }
        return SessionResult.failed(Duration.between(start, Instant.now()));
    }

    public HarnessConfig config() {
        return config;
    }

    public SessionConfig sessionConfig() {
        return sessionConfig;
    }

    private static ThreadFactory sessionThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "refinery-session-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
