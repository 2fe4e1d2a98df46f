package refinery.engine.harness;

import refinery.engine.config.HarnessConfig;
import refinery.engine.config.SessionConfig;
import refinery.engine.model.ProduceOutcome;
import refinery.engine.model.Score;
import refinery.engine.model.SessionContext;
import refinery.engine.model.SessionResult;
import refinery.engine.model.SessionRound;
import refinery.engine.model.SessionState;
import refinery.engine.session.ProducerScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HarnessTest {

    /** Scores each input by parsing it as a number; "fail" never produces anything. */
    static final class NumericProducer implements ProducerScorer<String, String> {
        @Override
        public ProduceOutcome<String> produce(String input, SessionContext<String> context) {
            return "fail".equals(input) ? ProduceOutcome.failure("unparseable") : ProduceOutcome.success(input);
        }

        @Override
        public Score score(String artifact) {
            double overall = Double.parseDouble(artifact);
            return new Score(overall, Map.of("coverage", overall, "clarity", 1.0 - overall),
                    List.of(), List.of(), List.of());
        }
    }

    private static HarnessConfig fastConfig() {
        return HarnessConfig.defaults()
                .withParallelism(4)
                .withMaxRetries(3)
                .withBackoffBase(Duration.ofMillis(1))
                .withTimeoutPerSession(Duration.ofSeconds(5));
    }

    private static SessionConfig sessionConfig() {
        return SessionConfig.defaults().withMaxRounds(2).withConvergenceThreshold(0.85);
    }

    private static SessionResult<String> converged(String artifact, double score) {
        Score s = Score.of(score);
        return new SessionResult<>(artifact, s, List.of(SessionRound.scored(1, artifact, s)),
                SessionState.CONVERGED, Duration.ZERO);
    }

    @Test
    void emptyBatchIsSafe() {
        Harness<String, String> harness = new Harness<>(new NumericProducer(), fastConfig(), sessionConfig());

        HarnessResult<String> result = harness.runBatch(List.of());

        assertEquals(0, result.totalSessions());
        assertEquals(0, result.successfulSessions());
        assertEquals(0, result.failedSessions());
        assertEquals(0.0, result.averageScore());
        assertEquals(0.0, result.convergenceRate());
    }

    @Test
    @DisplayName("Mismatched contexts are rejected before any session runs")
    void contextLengthMismatch() {
        AtomicInteger runs = new AtomicInteger();
        Harness<String, String> harness = new Harness<String, String>((input, context, config) -> {
            runs.incrementAndGet();
            return converged(input, 0.9);
        }, fastConfig(), sessionConfig(), LoggerFactory.getLogger(HarnessTest.class));

        assertThrows(IllegalArgumentException.class,
                () -> harness.runBatch(List.of("0.5", "0.6"), List.of(SessionContext.empty())));
        assertEquals(0, runs.get());
    }

    @Test
    @DisplayName("Aggregates cover successful sessions only; results keep input order")
    void aggregatesOverSuccessfulSessions() {
        Harness<String, String> harness = new Harness<>(new NumericProducer(), fastConfig(), sessionConfig());

        HarnessResult<String> result = harness.runBatch(List.of("0.5", "fail", "0.9", "0.7"));

        assertEquals(4, result.totalSessions());
        assertEquals(3, result.successfulSessions());
        assertEquals(1, result.failedSessions());
        assertEquals(1, result.convergedSessions());
        assertEquals(0.25, result.convergenceRate(), 1e-9);
        assertEquals(0.7, result.averageScore(), 1e-9);
        assertEquals(0.9, result.bestScore(), 1e-9);
        assertEquals(0.5, result.worstScore(), 1e-9);
        assertEquals(0.7, result.dimensionAverages().get("coverage"), 1e-9);
        assertEquals(0.3, result.dimensionAverages().get("clarity"), 1e-9);

        // 0.5 and 0.7 use both rounds, 0.9 converges in one
        assertEquals(1, result.minRounds());
        assertEquals(2, result.maxRounds());

        assertEquals("0.5", result.results().get(0).bestArtifact());
        assertFalse(result.results().get(1).success());
        assertEquals("0.9", result.results().get(2).bestArtifact());
        assertTrue(result.summary().startsWith("4 sessions: 3 successful, 1 failed"));
    }

    @Test
    @DisplayName("A session that throws is retried in place until it succeeds")
    void retriesThrowingSession() {
        AtomicInteger attempts = new AtomicInteger();
        Harness<String, String> harness = new Harness<String, String>((input, context, config) -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("transient");
            }
            return converged(input, 0.9);
        }, fastConfig(), sessionConfig(), LoggerFactory.getLogger(HarnessTest.class));

        HarnessResult<String> result = harness.runBatch(List.of("x"));

        assertEquals(3, attempts.get());
        assertEquals(1, result.successfulSessions());
    }

    @Test
    @DisplayName("Every attempt throwing yields a failed session, not an exception")
    void exhaustedRetriesGiveFailedResult() {
        AtomicInteger attempts = new AtomicInteger();
        Harness<String, String> harness = new Harness<String, String>((input, context, config) -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("always");
        }, fastConfig().withMaxRetries(2), sessionConfig(), LoggerFactory.getLogger(HarnessTest.class));

        HarnessResult<String> result = harness.runBatch(List.of("a", "b"));

        assertEquals(4, attempts.get());
        assertEquals(2, result.failedSessions());
        assertEquals(0.0, result.averageScore());
    }

    @Test
    void backoffGrowsExponentially() {
        HarnessConfig config = HarnessConfig.defaults();
        assertEquals(Duration.ofSeconds(1), config.backoffFor(0));
        assertEquals(Duration.ofSeconds(2), config.backoffFor(1));
        assertEquals(Duration.ofSeconds(8), config.backoffFor(3));
    }

    @Test
    @DisplayName("Sessions still running at the deadline are cancelled and counted failed")
    void timeoutCountsAsFailure() {
        Harness<String, String> harness = new Harness<String, String>((input, context, config) -> {
            if ("slow".equals(input)) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return converged(input, 0.9);
        }, fastConfig().withTimeoutPerSession(Duration.ofMillis(100)), sessionConfig(),
                LoggerFactory.getLogger(HarnessTest.class));

        long start = System.nanoTime();
        HarnessResult<String> result = harness.runBatch(List.of("fast", "slow"));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs < 2_000, "batch should stop waiting at the deadline, took " + elapsedMs + "ms");
        assertTrue(result.results().get(0).success());
        assertFalse(result.results().get(1).success());
        assertEquals(1, result.failedSessions());
    }

    @Test
    @DisplayName("Inputs beyond batchSize run in further chunks and merge into one result")
    void chunksAreMerged() {
        Harness<String, String> harness = new Harness<>(new NumericProducer(),
                fastConfig().withBatchSize(2), sessionConfig());

        HarnessResult<String> result = harness.runBatch(List.of("0.9", "0.9", "0.9", "0.9", "0.9"));

        assertEquals(5, result.totalSessions());
        assertEquals(5, result.convergedSessions());
        assertEquals(1.0, result.convergenceRate());
    }

    @Test
    void sessionIndexIsInMdcWhileRunning() {
        Set<String> seen = ConcurrentHashMap.newKeySet();
        Harness<String, String> harness = new Harness<String, String>((input, context, config) -> {
            seen.add(MDC.get("session"));
            return converged(input, 0.9);
        }, fastConfig(), sessionConfig(), LoggerFactory.getLogger(HarnessTest.class));

        harness.runBatch(List.of("a", "b", "c"));

        assertEquals(Set.of("0", "1", "2"), seen);
    }

    @Test
    void perInputContextsReachTheSessions() {
        Map<String, String> domains = new ConcurrentHashMap<>();
        Harness<String, String> harness = new Harness<String, String>((input, context, config) -> {
            domains.put(input, context.domain());
            return converged(input, 0.9);
        }, fastConfig(), sessionConfig(), LoggerFactory.getLogger(HarnessTest.class));

        harness.runBatch(List.of("a", "b"), List.of(
                SessionContext.<String>builder().domain("law").build(),
                SessionContext.<String>builder().domain("medicine").build()));

        assertEquals(Map.of("a", "law", "b", "medicine"), domains);
    }
}
