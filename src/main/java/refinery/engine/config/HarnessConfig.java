package refinery.engine.config;

import java.time.Duration;

/**
 * Configuration for the parallel batch harness.
 * All settings have sensible defaults.
 */
public final class HarnessConfig {

    // Pool settings
    private int parallelism = 4;
    private int batchSize = 10;

    // Retry settings
    private int maxRetries = 3;
    private Duration backoffBase = Duration.ofSeconds(1);

    // Collection wait, multiplied by the number of sessions in a chunk
    private Duration timeoutPerSession = Duration.ofSeconds(300);

    private HarnessConfig() {
    }

    public static HarnessConfig defaults() {
        return new HarnessConfig();
    }

    public static HarnessConfig fromEnv() {
        HarnessConfig config = new HarnessConfig();

        String parallelism = System.getenv("REFINERY_PARALLELISM");
        if (parallelism != null && !parallelism.isBlank()) {
            config.parallelism = Integer.parseInt(parallelism.trim());
        }

        String retries = System.getenv("REFINERY_SESSION_RETRIES");
        if (retries != null && !retries.isBlank()) {
            config.maxRetries = Integer.parseInt(retries.trim());
        }

        String timeout = System.getenv("REFINERY_SESSION_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.timeoutPerSession = Duration.ofSeconds(Long.parseLong(timeout.trim()));
        }

        String batchSize = System.getenv("REFINERY_BATCH_SIZE");
        if (batchSize != null && !batchSize.isBlank()) {
            config.batchSize = Integer.parseInt(batchSize.trim());
        }

        return config;
    }

    // Getters
    public int parallelism() {
        return parallelism;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration timeoutPerSession() {
        return timeoutPerSession;
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration backoffBase() {
        return backoffBase;
    }

    /** Backoff before the retry that follows {@code attempt} (0-based): base * 2^attempt. */
    public Duration backoffFor(int attempt) {
        return backoffBase.multipliedBy(1L << Math.min(attempt, 30));
    }

    // Fluent setters for testing/customization
    public HarnessConfig withParallelism(int parallelism) {
        this.parallelism = parallelism;
        return this;
    }

    public HarnessConfig withMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public HarnessConfig withTimeoutPerSession(Duration timeout) {
        this.timeoutPerSession = timeout;
        return this;
    }

    public HarnessConfig withBatchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    public HarnessConfig withBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
        return this;
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public HarnessConfig validate() {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got " + maxRetries);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        if (timeoutPerSession == null || timeoutPerSession.isNegative() || timeoutPerSession.isZero()) {
            throw new IllegalArgumentException("timeoutPerSession must be positive");
        }
        if (backoffBase == null || backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must not be negative");
        }
        return this;
    }

    @Override
    public String toString() {
        return "HarnessConfig{" +
                "parallelism=" + parallelism +
                ", maxRetries=" + maxRetries +
                ", timeoutPerSession=" + timeoutPerSession +
                ", batchSize=" + batchSize +
                ", backoffBase=" + backoffBase +
                '}';
    }
}
