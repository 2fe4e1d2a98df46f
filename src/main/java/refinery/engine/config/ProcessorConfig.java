package refinery.engine.config;

import java.time.Duration;

/**
 * Configuration holder for the distributed processor.
 * All settings have sensible defaults.
 */
public final class ProcessorConfig {

    // Worker settings
    private int numWorkers = 4;
    private Duration heartbeatInterval = Duration.ofSeconds(5);

    // Task settings
    private int maxRetries = 3;
    private boolean enableFaultTolerance = true;
    private Duration taskTimeout = Duration.ofSeconds(300);

    private ProcessorConfig() {
    }

    public static ProcessorConfig defaults() {
        return new ProcessorConfig();
    }

    public static ProcessorConfig fromEnv() {
        ProcessorConfig config = new ProcessorConfig();

        String workers = System.getenv("REFINERY_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.numWorkers = Integer.parseInt(workers.trim());
        }

        String retries = System.getenv("REFINERY_TASK_RETRIES");
        if (retries != null && !retries.isBlank()) {
            config.maxRetries = Integer.parseInt(retries.trim());
        }

        String faultTolerance = System.getenv("REFINERY_FAULT_TOLERANCE");
        if (faultTolerance != null && !faultTolerance.isBlank()) {
            config.enableFaultTolerance = Boolean.parseBoolean(faultTolerance.trim());
        }

        String heartbeat = System.getenv("REFINERY_HEARTBEAT_SECONDS");
        if (heartbeat != null && !heartbeat.isBlank()) {
            config.heartbeatInterval = Duration.ofSeconds(Long.parseLong(heartbeat.trim()));
        }

        String timeout = System.getenv("REFINERY_TASK_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.taskTimeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
        }

        return config;
    }

    // Getters
    public int numWorkers() {
        return numWorkers;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public boolean enableFaultTolerance() {
        return enableFaultTolerance;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    // Fluent setters for testing/customization
    public ProcessorConfig withNumWorkers(int numWorkers) {
        this.numWorkers = numWorkers;
        return this;
    }

    public ProcessorConfig withMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public ProcessorConfig withFaultTolerance(boolean enabled) {
        this.enableFaultTolerance = enabled;
        return this;
    }

    public ProcessorConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public ProcessorConfig withTaskTimeout(Duration timeout) {
        this.taskTimeout = timeout;
        return this;
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public ProcessorConfig validate() {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("numWorkers must be >= 1, got " + numWorkers);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (heartbeatInterval == null || heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (taskTimeout == null || taskTimeout.isNegative() || taskTimeout.isZero()) {
            throw new IllegalArgumentException("taskTimeout must be positive");
        }
        return this;
    }

    @Override
    public String toString() {
        return "ProcessorConfig{" +
                "numWorkers=" + numWorkers +
                ", maxRetries=" + maxRetries +
                ", faultTolerance=" + enableFaultTolerance +
                ", heartbeatInterval=" + heartbeatInterval +
                ", taskTimeout=" + taskTimeout +
                '}';
    }
}
