package refinery.engine.config;

/**
 * All engine settings in one place.
 */
public final class EngineConfig {

    private final SessionConfig session;
    private final HarnessConfig harness;
    private final ProcessorConfig processor;
    private final OptimizerConfig optimizer;

    public EngineConfig(SessionConfig session, HarnessConfig harness, ProcessorConfig processor,
            OptimizerConfig optimizer) {
        this.session = session;
        this.harness = harness;
        this.processor = processor;
        this.optimizer = optimizer;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(SessionConfig.defaults(), HarnessConfig.defaults(), ProcessorConfig.defaults(),
                OptimizerConfig.defaults());
    }

    public static EngineConfig fromEnv() {
        return new EngineConfig(SessionConfig.fromEnv(), HarnessConfig.fromEnv(), ProcessorConfig.fromEnv(),
                OptimizerConfig.fromEnv());
    }

    public SessionConfig session() {
        return session;
    }

    public HarnessConfig harness() {
        return harness;
    }

    public ProcessorConfig processor() {
        return processor;
    }

    public OptimizerConfig optimizer() {
        return optimizer;
    }

    /**
     * @throws IllegalArgumentException if any section is invalid
     */
    public EngineConfig validate() {
        session.validate();
        harness.validate();
        processor.validate();
        optimizer.validate();
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" + session + ", " + harness + ", " + processor + ", " + optimizer + '}';
    }
}
