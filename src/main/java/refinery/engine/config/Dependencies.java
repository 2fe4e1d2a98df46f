package refinery.engine.config;

import refinery.engine.distributed.DistributedProcessor;
import refinery.engine.harness.Harness;
import refinery.engine.optimizer.OptimizationLoop;
import refinery.engine.optimizer.Optimizer;
import refinery.engine.session.ProducerScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the engine components.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(EngineConfig.fromEnv())) {
 *     OptimizationLoop&lt;String, Doc&gt; loop = deps.optimizationLoop(myProducerScorer);
 *     OptimizationRun&lt;Doc&gt; run = loop.run(inputs, 5);
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Optimizer optimizer;

    // Lazy: its worker records exist from construction on
    private DistributedProcessor distributedProcessor;

    private Dependencies(EngineConfig config) {
        this.config = config.validate();

        log.info("Initializing dependencies with config: {}", config);

        this.optimizer = new Optimizer(config.optimizer());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    public EngineConfig config() {
        return config;
    }

    /**
     * Shared optimizer; its score history spans every loop created here.
     */
    public Optimizer optimizer() {
        return optimizer;
    }

    public synchronized DistributedProcessor distributedProcessor() {
        if (distributedProcessor == null) {
            distributedProcessor = new DistributedProcessor(config.processor());
        }
        return distributedProcessor;
    }

    /**
     * New harness running sessions against the given producer/scorer.
     */
    public <I, A> Harness<I, A> harness(ProducerScorer<I, A> producerScorer) {
        return new Harness<>(producerScorer, config.harness(), config.session());
    }

    public <I, A> OptimizationLoop<I, A> optimizationLoop(ProducerScorer<I, A> producerScorer) {
        return new OptimizationLoop<>(harness(producerScorer), optimizer);
    }

    @Override
    public synchronized void close() {
        log.info("Closing dependencies...");

        if (distributedProcessor != null && !distributedProcessor.isRunning()) {
            try {
                distributedProcessor.reset();
            } catch (IllegalStateException e) {
                log.warn("Error resetting distributed processor: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
