package refinery.engine.config;

/**
 * Thresholds used by the trend optimizer.
 */
public final class OptimizerConfig {

    private int windowSize = 5;
    private double minImprovementRate = 0.01;
    private double convergenceThreshold = 0.85;
    private double dimensionThreshold = 0.5;
    private double nearConvergenceScore = 0.7;

    private OptimizerConfig() {
    }

    public static OptimizerConfig defaults() {
        return new OptimizerConfig();
    }

    public static OptimizerConfig fromEnv() {
        OptimizerConfig config = new OptimizerConfig();

        String window = System.getenv("REFINERY_TREND_WINDOW");
        if (window != null && !window.isBlank()) {
            config.windowSize = Integer.parseInt(window.trim());
        }

        String minImprovement = System.getenv("REFINERY_MIN_IMPROVEMENT");
        if (minImprovement != null && !minImprovement.isBlank()) {
            config.minImprovementRate = Double.parseDouble(minImprovement.trim());
        }

        String target = System.getenv("REFINERY_TARGET_SCORE");
        if (target != null && !target.isBlank()) {
            config.convergenceThreshold = Double.parseDouble(target.trim());
        }

        return config;
    }

    public int windowSize() {
        return windowSize;
    }

    public double minImprovementRate() {
        return minImprovementRate;
    }

    public double convergenceThreshold() {
        return convergenceThreshold;
    }

    public double dimensionThreshold() {
        return dimensionThreshold;
    }

    public double nearConvergenceScore() {
        return nearConvergenceScore;
    }

    public OptimizerConfig withWindowSize(int windowSize) {
        this.windowSize = windowSize;
        return this;
    }

    public OptimizerConfig withMinImprovementRate(double rate) {
        this.minImprovementRate = rate;
        return this;
    }

    public OptimizerConfig withConvergenceThreshold(double threshold) {
        this.convergenceThreshold = threshold;
        return this;
    }

    public OptimizerConfig withDimensionThreshold(double threshold) {
        this.dimensionThreshold = threshold;
        return this;
    }

    public OptimizerConfig withNearConvergenceScore(double score) {
        this.nearConvergenceScore = score;
        return this;
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public OptimizerConfig validate() {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be >= 2, got " + windowSize);
        }
        if (minImprovementRate < 0.0) {
            throw new IllegalArgumentException("minImprovementRate must be >= 0, got " + minImprovementRate);
        }
        if (convergenceThreshold < 0.0 || convergenceThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "convergenceThreshold must be in [0, 1], got " + convergenceThreshold);
        }
        return this;
    }

    @Override
    public String toString() {
        return "OptimizerConfig{" +
                "windowSize=" + windowSize +
                ", minImprovementRate=" + minImprovementRate +
                ", convergenceThreshold=" + convergenceThreshold +
                ", dimensionThreshold=" + dimensionThreshold +
                '}';
    }
}
