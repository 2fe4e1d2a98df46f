package refinery.engine.config;

/**
 * Configuration for a single produce/score/refine session.
 */
public final class SessionConfig {

    private int maxRounds = 5;
    private double convergenceThreshold = 0.85;

    private SessionConfig() {
    }

    public static SessionConfig defaults() {
        return new SessionConfig();
    }

    public static SessionConfig fromEnv() {
        SessionConfig config = new SessionConfig();

        String rounds = System.getenv("REFINERY_MAX_ROUNDS");
        if (rounds != null && !rounds.isBlank()) {
            config.maxRounds = Integer.parseInt(rounds.trim());
        }

        String threshold = System.getenv("REFINERY_CONVERGENCE_THRESHOLD");
        if (threshold != null && !threshold.isBlank()) {
            config.convergenceThreshold = Double.parseDouble(threshold.trim());
        }

        return config;
    }

    public int maxRounds() {
        return maxRounds;
    }

    public double convergenceThreshold() {
        return convergenceThreshold;
    }

    public SessionConfig withMaxRounds(int maxRounds) {
        this.maxRounds = maxRounds;
        return this;
    }

    public SessionConfig withConvergenceThreshold(double threshold) {
        this.convergenceThreshold = threshold;
        return this;
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public SessionConfig validate() {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be >= 1, got " + maxRounds);
        }
        if (convergenceThreshold < 0.0 || convergenceThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "convergenceThreshold must be in [0, 1], got " + convergenceThreshold);
        }
        return this;
    }

    @Override
    public String toString() {
        return "SessionConfig{maxRounds=" + maxRounds +
                ", convergenceThreshold=" + convergenceThreshold + '}';
    }
}
