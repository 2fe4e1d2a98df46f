package refinery.engine.optimizer;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of the average score over the analysis window.
 */
public enum Trend {
    /** Latest score exceeds the window's first by more than the minimum improvement rate */
    IMPROVING("improving"),
    /** Change within plus or minus the minimum improvement rate */
    STABLE("stable"),
    /** Latest score is below the window's first by more than the minimum improvement rate */
    DECLINING("declining"),
    /** First recorded batch; nothing to compare against */
    BASELINE("baseline"),
    /** Empty batch, or fewer than two batches for trend analysis */
    INSUFFICIENT_DATA("insufficient_data"),
    /** Batch had sessions but none produced a score */
    NO_SCORES("no_scores");

    private final String label;

    Trend(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
