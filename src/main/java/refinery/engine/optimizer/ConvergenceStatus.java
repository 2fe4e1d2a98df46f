package refinery.engine.optimizer;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConvergenceStatus {
    CONVERGED("converged"),
    NEAR_CONVERGENCE("near_convergence"),
    NOT_CONVERGED("not_converged");

    private final String label;

    ConvergenceStatus(String label) {
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
