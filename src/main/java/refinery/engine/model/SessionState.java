package refinery.engine.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Session lifecycle. Every state except RUNNING is terminal.
 */
public enum SessionState {
    /** Rounds are still being produced and scored */
    RUNNING,
    /** A round reached the convergence threshold */
    CONVERGED,
    /** Round limit reached with at least one scored artifact */
    EXHAUSTED,
    /** Round limit reached without any scored artifact */
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public boolean canTransitionTo(SessionState next) {
        return allowedNext().contains(next);
    }

    private Set<SessionState> allowedNext() {
        return this == RUNNING ? EnumSet.of(CONVERGED, EXHAUSTED, FAILED) : EnumSet.noneOf(SessionState.class);
    }
}
