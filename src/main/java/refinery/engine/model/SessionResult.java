package refinery.engine.model;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one session.
 * {@code success} implies {@code bestArtifact != null}.
 */
public record SessionResult<A>(
        A bestArtifact,
        Score bestScore,
        List<SessionRound<A>> rounds,
        SessionState state,
        Duration elapsed) {

    public SessionResult {
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("session result needs a terminal state, got " + state);
        }
        if (state != SessionState.FAILED && (bestArtifact == null || bestScore == null)) {
            throw new IllegalArgumentException("successful session needs a best artifact and score");
        }
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    /** Zero-value failed result, used when a session could not run at all. */
    public static <A> SessionResult<A> failed(Duration elapsed) {
        return new SessionResult<>(null, null, List.of(), SessionState.FAILED, elapsed);
    }

    public boolean success() {
        return state != SessionState.FAILED;
    }

    public boolean converged() {
        return state == SessionState.CONVERGED;
    }

    /** Best overall score, 0.0 for failed sessions */
    public double bestOverall() {
        return bestScore != null ? bestScore.overall() : 0.0;
    }

    public int roundCount() {
        return rounds.size();
    }
}
