package refinery.engine.model;

import java.util.List;
import java.util.Map;

/**
 * One produce/score iteration of a session. Immutable once appended.
 *
 * @param round    1-based round index
 * @param artifact produced artifact, or null if produce failed
 * @param score    evaluation, or null if nothing was scored
 * @param error    failure reason for unsuccessful rounds, otherwise null
 */
public record SessionRound<A>(int round, A artifact, Score score, String error) {

    public static <A> SessionRound<A> scored(int round, A artifact, Score score) {
        return new SessionRound<>(round, artifact, score, null);
    }

    public static <A> SessionRound<A> failed(int round, A artifact, String error) {
        return new SessionRound<>(round, artifact, null, error);
    }

    public boolean successful() {
        return score != null;
    }

    public double overall() {
        return score != null ? score.overall() : 0.0;
    }

    public Map<String, Double> dimensions() {
        return score != null ? score.dimensions() : Map.of();
    }

    public List<String> strengths() {
        return score != null ? score.strengths() : List.of();
    }

    public List<String> weaknesses() {
        return score != null ? score.weaknesses() : List.of();
    }

    public List<String> recommendations() {
        return score != null ? score.recommendations() : List.of();
    }
}
