package refinery.engine.session;

import refinery.engine.config.SessionConfig;
import refinery.engine.model.ProduceOutcome;
import refinery.engine.model.Score;
import refinery.engine.model.SessionContext;
import refinery.engine.model.SessionResult;
import refinery.engine.model.SessionRound;
import refinery.engine.model.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Produce/score/refine loop for a single input.
 *
 * <p>Each round calls produce, scores the artifact and keeps the best one.
 * A round that reaches the convergence threshold ends the session; otherwise
 * the artifact is added to the prior artifacts and the round's top three
 * recommendations become the hints for the next produce call.
 *
 * <p>Exceptions from produce or score are recorded on the round and never
 * leave {@link #run}.
 */
public class Session<I, A> implements SessionRunner<I, A> {

    static final int FEEDBACK_HINTS = 3;

    private final ProducerScorer<I, A> producerScorer;
    private final Logger log;

    public Session(ProducerScorer<I, A> producerScorer) {
        this(producerScorer, LoggerFactory.getLogger(Session.class));
    }

    public Session(ProducerScorer<I, A> producerScorer, Logger log) {
        this.producerScorer = Objects.requireNonNull(producerScorer, "producerScorer is required");
        this.log = log;
    }

    @Override
    public SessionResult<A> run(I input, SessionContext<A> context, SessionConfig config) {
        config.validate();
        Instant start = Instant.now();

        SessionContext<A> baseContext = context != null ? context : SessionContext.empty();
        List<String> baseHints = baseContext.hints();
        SessionContext<A> current = baseContext;

        List<SessionRound<A>> rounds = new ArrayList<>();
        A bestArtifact = null;
        Score bestScore = null;
        SessionState state = SessionState.RUNNING;

        for (int round = 1; round <= config.maxRounds(); round++) {
            // 1. Produce
            ProduceOutcome<A> outcome;
            try {
                outcome = producerScorer.produce(input, current);
            } catch (Exception e) {
                log.warn("Round {}/{}: produce threw {}", round, config.maxRounds(), e.toString());
                rounds.add(SessionRound.failed(round, null, "produce error: " + e.getMessage()));
                continue;
            }
            if (outcome == null || !outcome.isSuccess()) {
                String reason = outcome == null ? "produce returned nothing" : outcome.failureReason();
                log.debug("Round {}/{}: produce failed: {}", round, config.maxRounds(), reason);
                rounds.add(SessionRound.failed(round, null, reason));
                continue;
            }
            A artifact = outcome.artifact();

            // 2. Score
            Score score;
            try {
                score = producerScorer.score(artifact);
            } catch (Exception e) {
                log.warn("Round {}/{}: score threw {}", round, config.maxRounds(), e.toString());
                rounds.add(SessionRound.failed(round, artifact, "score error: " + e.getMessage()));
                continue;
            }
            if (score == null) {
                rounds.add(SessionRound.failed(round, artifact, "score returned nothing"));
                continue;
            }

            rounds.add(SessionRound.scored(round, artifact, score));
            log.debug("Round {}/{}: score {}", round, config.maxRounds(), score.overall());

            if (bestScore == null || score.overall() > bestScore.overall()) {
                bestArtifact = artifact;
                bestScore = score;
            }

            // 3. Converged?
            if (score.overall() >= config.convergenceThreshold()) {
                state = advance(state, SessionState.CONVERGED);
                break;
            }

            // 4. Feed back into the next round
            List<String> hints = new ArrayList<>(baseHints);
            hints.addAll(score.topRecommendations(FEEDBACK_HINTS));
            current = current.toBuilder()
                    .priorArtifact(artifact)
                    .hints(hints)
                    .build();
        }

        if (state == SessionState.RUNNING) {
            state = advance(state, bestArtifact != null ? SessionState.EXHAUSTED : SessionState.FAILED);
        }

        Duration elapsed = Duration.between(start, Instant.now());
        switch (state) {
            case CONVERGED -> log.info("Session converged after {} rounds (score {})",
                    rounds.size(), bestScore.overall());
            case EXHAUSTED -> log.info("Session exhausted {} rounds, best score {}",
                    rounds.size(), bestScore.overall());
            default -> log.warn("Session failed: no scoreable artifact in {} rounds", rounds.size());
        }

        return new SessionResult<>(bestArtifact, bestScore, rounds, state, elapsed);
    }

    private static SessionState advance(SessionState from, SessionState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal session transition " + from + " -> " + to);
        }
        return to;
    }
}
