package refinery.engine.session;

import refinery.engine.model.ProduceOutcome;
import refinery.engine.model.Score;
import refinery.engine.model.SessionContext;

/**
 * The two external capabilities a session drives.
 *
 * @param <I> input type
 * @param <A> artifact type
 */
public interface ProducerScorer<I, A> {

    /**
     * Turn an input into a candidate artifact.
     * Expected failures are reported with {@link ProduceOutcome#failure(String)}.
     */
    ProduceOutcome<A> produce(I input, SessionContext<A> context);

    /**
     * Evaluate an artifact.
     */
    Score score(A artifact);
}
