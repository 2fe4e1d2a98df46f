package refinery.engine.session;

import refinery.engine.config.SessionConfig;
import refinery.engine.model.SessionContext;
import refinery.engine.model.SessionResult;

/**
 * Runs one session for one input. {@link Session} is the standard implementation.
 */
@FunctionalInterface
public interface SessionRunner<I, A> {

    SessionResult<A> run(I input, SessionContext<A> context, SessionConfig config);
}
