package refinery.engine.model;

import java.util.Objects;

/**
 * Tagged result of a produce call: either an artifact or a failure reason.
 */
public final class ProduceOutcome<A> {

    private final A artifact;
    private final String failureReason;

    private ProduceOutcome(A artifact, String failureReason) {
        this.artifact = artifact;
        this.failureReason = failureReason;
    }

    public static <A> ProduceOutcome<A> success(A artifact) {
        return new ProduceOutcome<>(Objects.requireNonNull(artifact, "artifact is required"), null);
    }

    public static <A> ProduceOutcome<A> failure(String reason) {
        return new ProduceOutcome<>(null, reason == null || reason.isBlank() ? "produce failed" : reason);
    }

    public boolean isSuccess() {
        return artifact != null;
    }

    public A artifact() {
        return artifact;
    }

    public String failureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ProduceOutcome{success}" : "ProduceOutcome{failure='" + failureReason + "'}";
    }
}
