package refinery.engine.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable context handed to every produce call.
 * Sessions derive a fresh context per round (prior artifacts and hints change).
 */
public final class SessionContext<A> {
    private final String dataType;
    private final String mode;
    private final String domain;
    private final List<A> priorArtifacts;
    private final List<String> hints;

    private SessionContext(Builder<A> builder) {
        this.dataType = builder.dataType;
        this.mode = builder.mode;
        this.domain = builder.domain;
        this.priorArtifacts = List.copyOf(builder.priorArtifacts);
        this.hints = List.copyOf(builder.hints);
    }

    public String dataType() {
        return dataType;
    }

    public String mode() {
        return mode;
    }

    public String domain() {
        return domain;
    }

    public List<A> priorArtifacts() {
        return priorArtifacts;
    }

    public List<String> hints() {
        return hints;
    }

    /** Copy of this context with one more prior artifact */
    public SessionContext<A> withPriorArtifact(A artifact) {
        return toBuilder().priorArtifact(artifact).build();
    }

    /** Copy of this context with the hint list replaced */
    public SessionContext<A> withHints(List<String> hints) {
        return toBuilder().hints(hints).build();
    }

    public Builder<A> toBuilder() {
        return new Builder<A>()
                .dataType(dataType)
                .mode(mode)
                .domain(domain)
                .priorArtifacts(priorArtifacts)
                .hints(hints);
    }

    public static <A> SessionContext<A> empty() {
        return new Builder<A>().build();
    }

    public static <A> Builder<A> builder() {
        return new Builder<>();
    }

    public static final class Builder<A> {
        private String dataType = "text";
        private String mode = "default";
        private String domain = "general";
        private List<A> priorArtifacts = new ArrayList<>();
        private List<String> hints = new ArrayList<>();

        public Builder<A> dataType(String dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder<A> mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder<A> domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder<A> priorArtifacts(List<A> priorArtifacts) {
            this.priorArtifacts = new ArrayList<>(priorArtifacts);
            return this;
        }

        public Builder<A> priorArtifact(A artifact) {
            this.priorArtifacts.add(artifact);
            return this;
        }

        public Builder<A> hints(List<String> hints) {
            this.hints = new ArrayList<>(hints);
            return this;
        }

        public Builder<A> hint(String hint) {
            this.hints.add(hint);
            return this;
        }

        public SessionContext<A> build() {
            return new SessionContext<>(this);
        }
    }

    @Override
    public String toString() {
        return "SessionContext{dataType='" + dataType + "', mode='" + mode + "', domain='" + domain +
                "', priorArtifacts=" + priorArtifacts.size() + ", hints=" + hints + '}';
    }
}
