package tree;

import java.util.Objects;

// Immutable configuration for suffix tree builders.
public final class SuffixTreeConfiguration {

    private static final SuffixTreeConfiguration DEFAULTS = builder().build();

    private final LeafEndMode leafEndMode;
    private final int initialCapacity;
    private final boolean traceLogging;
    private final boolean verifyInvariants;

    private SuffixTreeConfiguration(Builder builder) {
        this.leafEndMode = Objects.requireNonNull(builder.leafEndMode, "leafEndMode");
        this.initialCapacity = builder.initialCapacity;
        this.traceLogging = builder.traceLogging;
        this.verifyInvariants = builder.verifyInvariants;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static SuffixTreeConfiguration defaults() { return DEFAULTS; }

    private void validate() {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
    }

    public LeafEndMode leafEndMode() { return leafEndMode; }
    public int initialCapacity() { return initialCapacity; }
    public boolean traceLogging() { return traceLogging; }
    public boolean verifyInvariants() { return verifyInvariants; }

    public Builder toBuilder() {
        return builder()
                .leafEndMode(leafEndMode)
                .initialCapacity(initialCapacity)
                .traceLogging(traceLogging)
                .verifyInvariants(verifyInvariants);
    }

    @Override
    public String toString() {
        return "SuffixTreeConfiguration{leafEndMode=" + leafEndMode
                + ", initialCapacity=" + initialCapacity
                + ", traceLogging=" + traceLogging
                + ", verifyInvariants=" + verifyInvariants + '}';
    }

    public static final class Builder {
        private LeafEndMode leafEndMode = LeafEndMode.OPEN;
        private int initialCapacity = 16;
        private boolean traceLogging;
        private boolean verifyInvariants;

        private Builder() {
        }

        public Builder leafEndMode(LeafEndMode leafEndMode) {
            this.leafEndMode = leafEndMode;
            return this;
        }

        // Expected number of symbols; pre-sizes the word and vertex arenas.
        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        // Log every phase at FINEST.
        public Builder traceLogging(boolean traceLogging) {
            this.traceLogging = traceLogging;
            return this;
        }

        // Run TreeValidator on every snapshot.
        public Builder verifyInvariants(boolean verifyInvariants) {
            this.verifyInvariants = verifyInvariants;
            return this;
        }

        public SuffixTreeConfiguration build() {
            return new SuffixTreeConfiguration(this);
        }
    }
}
