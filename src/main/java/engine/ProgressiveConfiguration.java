package engine;

import algorithms.PrefixAlgorithm;
import performance.MemoryModel;

import java.util.Objects;

// Immutable settings for a progressive run. The algorithm is kept as its raw identifier so that
// an unknown one can be reported in the run result rather than rejected here.
public final class ProgressiveConfiguration {

    private final String algorithm;
    private final boolean includePerformance;
    private final MemoryModel memoryModel;

    private ProgressiveConfiguration(Builder builder) {
        this.algorithm = Objects.requireNonNull(builder.algorithm, "algorithm");
        this.includePerformance = builder.includePerformance;
        this.memoryModel = Objects.requireNonNull(builder.memoryModel, "memoryModel");
    }

    public static Builder builder() { return new Builder(); }

    public static ProgressiveConfiguration defaults() { return builder().build(); }

    public String algorithm() { return algorithm; }
    public boolean includePerformance() { return includePerformance; }
    public MemoryModel memoryModel() { return memoryModel; }

    public Builder toBuilder() {
        return builder()
                .algorithm(algorithm)
                .includePerformance(includePerformance)
                .memoryModel(memoryModel);
    }

    @Override
    public String toString() {
        return "ProgressiveConfiguration{algorithm=" + algorithm
                + ", includePerformance=" + includePerformance
                + ", memoryModel=" + memoryModel + "}";
    }

    public static final class Builder {
        private String algorithm = PrefixAlgorithm.DEFAULT.id();
        private boolean includePerformance;
        private MemoryModel memoryModel = MemoryModel.defaults();

        private Builder() {
        }

        // null selects the default algorithm
        public Builder algorithm(String algorithm) {
            this.algorithm = algorithm == null ? PrefixAlgorithm.DEFAULT.id() : algorithm;
            return this;
        }

        public Builder algorithm(PrefixAlgorithm algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm").id();
            return this;
        }

        public Builder includePerformance(boolean includePerformance) {
            this.includePerformance = includePerformance;
            return this;
        }

        public Builder memoryModel(MemoryModel memoryModel) {
            this.memoryModel = memoryModel;
            return this;
        }

        public ProgressiveConfiguration build() {
            return new ProgressiveConfiguration(this);
        }
    }
}
