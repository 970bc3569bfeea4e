package org.carma.allocation.model;

/**
 * Parameters of the dual price update rule and the iteration caps of the engine.
 *
 * Price rule on a congested plan (utilization at or above {@code highUtilization}):
 * <pre>
 *   phi ← phi · (1 + epsilon) + delta
 * </pre>
 * and on a plan whose utilization dropped back below the threshold:
 * <pre>
 *   phi ← max(0, (phi − delta) / (1 + epsilon))
 * </pre>
 *
 * Fixed at engine construction.
 */
public class PriceUpdateParams {

    public static final PriceUpdateParams DEFAULT = new Builder().build();

    private final double epsilon;
    private final double delta;
    private final double highUtilization;
    private final double initialPrice;
    private final double revisionBudget;
    private final int maxIterations;
    private final int maxRounds;
    private final double tolerance;

    private PriceUpdateParams(Builder builder) {
        this.epsilon = builder.epsilon;
        this.delta = builder.delta;
        this.highUtilization = builder.highUtilization;
        this.initialPrice = builder.initialPrice;
        this.revisionBudget = builder.revisionBudget;
        this.maxIterations = builder.maxIterations;
        this.maxRounds = builder.maxRounds;
        this.tolerance = builder.tolerance;
    }

    public double getEpsilon() { return epsilon; }
    public double getDelta() { return delta; }
    public double getHighUtilization() { return highUtilization; }
    public double getInitialPrice() { return initialPrice; }

    /** Budget the revision passes of one round may allocate in total. */
    public double getRevisionBudget() { return revisionBudget; }

    /** Sweep cap of a single revision pass. */
    public int getMaxIterations() { return maxIterations; }

    /** Cap on settling rounds after the input stream is exhausted in batch runs. */
    public int getMaxRounds() { return maxRounds; }

    /** Largest per-round price movement still considered stable. */
    public double getTolerance() { return tolerance; }

    public Builder toBuilder() {
        return new Builder()
            .epsilon(epsilon)
            .delta(delta)
            .highUtilization(highUtilization)
            .initialPrice(initialPrice)
            .revisionBudget(revisionBudget)
            .maxIterations(maxIterations)
            .maxRounds(maxRounds)
            .tolerance(tolerance);
    }

    @Override
    public String toString() {
        return String.format(
            "PriceUpdateParams[epsilon=%.4f, delta=%.4f, highUtilization=%.2f, initialPrice=%.4f, " +
            "revisionBudget=%s, maxIterations=%d, maxRounds=%d, tolerance=%.2e]",
            epsilon, delta, highUtilization, initialPrice,
            Double.isInfinite(revisionBudget) ? "unlimited" : String.format("%.2f", revisionBudget),
            maxIterations, maxRounds, tolerance);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private double epsilon = 0.1;
        private double delta = 0.01;
        private double highUtilization = 0.8;
        private double initialPrice = 0.0;
        private double revisionBudget = Double.POSITIVE_INFINITY;
        private int maxIterations = 100;
        private int maxRounds = 1000;
        private double tolerance = 1e-6;

        public Builder epsilon(double epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        public Builder delta(double delta) {
            this.delta = delta;
            return this;
        }

        public Builder highUtilization(double highUtilization) {
            this.highUtilization = highUtilization;
            return this;
        }

        public Builder initialPrice(double initialPrice) {
            this.initialPrice = initialPrice;
            return this;
        }

        public Builder revisionBudget(double revisionBudget) {
            this.revisionBudget = revisionBudget;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public PriceUpdateParams build() {
            return new PriceUpdateParams(this);
        }
    }
}
