package org.carma.allocation.mechanism;

import java.util.*;

/**
 * A pass that revisits earlier decisions under the current dual prices.
 *
 * Implementations:
 * - {@link ReactivationStrategy}: rejected → active
 * - {@link ReassignmentStrategy}: active on one plan → active on another
 *
 * A pass never decreases profit, never exceeds a plan budget and allocates at
 * most {@code thresholdBudget} of additional budget. Passes repeat sweeps until
 * a sweep changes nothing, bounded by the configured iteration cap.
 */
public interface RevisionStrategy {

    /**
     * Result of one revision pass.
     */
    class RevisionOutcome {

        /**
         * One applied revision. {@code fromPlan} is UNASSIGNED for promotions.
         */
        public record Change(
                String queryId,
                int fromPlan,
                int toPlan,
                double profitDelta,
                double budgetUsed
        ) {
        }

        private final String strategy;
        private final List<Change> changes;
        private final int sweeps;
        private final boolean converged;

        public RevisionOutcome(String strategy, List<Change> changes, int sweeps, boolean converged) {
            this.strategy = strategy;
            this.changes = List.copyOf(changes);
            this.sweeps = sweeps;
            this.converged = converged;
        }

        public static RevisionOutcome empty(String strategy) {
            return new RevisionOutcome(strategy, Collections.emptyList(), 0, true);
        }

        public String getStrategy() { return strategy; }
        public List<Change> getChanges() { return changes; }
        public int getCount() { return changes.size(); }
        public int getSweeps() { return sweeps; }
        public boolean isConverged() { return converged; }

        public double getProfitDelta() {
            return changes.stream().mapToDouble(Change::profitDelta).sum();
        }

        public double getBudgetUsed() {
            return changes.stream().mapToDouble(Change::budgetUsed).sum();
        }

        @Override
        public String toString() {
            return String.format("RevisionOutcome[%s: %d changes, %d sweeps, profit %+.4f, budget %.2f%s]",
                strategy, changes.size(), sweeps, getProfitDelta(), getBudgetUsed(),
                converged ? "" : ", not converged");
        }
    }

    /**
     * Run one pass over the ledger, mutating prices and ledger in place.
     *
     * @param thresholdBudget Additional budget this pass may allocate
     */
    RevisionOutcome revise(PriceState priceState, AllocationLedger ledger, double thresholdBudget);

    String getName();
}
