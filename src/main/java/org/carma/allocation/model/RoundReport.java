package org.carma.allocation.model;

import java.util.*;

/**
 * Result of one scheduling round.
 *
 * Contains:
 * - Every decision taken in the round (deciding and revising phases)
 * - Profit change and running profit
 * - Per-plan utilization and the dual price deficit
 * - Queries and plans found infeasible
 *
 * A report is filled in while its round runs and frozen once the round is
 * committed to the trace; setters on a frozen report throw.
 */
public class RoundReport {

    public enum Outcome {
        ASSIGNED,
        REJECTED,
        DEFERRED,
        REACTIVATED,
        MIGRATED
    }

    /**
     * One decision. {@code planId} is the plan the query ended on (null when it is
     * not active), {@code previousPlanId} is only set for migrations.
     */
    public record DecisionRecord(
            String queryId,
            Outcome outcome,
            String planId,
            String previousPlanId
    ) {
        public static DecisionRecord of(String queryId, Outcome outcome, String planId) {
            return new DecisionRecord(queryId, outcome, planId, null);
        }
    }

    private final int round;
    private final AllocationMode mode;
    private final List<DecisionRecord> decisions;
    private final Map<String, Double> utilization;
    private final List<String> infeasibleQueries;
    private final List<String> infeasiblePlans;
    private double profitDelta;
    private double profit;
    private double deficit;
    private int promotions;
    private int migrations;
    private boolean converged;
    private volatile boolean frozen;

    public RoundReport(int round, AllocationMode mode) {
        this.round = round;
        this.mode = mode;
        this.decisions = new ArrayList<>();
        this.utilization = new LinkedHashMap<>();
        this.infeasibleQueries = new ArrayList<>();
        this.infeasiblePlans = new ArrayList<>();
        this.converged = true;
    }

    // ========================================================================
    // Builder-style setters
    // ========================================================================

    public RoundReport addDecision(DecisionRecord decision) {
        requireOpen();
        decisions.add(decision);
        return this;
    }

    public RoundReport addInfeasibleQuery(String queryId) {
        requireOpen();
        infeasibleQueries.add(queryId);
        return this;
    }

    public RoundReport addInfeasiblePlan(String planId) {
        requireOpen();
        infeasiblePlans.add(planId);
        return this;
    }

    public RoundReport setUtilization(String planId, double ratio) {
        requireOpen();
        utilization.put(planId, ratio);
        return this;
    }

    public RoundReport setProfitDelta(double profitDelta) {
        requireOpen();
        this.profitDelta = profitDelta;
        return this;
    }

    public RoundReport setProfit(double profit) {
        requireOpen();
        this.profit = profit;
        return this;
    }

    public RoundReport setDeficit(double deficit) {
        requireOpen();
        this.deficit = deficit;
        return this;
    }

    public RoundReport setPromotions(int promotions) {
        requireOpen();
        this.promotions = promotions;
        return this;
    }

    public RoundReport setMigrations(int migrations) {
        requireOpen();
        this.migrations = migrations;
        return this;
    }

    public RoundReport setConverged(boolean converged) {
        requireOpen();
        this.converged = converged;
        return this;
    }

    /**
     * Make the report read-only. Idempotent.
     */
    public RoundReport freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void requireOpen() {
        if (frozen) {
            throw new IllegalStateException("Round " + round + " is committed and can no longer change");
        }
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public int getRound() { return round; }
    public AllocationMode getMode() { return mode; }
    public double getProfitDelta() { return profitDelta; }
    public double getProfit() { return profit; }
    public double getDeficit() { return deficit; }
    public int getPromotions() { return promotions; }
    public int getMigrations() { return migrations; }
    public boolean isConverged() { return converged; }

    public List<DecisionRecord> getDecisions() {
        return Collections.unmodifiableList(decisions);
    }

    public Map<String, Double> getUtilization() {
        return Collections.unmodifiableMap(utilization);
    }

    public double getUtilization(String planId) {
        return utilization.getOrDefault(planId, 0.0);
    }

    public List<String> getInfeasibleQueries() {
        return Collections.unmodifiableList(infeasibleQueries);
    }

    public List<String> getInfeasiblePlans() {
        return Collections.unmodifiableList(infeasiblePlans);
    }

    /**
     * Last decision recorded for a query in this round.
     */
    public Optional<DecisionRecord> getDecision(String queryId) {
        DecisionRecord found = null;
        for (DecisionRecord d : decisions) {
            if (d.queryId().equals(queryId)) {
                found = d;
            }
        }
        return Optional.ofNullable(found);
    }

    public int count(Outcome outcome) {
        return (int) decisions.stream().filter(d -> d.outcome() == outcome).count();
    }

    /**
     * True when the round neither activated, rejected nor moved any query.
     */
    public boolean isQuiet() {
        return count(Outcome.ASSIGNED) + count(Outcome.REJECTED)
            + promotions + migrations == 0;
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("RoundReport[").append(round).append(", ").append(mode).append("]:\n");
        sb.append("  Decisions: ").append(decisions.size())
          .append(" (assigned=").append(count(Outcome.ASSIGNED))
          .append(", rejected=").append(count(Outcome.REJECTED))
          .append(", deferred=").append(count(Outcome.DEFERRED))
          .append(", reactivated=").append(promotions)
          .append(", migrated=").append(migrations).append(")\n");
        sb.append("  Profit: ").append(String.format("%.4f (%+.4f)", profit, profitDelta)).append("\n");
        sb.append("  Deficit: ").append(String.format("%.6f", deficit)).append("\n");
        sb.append("  Utilization:\n");
        for (var entry : utilization.entrySet()) {
            sb.append(String.format("    %s: %.1f%%\n", entry.getKey(), entry.getValue() * 100));
        }
        if (!infeasiblePlans.isEmpty()) {
            sb.append("  Infeasible plans: ").append(infeasiblePlans).append("\n");
        }
        if (!infeasibleQueries.isEmpty()) {
            sb.append("  Infeasible queries: ").append(infeasibleQueries).append("\n");
        }
        if (!converged) {
            sb.append("  Revision did not converge\n");
        }
        return sb.toString();
    }
}
