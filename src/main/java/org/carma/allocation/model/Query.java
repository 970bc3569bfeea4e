package org.carma.allocation.model;

import java.util.Arrays;

/**
 * A data-trading query revealed to the scheduler.
 *
 * Carries:
 * - Value earned while the query is active
 * - Assignment cost on each plan (indexed by plan position)
 * - One-time activation cost, paid the first time the query becomes active
 *
 * A cost of {@link Double#NaN} means the cost on that plan is not known yet.
 * Such a query can only be deferred until its costs are revealed.
 */
public class Query {

    private final String id;
    private final double value;
    private final double[] assignmentCosts;
    private final double activationCost;

    public Query(String id, double value, double[] assignmentCosts, double activationCost) {
        this.id = id;
        this.value = value;
        this.assignmentCosts = assignmentCosts == null ? new double[0] : assignmentCosts.clone();
        this.activationCost = activationCost;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public String getId() {
        return id;
    }

    public double getValue() {
        return value;
    }

    public double getActivationCost() {
        return activationCost;
    }

    public double getAssignmentCost(int planIndex) {
        return assignmentCosts[planIndex];
    }

    public double[] getAssignmentCosts() {
        return assignmentCosts.clone();
    }

    public int getPlanCount() {
        return assignmentCosts.length;
    }

    // ========================================================================
    // Derived Properties
    // ========================================================================

    public boolean hasUnknownCost() {
        for (double c : assignmentCosts) {
            if (Double.isNaN(c)) return true;
        }
        return false;
    }

    /**
     * Cheapest known assignment cost, or +inf if none is known.
     */
    public double getMinimumCost() {
        double min = Double.POSITIVE_INFINITY;
        for (double c : assignmentCosts) {
            if (!Double.isNaN(c) && c < min) {
                min = c;
            }
        }
        return min;
    }

    /**
     * Profit this query would realize on its cheapest plan, ignoring prices and budgets.
     */
    public double getStandaloneProfit() {
        return value - getMinimumCost() - activationCost;
    }

    /**
     * Same query with a newly revealed cost vector.
     */
    public Query withAssignmentCosts(double[] costs) {
        return new Query(id, value, costs, activationCost);
    }

    @Override
    public String toString() {
        return String.format("Query[%s, value=%.2f, costs=%s, activation=%.2f]",
            id, value, Arrays.toString(assignmentCosts), activationCost);
    }
}
