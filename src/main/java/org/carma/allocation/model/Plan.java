package org.carma.allocation.model;

import java.util.Objects;

/**
 * A capacity-limited resource ("plan") that queries can be assigned to.
 *
 * Budgets are fixed for the lifetime of an engine. A budget change is modelled
 * as a new plan. Plans are identified for tie-breaking by their position in the
 * configured plan list, not by id.
 */
public class Plan {

    private final String id;
    private final double budget;

    public Plan(String id, double budget) {
        this.id = id;
        this.budget = budget;
    }

    public String getId() {
        return id;
    }

    public double getBudget() {
        return budget;
    }

    /**
     * A plan with no budget can never hold a query.
     */
    public boolean isUsable() {
        return budget > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Plan)) return false;
        Plan other = (Plan) o;
        return id.equals(other.id) && Double.compare(budget, other.budget) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, budget);
    }

    @Override
    public String toString() {
        return String.format("Plan[%s, budget=%.2f]", id, budget);
    }
}
