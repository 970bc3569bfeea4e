package org.carma.allocation.mechanism;

import org.carma.allocation.model.Plan;
import org.carma.allocation.model.PriceUpdateParams;

import java.util.*;

/**
 * Holds the dual price and the consumed capacity of every plan.
 *
 * Dual prices follow plan congestion:
 * - Rise multiplicatively when a plan is filled past the high-utilization threshold
 * - Decay when freed budget brings a plan back under the threshold
 *
 * Consumption is only changed through {@link AllocationLedger} transitions,
 * which validate the budget invariant before committing.
 */
public class PriceState {

    private final List<Plan> plans;
    private final Map<String, Integer> indexById;
    private final PriceUpdateParams params;
    private final double[] prices;
    private final double[] consumed;
    private int raiseCount;
    private int decayCount;

    public PriceState(List<Plan> plans, PriceUpdateParams params) {
        this.plans = List.copyOf(plans);
        this.params = params;
        this.indexById = new HashMap<>();
        this.prices = new double[plans.size()];
        this.consumed = new double[plans.size()];
        for (int j = 0; j < plans.size(); j++) {
            indexById.put(plans.get(j).getId(), j);
            prices[j] = params.getInitialPrice();
        }
    }

    // ========================================================================
    // Plan Queries
    // ========================================================================

    public int getPlanCount() {
        return plans.size();
    }

    public Plan getPlan(int j) {
        return plans.get(j);
    }

    public List<Plan> getPlans() {
        return plans;
    }

    public int indexOf(String planId) {
        Integer j = indexById.get(planId);
        if (j == null) {
            throw new IllegalArgumentException("Unknown plan: " + planId);
        }
        return j;
    }

    public double getBudget(int j) {
        return plans.get(j).getBudget();
    }

    public double getConsumed(int j) {
        return consumed[j];
    }

    public double getRemaining(int j) {
        return getBudget(j) - consumed[j];
    }

    /**
     * Whether an additional charge fits in the plan's budget.
     */
    public boolean fits(int j, double charge) {
        return plans.get(j).isUsable()
            && consumed[j] + charge <= getBudget(j) + InvariantMonitor.TOLERANCE;
    }

    // ========================================================================
    // Utilization
    // ========================================================================

    /**
     * Consumed share of the budget (0.0 for plans without budget).
     */
    public double getUtilization(int j) {
        double budget = getBudget(j);
        if (budget <= 0) return 0.0;
        return consumed[j] / budget;
    }

    public boolean isCongested(int j) {
        return plans.get(j).isUsable() && getUtilization(j) >= params.getHighUtilization();
    }

    // ========================================================================
    // Dual Prices
    // ========================================================================

    public double getPrice(int j) {
        return prices[j];
    }

    /**
     * Dual-weighted cost of serving a cost on plan j: c · (1 + phi_j).
     */
    public double weightedCost(int j, double cost) {
        return cost + prices[j] * cost;
    }

    /**
     * Raise the price of a plan that is at or above the high-utilization threshold.
     *
     * @return true if the price changed
     */
    public boolean raiseIfCongested(int j) {
        if (!isCongested(j)) {
            return false;
        }
        prices[j] = prices[j] * (1 + params.getEpsilon()) + params.getDelta();
        raiseCount++;
        return true;
    }

    /**
     * Let the price of a plan that fell back under the threshold decay toward zero.
     *
     * @return true if the price changed
     */
    public boolean relaxIfUncongested(int j) {
        if (isCongested(j) || prices[j] <= 0) {
            return false;
        }
        prices[j] = Math.max(0.0, (prices[j] - params.getDelta()) / (1 + params.getEpsilon()));
        decayCount++;
        return true;
    }

    /**
     * Price plan j would have after releasing a charge, without changing state.
     */
    public double priceAfterRemoval(int j, double charge) {
        if (isCongestedAt(j, consumed[j] - charge) || prices[j] <= 0) {
            return prices[j];
        }
        return Math.max(0.0, (prices[j] - params.getDelta()) / (1 + params.getEpsilon()));
    }

    /**
     * Price plan j would have after taking on a charge, without changing state.
     */
    public double priceAfterAddition(int j, double charge) {
        if (!isCongestedAt(j, consumed[j] + charge)) {
            return prices[j];
        }
        return prices[j] * (1 + params.getEpsilon()) + params.getDelta();
    }

    private boolean isCongestedAt(int j, double consumption) {
        double budget = getBudget(j);
        return plans.get(j).isUsable() && budget > 0 && consumption / budget >= params.getHighUtilization();
    }

    public double[] snapshotPrices() {
        return prices.clone();
    }

    public double[] snapshotConsumed() {
        return consumed.clone();
    }

    /**
     * L1 distance between the current prices and an earlier snapshot.
     */
    public double distanceFrom(double[] earlierPrices) {
        double distance = 0;
        for (int j = 0; j < prices.length; j++) {
            distance += Math.abs(prices[j] - earlierPrices[j]);
        }
        return distance;
    }

    public int getRaiseCount() {
        return raiseCount;
    }

    public int getDecayCount() {
        return decayCount;
    }

    public PriceUpdateParams getParams() {
        return params;
    }

    // ========================================================================
    // Consumption (ledger only)
    // ========================================================================

    /**
     * Stored as given; a negative value is left for {@link InvariantMonitor} to report.
     */
    void setConsumed(int j, double value) {
        consumed[j] = value;
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PriceState[\n");
        for (int j = 0; j < plans.size(); j++) {
            sb.append(String.format("  %s: consumed=%.2f/%.2f (%.1f%%), phi=%.4f\n",
                plans.get(j).getId(), consumed[j], getBudget(j), getUtilization(j) * 100, prices[j]));
        }
        sb.append("]");
        return sb.toString();
    }
}
