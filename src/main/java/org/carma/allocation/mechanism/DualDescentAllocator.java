package org.carma.allocation.mechanism;

import org.carma.allocation.model.Decision;
import org.carma.allocation.model.Query;

/**
 * Online primal-dual assignment of revealed queries to plans.
 *
 * Reduced profit of query i on plan j:
 * <pre>
 *   r_ij = value_i − c_ij − phi_j · c_ij − a_i · [i never active]
 * </pre>
 * The query goes to the feasible plan with the largest reduced profit when
 * that profit is strictly positive, ties broken by lowest plan index.
 * Otherwise it is rejected.
 *
 * After an assignment the dual price of the chosen plan rises if the plan is
 * now congested.
 */
public class DualDescentAllocator {

    /**
     * Best feasible placement of a query under current prices.
     */
    public record Candidate(
            String queryId,
            int planIndex,
            double reducedProfit,
            double charge
    ) {
    }

    // ========================================================================
    // Decision
    // ========================================================================

    /**
     * Decide a pending query and apply the decision to the price state and ledger.
     */
    public Decision decide(Query query, PriceState priceState, AllocationLedger ledger) {
        String id = query.getId();

        if (query.hasUnknownCost()) {
            return new Decision.Defer(id);
        }

        Candidate best = evaluate(query, priceState, ledger);
        if (best != null && best.reducedProfit() > 0) {
            ledger.activate(id, best.planIndex(), priceState);
            priceState.raiseIfCongested(best.planIndex());
            return new Decision.Assign(id, best.planIndex(), best.reducedProfit(), best.charge());
        }

        boolean permanent = !fitsAnyEmptyPlan(query, priceState, ledger);
        ledger.reject(id, permanent);
        return new Decision.Reject(id, permanent);
    }

    // ========================================================================
    // Evaluation
    // ========================================================================

    /**
     * Find the feasible plan with the highest reduced profit.
     *
     * @return best candidate, or null if no plan can take the query
     */
    public Candidate evaluate(Query query, PriceState priceState, AllocationLedger ledger) {
        Candidate best = null;

        for (int j = 0; j < priceState.getPlanCount(); j++) {
            double cost = query.getAssignmentCost(j);
            if (Double.isNaN(cost)) continue;

            double charge = ledger.chargeFor(query, j);
            if (!priceState.fits(j, charge)) continue;

            double reduced = reducedProfit(query, j, priceState, ledger);
            // Strict comparison keeps the lowest index on ties
            if (best == null || reduced > best.reducedProfit()) {
                best = new Candidate(query.getId(), j, reduced, charge);
            }
        }

        return best;
    }

    /**
     * r_ij under current prices, charging activation only before the first activation.
     */
    public double reducedProfit(Query query, int planIndex, PriceState priceState, AllocationLedger ledger) {
        double activation = ledger.hasBeenActive(query.getId()) ? 0.0 : query.getActivationCost();
        return query.getValue()
            - priceState.weightedCost(planIndex, query.getAssignmentCost(planIndex))
            - activation;
    }

    /**
     * Whether some plan could hold the query if it were empty.
     */
    private boolean fitsAnyEmptyPlan(Query query, PriceState priceState, AllocationLedger ledger) {
        for (int j = 0; j < priceState.getPlanCount(); j++) {
            if (!priceState.getPlan(j).isUsable()) continue;
            if (ledger.chargeFor(query, j) <= priceState.getBudget(j) + InvariantMonitor.TOLERANCE) {
                return true;
            }
        }
        return false;
    }
}
