package org.carma.allocation.mechanism;

import org.carma.allocation.model.Query;

import java.util.*;

/**
 * Tracks every known query, its partition membership, its assignment and the
 * running profit.
 *
 * Partition:
 * - Active (X): assigned to a plan and counted in that plan's consumption
 * - Rejected (Y): evaluated and declined
 * - Pending (U): arrived but not yet decided
 *
 * All transitions go through this class. Each transition computes the new
 * consumption, validates it against the budget and only then commits, so no
 * intermediate state is ever observable. Profit is updated incrementally.
 */
public class AllocationLedger {

    public static final int UNASSIGNED = -1;

    private final InvariantMonitor monitor;
    private final Map<String, Query> queries;
    private final Map<String, Integer> arrivalIndex;
    private final Set<String> active;
    private final Set<String> rejected;
    private final Set<String> pending;
    private final Map<String, Integer> assignment;
    private final Map<String, Double> charges;
    private final Map<String, Double> activationCharged;
    private final Map<String, Double> contributions;
    private final Set<String> everActivated;
    private final Set<String> permanentlyRejected;
    private final Set<String> released;
    private double profit;

    public AllocationLedger(InvariantMonitor monitor) {
        this.monitor = monitor;
        this.queries = new LinkedHashMap<>();
        this.arrivalIndex = new HashMap<>();
        this.active = new LinkedHashSet<>();
        this.rejected = new LinkedHashSet<>();
        this.pending = new LinkedHashSet<>();
        this.assignment = new HashMap<>();
        this.charges = new HashMap<>();
        this.activationCharged = new HashMap<>();
        this.contributions = new HashMap<>();
        this.everActivated = new HashSet<>();
        this.permanentlyRejected = new HashSet<>();
        this.released = new HashSet<>();
    }

    // ========================================================================
    // Arrival
    // ========================================================================

    /**
     * Register a newly revealed query as pending.
     */
    public void admit(Query query) {
        if (queries.containsKey(query.getId())) {
            throw new IllegalArgumentException("Query already known: " + query.getId());
        }
        arrivalIndex.put(query.getId(), queries.size());
        queries.put(query.getId(), query);
        pending.add(query.getId());
    }

    /**
     * Replace the cost vector of a pending query once its costs are revealed.
     */
    public Query revealCosts(String queryId, double[] costs) {
        requireIn(pending, queryId, "pending");
        Query revealed = queries.get(queryId).withAssignmentCosts(costs);
        queries.put(queryId, revealed);
        return revealed;
    }

    // ========================================================================
    // Transitions
    // ========================================================================

    /**
     * Charge a query would pay on a plan if activated now.
     */
    public double chargeFor(Query query, int planIndex) {
        double cost = query.getAssignmentCost(planIndex);
        return hasBeenActive(query.getId()) ? cost : cost + query.getActivationCost();
    }

    /**
     * Move a pending or rejected query into the active set on a plan.
     *
     * @return realized profit contribution of the activation
     */
    public double activate(String queryId, int planIndex, PriceState priceState) {
        if (!pending.contains(queryId) && !rejected.contains(queryId)) {
            throw new IllegalStateException("Query " + queryId + " cannot be activated from its current state");
        }
        Query query = queries.get(queryId);
        boolean first = !hasBeenActive(queryId);
        double cost = query.getAssignmentCost(planIndex);
        double activation = first ? query.getActivationCost() : 0.0;
        double charge = cost + activation;
        double proposed = priceState.getConsumed(planIndex) + charge;

        monitor.requireWithinBudget(priceState, planIndex, proposed, queryId);

        priceState.setConsumed(planIndex, proposed);
        pending.remove(queryId);
        rejected.remove(queryId);
        active.add(queryId);
        assignment.put(queryId, planIndex);
        charges.put(queryId, charge);
        activationCharged.put(queryId, activation);
        double contribution = query.getValue() - cost - activation;
        contributions.put(queryId, contribution);
        everActivated.add(queryId);
        profit += contribution;
        return contribution;
    }

    /**
     * Move a pending query into the rejected set.
     *
     * @param permanent the query can never fit any plan and is never reconsidered
     */
    public void reject(String queryId, boolean permanent) {
        requireIn(pending, queryId, "pending");
        pending.remove(queryId);
        rejected.add(queryId);
        if (permanent) {
            permanentlyRejected.add(queryId);
        }
    }

    /**
     * Move an active query to another plan. The activation cost already paid
     * travels with the query.
     *
     * @return profit change (cost on the old plan minus cost on the new one)
     */
    public double migrate(String queryId, int targetPlan, PriceState priceState) {
        requireIn(active, queryId, "active");
        int currentPlan = assignment.get(queryId);
        if (currentPlan == targetPlan) {
            throw new IllegalArgumentException("Query " + queryId + " is already on plan " + targetPlan);
        }
        Query query = queries.get(queryId);
        double oldCharge = charges.get(queryId);
        double newCharge = query.getAssignmentCost(targetPlan) + activationCharged.get(queryId);
        double freed = priceState.getConsumed(currentPlan) - oldCharge;
        double proposed = priceState.getConsumed(targetPlan) + newCharge;

        monitor.requireWithinBudget(priceState, targetPlan, proposed, queryId);

        priceState.setConsumed(currentPlan, freed);
        priceState.setConsumed(targetPlan, proposed);
        assignment.put(queryId, targetPlan);
        charges.put(queryId, newCharge);
        double delta = query.getAssignmentCost(currentPlan) - query.getAssignmentCost(targetPlan);
        contributions.merge(queryId, delta, Double::sum);
        profit += delta;
        return delta;
    }

    /**
     * Withdraw an active query from consideration. Its budget is freed, its
     * contribution leaves the profit and it is never reactivated.
     *
     * @return plan the query was released from
     */
    public int release(String queryId, PriceState priceState) {
        requireIn(active, queryId, "active");
        int plan = assignment.remove(queryId);
        priceState.setConsumed(plan, priceState.getConsumed(plan) - charges.remove(queryId));
        activationCharged.remove(queryId);
        profit -= contributions.remove(queryId);
        active.remove(queryId);
        rejected.add(queryId);
        released.add(queryId);
        return plan;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public Query getQuery(String queryId) {
        Query query = queries.get(queryId);
        if (query == null) {
            throw new IllegalArgumentException("Unknown query: " + queryId);
        }
        return query;
    }

    public boolean isKnown(String queryId) {
        return queries.containsKey(queryId);
    }

    public boolean isActive(String queryId) { return active.contains(queryId); }
    public boolean isRejected(String queryId) { return rejected.contains(queryId); }
    public boolean isPending(String queryId) { return pending.contains(queryId); }

    public boolean hasBeenActive(String queryId) {
        return everActivated.contains(queryId);
    }

    public boolean isPermanentlyRejected(String queryId) {
        return permanentlyRejected.contains(queryId);
    }

    public boolean isReleased(String queryId) {
        return released.contains(queryId);
    }

    /**
     * Rejected queries that may still be promoted.
     */
    public List<String> getReactivationCandidates() {
        List<String> candidates = new ArrayList<>();
        for (String id : rejected) {
            if (!permanentlyRejected.contains(id) && !released.contains(id)) {
                candidates.add(id);
            }
        }
        return candidates;
    }

    public int getAssignment(String queryId) {
        return assignment.getOrDefault(queryId, UNASSIGNED);
    }

    public double getCharge(String queryId) {
        return charges.getOrDefault(queryId, 0.0);
    }

    /**
     * Activation cost paid by an active query in its current activation.
     */
    public double getActivationCharged(String queryId) {
        return activationCharged.getOrDefault(queryId, 0.0);
    }

    public double getContribution(String queryId) {
        return contributions.getOrDefault(queryId, 0.0);
    }

    public int getArrivalIndex(String queryId) {
        return arrivalIndex.getOrDefault(queryId, Integer.MAX_VALUE);
    }

    public List<String> getKnownQueryIds() {
        return new ArrayList<>(queries.keySet());
    }

    public List<String> getActive() { return new ArrayList<>(active); }
    public List<String> getRejected() { return new ArrayList<>(rejected); }
    public List<String> getPending() { return new ArrayList<>(pending); }

    public int getActiveCount() { return active.size(); }
    public int getRejectedCount() { return rejected.size(); }
    public int getPendingCount() { return pending.size(); }

    public double getProfit() {
        return profit;
    }

    private void requireIn(Set<String> set, String queryId, String setName) {
        if (!set.contains(queryId)) {
            throw new IllegalStateException("Query " + queryId + " is not " + setName);
        }
    }

    @Override
    public String toString() {
        return String.format("AllocationLedger[active=%d, rejected=%d, pending=%d, profit=%.4f]",
            active.size(), rejected.size(), pending.size(), profit);
    }
}
