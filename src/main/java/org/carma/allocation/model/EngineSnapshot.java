package org.carma.allocation.model;

import java.util.*;

/**
 * Read-only view of the engine state between rounds.
 */
public class EngineSnapshot {

    private final List<String> active;
    private final List<String> rejected;
    private final List<String> pending;
    private final List<String> queued;
    private final Map<String, String> assignment;
    private final Map<String, Double> prices;
    private final Map<String, Double> consumed;
    private final double profit;

    public EngineSnapshot(
            List<String> active,
            List<String> rejected,
            List<String> pending,
            List<String> queued,
            Map<String, String> assignment,
            Map<String, Double> prices,
            Map<String, Double> consumed,
            double profit) {
        this.active = List.copyOf(active);
        this.rejected = List.copyOf(rejected);
        this.pending = List.copyOf(pending);
        this.queued = List.copyOf(queued);
        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        this.prices = Collections.unmodifiableMap(new LinkedHashMap<>(prices));
        this.consumed = Collections.unmodifiableMap(new LinkedHashMap<>(consumed));
        this.profit = profit;
    }

    public List<String> getActive() { return active; }
    public List<String> getRejected() { return rejected; }
    public List<String> getPending() { return pending; }

    /** Submitted but not yet ingested by a round. */
    public List<String> getQueued() { return queued; }

    /** Active query id → plan id. */
    public Map<String, String> getAssignment() { return assignment; }

    public Map<String, Double> getPrices() { return prices; }
    public Map<String, Double> getConsumed() { return consumed; }
    public double getProfit() { return profit; }

    public Optional<String> getPlanOf(String queryId) {
        return Optional.ofNullable(assignment.get(queryId));
    }

    public double getPrice(String planId) {
        return prices.getOrDefault(planId, 0.0);
    }

    @Override
    public String toString() {
        return String.format("EngineSnapshot[active=%d, rejected=%d, pending=%d, queued=%d, profit=%.4f]",
            active.size(), rejected.size(), pending.size(), queued.size(), profit);
    }
}
