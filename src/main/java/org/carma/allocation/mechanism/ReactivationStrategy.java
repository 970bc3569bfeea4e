package org.carma.allocation.mechanism;

import org.carma.allocation.model.Query;

import java.util.*;

/**
 * Promotes rejected queries that have become profitable under current prices.
 *
 * Each sweep ranks the positive candidates by reduced profit (highest first,
 * arrival order on ties) and re-evaluates each one at the moment it is
 * processed, since earlier promotions in the same sweep consume budget and
 * raise prices. Queries that can never fit a plan and queries released by the
 * host are not candidates.
 */
public class ReactivationStrategy implements RevisionStrategy {

    public static final String NAME = "reactivation";

    private final DualDescentAllocator allocator;
    private final int maxIterations;
    private final boolean loggingEnabled;

    public ReactivationStrategy(DualDescentAllocator allocator, int maxIterations) {
        this(allocator, maxIterations, false);
    }

    public ReactivationStrategy(DualDescentAllocator allocator, int maxIterations, boolean loggingEnabled) {
        this.allocator = allocator;
        this.maxIterations = maxIterations;
        this.loggingEnabled = loggingEnabled;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RevisionOutcome revise(PriceState priceState, AllocationLedger ledger, double thresholdBudget) {
        List<RevisionOutcome.Change> changes = new ArrayList<>();
        double remaining = thresholdBudget;
        int sweeps = 0;
        boolean converged = false;

        while (sweeps < maxIterations) {
            sweeps++;
            int promoted = 0;

            for (DualDescentAllocator.Candidate ranked : rankCandidates(priceState, ledger)) {
                Query query = ledger.getQuery(ranked.queryId());
                DualDescentAllocator.Candidate current = allocator.evaluate(query, priceState, ledger);
                if (current == null || current.reducedProfit() <= 0) {
                    continue;
                }
                if (current.charge() > remaining + InvariantMonitor.TOLERANCE) {
                    continue;
                }

                double contribution = ledger.activate(query.getId(), current.planIndex(), priceState);
                priceState.raiseIfCongested(current.planIndex());
                remaining -= current.charge();
                promoted++;
                changes.add(new RevisionOutcome.Change(query.getId(), AllocationLedger.UNASSIGNED,
                    current.planIndex(), contribution, current.charge()));
                log("[REACTIVATE] %s -> %s (reduced profit %.4f)",
                    query.getId(), priceState.getPlan(current.planIndex()).getId(), current.reducedProfit());
            }

            if (promoted == 0) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log("[REACTIVATE] stopped after %d sweeps without settling", sweeps);
        }
        return new RevisionOutcome(NAME, changes, sweeps, converged);
    }

    /**
     * Rejected queries with a positive reduced profit on some feasible plan,
     * best first.
     */
    List<DualDescentAllocator.Candidate> rankCandidates(PriceState priceState, AllocationLedger ledger) {
        List<DualDescentAllocator.Candidate> ranked = new ArrayList<>();
        for (String id : ledger.getReactivationCandidates()) {
            Query query = ledger.getQuery(id);
            if (query.hasUnknownCost()) continue;
            DualDescentAllocator.Candidate candidate = allocator.evaluate(query, priceState, ledger);
            if (candidate != null && candidate.reducedProfit() > 0) {
                ranked.add(candidate);
            }
        }
        ranked.sort(Comparator
            .comparingDouble(DualDescentAllocator.Candidate::reducedProfit).reversed()
            .thenComparingInt(c -> ledger.getArrivalIndex(c.queryId())));
        return ranked;
    }

    private void log(String format, Object... args) {
        if (loggingEnabled) {
            System.out.println(String.format(format, args));
        }
    }
}
