package org.carma.allocation.mechanism;

import org.carma.allocation.model.Query;

import java.util.*;

/**
 * Migrates active queries whose current plan is no longer cost-optimal under
 * current prices.
 *
 * Both sides are priced as the move would leave them:
 * <pre>
 *   r_cur = value − c_cur − phi_cur' · c_cur    phi_cur' = price of j_cur once the query's charge is freed
 *   r_alt = value − c_alt − phi_alt' · c_alt    phi_alt' = price of j_alt once it holds the charge
 * </pre>
 * (activation is sunk once a query is active). A move happens only if
 * r_alt &gt; r_cur strictly, c_alt ≤ c_cur so realized profit cannot drop, and
 * j_alt can hold the migrated charge. Moving the query straight back would
 * price j_cur at least at phi_cur' and j_alt at most at phi_alt', so a move is
 * never reversed on its own and equal-cost plans cannot trade a query forever.
 */
public class ReassignmentStrategy implements RevisionStrategy {

    public static final String NAME = "reassignment";

    /** Minimum reduced-profit gain for a move, guards against float ping-pong. */
    private static final double MIN_GAIN = 1e-9;

    private final int maxIterations;
    private final boolean loggingEnabled;

    /**
     * A proposed move of an active query.
     */
    record Move(
            String queryId,
            int fromPlan,
            int toPlan,
            double targetReducedProfit,
            double gain,
            double charge
    ) {
    }

    public ReassignmentStrategy(int maxIterations) {
        this(maxIterations, false);
    }

    public ReassignmentStrategy(int maxIterations, boolean loggingEnabled) {
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
            int migrated = 0;

            for (Move ranked : rankMoves(priceState, ledger)) {
                Move current = bestMove(ranked.queryId(), priceState, ledger);
                if (current == null) {
                    continue;
                }
                if (current.charge() > remaining + InvariantMonitor.TOLERANCE) {
                    continue;
                }

                double delta = ledger.migrate(current.queryId(), current.toPlan(), priceState);
                priceState.relaxIfUncongested(current.fromPlan());
                priceState.raiseIfCongested(current.toPlan());
                remaining -= current.charge();
                migrated++;
                changes.add(new RevisionOutcome.Change(current.queryId(), current.fromPlan(),
                    current.toPlan(), delta, current.charge()));
                log("[REASSIGN] %s %s -> %s (gain %.4f)", current.queryId(),
                    priceState.getPlan(current.fromPlan()).getId(),
                    priceState.getPlan(current.toPlan()).getId(), current.gain());
            }

            if (migrated == 0) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log("[REASSIGN] stopped after %d sweeps without settling", sweeps);
        }
        return new RevisionOutcome(NAME, changes, sweeps, converged);
    }

    /**
     * Improving moves for all active queries, highest target reduced profit first.
     */
    List<Move> rankMoves(PriceState priceState, AllocationLedger ledger) {
        List<Move> moves = new ArrayList<>();
        for (String id : ledger.getActive()) {
            Move move = bestMove(id, priceState, ledger);
            if (move != null) {
                moves.add(move);
            }
        }
        moves.sort(Comparator
            .comparingDouble(Move::targetReducedProfit).reversed()
            .thenComparingInt(m -> ledger.getArrivalIndex(m.queryId())));
        return moves;
    }

    /**
     * Best strictly improving move for an active query, or null.
     */
    Move bestMove(String queryId, PriceState priceState, AllocationLedger ledger) {
        if (!ledger.isActive(queryId)) {
            return null;
        }
        Query query = ledger.getQuery(queryId);
        int from = ledger.getAssignment(queryId);
        double currentCost = query.getAssignmentCost(from);
        double activationPortion = ledger.getActivationCharged(queryId);
        double freedPrice = priceState.priceAfterRemoval(from, ledger.getCharge(queryId));
        double currentReduced = query.getValue() - currentCost * (1 + freedPrice);

        Move best = null;
        for (int j = 0; j < priceState.getPlanCount(); j++) {
            if (j == from) continue;
            double cost = query.getAssignmentCost(j);
            if (Double.isNaN(cost) || cost > currentCost) continue;

            double charge = cost + activationPortion;
            if (!priceState.fits(j, charge)) continue;

            double targetPrice = priceState.priceAfterAddition(j, charge);
            double reduced = query.getValue() - cost * (1 + targetPrice);
            if (reduced <= currentReduced + MIN_GAIN) continue;

            if (best == null || reduced > best.targetReducedProfit()) {
                best = new Move(queryId, from, j, reduced, reduced - currentReduced, charge);
            }
        }
        return best;
    }

    private void log(String format, Object... args) {
        if (loggingEnabled) {
            System.out.println(String.format(format, args));
        }
    }
}
