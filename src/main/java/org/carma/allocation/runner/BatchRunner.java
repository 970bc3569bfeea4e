package org.carma.allocation.runner;

import org.carma.allocation.model.*;
import org.carma.allocation.safety.ConfigurationException;
import org.carma.allocation.simulation.RoundTrace;

import java.util.*;

/**
 * Drives a whole query stream through an {@link AllocationEngine}.
 *
 * Online modes submit one query per round in stream order. OFFLINE submits
 * the whole batch in a single round. Once the stream is exhausted, online
 * modes keep running revision-only rounds until a round changes nothing and
 * moves prices by at most the configured tolerance, or until the round cap
 * is reached.
 *
 * Usage:
 * <pre>
 * BatchResult result = new BatchRunner().run(values, costs, activation, budgets, AllocationMode.BOTH);
 * </pre>
 */
public class BatchRunner {

    private final PriceUpdateParams params;
    private boolean verbose = false;

    public BatchRunner() {
        this(PriceUpdateParams.DEFAULT);
    }

    public BatchRunner(PriceUpdateParams params) {
        this.params = params;
    }

    public BatchRunner verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Run a stream given as arrays. Plans are named {@code plan-j} and
     * queries {@code q-i}; a NaN cost marks an unknown entry.
     *
     * @param values          value of each query
     * @param costMatrix      costMatrix[i][j] is the cost of query i on plan j
     * @param activationCosts one-time activation cost of each query
     * @param budgets         budget of each plan
     * @throws ConfigurationException if the dimensions disagree or an entry is malformed
     */
    public BatchResult run(double[] values, double[][] costMatrix, double[] activationCosts,
                           double[] budgets, AllocationMode mode) {
        if (values == null || costMatrix == null || activationCosts == null || budgets == null) {
            throw new ConfigurationException("Batch", "input", "values, costs, activation costs and budgets are required");
        }
        if (costMatrix.length != values.length) {
            throw new ConfigurationException("Batch", "costMatrix", String.format(
                "expected %d cost rows, got %d", values.length, costMatrix.length));
        }
        if (activationCosts.length != values.length) {
            throw new ConfigurationException("Batch", "activationCosts", String.format(
                "expected %d activation costs, got %d", values.length, activationCosts.length));
        }

        List<Plan> plans = new ArrayList<>(budgets.length);
        for (int j = 0; j < budgets.length; j++) {
            plans.add(new Plan("plan-" + j, budgets[j]));
        }
        List<Query> queries = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            queries.add(new Query("q-" + i, values[i], costMatrix[i], activationCosts[i]));
        }
        return run(plans, queries, mode);
    }

    /**
     * Run a stream of queries over the given plans.
     */
    public BatchResult run(List<Plan> plans, List<Query> queries, AllocationMode mode) {
        AllocationEngine engine = AllocationEngine.configure(plans, params, verbose);
        log("=== BATCH: %d queries, %d plans, %s ===", queries.size(), plans.size(), mode);

        boolean converged = true;
        if (mode.isBatch()) {
            for (Query query : queries) {
                engine.submit(query);
            }
            converged = engine.runRound(mode).isConverged();
        } else {
            for (Query query : queries) {
                engine.submit(query);
                converged &= engine.runRound(mode).isConverged();
            }
            converged &= settle(engine, mode);
        }

        BatchResult result = collect(engine, queries, converged);
        log("=== RESULT === %s", result);
        return result;
    }

    /**
     * Revision-only rounds after the stream is exhausted.
     *
     * @return true if a quiet, price-stable round was reached within the cap
     */
    private boolean settle(AllocationEngine engine, AllocationMode mode) {
        for (int k = 0; k < params.getMaxRounds(); k++) {
            RoundReport report = engine.runRound(mode);
            if (report.isQuiet() && report.getDeficit() <= params.getTolerance()) {
                return report.isConverged();
            }
        }
        log("[SETTLE] no stable round within %d rounds", params.getMaxRounds());
        return false;
    }

    private BatchResult collect(AllocationEngine engine, List<Query> queries, boolean converged) {
        EngineSnapshot snapshot = engine.inspect();
        List<Plan> plans = engine.getPlans();
        Map<String, Integer> planIndex = new HashMap<>();
        for (int j = 0; j < plans.size(); j++) {
            planIndex.put(plans.get(j).getId(), j);
        }

        int[] assignment = new int[queries.size()];
        for (int i = 0; i < queries.size(); i++) {
            assignment[i] = snapshot.getPlanOf(queries.get(i).getId())
                .map(planIndex::get)
                .orElse(-1);
        }
        double[] duals = new double[plans.size()];
        for (int j = 0; j < plans.size(); j++) {
            duals[j] = snapshot.getPrice(plans.get(j).getId());
        }

        RoundTrace trace = engine.trace();
        return new BatchResult(assignment, duals, snapshot.getActive(), snapshot.getRejected(),
            snapshot.getPending(), snapshot.getProfit(), trace.getUtilizationMatrix(),
            trace.getDeficitHistory(), converged, trace.getRoundCount());
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    /**
     * Final state of a batch run.
     */
    public static class BatchResult {
        /** Plan index per query in stream order, -1 when not active. */
        public final int[] assignment;
        public final double[] duals;
        public final List<String> active;
        public final List<String> rejected;
        public final List<String> pending;
        public final double profit;
        /** Per round, utilization of every plan in plan order. */
        public final List<double[]> utilizationTrace;
        public final List<Double> deficitTrace;
        public final boolean converged;
        public final int rounds;

        public BatchResult(int[] assignment, double[] duals, List<String> active, List<String> rejected,
                           List<String> pending, double profit, List<double[]> utilizationTrace,
                           List<Double> deficitTrace, boolean converged, int rounds) {
            this.assignment = assignment;
            this.duals = duals;
            this.active = List.copyOf(active);
            this.rejected = List.copyOf(rejected);
            this.pending = List.copyOf(pending);
            this.profit = profit;
            this.utilizationTrace = List.copyOf(utilizationTrace);
            this.deficitTrace = List.copyOf(deficitTrace);
            this.converged = converged;
            this.rounds = rounds;
        }

        public boolean isActive(String queryId) {
            return active.contains(queryId);
        }

        @Override
        public String toString() {
            return String.format("BatchResult[profit=%.4f, active=%d, rejected=%d, pending=%d, rounds=%d%s]",
                profit, active.size(), rejected.size(), pending.size(), rounds,
                converged ? "" : ", not converged");
        }
    }

    private void log(String format, Object... args) {
        if (verbose) {
            System.out.println(String.format(format, args));
        }
    }
}
