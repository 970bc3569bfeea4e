package org.carma.allocation.simulation;

import org.carma.allocation.model.RoundReport;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only trace of committed rounds: utilization per plan, deficit and profit.
 *
 * Readers may consume the trace from another thread while rounds are running;
 * they only ever see fully committed rounds.
 */
public class RoundTrace {

    private final List<String> planIds;
    private final List<RoundReport> rounds;

    public RoundTrace(List<String> planIds) {
        this.planIds = List.copyOf(planIds);
        this.rounds = new CopyOnWriteArrayList<>();
    }

    // ========================================================================
    // Recording
    // ========================================================================

    /**
     * Append a committed round. The report is frozen so the history cannot be
     * rewritten through a reference held elsewhere.
     */
    public void record(RoundReport report) {
        rounds.add(report.freeze());
    }

    // ========================================================================
    // Analysis
    // ========================================================================

    public int getRoundCount() {
        return rounds.size();
    }

    public List<RoundReport> getReports() {
        return Collections.unmodifiableList(rounds);
    }

    public Optional<RoundReport> getLast() {
        List<RoundReport> view = new ArrayList<>(rounds);
        return view.isEmpty() ? Optional.empty() : Optional.of(view.get(view.size() - 1));
    }

    public double getFinalProfit() {
        return getLast().map(RoundReport::getProfit).orElse(0.0);
    }

    public List<Double> getDeficitHistory() {
        List<Double> history = new ArrayList<>();
        for (RoundReport r : rounds) {
            history.add(r.getDeficit());
        }
        return history;
    }

    public List<Double> getProfitHistory() {
        List<Double> history = new ArrayList<>();
        for (RoundReport r : rounds) {
            history.add(r.getProfit());
        }
        return history;
    }

    public List<Double> getUtilizationHistory(String planId) {
        List<Double> history = new ArrayList<>();
        for (RoundReport r : rounds) {
            history.add(r.getUtilization(planId));
        }
        return history;
    }

    /**
     * Utilization of every plan per round, in plan order.
     */
    public List<double[]> getUtilizationMatrix() {
        List<double[]> matrix = new ArrayList<>();
        for (RoundReport r : rounds) {
            double[] row = new double[planIds.size()];
            for (int j = 0; j < planIds.size(); j++) {
                row[j] = r.getUtilization(planIds.get(j));
            }
            matrix.add(row);
        }
        return matrix;
    }

    /**
     * Check if prices have settled: every deficit over the last N rounds is below threshold.
     */
    public boolean hasConverged(int windowSize, double threshold) {
        List<Double> deficits = getDeficitHistory();
        if (deficits.size() < windowSize) return false;
        for (double d : deficits.subList(deficits.size() - windowSize, deficits.size())) {
            if (d > threshold) return false;
        }
        return true;
    }

    public double getAverageUtilization(String planId) {
        return getUtilizationHistory(planId).stream()
            .mapToDouble(Double::doubleValue)
            .average()
            .orElse(0.0);
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Round Trace Summary:\n");
        sb.append(String.format("  Rounds: %d\n", getRoundCount()));
        sb.append(String.format("  Final profit: %.4f\n", getFinalProfit()));
        for (String planId : planIds) {
            sb.append(String.format("  %s: avg utilization %.1f%%\n",
                planId, getAverageUtilization(planId) * 100));
        }
        sb.append(String.format("  Prices settled (last 5): %s\n", hasConverged(5, 1e-6)));
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("RoundTrace[%d rounds, profit=%.4f]", getRoundCount(), getFinalProfit());
    }
}
