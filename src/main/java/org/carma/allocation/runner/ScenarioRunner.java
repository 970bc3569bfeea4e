package org.carma.allocation.runner;

import org.carma.allocation.config.ScenarioConfigLoader;
import org.carma.allocation.config.ScenarioConfigLoader.ScenarioConfig;
import org.carma.allocation.model.*;
import org.carma.allocation.runner.BatchRunner.BatchResult;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

/**
 * Executes scenarios loaded from configuration files.
 *
 * Loads plans, price parameters, the query stream and the mode from
 * {@code scenario.yaml}, runs the stream through {@link BatchRunner} and
 * reports the final assignment, prices and profit.
 *
 * Usage:
 * <pre>
 * ScenarioRunner runner = new ScenarioRunner();
 * ScenarioResult result = runner.run(Paths.get("scenarios/two-plans"));
 * System.out.println(result);
 * </pre>
 */
public class ScenarioRunner {

    private final ScenarioConfigLoader loader;

    private boolean verbose = true;

    public ScenarioRunner() {
        this.loader = new ScenarioConfigLoader();
    }

    public ScenarioRunner verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Run a scenario from a directory.
     *
     * @param scenarioDir Directory containing scenario.yaml
     * @return Final state of the run
     */
    public ScenarioResult run(Path scenarioDir) throws IOException {
        log("Loading scenario from: " + scenarioDir);
        ScenarioConfig scenario = loader.loadScenario(scenarioDir);
        return run(scenario);
    }

    /**
     * Run an already parsed scenario.
     */
    public ScenarioResult run(ScenarioConfig scenario) {
        log("Scenario: " + scenario.name);
        log("Description: " + scenario.description);
        log("");

        List<Plan> plans = loader.buildPlans(scenario);
        PriceUpdateParams params = loader.buildParams(scenario);
        List<Query> queries = loader.buildQueries(scenario, plans.size());
        AllocationMode mode = loader.buildMode(scenario);

        log("Plans:");
        for (Plan plan : plans) {
            log(String.format("  %s: budget %.2f", plan.getId(), plan.getBudget()));
        }
        log("Queries: " + queries.size());
        log("Mode: " + mode.getDisplayName());
        log(params.toString());
        log("");

        BatchResult result = new BatchRunner(params).verbose(verbose).run(plans, queries, mode);

        log("=== RESULTS ===");
        for (int i = 0; i < queries.size(); i++) {
            int j = result.assignment[i];
            log(String.format("  %s -> %s", queries.get(i).getId(), j < 0 ? "-" : plans.get(j).getId()));
        }
        for (int j = 0; j < plans.size(); j++) {
            log(String.format("  %s: phi=%.4f", plans.get(j).getId(), result.duals[j]));
        }
        log(String.format("Profit: %.4f", result.profit));
        log("Converged: " + result.converged + " after " + result.rounds + " rounds");

        return new ScenarioResult(scenario.name, mode, plans, result);
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    /**
     * Complete result for a scenario.
     */
    public static class ScenarioResult {
        public final String scenarioName;
        public final AllocationMode mode;
        public final List<Plan> plans;
        public final BatchResult batch;

        public ScenarioResult(String scenarioName, AllocationMode mode, List<Plan> plans, BatchResult batch) {
            this.scenarioName = scenarioName;
            this.mode = mode;
            this.plans = plans;
            this.batch = batch;
        }

        public double getProfit() {
            return batch.profit;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ScenarioResult[").append(scenarioName).append("]\n");
            sb.append("  Mode: ").append(mode.getDisplayName()).append("\n");
            sb.append("  Plans: ").append(plans.size()).append("\n");
            sb.append("  Active: ").append(batch.active.size())
              .append(", rejected: ").append(batch.rejected.size())
              .append(", pending: ").append(batch.pending.size()).append("\n");
            sb.append("  Profit: ").append(String.format("%.4f", batch.profit)).append("\n");
            return sb.toString();
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void log(String message) {
        if (verbose) {
            System.out.println(message);
        }
    }

    /**
     * List available scenarios.
     */
    public List<String> listScenarios(Path scenariosDir) throws IOException {
        return loader.listScenarios(scenariosDir);
    }

    /**
     * Run the scenario directories given on the command line, or every
     * scenario under {@code scenarios/} when none are given.
     */
    public static void main(String[] args) throws IOException {
        ScenarioRunner runner = new ScenarioRunner();
        List<Path> dirs = new ArrayList<>();
        if (args.length > 0) {
            for (String arg : args) {
                dirs.add(Paths.get(arg));
            }
        } else {
            Path root = Paths.get("src/main/resources/scenarios");
            for (String name : runner.listScenarios(root)) {
                dirs.add(root.resolve(name));
            }
        }
        for (Path dir : dirs) {
            System.out.println(runner.run(dir));
        }
    }
}
