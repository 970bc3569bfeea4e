package org.carma.allocation;

import org.carma.allocation.model.*;
import org.carma.allocation.runner.AllocationEngine;
import org.carma.allocation.runner.BatchRunner;
import org.carma.allocation.runner.BatchRunner.BatchResult;

import java.util.*;

/**
 * Demonstration of the online allocation engine.
 *
 * 1. Single-plan walkthrough: assignment, rejection, release
 * 2. Ablation of the revision strategies on a random stream
 *
 * Usage:
 *   java Demo.java            # Walkthrough and ablation with the default seed
 *   java Demo.java --seed 7   # Ablation with another seed
 */
public class Demo {

    private static final String SEP = "═".repeat(72);
    private static final String SUBSEP = "─".repeat(60);

    public static void main(String[] args) {
        long seed = 42L;
        List<String> argList = Arrays.asList(args);
        int seedAt = argList.indexOf("--seed");
        if (seedAt >= 0 && seedAt + 1 < args.length) {
            seed = Long.parseLong(args[seedAt + 1]);
        }

        System.out.println(SEP);
        System.out.println("   ONLINE PRIMAL-DUAL QUERY ALLOCATION");
        System.out.println(SEP);
        System.out.println();

        runWalkthrough();
        runAblation(seed);

        System.out.println(SEP);
        System.out.println("   ALL DEMONSTRATIONS COMPLETE");
        System.out.println(SEP);
    }

    // ========================================================================
    // WALKTHROUGH
    // ========================================================================

    static void runWalkthrough() {
        System.out.println("WALKTHROUGH: ONE PLAN, TWO QUERIES");
        System.out.println(SUBSEP);

        AllocationEngine engine = AllocationEngine.configure(
            List.of(new Plan("plan-a", 10.0)), PriceUpdateParams.DEFAULT, true);

        engine.submit(new Query("id1", 8.0, new double[]{6.0}, 0.0));
        System.out.println(engine.runRound(AllocationMode.BOTH));

        engine.submit(new Query("id2", 3.0, new double[]{6.0}, 1.0));
        System.out.println(engine.runRound(AllocationMode.BOTH));

        engine.release("id1");
        System.out.println(engine.runRound(AllocationMode.BOTH));
        System.out.println(engine.inspect());
        System.out.println();
    }

    // ========================================================================
    // ABLATION
    // ========================================================================

    static void runAblation(long seed) {
        System.out.println("ABLATION: REVISION STRATEGIES (seed " + seed + ")");
        System.out.println(SUBSEP);

        QueryGenerator generator = new QueryGenerator(seed);
        List<Plan> plans = generator.generatePlans(3);
        List<Query> queries = generator.generateQueries(40, plans.size());

        BatchRunner runner = new BatchRunner();
        System.out.printf("%-24s %10s %8s %8s %8s %7s%n",
            "Mode", "Profit", "Active", "Rejected", "Rounds", "Settled");
        for (AllocationMode mode : AllocationMode.values()) {
            BatchResult result = runner.run(plans, queries, mode);
            System.out.printf("%-24s %10.2f %8d %8d %8d %7s%n",
                mode.getDisplayName(), result.profit, result.active.size(),
                result.rejected.size(), result.rounds, result.converged);
        }
        System.out.println();
    }
}
