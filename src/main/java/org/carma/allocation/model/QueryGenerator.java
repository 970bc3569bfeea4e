package org.carma.allocation.model;

import java.util.*;

/**
 * Seeded generation of random plans and query streams for testing and demos.
 *
 * Every draw comes from a single {@link Random}, so two generators with the
 * same seed and the same call sequence produce identical instances.
 */
public class QueryGenerator {

    private final Random random;
    private final long seed;

    // Parameter bounds
    private double minValue = 5.0;
    private double maxValue = 50.0;
    private double minCost = 1.0;
    private double maxCost = 30.0;
    private double minActivation = 0.0;
    private double maxActivation = 5.0;
    private double minBudget = 40.0;
    private double maxBudget = 120.0;
    private double unknownCostProbability = 0.0;

    public QueryGenerator(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /**
     * Create a generator with the default seed (42).
     */
    public QueryGenerator() {
        this(42L);
    }

    // ========================================================================
    // Configuration Methods
    // ========================================================================

    public QueryGenerator valueRange(double min, double max) {
        this.minValue = min;
        this.maxValue = max;
        return this;
    }

    public QueryGenerator costRange(double min, double max) {
        this.minCost = min;
        this.maxCost = max;
        return this;
    }

    public QueryGenerator activationRange(double min, double max) {
        this.minActivation = min;
        this.maxActivation = max;
        return this;
    }

    public QueryGenerator budgetRange(double min, double max) {
        this.minBudget = min;
        this.maxBudget = max;
        return this;
    }

    /**
     * Probability that an individual cost entry is left unknown (NaN).
     */
    public QueryGenerator unknownCostProbability(double probability) {
        this.unknownCostProbability = probability;
        return this;
    }

    public long getSeed() {
        return seed;
    }

    // ========================================================================
    // Generation
    // ========================================================================

    public List<Plan> generatePlans(int count) {
        List<Plan> plans = new ArrayList<>(count);
        for (int j = 0; j < count; j++) {
            plans.add(new Plan("plan-" + j, round2(uniform(minBudget, maxBudget))));
        }
        return plans;
    }

    public Query generateQuery(String id, int planCount) {
        double[] costs = new double[planCount];
        for (int j = 0; j < planCount; j++) {
            costs[j] = random.nextDouble() < unknownCostProbability
                ? Double.NaN
                : round2(uniform(minCost, maxCost));
        }
        return new Query(id,
            round2(uniform(minValue, maxValue)),
            costs,
            round2(uniform(minActivation, maxActivation)));
    }

    public List<Query> generateQueries(int count, int planCount) {
        List<Query> queries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            queries.add(generateQuery("q-" + i, planCount));
        }
        return queries;
    }

    private double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    @Override
    public String toString() {
        return String.format("QueryGenerator[seed=%d, value=[%.1f,%.1f], cost=[%.1f,%.1f], budget=[%.1f,%.1f]]",
            seed, minValue, maxValue, minCost, maxCost, minBudget, maxBudget);
    }
}
