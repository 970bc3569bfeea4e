package org.carma.allocation.config;

import org.carma.allocation.model.*;
import org.carma.allocation.safety.ConfigurationException;
import org.carma.allocation.safety.ConfigurationValidator;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Loads allocation scenarios from YAML files.
 *
 * A scenario consists of:
 * - Plans with their budgets
 * - Price update parameters (optional, defaults otherwise)
 * - The query stream, listed explicitly or drawn from a seeded generator
 * - The allocation mode
 *
 * Directory structure:
 * <pre>
 * scenarios/
 *   two-plans/
 *     scenario.yaml
 * </pre>
 *
 * A null cost entry ({@code ~}) marks a cost that is not yet known.
 */
public class ScenarioConfigLoader {

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    /**
     * Root configuration for a scenario.
     */
    public static class ScenarioConfig {
        public String name;
        public String description;
        public String mode = "both";
        public List<PlanConfig> plans;
        public PricingConfig pricing;
        public List<QueryConfig> queries;
        public GeneratorConfig generator;

        @Override
        public String toString() {
            return String.format("ScenarioConfig[name=%s, plans=%d, queries=%d]",
                name, plans != null ? plans.size() : 0, queries != null ? queries.size() : 0);
        }
    }

    public static class PlanConfig {
        public String id;
        public double budget;
    }

    /**
     * Price rule and iteration caps. Unset fields keep their defaults.
     */
    public static class PricingConfig {
        public Double epsilon;
        public Double delta;
        public Double highUtilization;
        public Double initialPrice;
        public Double revisionBudget;
        public Integer maxIterations;
        public Integer maxRounds;
        public Double tolerance;
    }

    public static class QueryConfig {
        public String id;
        public double value;
        public double activationCost;
        public List<Double> costs;   // null entries are unknown
    }

    /**
     * Random stream used when no queries are listed.
     */
    public static class GeneratorConfig {
        public long seed = 42L;
        public int count = 20;
        public double unknownCostProbability = 0.0;
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;

    public ScenarioConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    /**
     * Load a scenario from a directory.
     *
     * @param scenarioDir Directory containing scenario.yaml
     * @return Parsed scenario configuration
     */
    public ScenarioConfig loadScenario(Path scenarioDir) throws IOException {
        Path scenarioFile = scenarioDir.resolve("scenario.yaml");
        if (!Files.exists(scenarioFile)) {
            throw new IOException("scenario.yaml not found in: " + scenarioDir);
        }

        try (InputStream is = Files.newInputStream(scenarioFile)) {
            return loadScenario(is);
        }
    }

    /**
     * Parse a scenario from a YAML stream.
     *
     * @throws ConfigurationException if the document is malformed
     */
    public ScenarioConfig loadScenario(InputStream in) {
        Object raw;
        try {
            raw = yaml.load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Scenario", "yaml", e.getMessage());
        }
        if (!(raw instanceof Map)) {
            throw new ConfigurationException("Scenario", "root", "scenario must be a YAML mapping");
        }
        return parseScenarioConfig(asMap(raw, "root"));
    }

    private ScenarioConfig parseScenarioConfig(Map<String, Object> raw) {
        ScenarioConfig config = new ScenarioConfig();

        config.name = getString(raw, "name", "unnamed");
        config.description = getString(raw, "description", "");
        config.mode = getString(raw, "mode", "both");

        config.plans = new ArrayList<>();
        for (Object entry : getList(raw, "plans")) {
            Map<String, Object> planMap = asMap(entry, "plans");
            PlanConfig plan = new PlanConfig();
            plan.id = getString(planMap, "id", null);
            plan.budget = getDouble(planMap, "budget", Double.NaN);
            config.plans.add(plan);
        }

        Object pricing = raw.get("pricing");
        if (pricing != null) {
            Map<String, Object> pricingMap = asMap(pricing, "pricing");
            config.pricing = new PricingConfig();
            config.pricing.epsilon = getBoxedDouble(pricingMap, "epsilon");
            config.pricing.delta = getBoxedDouble(pricingMap, "delta");
            config.pricing.highUtilization = getBoxedDouble(pricingMap, "highUtilization");
            config.pricing.initialPrice = getBoxedDouble(pricingMap, "initialPrice");
            config.pricing.revisionBudget = getBoxedDouble(pricingMap, "revisionBudget");
            config.pricing.maxIterations = getBoxedInt(pricingMap, "maxIterations");
            config.pricing.maxRounds = getBoxedInt(pricingMap, "maxRounds");
            config.pricing.tolerance = getBoxedDouble(pricingMap, "tolerance");
        }

        config.queries = new ArrayList<>();
        for (Object entry : getList(raw, "queries")) {
            Map<String, Object> queryMap = asMap(entry, "queries");
            QueryConfig query = new QueryConfig();
            query.id = getString(queryMap, "id", null);
            query.value = getDouble(queryMap, "value", Double.NaN);
            query.activationCost = getDouble(queryMap, "activationCost", 0.0);
            query.costs = new ArrayList<>();
            for (Object cost : getList(queryMap, "costs")) {
                query.costs.add(cost == null ? null : toDouble(cost, "costs"));
            }
            config.queries.add(query);
        }

        Object generator = raw.get("generator");
        if (generator != null) {
            Map<String, Object> genMap = asMap(generator, "generator");
            config.generator = new GeneratorConfig();
            Integer count = getBoxedInt(genMap, "count");
            if (count != null) config.generator.count = count;
            Object seed = genMap.get("seed");
            if (seed instanceof Number) config.generator.seed = ((Number) seed).longValue();
            config.generator.unknownCostProbability = getDouble(genMap, "unknownCostProbability", 0.0);
        }

        return config;
    }

    // ========================================================================
    // BUILDING
    // ========================================================================

    /**
     * Build and validate the plans of a scenario.
     */
    public List<Plan> buildPlans(ScenarioConfig config) {
        List<Plan> plans = new ArrayList<>();
        for (PlanConfig pc : config.plans) {
            plans.add(new Plan(pc.id, pc.budget));
        }
        new ConfigurationValidator().validatePlans(plans).orThrow();
        return plans;
    }

    /**
     * Build price parameters; unset fields keep the defaults.
     */
    public PriceUpdateParams buildParams(ScenarioConfig config) {
        if (config.pricing == null) {
            return PriceUpdateParams.DEFAULT;
        }
        PricingConfig pc = config.pricing;
        PriceUpdateParams.Builder builder = PriceUpdateParams.DEFAULT.toBuilder();
        if (pc.epsilon != null) builder.epsilon(pc.epsilon);
        if (pc.delta != null) builder.delta(pc.delta);
        if (pc.highUtilization != null) builder.highUtilization(pc.highUtilization);
        if (pc.initialPrice != null) builder.initialPrice(pc.initialPrice);
        if (pc.revisionBudget != null) builder.revisionBudget(pc.revisionBudget);
        if (pc.maxIterations != null) builder.maxIterations(pc.maxIterations);
        if (pc.maxRounds != null) builder.maxRounds(pc.maxRounds);
        if (pc.tolerance != null) builder.tolerance(pc.tolerance);

        PriceUpdateParams params = builder.build();
        new ConfigurationValidator().validateParams(params).orThrow();
        return params;
    }

    /**
     * Build the query stream: listed queries, or generated ones when none are listed.
     */
    public List<Query> buildQueries(ScenarioConfig config, int planCount) {
        List<Query> queries = new ArrayList<>();
        if (config.queries.isEmpty() && config.generator != null) {
            return new QueryGenerator(config.generator.seed)
                .unknownCostProbability(config.generator.unknownCostProbability)
                .generateQueries(config.generator.count, planCount);
        }

        ConfigurationValidator validator = new ConfigurationValidator();
        for (QueryConfig qc : config.queries) {
            double[] costs = new double[qc.costs.size()];
            for (int j = 0; j < costs.length; j++) {
                Double cost = qc.costs.get(j);
                costs[j] = cost == null ? Double.NaN : cost;
            }
            Query query = new Query(qc.id, qc.value, costs, qc.activationCost);
            validator.validateQuery(query, planCount).orThrow();
            queries.add(query);
        }
        return queries;
    }

    public AllocationMode buildMode(ScenarioConfig config) {
        try {
            return AllocationMode.parse(config.mode);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Scenario", "mode", "unknown allocation mode " + config.mode);
        }
    }

    // ========================================================================
    // UTILITY METHODS
    // ========================================================================

    /**
     * List all available scenarios under a scenarios directory.
     */
    public List<String> listScenarios(Path scenariosDir) throws IOException {
        if (!Files.exists(scenariosDir)) {
            return Collections.emptyList();
        }

        List<String> scenarios = new ArrayList<>();
        try (var stream = Files.list(scenariosDir)) {
            stream.filter(Files::isDirectory)
                  .filter(p -> Files.exists(p.resolve("scenario.yaml")))
                  .map(p -> p.getFileName().toString())
                  .sorted()
                  .forEach(scenarios::add);
        }
        return scenarios;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value, String field) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Scenario", field, "expected a mapping, got " + value);
        }
        return (Map<String, Object>) value;
    }

    private List<?> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("Scenario", key, "expected a list, got " + value);
        }
        return (List<?>) value;
    }

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        return value != null ? toDouble(value, key) : defaultValue;
    }

    private Double getBoxedDouble(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? toDouble(value, key) : null;
    }

    private Integer getBoxedInt(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Integer)) {
            throw new ConfigurationException("Scenario", key, "expected an integer, got " + value);
        }
        return (Integer) value;
    }

    private double toDouble(Object value, String field) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        // "inf" as well as YAML .inf, for an unlimited revision budget
        if ("inf".equalsIgnoreCase(value.toString()) || "infinity".equalsIgnoreCase(value.toString())) {
            return Double.POSITIVE_INFINITY;
        }
        throw new ConfigurationException("Scenario", field, "expected a number, got " + value);
    }
}
