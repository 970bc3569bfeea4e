package org.carma.allocation.config;

import org.carma.allocation.config.ScenarioConfigLoader.ScenarioConfig;
import org.carma.allocation.model.*;
import org.carma.allocation.safety.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScenarioConfigLoaderTest {

    private final ScenarioConfigLoader loader = new ScenarioConfigLoader();

    private static ScenarioConfig parse(ScenarioConfigLoader loader, String yaml) {
        return loader.loadScenario(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void loads_scenario_directory() throws IOException {
        ScenarioConfig config = loader.loadScenario(Paths.get("src/test/resources/scenarios/basic"));

        assertEquals("basic", config.name);
        assertEquals(AllocationMode.REACTIVATE_ONLY, loader.buildMode(config));

        List<Plan> plans = loader.buildPlans(config);
        assertEquals(1, plans.size());
        assertEquals(10.0, plans.get(0).getBudget());

        PriceUpdateParams params = loader.buildParams(config);
        assertEquals(0.8, params.getHighUtilization());
        assertTrue(Double.isInfinite(params.getRevisionBudget()));
        assertEquals(50, params.getMaxRounds());
        assertEquals(PriceUpdateParams.DEFAULT.getEpsilon(), params.getEpsilon());

        List<Query> queries = loader.buildQueries(config, plans.size());
        assertEquals(2, queries.size());
        assertEquals("id2", queries.get(1).getId());
        assertEquals(1.0, queries.get(1).getActivationCost());
    }

    @Test
    void loads_from_classpath() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/scenarios/basic/scenario.yaml")) {
            assertNotNull(in);
            assertEquals("basic", loader.loadScenario(in).name);
        }
    }

    @Test
    void null_cost_entries_are_unknown() {
        ScenarioConfig config = parse(loader, String.join("\n",
            "plans:",
            "  - {id: a, budget: 5}",
            "  - {id: b, budget: 5}",
            "queries:",
            "  - {id: q, value: 3, costs: [1, ~]}"));

        Query q = loader.buildQueries(config, 2).get(0);
        assertEquals(1.0, q.getAssignmentCost(0));
        assertTrue(Double.isNaN(q.getAssignmentCost(1)));
        assertEquals(0.0, q.getActivationCost());
        assertSame(PriceUpdateParams.DEFAULT, loader.buildParams(config));
        assertEquals(AllocationMode.BOTH, loader.buildMode(config));
    }

    @Test
    void generator_supplies_queries_when_none_are_listed() {
        ScenarioConfig config = parse(loader, String.join("\n",
            "plans:",
            "  - {id: a, budget: 50}",
            "generator: {seed: 3, count: 12}"));

        List<Query> queries = loader.buildQueries(config, 1);
        assertEquals(12, queries.size());
        assertEquals(new QueryGenerator(3L).generateQueries(12, 1).get(5).getValue(), queries.get(5).getValue());
    }

    @Test
    void duplicate_keys_are_refused() {
        assertThrows(ConfigurationException.class,
            () -> loader.loadScenario(Paths.get("src/test/resources/scenarios/duplicate-keys")));
    }

    @Test
    void malformed_entries_are_refused() {
        assertThrows(ConfigurationException.class, () -> loader.buildPlans(parse(loader,
            "plans:\n  - {id: a, budget: -3}")));
        assertThrows(ConfigurationException.class, () -> loader.buildPlans(parse(loader,
            "plans:\n  - {id: a}")));
        assertThrows(ConfigurationException.class, () -> parse(loader,
            "plans:\n  - {id: a, budget: lots}"));
        assertThrows(ConfigurationException.class, () -> loader.buildMode(parse(loader,
            "mode: sometimes")));
        assertThrows(ConfigurationException.class, () -> loader.buildParams(parse(loader,
            "pricing: {highUtilization: 1.5}")));
        assertThrows(ConfigurationException.class, () -> loader.buildQueries(parse(loader,
            "queries:\n  - {id: q, value: 3, costs: [1, 2]}"), 1));
        assertThrows(ConfigurationException.class, () -> parse(loader, "- just\n- a list"));
    }

    @Test
    void missing_scenario_file_is_an_io_error() {
        assertThrows(IOException.class, () -> loader.loadScenario(Paths.get("src/test/resources/scenarios")));
    }

    @Test
    void lists_scenario_directories() throws IOException {
        List<String> names = loader.listScenarios(Paths.get("src/test/resources/scenarios"));
        assertEquals(List.of("basic", "duplicate-keys"), names);
        assertTrue(loader.listScenarios(Path.of("does-not-exist")).isEmpty());
    }
}
