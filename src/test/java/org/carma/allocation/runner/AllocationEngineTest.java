package org.carma.allocation.runner;

import org.carma.allocation.event.Event;
import org.carma.allocation.metrics.EngineMetrics;
import org.carma.allocation.model.*;
import org.carma.allocation.model.RoundReport.Outcome;
import org.carma.allocation.safety.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class AllocationEngineTest {

    private static AllocationEngine singlePlan() {
        return AllocationEngine.configure(List.of(new Plan("plan-a", 10.0)), PriceUpdateParams.DEFAULT);
    }

    @Test
    void single_plan_walkthrough_with_release() {
        AllocationEngine engine = singlePlan();

        engine.submit(new Query("id1", 8.0, new double[]{6.0}, 0.0));
        RoundReport r1 = engine.runRound(AllocationMode.BOTH);
        assertEquals(Outcome.ASSIGNED, r1.getDecision("id1").orElseThrow().outcome());
        assertEquals(2.0, r1.getProfit(), 1e-12);
        assertEquals(0.6, r1.getUtilization("plan-a"), 1e-12);
        assertEquals(0.0, r1.getDeficit());

        engine.submit(new Query("id2", 3.0, new double[]{6.0}, 1.0));
        RoundReport r2 = engine.runRound(AllocationMode.BOTH);
        assertEquals(Outcome.REJECTED, r2.getDecision("id2").orElseThrow().outcome());
        assertTrue(r2.getInfeasibleQueries().isEmpty());
        assertEquals(0, r2.getPromotions());

        engine.release("id1");
        RoundReport r3 = engine.runRound(AllocationMode.BOTH);
        assertEquals(0, r3.getPromotions());

        EngineSnapshot snapshot = engine.inspect();
        assertTrue(snapshot.getActive().isEmpty());
        assertEquals(List.of("id2", "id1"), snapshot.getRejected());
        assertEquals(0.0, snapshot.getProfit(), 1e-12);
        assertEquals(0.0, snapshot.getConsumed().get("plan-a"), 1e-12);
        assertEquals(3, engine.trace().getRoundCount());
    }

    @Test
    void returned_report_cannot_rewrite_the_trace() {
        AllocationEngine engine = singlePlan();
        engine.submit(new Query("id1", 20.0, new double[]{6.0}, 0.0));
        RoundReport report = engine.runRound(AllocationMode.BOTH);

        assertTrue(report.isFrozen());
        assertThrows(IllegalStateException.class, () -> report.setProfit(-999.0));
        assertThrows(IllegalStateException.class, () -> report.setDeficit(42.0));
        assertThrows(IllegalStateException.class,
            () -> report.addDecision(RoundReport.DecisionRecord.of("id1", Outcome.REJECTED, null)));

        assertEquals(List.of(14.0), engine.trace().getProfitHistory());
        assertEquals(List.of(0.0), engine.trace().getDeficitHistory());
        assertEquals(1, engine.trace().getLast().orElseThrow().getDecisions().size());
    }

    @Test
    void offline_mode_orders_batch_by_standalone_profit() {
        List<Query> batch = List.of(
            new Query("weak", 8.0, new double[]{6.0}, 0.0),
            new Query("strong", 20.0, new double[]{6.0}, 0.0));

        AllocationEngine online = singlePlan();
        batch.forEach(online::submit);
        online.runRound(AllocationMode.NO_STRATEGY);
        assertEquals(Map.of("weak", "plan-a"), online.inspect().getAssignment());

        AllocationEngine offline = singlePlan();
        batch.forEach(offline::submit);
        RoundReport report = offline.runRound(AllocationMode.OFFLINE);
        assertEquals(Map.of("strong", "plan-a"), offline.inspect().getAssignment());
        assertEquals(14.0, report.getProfit(), 1e-12);
    }

    @Test
    void unknown_costs_are_deferred_until_revealed() {
        AllocationEngine engine = AllocationEngine.configure(
            List.of(new Plan("a", 10.0), new Plan("b", 10.0)), PriceUpdateParams.DEFAULT);
        engine.submit(new Query("q", 10.0, new double[]{Double.NaN, 4.0}, 0.0));

        RoundReport first = engine.runRound(AllocationMode.NO_STRATEGY);
        assertEquals(Outcome.DEFERRED, first.getDecision("q").orElseThrow().outcome());
        assertEquals(List.of("q"), engine.inspect().getPending());
        assertTrue(engine.hasWork());

        engine.revealCosts("q", new double[]{3.0, 4.0});
        RoundReport second = engine.runRound(AllocationMode.NO_STRATEGY);
        assertEquals("a", second.getDecision("q").orElseThrow().planId());
        assertFalse(engine.hasWork());
    }

    @Test
    void costs_of_queued_queries_can_be_revealed_before_ingestion() {
        AllocationEngine engine = singlePlan();
        engine.submit(new Query("q", 10.0, new double[]{Double.NaN}, 0.0));
        engine.revealCosts("q", new double[]{4.0});

        RoundReport report = engine.runRound(AllocationMode.NO_STRATEGY);
        assertEquals(Outcome.ASSIGNED, report.getDecision("q").orElseThrow().outcome());
    }

    @Test
    void reveal_and_release_require_the_right_state() {
        AllocationEngine engine = singlePlan();
        engine.submit(new Query("q", 10.0, new double[]{4.0}, 0.0));
        engine.runRound(AllocationMode.BOTH);

        assertThrows(IllegalStateException.class, () -> engine.revealCosts("q", new double[]{1.0}));
        assertThrows(IllegalStateException.class, () -> engine.release("missing"));
        assertThrows(ConfigurationException.class, () -> engine.revealCosts("q", new double[]{1.0, 2.0}));

        engine.release("q");
        assertThrows(IllegalStateException.class, () -> engine.release("q"));
    }

    @Test
    void duplicate_and_malformed_queries_are_refused() {
        AllocationEngine engine = singlePlan();
        engine.submit(new Query("q", 10.0, new double[]{4.0}, 0.0));

        assertThrows(ConfigurationException.class, () -> engine.submit(new Query("q", 1.0, new double[]{1.0}, 0.0)));
        engine.runRound(AllocationMode.BOTH);
        assertThrows(ConfigurationException.class, () -> engine.submit(new Query("q", 1.0, new double[]{1.0}, 0.0)));

        assertThrows(ConfigurationException.class, () -> engine.submit(new Query("neg", -1.0, new double[]{1.0}, 0.0)));
        assertThrows(ConfigurationException.class, () -> engine.submit(new Query("inf", 1.0, new double[]{Double.POSITIVE_INFINITY}, 0.0)));
        assertThrows(ConfigurationException.class, () -> engine.submit(new Query("short", 1.0, new double[]{}, 0.0)));
    }

    @Test
    void malformed_plans_are_refused_and_empty_plans_reported() {
        assertThrows(ConfigurationException.class,
            () -> AllocationEngine.configure(List.of(new Plan("a", -1.0)), PriceUpdateParams.DEFAULT));
        assertThrows(ConfigurationException.class,
            () -> AllocationEngine.configure(List.of(new Plan("a", Double.NaN)), PriceUpdateParams.DEFAULT));
        assertThrows(ConfigurationException.class,
            () -> AllocationEngine.configure(List.of(new Plan("a", 1.0), new Plan("a", 2.0)), PriceUpdateParams.DEFAULT));
        assertThrows(ConfigurationException.class,
            () -> AllocationEngine.configure(List.of(), PriceUpdateParams.DEFAULT));

        AllocationEngine engine = AllocationEngine.configure(
            List.of(new Plan("a", 10.0), new Plan("empty", 0.0)), PriceUpdateParams.DEFAULT);
        engine.submit(new Query("huge", 100.0, new double[]{50.0, 1.0}, 0.0));
        RoundReport report = engine.runRound(AllocationMode.BOTH);

        assertEquals(List.of("empty"), report.getInfeasiblePlans());
        assertEquals(List.of("huge"), report.getInfeasibleQueries());
    }

    @Test
    void rounds_are_not_reentrant() {
        AllocationEngine engine = singlePlan();
        AtomicReference<Exception> nested = new AtomicReference<>();
        AtomicReference<AllocationEngine.State> seen = new AtomicReference<>();
        engine.events().subscribe(Event.QueryAssignedEvent.class, e -> {
            seen.set(engine.getState());
            try {
                engine.runRound(AllocationMode.BOTH);
            } catch (IllegalStateException ex) {
                nested.set(ex);
            }
        });

        engine.submit(new Query("q", 10.0, new double[]{4.0}, 0.0));
        engine.runRound(AllocationMode.BOTH);

        assertEquals(AllocationEngine.State.DECIDING, seen.get());
        assertInstanceOf(IllegalStateException.class, nested.get());
        assertEquals(AllocationEngine.State.IDLE, engine.getState());
        assertEquals(1, engine.getRound());
    }

    @Test
    void decisions_are_published_and_counted() {
        AllocationEngine engine = singlePlan();
        List<Event> seen = new ArrayList<>();
        engine.events().subscribe(Event.class, seen::add);

        engine.submit(new Query("id1", 8.0, new double[]{6.0}, 0.0));
        engine.submit(new Query("id2", 3.0, new double[]{6.0}, 1.0));
        engine.submit(new Query("id3", 5.0, new double[]{Double.NaN}, 0.0));
        engine.runRound(AllocationMode.BOTH);
        engine.release("id1");
        Event.QueryReleasedEvent released = engine.events().getEvents(Event.QueryReleasedEvent.class).get(0);

        assertEquals(3, engine.events().count(Event.QuerySubmittedEvent.class));
        assertEquals(1, engine.events().count(Event.QueryAssignedEvent.class));
        assertEquals(1, engine.events().count(Event.QueryRejectedEvent.class));
        assertEquals(1, engine.events().count(Event.QueryDeferredEvent.class));
        assertEquals(1, engine.events().count(Event.QueryReleasedEvent.class));
        assertEquals(1, engine.events().count(Event.RoundCompletedEvent.class));
        assertEquals(engine.events().size(), seen.size());
        assertEquals(7, engine.events().getRoundEvents(1).size());
        assertEquals(List.of(new Event.QueryReleasedEvent(released.timestamp(), "id1", "plan-a")),
            engine.events().getRoundEvents(2));

        EngineMetrics metrics = engine.metrics();
        assertEquals(1, metrics.count(EngineMetrics.ASSIGNED));
        assertEquals(1, metrics.count(EngineMetrics.REJECTED));
        assertEquals(1, metrics.count(EngineMetrics.DEFERRED));
        assertEquals(1, metrics.count(EngineMetrics.RELEASED));
        assertEquals(1, metrics.count(EngineMetrics.ROUNDS));
        assertEquals(1, metrics.timer(EngineMetrics.ROUND_LATENCY).getCount());
    }

    @Test
    void random_streams_keep_budgets_and_partition_in_every_mode() {
        for (AllocationMode mode : AllocationMode.values()) {
            QueryGenerator generator = new QueryGenerator(11L).unknownCostProbability(0.05);
            List<Plan> plans = generator.generatePlans(3);
            AllocationEngine engine = AllocationEngine.configure(plans, PriceUpdateParams.DEFAULT);

            List<Query> queries = generator.generateQueries(60, plans.size());
            for (Query q : queries) {
                engine.submit(q);
                RoundReport report = engine.runRound(mode);
                for (Plan plan : plans) {
                    assertTrue(report.getUtilization(plan.getId()) <= 1.0 + 1e-9);
                }
                assertTrue(report.getProfitDelta() >= -1e-9, "profit dropped in " + mode);
            }

            EngineSnapshot snapshot = engine.inspect();
            assertEquals(queries.size(),
                snapshot.getActive().size() + snapshot.getRejected().size() + snapshot.getPending().size());
            for (Plan plan : plans) {
                assertTrue(snapshot.getConsumed().get(plan.getId()) <= plan.getBudget() + 1e-9);
            }
            assertFalse(engine.isHalted());
        }
    }
}
