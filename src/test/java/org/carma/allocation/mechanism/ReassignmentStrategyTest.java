package org.carma.allocation.mechanism;

import org.carma.allocation.mechanism.RevisionStrategy.RevisionOutcome;
import org.carma.allocation.model.Plan;
import org.carma.allocation.model.PriceUpdateParams;
import org.carma.allocation.model.Query;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReassignmentStrategyTest {

    private DualDescentAllocator allocator;
    private PriceState ps;
    private AllocationLedger ledger;

    @BeforeEach
    void setUp() {
        allocator = new DualDescentAllocator();
        ps = new PriceState(List.of(new Plan("a", 10.0), new Plan("b", 10.0)), PriceUpdateParams.DEFAULT);
        ledger = new AllocationLedger(new InvariantMonitor());
    }

    private void decide(Query q) {
        ledger.admit(q);
        allocator.decide(q, ps, ledger);
    }

    /**
     * "mover" lands on plan a because b is full, then b is freed.
     */
    private void moverOnCostlierPlan() {
        decide(new Query("filler", 50.0, new double[]{100.0, 10.0}, 0.0));
        decide(new Query("mover", 20.0, new double[]{6.0, 5.0}, 1.0));
        assertEquals(0, ledger.getAssignment("mover"));
        ledger.release("filler", ps);
    }

    @Test
    void moves_query_to_cheaper_plan_once_it_has_room() {
        moverOnCostlierPlan();
        double before = ledger.getProfit();

        RevisionOutcome outcome = new ReassignmentStrategy(10).revise(ps, ledger, Double.POSITIVE_INFINITY);

        assertEquals(1, outcome.getCount());
        assertTrue(outcome.isConverged());
        assertEquals(1, ledger.getAssignment("mover"));
        assertEquals(1.0, outcome.getProfitDelta(), 1e-12);
        assertEquals(before + 1.0, ledger.getProfit(), 1e-12);
        assertEquals(0.0, ps.getConsumed(0), 1e-12);
        assertEquals(6.0, ps.getConsumed(1), 1e-12);
    }

    @Test
    void never_moves_to_a_costlier_plan() {
        moverOnCostlierPlan();
        new ReassignmentStrategy(10).revise(ps, ledger, Double.POSITIVE_INFINITY);

        assertNull(new ReassignmentStrategy(10).bestMove("mover", ps, ledger));
    }

    @Test
    void threshold_budget_limits_moves() {
        moverOnCostlierPlan();

        RevisionOutcome outcome = new ReassignmentStrategy(10).revise(ps, ledger, 5.0);

        assertEquals(0, outcome.getCount());
        assertEquals(0, ledger.getAssignment("mover"));
    }

    @Test
    void second_pass_changes_nothing() {
        moverOnCostlierPlan();
        ReassignmentStrategy strategy = new ReassignmentStrategy(10);
        strategy.revise(ps, ledger, Double.POSITIVE_INFINITY);
        double profit = ledger.getProfit();

        RevisionOutcome again = strategy.revise(ps, ledger, Double.POSITIVE_INFINITY);

        assertEquals(0, again.getCount());
        assertEquals(profit, ledger.getProfit(), 1e-12);
    }

    @Test
    void equal_cost_query_stays_put_when_moving_only_shifts_congestion() {
        decide(new Query("q", 20.0, new double[]{8.0, 8.0}, 1.0));
        assertEquals(0, ledger.getAssignment("q"));
        assertEquals(0.01, ps.getPrice(0), 1e-12);
        ReassignmentStrategy strategy = new ReassignmentStrategy(100);

        RevisionOutcome first = strategy.revise(ps, ledger, Double.POSITIVE_INFINITY);
        RevisionOutcome second = strategy.revise(ps, ledger, Double.POSITIVE_INFINITY);

        assertEquals(0, first.getCount());
        assertEquals(0, second.getCount());
        assertTrue(first.isConverged() && second.isConverged());
        assertEquals(1, second.getSweeps());
        assertEquals(0.0, second.getBudgetUsed(), 1e-12);
        assertEquals(0, ledger.getAssignment("q"));
    }

    @Test
    void equal_cost_move_happens_once_when_prices_stay_apart() {
        decide(new Query("q0", 20.0, new double[]{4.0, 4.0}, 0.0));
        decide(new Query("q1", 30.0, new double[]{4.0, 50.0}, 0.0));
        decide(new Query("q2", 10.0, new double[]{1.0, 60.0}, 0.0));
        assertEquals(0.021, ps.getPrice(0), 1e-12);
        ReassignmentStrategy strategy = new ReassignmentStrategy(100);

        RevisionOutcome first = strategy.revise(ps, ledger, Double.POSITIVE_INFINITY);
        RevisionOutcome second = strategy.revise(ps, ledger, Double.POSITIVE_INFINITY);

        assertEquals(1, first.getCount());
        assertTrue(first.isConverged());
        assertEquals(1, ledger.getAssignment("q0"));
        assertEquals(0.01, ps.getPrice(0), 1e-12);
        assertEquals(0, second.getCount());
        assertEquals(1, ledger.getAssignment("q0"));
    }
}
