package org.carma.allocation.mechanism;

import org.carma.allocation.model.Decision;
import org.carma.allocation.model.Plan;
import org.carma.allocation.model.PriceUpdateParams;
import org.carma.allocation.model.Query;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DualDescentAllocatorTest {

    private final DualDescentAllocator allocator = new DualDescentAllocator();

    private Decision admitAndDecide(Query q, PriceState ps, AllocationLedger ledger) {
        ledger.admit(q);
        return allocator.decide(q, ps, ledger);
    }

    @Test
    void single_plan_walkthrough() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(new InvariantMonitor());

        Decision first = admitAndDecide(new Query("id1", 8.0, new double[]{6.0}, 0.0), ps, ledger);
        Decision.Assign assign = assertInstanceOf(Decision.Assign.class, first);
        assertEquals(0, assign.planIndex());
        assertEquals(2.0, assign.reducedProfit(), 1e-12);
        assertEquals(6.0, ps.getConsumed(0), 1e-12);
        assertEquals(0.0, ps.getPrice(0));

        Decision second = admitAndDecide(new Query("id2", 3.0, new double[]{6.0}, 1.0), ps, ledger);
        Decision.Reject reject = assertInstanceOf(Decision.Reject.class, second);
        assertFalse(reject.permanent());
        assertTrue(ledger.isRejected("id2"));
        assertEquals(2.0, ledger.getProfit(), 1e-12);
    }

    @Test
    void picks_plan_with_highest_reduced_profit() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0), new Plan("b", 10.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(new InvariantMonitor());

        Decision d = admitAndDecide(new Query("q", 10.0, new double[]{6.0, 3.0}, 0.0), ps, ledger);
        assertEquals(1, assertInstanceOf(Decision.Assign.class, d).planIndex());
    }

    @Test
    void ties_go_to_the_lowest_plan_index() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0), new Plan("b", 10.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(new InvariantMonitor());

        Decision d = admitAndDecide(new Query("q", 10.0, new double[]{3.0, 3.0}, 0.0), ps, ledger);
        assertEquals(0, assertInstanceOf(Decision.Assign.class, d).planIndex());
    }

    @Test
    void zero_reduced_profit_is_rejected() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(new InvariantMonitor());

        Decision d = admitAndDecide(new Query("q", 5.0, new double[]{4.0}, 1.0), ps, ledger);
        assertFalse(assertInstanceOf(Decision.Reject.class, d).permanent());
    }

    @Test
    void query_larger_than_every_plan_is_rejected_permanently() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0), new Plan("none", 0.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(new InvariantMonitor());

        Decision d = admitAndDecide(new Query("q", 100.0, new double[]{20.0, 0.0}, 0.0), ps, ledger);
        assertTrue(assertInstanceOf(Decision.Reject.class, d).permanent());
        assertTrue(ledger.isPermanentlyRejected("q"));
    }

    @Test
    void unknown_cost_defers_the_query() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0), new Plan("b", 10.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(new InvariantMonitor());

        Decision d = admitAndDecide(new Query("q", 10.0, new double[]{2.0, Double.NaN}, 0.0), ps, ledger);
        assertInstanceOf(Decision.Defer.class, d);
        assertTrue(ledger.isPending("q"));
        assertEquals(0.0, ps.getConsumed(0));
    }

    @Test
    void congestion_raises_the_chosen_plan_price() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(new InvariantMonitor());

        admitAndDecide(new Query("q", 20.0, new double[]{8.0}, 0.0), ps, ledger);
        assertEquals(0.01, ps.getPrice(0), 1e-12);

        Query next = new Query("r", 20.0, new double[]{2.0}, 0.0);
        ledger.admit(next);
        assertEquals(20.0 - 2.0 * 1.01, allocator.reducedProfit(next, 0, ps, ledger), 1e-12);
    }

    @Test
    void evaluate_skips_plans_without_room() {
        PriceState ps = new PriceState(List.of(new Plan("a", 5.0), new Plan("b", 10.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(new InvariantMonitor());
        Query q = new Query("q", 20.0, new double[]{5.0, 8.0}, 1.0);
        ledger.admit(q);

        DualDescentAllocator.Candidate best = allocator.evaluate(q, ps, ledger);
        assertNotNull(best);
        assertEquals(1, best.planIndex());
        assertEquals(9.0, best.charge(), 1e-12);
        assertEquals(11.0, best.reducedProfit(), 1e-12);
    }
}
