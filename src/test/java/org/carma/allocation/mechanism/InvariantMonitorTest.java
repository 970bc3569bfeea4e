package org.carma.allocation.mechanism;

import org.carma.allocation.mechanism.InvariantMonitor.CheckResult;
import org.carma.allocation.mechanism.InvariantMonitor.InvariantViolationException;
import org.carma.allocation.model.Plan;
import org.carma.allocation.model.PriceUpdateParams;
import org.carma.allocation.model.Query;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InvariantMonitorTest {

    private final InvariantMonitor monitor = new InvariantMonitor();

    @Test
    void consistent_state_passes_every_check() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(monitor);
        ledger.admit(new Query("q1", 10.0, new double[]{4.0}, 1.0));
        ledger.admit(new Query("q2", 10.0, new double[]{4.0}, 1.0));
        ledger.activate("q1", 0, ps);
        ledger.reject("q2", false);

        assertDoesNotThrow(() -> monitor.validate(ps, ledger, "TEST"));
        assertTrue(monitor.getPassCount() > 0);
        assertEquals(0, monitor.getFailCount());
    }

    @Test
    void overspent_plan_fails_budget_check() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0)), PriceUpdateParams.DEFAULT);
        ps.setConsumed(0, 11.0);

        CheckResult result = monitor.checkBudgets(ps);

        assertFalse(result.isSatisfied());
        assertEquals("a", result.getPlanId());
        assertEquals(1, monitor.getFailCount());
    }

    @Test
    void consumption_without_matching_charges_fails_accounting() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(monitor);
        ledger.admit(new Query("q1", 10.0, new double[]{4.0}, 0.0));
        ledger.activate("q1", 0, ps);
        ps.setConsumed(0, 7.0);

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
            () -> monitor.validate(ps, ledger, "REVISING"));
        assertEquals("REVISING accounting", e.getCheckName());
        assertEquals("a", e.getPlanId().orElseThrow());
        assertFalse(e.getViolations().isEmpty());
    }

    @Test
    void proposed_overrun_is_refused_before_commit() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0)), PriceUpdateParams.DEFAULT);

        assertDoesNotThrow(() -> monitor.requireWithinBudget(ps, 0, 10.0, "q"));
        InvariantViolationException e = assertThrows(InvariantViolationException.class,
            () -> monitor.requireWithinBudget(ps, 0, 10.5, "q"));
        assertEquals("q", e.getQueryId().orElseThrow());
    }

    @Test
    void partition_check_covers_every_known_query() {
        PriceState ps = new PriceState(List.of(new Plan("a", 10.0)), PriceUpdateParams.DEFAULT);
        AllocationLedger ledger = new AllocationLedger(monitor);
        ledger.admit(new Query("q1", 10.0, new double[]{4.0}, 0.0));
        ledger.admit(new Query("q2", 10.0, new double[]{4.0}, 0.0));
        ledger.activate("q1", 0, ps);
        ledger.release("q1", ps);

        assertTrue(monitor.checkPartition(ledger).isSatisfied());
    }
}
