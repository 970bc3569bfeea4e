package org.carma.allocation.mechanism;

import java.util.*;

/**
 * Enforces the engine invariants before and after state commits.
 *
 * 1. Budget: consumed_j ≤ B_j for every plan
 * 2. Partition: active, rejected and pending are disjoint and cover every known query
 * 3. Assignment: a query has a plan iff it is active
 * 4. Accounting: consumed_j equals the sum of charges of the queries on plan j
 *
 * Any failure is a defect in the engine, never a recoverable runtime condition,
 * so violations are thrown as {@link InvariantViolationException}.
 */
public class InvariantMonitor {

    /** Floating point slack allowed on budget comparisons. */
    public static final double TOLERANCE = 1e-9;

    /**
     * Result of an invariant check.
     */
    public static class CheckResult {
        private final boolean satisfied;
        private final List<String> violations;
        private final String planId;
        private final String queryId;

        private CheckResult(boolean satisfied, List<String> violations, String planId, String queryId) {
            this.satisfied = satisfied;
            this.violations = new ArrayList<>(violations);
            this.planId = planId;
            this.queryId = queryId;
        }

        public static CheckResult pass() {
            return new CheckResult(true, Collections.emptyList(), null, null);
        }

        public static CheckResult fail(List<String> violations, String planId, String queryId) {
            return new CheckResult(false, violations, planId, queryId);
        }

        public boolean isSatisfied() { return satisfied; }
        public List<String> getViolations() { return Collections.unmodifiableList(violations); }
        public String getPlanId() { return planId; }
        public String getQueryId() { return queryId; }

        @Override
        public String toString() {
            return satisfied
                ? "CheckResult[PASS]"
                : "CheckResult[FAIL: " + String.join("; ", violations) + "]";
        }
    }

    private int passCount;
    private int failCount;

    // ========================================================================
    // Invariant 1: Budget
    // ========================================================================

    public CheckResult checkBudgets(PriceState priceState) {
        List<String> violations = new ArrayList<>();
        String firstPlan = null;

        for (int j = 0; j < priceState.getPlanCount(); j++) {
            double consumed = priceState.getConsumed(j);
            double budget = priceState.getBudget(j);
            if (consumed > budget + TOLERANCE) {
                String planId = priceState.getPlan(j).getId();
                violations.add(String.format(
                    "Budget exceeded on %s: consumed %.6f > budget %.6f", planId, consumed, budget));
                if (firstPlan == null) firstPlan = planId;
            }
            if (consumed < -TOLERANCE) {
                String planId = priceState.getPlan(j).getId();
                violations.add(String.format("Negative consumption on %s: %.6f", planId, consumed));
                if (firstPlan == null) firstPlan = planId;
            }
        }

        return record(violations.isEmpty()
            ? CheckResult.pass()
            : CheckResult.fail(violations, firstPlan, null));
    }

    /**
     * Validate a proposed consumption level before it is committed.
     */
    public void requireWithinBudget(PriceState priceState, int planIndex, double proposed, String queryId) {
        double budget = priceState.getBudget(planIndex);
        if (proposed > budget + TOLERANCE) {
            String planId = priceState.getPlan(planIndex).getId();
            CheckResult result = record(CheckResult.fail(List.of(String.format(
                "Committing %s would exceed budget on %s: %.6f > %.6f",
                queryId, planId, proposed, budget)), planId, queryId));
            throw new InvariantViolationException("Budget", result);
        }
        passCount++;
    }

    // ========================================================================
    // Invariants 2-3: Partition and Assignment
    // ========================================================================

    public CheckResult checkPartition(AllocationLedger ledger) {
        List<String> violations = new ArrayList<>();
        String firstQuery = null;

        for (String queryId : ledger.getKnownQueryIds()) {
            int memberships = 0;
            if (ledger.isActive(queryId)) memberships++;
            if (ledger.isRejected(queryId)) memberships++;
            if (ledger.isPending(queryId)) memberships++;

            if (memberships != 1) {
                violations.add(String.format(
                    "Query %s belongs to %d partitions", queryId, memberships));
                if (firstQuery == null) firstQuery = queryId;
            }

            boolean assigned = ledger.getAssignment(queryId) != AllocationLedger.UNASSIGNED;
            if (assigned != ledger.isActive(queryId)) {
                violations.add(String.format(
                    "Query %s is %s but %s", queryId,
                    ledger.isActive(queryId) ? "active" : "inactive",
                    assigned ? "assigned" : "unassigned"));
                if (firstQuery == null) firstQuery = queryId;
            }
        }

        int partitioned = ledger.getActiveCount() + ledger.getRejectedCount() + ledger.getPendingCount();
        if (partitioned != ledger.getKnownQueryIds().size()) {
            violations.add(String.format(
                "Partition sizes sum to %d but %d queries are known",
                partitioned, ledger.getKnownQueryIds().size()));
        }

        return record(violations.isEmpty()
            ? CheckResult.pass()
            : CheckResult.fail(violations, null, firstQuery));
    }

    // ========================================================================
    // Invariant 4: Accounting
    // ========================================================================

    public CheckResult checkAccounting(PriceState priceState, AllocationLedger ledger) {
        double[] expected = new double[priceState.getPlanCount()];
        for (String queryId : ledger.getActive()) {
            expected[ledger.getAssignment(queryId)] += ledger.getCharge(queryId);
        }

        List<String> violations = new ArrayList<>();
        String firstPlan = null;
        for (int j = 0; j < expected.length; j++) {
            double slack = 1e-6 * Math.max(1.0, priceState.getBudget(j));
            if (Math.abs(expected[j] - priceState.getConsumed(j)) > slack) {
                String planId = priceState.getPlan(j).getId();
                violations.add(String.format(
                    "Consumption on %s is %.6f but active charges sum to %.6f",
                    planId, priceState.getConsumed(j), expected[j]));
                if (firstPlan == null) firstPlan = planId;
            }
        }

        return record(violations.isEmpty()
            ? CheckResult.pass()
            : CheckResult.fail(violations, firstPlan, null));
    }

    // ========================================================================
    // Composite
    // ========================================================================

    /**
     * Run every invariant check; throw on the first failing one.
     *
     * @param phase Round phase being validated, used in the diagnostic
     */
    public void validate(PriceState priceState, AllocationLedger ledger, String phase) {
        enforce(phase + " budget", checkBudgets(priceState));
        enforce(phase + " partition", checkPartition(ledger));
        enforce(phase + " accounting", checkAccounting(priceState, ledger));
    }

    private void enforce(String checkName, CheckResult result) {
        if (!result.isSatisfied()) {
            throw new InvariantViolationException(checkName, result);
        }
    }

    private CheckResult record(CheckResult result) {
        if (result.isSatisfied()) passCount++;
        else failCount++;
        return result;
    }

    public int getPassCount() { return passCount; }
    public int getFailCount() { return failCount; }

    /**
     * Thrown when an engine invariant is broken. Identifies the violating plan
     * and/or query where one is known.
     */
    public static class InvariantViolationException extends RuntimeException {
        private final String checkName;
        private final List<String> violations;
        private final String planId;
        private final String queryId;

        public InvariantViolationException(String checkName, CheckResult result) {
            super(checkName + " invariant violated: " + String.join("; ", result.getViolations()));
            this.checkName = checkName;
            this.violations = result.getViolations();
            this.planId = result.getPlanId();
            this.queryId = result.getQueryId();
        }

        public String getCheckName() { return checkName; }
        public List<String> getViolations() { return violations; }
        public Optional<String> getPlanId() { return Optional.ofNullable(planId); }
        public Optional<String> getQueryId() { return Optional.ofNullable(queryId); }
    }

    @Override
    public String toString() {
        return String.format("InvariantMonitor[%d checks: %d pass, %d fail]",
            passCount + failCount, passCount, failCount);
    }
}
