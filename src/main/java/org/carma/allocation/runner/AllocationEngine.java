package org.carma.allocation.runner;

import com.codahale.metrics.Timer;
import org.carma.allocation.event.Event;
import org.carma.allocation.event.EventBus;
import org.carma.allocation.mechanism.*;
import org.carma.allocation.mechanism.InvariantMonitor.InvariantViolationException;
import org.carma.allocation.mechanism.RevisionStrategy.RevisionOutcome;
import org.carma.allocation.metrics.EngineMetrics;
import org.carma.allocation.model.*;
import org.carma.allocation.model.RoundReport.DecisionRecord;
import org.carma.allocation.model.RoundReport.Outcome;
import org.carma.allocation.safety.ConfigurationException;
import org.carma.allocation.safety.ConfigurationValidator;
import org.carma.allocation.simulation.RoundTrace;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives scheduling rounds over a single price state and ledger.
 *
 * Round lifecycle:
 * <pre>
 *   IDLE → INGESTING → DECIDING → REVISING → REPORTING → IDLE
 * </pre>
 * - INGESTING: queries submitted since the last round become pending
 * - DECIDING: the allocator decides every pending query
 * - REVISING: the mode selects reactivation and/or reassignment, in that order
 * - REPORTING: utilization, deficit and profit are appended to the trace
 *
 * Invariants are validated after DECIDING and after REVISING. A violation
 * aborts the round and halts the engine. Rounds are not re-entrant: a second
 * call while one is running fails immediately.
 *
 * Usage:
 * <pre>
 * AllocationEngine engine = AllocationEngine.configure(plans, PriceUpdateParams.DEFAULT);
 * engine.submit(query);
 * RoundReport report = engine.runRound(AllocationMode.BOTH);
 * </pre>
 */
public class AllocationEngine {

    public enum State {
        IDLE,
        INGESTING,
        DECIDING,
        REVISING,
        REPORTING
    }

    private final List<Plan> plans;
    private final PriceUpdateParams params;
    private final PriceState priceState;
    private final AllocationLedger ledger;
    private final InvariantMonitor monitor;
    private final DualDescentAllocator allocator;
    private final ReactivationStrategy reactivation;
    private final ReassignmentStrategy reassignment;
    private final ConfigurationValidator validator;
    private final EventBus eventBus;
    private final EngineMetrics metrics;
    private final RoundTrace trace;
    private final AtomicReference<State> state;
    private final List<Query> inbox;
    private final boolean verbose;

    private volatile boolean halted;
    private int round;

    private AllocationEngine(List<Plan> plans, PriceUpdateParams params, boolean verbose) {
        this.plans = List.copyOf(plans);
        this.params = params;
        this.verbose = verbose;
        this.monitor = new InvariantMonitor();
        this.priceState = new PriceState(this.plans, params);
        this.ledger = new AllocationLedger(monitor);
        this.allocator = new DualDescentAllocator();
        this.reactivation = new ReactivationStrategy(allocator, params.getMaxIterations(), verbose);
        this.reassignment = new ReassignmentStrategy(params.getMaxIterations(), verbose);
        this.validator = new ConfigurationValidator();
        this.eventBus = new EventBus();
        this.metrics = new EngineMetrics();
        this.trace = new RoundTrace(this.plans.stream().map(Plan::getId).toList());
        this.state = new AtomicReference<>(State.IDLE);
        this.inbox = new ArrayList<>();
    }

    // ========================================================================
    // Configuration
    // ========================================================================

    /**
     * Create an engine over a fixed set of plans.
     *
     * @throws ConfigurationException if a plan or parameter is malformed
     */
    public static AllocationEngine configure(List<Plan> plans, PriceUpdateParams params) {
        return configure(plans, params, false);
    }

    public static AllocationEngine configure(List<Plan> plans, PriceUpdateParams params, boolean verbose) {
        ConfigurationValidator validator = new ConfigurationValidator();
        ConfigurationValidator.ValidationResult planCheck = validator.validatePlans(plans).orThrow();
        validator.validateParams(params).orThrow();

        AllocationEngine engine = new AllocationEngine(plans, params, verbose);
        for (ConfigurationValidator.ValidationWarning warning : planCheck.getWarnings()) {
            engine.log("[CONFIG] %s", warning);
        }
        return engine;
    }

    // ========================================================================
    // Inputs
    // ========================================================================

    /**
     * Stage a revealed query for the next round.
     *
     * @throws ConfigurationException if the query is malformed or its id is already known
     */
    public void submit(Query query) {
        requireIdle("submit");
        validator.validateQuery(query, plans.size()).orThrow();
        if (isKnownOrQueued(query.getId())) {
            throw new ConfigurationException("Query", "query.id", "duplicate query id " + query.getId());
        }
        inbox.add(query);
        eventBus.publish(new Event.QuerySubmittedEvent(Instant.now(), query.getId(), query.getValue()));
    }

    /**
     * Reveal the cost vector of a query that is still pending or queued.
     */
    public void revealCosts(String queryId, double[] costs) {
        requireIdle("revealCosts");
        List<ConfigurationValidator.ValidationError> errors =
            validator.validateCosts("query[" + queryId + "]", costs, plans.size());
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        for (int k = 0; k < inbox.size(); k++) {
            if (inbox.get(k).getId().equals(queryId)) {
                inbox.set(k, inbox.get(k).withAssignmentCosts(costs));
                return;
            }
        }
        if (!ledger.isPending(queryId)) {
            throw new IllegalStateException("Costs can only be revealed for pending queries: " + queryId);
        }
        ledger.revealCosts(queryId, costs);
    }

    /**
     * Withdraw an active query, freeing its budget. The freed plan's price may
     * decay. The query moves to the rejected set and is never reactivated.
     */
    public void release(String queryId) {
        requireIdle("release");
        if (!ledger.isActive(queryId)) {
            throw new IllegalStateException("Only active queries can be released: " + queryId);
        }
        int plan = ledger.release(queryId, priceState);
        priceState.relaxIfUncongested(plan);
        metrics.counter(EngineMetrics.RELEASED).inc();
        eventBus.publish(new Event.QueryReleasedEvent(Instant.now(), queryId, plans.get(plan).getId()));
        log("[RELEASE] %s from %s", queryId, plans.get(plan).getId());
    }

    // ========================================================================
    // Rounds
    // ========================================================================

    /**
     * Run one full round in the given mode.
     *
     * @throws InvariantViolationException if an engine invariant is broken; the engine halts
     * @throws IllegalStateException if a round is already running or the engine has halted
     */
    public RoundReport runRound(AllocationMode mode) {
        if (halted) {
            throw new IllegalStateException("Engine halted after an invariant violation");
        }
        if (!state.compareAndSet(State.IDLE, State.INGESTING)) {
            throw new IllegalStateException("Round already in progress (state " + state.get() + ")");
        }

        Timer.Context timer = metrics.timer(EngineMetrics.ROUND_LATENCY).time();
        try {
            round++;
            RoundReport report = new RoundReport(round, mode);
            double[] pricesBefore = priceState.snapshotPrices();
            double profitBefore = ledger.getProfit();
            log("[ROUND-START] %d (%s, %d queued)", round, mode, inbox.size());

            ingest();

            state.set(State.DECIDING);
            decidePending(mode, report);
            monitor.validate(priceState, ledger, "DECIDING");

            state.set(State.REVISING);
            revise(mode, report);
            monitor.validate(priceState, ledger, "REVISING");

            state.set(State.REPORTING);
            report(report, pricesBefore, profitBefore);
            return report;

        } catch (InvariantViolationException e) {
            halted = true;
            log("[ROUND-ABORT] %d: %s", round, e.getMessage());
            throw e;
        } finally {
            timer.stop();
            eventBus.closeRound(round);
            state.set(State.IDLE);
        }
    }

    private void ingest() {
        for (Query query : inbox) {
            ledger.admit(query);
        }
        inbox.clear();
    }

    private void decidePending(AllocationMode mode, RoundReport report) {
        List<Query> batch = new ArrayList<>();
        for (String id : ledger.getPending()) {
            batch.add(ledger.getQuery(id));
        }
        if (mode.isBatch()) {
            // Whole batch is known: most profitable queries claim budget first
            batch.sort(Comparator
                .comparingDouble(Query::getStandaloneProfit).reversed()
                .thenComparingInt(q -> ledger.getArrivalIndex(q.getId())));
        }

        for (Query query : batch) {
            Decision decision = allocator.decide(query, priceState, ledger);
            Instant now = Instant.now();
            if (decision instanceof Decision.Assign assign) {
                String planId = plans.get(assign.planIndex()).getId();
                report.addDecision(DecisionRecord.of(query.getId(), Outcome.ASSIGNED, planId));
                metrics.counter(EngineMetrics.ASSIGNED).inc();
                eventBus.publish(new Event.QueryAssignedEvent(now, query.getId(), planId,
                    assign.reducedProfit(), assign.charge()));
            } else if (decision instanceof Decision.Reject reject) {
                report.addDecision(DecisionRecord.of(query.getId(), Outcome.REJECTED, null));
                if (reject.permanent()) {
                    report.addInfeasibleQuery(query.getId());
                }
                metrics.counter(EngineMetrics.REJECTED).inc();
                eventBus.publish(new Event.QueryRejectedEvent(now, query.getId(), reject.permanent()));
            } else {
                report.addDecision(DecisionRecord.of(query.getId(), Outcome.DEFERRED, null));
                metrics.counter(EngineMetrics.DEFERRED).inc();
                eventBus.publish(new Event.QueryDeferredEvent(now, query.getId()));
            }
        }
    }

    private void revise(AllocationMode mode, RoundReport report) {
        double remaining = params.getRevisionBudget();
        boolean converged = true;

        if (mode.runsReactivation()) {
            RevisionOutcome outcome = reactivation.revise(priceState, ledger, remaining);
            remaining -= outcome.getBudgetUsed();
            converged &= outcome.isConverged();
            report.setPromotions(outcome.getCount());
            for (RevisionOutcome.Change change : outcome.getChanges()) {
                String planId = plans.get(change.toPlan()).getId();
                report.addDecision(DecisionRecord.of(change.queryId(), Outcome.REACTIVATED, planId));
                metrics.counter(EngineMetrics.REACTIVATED).inc();
                eventBus.publish(new Event.QueryReactivatedEvent(Instant.now(), change.queryId(),
                    planId, change.profitDelta()));
            }
        }

        if (mode.runsReassignment()) {
            RevisionOutcome outcome = reassignment.revise(priceState, ledger, Math.max(0.0, remaining));
            converged &= outcome.isConverged();
            report.setMigrations(outcome.getCount());
            for (RevisionOutcome.Change change : outcome.getChanges()) {
                String from = plans.get(change.fromPlan()).getId();
                String to = plans.get(change.toPlan()).getId();
                report.addDecision(new DecisionRecord(change.queryId(), Outcome.MIGRATED, to, from));
                metrics.counter(EngineMetrics.MIGRATED).inc();
                eventBus.publish(new Event.QueryMigratedEvent(Instant.now(), change.queryId(),
                    from, to, change.profitDelta()));
            }
        }

        report.setConverged(converged);
    }

    private void report(RoundReport report, double[] pricesBefore, double profitBefore) {
        for (int j = 0; j < plans.size(); j++) {
            report.setUtilization(plans.get(j).getId(), priceState.getUtilization(j));
            if (!plans.get(j).isUsable()) {
                report.addInfeasiblePlan(plans.get(j).getId());
            }
        }
        double deficit = priceState.distanceFrom(pricesBefore);
        report.setDeficit(deficit)
              .setProfit(ledger.getProfit())
              .setProfitDelta(ledger.getProfit() - profitBefore);

        trace.record(report);
        metrics.counter(EngineMetrics.ROUNDS).inc();
        metrics.recordDeficit(deficit);
        eventBus.publish(new Event.RoundCompletedEvent(Instant.now(), report.getRound(),
            report.getProfit(), deficit, report.getUtilization()));
        log("[ROUND-COMMIT] %d: profit=%.4f (%+.4f), deficit=%.6f, active=%d, rejected=%d, pending=%d",
            report.getRound(), report.getProfit(), report.getProfitDelta(), deficit,
            ledger.getActiveCount(), ledger.getRejectedCount(), ledger.getPendingCount());
    }

    // ========================================================================
    // Inspection
    // ========================================================================

    /**
     * Read-only snapshot of partitions, assignment, prices and profit.
     */
    public EngineSnapshot inspect() {
        Map<String, String> assignment = new LinkedHashMap<>();
        for (String id : ledger.getActive()) {
            assignment.put(id, plans.get(ledger.getAssignment(id)).getId());
        }
        Map<String, Double> prices = new LinkedHashMap<>();
        Map<String, Double> consumed = new LinkedHashMap<>();
        for (int j = 0; j < plans.size(); j++) {
            prices.put(plans.get(j).getId(), priceState.getPrice(j));
            consumed.put(plans.get(j).getId(), priceState.getConsumed(j));
        }
        List<String> queued = new ArrayList<>();
        for (Query q : inbox) {
            queued.add(q.getId());
        }
        return new EngineSnapshot(ledger.getActive(), ledger.getRejected(), ledger.getPending(),
            queued, assignment, prices, consumed, ledger.getProfit());
    }

    /**
     * Whether another round would have anything to decide.
     */
    public boolean hasWork() {
        return !inbox.isEmpty() || ledger.getPendingCount() > 0;
    }

    public State getState() { return state.get(); }
    public boolean isHalted() { return halted; }
    public int getRound() { return round; }
    public List<Plan> getPlans() { return plans; }
    public PriceUpdateParams getParams() { return params; }
    public RoundTrace trace() { return trace; }
    public EventBus events() { return eventBus; }
    public EngineMetrics metrics() { return metrics; }

    PriceState priceState() { return priceState; }
    AllocationLedger ledger() { return ledger; }

    // ========================================================================
    // Helpers
    // ========================================================================

    private boolean isKnownOrQueued(String queryId) {
        if (ledger.isKnown(queryId)) return true;
        for (Query q : inbox) {
            if (q.getId().equals(queryId)) return true;
        }
        return false;
    }

    private void requireIdle(String operation) {
        if (state.get() != State.IDLE) {
            throw new IllegalStateException(operation + " is not allowed while a round is running");
        }
    }

    private void log(String format, Object... args) {
        if (verbose) {
            System.out.println(String.format(format, args));
        }
    }

    @Override
    public String toString() {
        return String.format("AllocationEngine[%d plans, round %d, %s, %s]",
            plans.size(), round, state.get(), ledger);
    }
}
