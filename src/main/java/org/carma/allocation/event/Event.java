package org.carma.allocation.event;

import java.time.Instant;
import java.util.Map;

/**
 * Base interface for all engine events.
 * Events provide an audit trail of every allocation decision.
 */
public sealed interface Event permits
        Event.QuerySubmittedEvent,
        Event.QueryAssignedEvent,
        Event.QueryRejectedEvent,
        Event.QueryDeferredEvent,
        Event.QueryReactivatedEvent,
        Event.QueryMigratedEvent,
        Event.QueryReleasedEvent,
        Event.RoundCompletedEvent {

    Instant timestamp();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * Query accepted for the next round.
     */
    record QuerySubmittedEvent(
            Instant timestamp,
            String queryId,
            double value
    ) implements Event {
        public String eventType() { return "QUERY_SUBMITTED"; }
    }

    /**
     * Query activated by the allocator.
     */
    record QueryAssignedEvent(
            Instant timestamp,
            String queryId,
            String planId,
            double reducedProfit,
            double charge
    ) implements Event {
        public String eventType() { return "QUERY_ASSIGNED"; }
    }

    /**
     * Query declined by the allocator.
     */
    record QueryRejectedEvent(
            Instant timestamp,
            String queryId,
            boolean permanent
    ) implements Event {
        public String eventType() { return "QUERY_REJECTED"; }
    }

    /**
     * Query left pending because some of its costs are unknown.
     */
    record QueryDeferredEvent(
            Instant timestamp,
            String queryId
    ) implements Event {
        public String eventType() { return "QUERY_DEFERRED"; }
    }

    /**
     * Rejected query promoted to active.
     */
    record QueryReactivatedEvent(
            Instant timestamp,
            String queryId,
            String planId,
            double profitDelta
    ) implements Event {
        public String eventType() { return "QUERY_REACTIVATED"; }
    }

    /**
     * Active query moved to another plan.
     */
    record QueryMigratedEvent(
            Instant timestamp,
            String queryId,
            String fromPlanId,
            String toPlanId,
            double profitDelta
    ) implements Event {
        public String eventType() { return "QUERY_MIGRATED"; }
    }

    /**
     * Active query withdrawn by the host.
     */
    record QueryReleasedEvent(
            Instant timestamp,
            String queryId,
            String planId
    ) implements Event {
        public String eventType() { return "QUERY_RELEASED"; }
    }

    /**
     * Round committed and reported.
     */
    record RoundCompletedEvent(
            Instant timestamp,
            int round,
            double profit,
            double deficit,
            Map<String, Double> utilization
    ) implements Event {
        public String eventType() { return "ROUND_COMPLETED"; }
    }
}
