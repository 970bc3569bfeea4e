package org.carma.allocation.model;

/**
 * Outcome of evaluating a single revealed query.
 */
public sealed interface Decision permits
        Decision.Assign,
        Decision.Reject,
        Decision.Defer {

    String queryId();

    /**
     * Query activated on the plan at {@code planIndex}.
     */
    record Assign(
            String queryId,
            int planIndex,
            double reducedProfit,
            double charge
    ) implements Decision {
    }

    /**
     * Query declined. A permanent rejection means no plan could ever hold it.
     */
    record Reject(
            String queryId,
            boolean permanent
    ) implements Decision {
    }

    /**
     * Costs on some plan are not known yet; query stays pending.
     */
    record Defer(
            String queryId
    ) implements Decision {
    }
}
