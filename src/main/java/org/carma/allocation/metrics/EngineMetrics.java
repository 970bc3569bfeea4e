package org.carma.allocation.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Named decision counters and round timing, exported through a Dropwizard registry
 * so an external monitor can read them without touching engine state.
 */
public class EngineMetrics {

    public static final String ASSIGNED = "queries.assigned";
    public static final String REJECTED = "queries.rejected";
    public static final String DEFERRED = "queries.deferred";
    public static final String REACTIVATED = "queries.reactivated";
    public static final String MIGRATED = "queries.migrated";
    public static final String RELEASED = "queries.released";
    public static final String ROUNDS = "rounds";
    public static final String ROUND_LATENCY = "round.latency";
    public static final String DEFICIT = "round.deficit.micros";

    private final MetricRegistry registry;

    public EngineMetrics() {
        this(new MetricRegistry());
    }

    public EngineMetrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }
    public Histogram histogram(String name) { return registry.histogram(name); }

    public long count(String name) {
        return counter(name).getCount();
    }

    /**
     * Deficit is recorded in millionths so it fits the long-valued histogram.
     */
    public void recordDeficit(double deficit) {
        histogram(DEFICIT).update(Math.round(deficit * 1_000_000));
    }
}
