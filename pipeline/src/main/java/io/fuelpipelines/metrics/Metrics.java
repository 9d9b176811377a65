package io.fuelpipelines.metrics;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.concurrent.TimeUnit;

/** Thin facade over a Dropwizard registry with the few lookups the load pipeline needs. */
public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Mean of a timer's samples in milliseconds, 0 when it has none. */
    public double meanMillis(String timerName) {
        Timer t = registry.getTimers().get(timerName);
        if (t == null || t.getCount() == 0) return 0.0;
        return t.getSnapshot().getMean() / TimeUnit.MILLISECONDS.toNanos(1);
    }
}
