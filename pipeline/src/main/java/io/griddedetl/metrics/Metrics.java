package io.griddedetl.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin facade over a {@link MetricRegistry} that scopes every metric under a prefix, so several
 * pipelines can share one registry.
 */
public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
    }

    public String name(String suffix) { return MetricRegistry.name(prefix, suffix); }

    public Counter counter(String suffix) { return registry.counter(name(suffix)); }
    public Meter meter(String suffix) { return registry.meter(name(suffix)); }
    public Timer timer(String suffix) { return registry.timer(name(suffix)); }
}
