package com.voicetally.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter sessionsStarted() {
        return Counter.builder("voicetally.sessions.started").register(registry);
    }

    public Counter sessionsEnded() {
        return Counter.builder("voicetally.sessions.ended").register(registry);
    }

    public Counter secondsTracked() {
        return Counter.builder("voicetally.seconds.tracked").baseUnit("seconds").register(registry);
    }

    public Counter reportsPosted() {
        return Counter.builder("voicetally.reports.posted").register(registry);
    }
}
