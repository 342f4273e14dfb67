/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.redactflow4j.core.api.model.Discard;
import io.redactflow4j.core.report.DiscardSink;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/** Counts discards per stage and reason, and keeps the most recent ones for the endpoint. */
public final class MicrometerDiscardSink implements DiscardSink {
    public static final String METRIC = "redactflow4j_discards_total";

    private final MeterRegistry registry;
    private final Deque<Discard> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerDiscardSink(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(List<Discard> discards) {
        if (discards == null || discards.isEmpty()) return;
        for (Discard d : discards) {
            registry.counter(METRIC, "stage", d.stage().name(), "reason", d.reason().name())
                    .increment();
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(d);
        }
    }

    /** Returns an unmodifiable snapshot of the recent discards ring buffer. */
    public synchronized List<Discard> recentDiscards() {
        return List.copyOf(ring);
    }
}
