/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import io.redactflow4j.core.api.model.Discard;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fans out to several sinks; one failing sink does not stop the others. */
public final class CompositeSink implements DiscardSink {
    private static final Logger log = LoggerFactory.getLogger(CompositeSink.class);

    private final List<DiscardSink> sinks;

    public CompositeSink(List<DiscardSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void report(List<Discard> discards) {
        for (DiscardSink s : sinks) {
            try {
                s.report(discards);
            } catch (RuntimeException e) {
                log.warn("Discard sink {} failed: {}", s.getClass().getSimpleName(), e.toString());
            }
        }
    }
}
