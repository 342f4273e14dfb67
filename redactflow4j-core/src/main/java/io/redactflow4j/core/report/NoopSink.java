/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import io.redactflow4j.core.api.model.Discard;
import java.util.List;

public final class NoopSink implements DiscardSink {
    @Override
    public void report(List<Discard> discards) {
        /* no-op */
    }
}
