/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import io.redactflow4j.core.api.model.Discard;
import io.redactflow4j.core.api.model.DiscardStage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes discards to the {@code redactflow4j.discards} logger. Recovery discards go to INFO so a
 * dropped model finding is visible by default; the rest go to DEBUG.
 */
public final class LoggingSink implements DiscardSink {
    private static final Logger log = LoggerFactory.getLogger("redactflow4j.discards");

    @Override
    public void report(List<Discard> discards) {
        if (discards == null) return;
        for (Discard d : discards) {
            if (d.stage() == DiscardStage.RECOVERY_DISCARD) {
                log.info("[{}] {} '{}' from {} {}", d.stage(), d.reason(), d.valueOrSpan(), d.source(), d.detail());
            } else if (log.isDebugEnabled()) {
                log.debug("[{}] {} '{}' from {} {}", d.stage(), d.reason(), d.valueOrSpan(), d.source(), d.detail());
            }
        }
    }
}
