/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/**
 * Observability event for a local, recoverable rejection (value or span, reason, source).
 * Never raised to the caller.
 */
public record Discard(String valueOrSpan, DiscardReason reason, DetectorSource source, String detail) {

    public static Discard of(String valueOrSpan, DiscardReason reason, DetectorSource source) {
        return new Discard(valueOrSpan, reason, source, "");
    }

    public static Discard of(EntityCandidate c, DiscardReason reason, String detail) {
        return new Discard(c.describe(), reason, c.source(), detail == null ? "" : detail);
    }

    public DiscardStage stage() {
        return reason.stage();
    }
}
