/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import java.util.Objects;

/** Result of aligning one generative tag: either a recovered span or a discard reason. */
public record RecoveryOutcome(GenerativeTag tag, int start, int end, DiscardReason reason) {

    public static RecoveryOutcome recovered(GenerativeTag tag, int start, int end) {
        return new RecoveryOutcome(tag, start, end, null);
    }

    public static RecoveryOutcome discarded(GenerativeTag tag, DiscardReason reason) {
        Objects.requireNonNull(reason, "reason");
        return new RecoveryOutcome(tag, -1, -1, reason);
    }

    public boolean isRecovered() {
        return reason == null;
    }
}
