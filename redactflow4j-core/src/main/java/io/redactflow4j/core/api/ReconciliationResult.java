/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api;

import io.redactflow4j.core.api.model.ConsensusRecord;
import io.redactflow4j.core.api.model.Discard;
import io.redactflow4j.core.api.model.EntityCandidate;
import java.util.List;

/** Final candidates sorted by start, plus what was discarded on the way and why. */
public record ReconciliationResult(
        List<EntityCandidate> candidates, List<Discard> discards, List<ConsensusRecord> consensus) {

    public ReconciliationResult {
        candidates = List.copyOf(candidates);
        discards = List.copyOf(discards);
        consensus = List.copyOf(consensus);
    }

    public static ReconciliationResult empty() {
        return new ReconciliationResult(List.of(), List.of(), List.of());
    }

    public boolean found() {
        return !candidates.isEmpty();
    }
}
