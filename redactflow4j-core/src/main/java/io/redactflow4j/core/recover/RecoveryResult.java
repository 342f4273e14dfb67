/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.recover;

import io.redactflow4j.core.api.model.Discard;
import io.redactflow4j.core.api.model.EntityCandidate;
import io.redactflow4j.core.api.model.RecoveryOutcome;
import java.util.List;

/** Recovered candidates (source GENERATIVE), one outcome per input tag, and the discards. */
public record RecoveryResult(
        List<EntityCandidate> candidates, List<RecoveryOutcome> outcomes, List<Discard> discards) {

    public RecoveryResult {
        candidates = List.copyOf(candidates);
        outcomes = List.copyOf(outcomes);
        discards = List.copyOf(discards);
    }

    public static RecoveryResult empty() {
        return new RecoveryResult(List.of(), List.of(), List.of());
    }
}
