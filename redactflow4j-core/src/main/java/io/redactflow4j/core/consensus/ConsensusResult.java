/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.consensus;

import io.redactflow4j.core.api.model.ConsensusRecord;
import io.redactflow4j.core.api.model.EntityCandidate;
import java.util.List;

public record ConsensusResult(List<EntityCandidate> candidates, List<ConsensusRecord> records) {

    public ConsensusResult {
        candidates = List.copyOf(candidates);
        records = List.copyOf(records);
    }
}
