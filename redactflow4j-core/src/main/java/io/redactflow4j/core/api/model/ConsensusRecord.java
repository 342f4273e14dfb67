/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/**
 * Audit record for two agreeing candidates: the union span, the max score, and both raw types.
 */
public record ConsensusRecord(
        int start,
        int end,
        CanonicalType type,
        double score,
        String primaryRawType,
        DetectorSource primarySource,
        String secondaryRawType,
        DetectorSource secondarySource) {

    public static ConsensusRecord of(EntityCandidate primary, EntityCandidate secondary) {
        return new ConsensusRecord(
                Math.min(primary.start(), secondary.start()),
                Math.max(primary.end(), secondary.end()),
                primary.type(),
                Math.max(primary.score(), secondary.score()),
                primary.rawType(),
                primary.source(),
                secondary.rawType(),
                secondary.source());
    }

    public EntityCandidate toCandidate() {
        return new EntityCandidate(
                start, end, type, primaryRawType + "+" + secondaryRawType, score, DetectorSource.CONSENSUS);
    }
}
