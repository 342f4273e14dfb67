/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/** Why something was discarded; each reason belongs to exactly one {@link DiscardStage}. */
public enum DiscardReason {
    NO_MATCH(DiscardStage.RECOVERY_DISCARD),
    AMBIGUOUS_MATCH(DiscardStage.RECOVERY_DISCARD),
    ANCHOR_MISSING(DiscardStage.RECOVERY_DISCARD),
    LENGTH_MISMATCH(DiscardStage.RECOVERY_DISCARD),
    TAG_UNRECOGNIZED(DiscardStage.RECOVERY_DISCARD),

    TYPE_MISMATCH(DiscardStage.CONSENSUS_REJECT),
    INSUFFICIENT_OVERLAP(DiscardStage.CONSENSUS_REJECT),
    NO_COUNTERPART(DiscardStage.CONSENSUS_REJECT),

    CONTAINED_BY_HIGHER_PRIORITY(DiscardStage.MERGE_DROP),
    OUT_OF_BOUNDS(DiscardStage.MERGE_DROP),

    NOISE_CONTENT(DiscardStage.NOISE_REJECT),
    ALLOW_LISTED(DiscardStage.ALLOW_LIST),
    UNKNOWN_LABEL(DiscardStage.MAPPING_UNKNOWN);

    private final DiscardStage stage;

    DiscardReason(DiscardStage stage) {
        this.stage = stage;
    }

    public DiscardStage stage() {
        return stage;
    }
}
