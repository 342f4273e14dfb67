/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/** Pipeline stage that rejected a candidate or label. */
public enum DiscardStage {
    RECOVERY_DISCARD,
    CONSENSUS_REJECT,
    MERGE_DROP,
    NOISE_REJECT,
    ALLOW_LIST,
    MAPPING_UNKNOWN
}
