/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/** Where a candidate came from. CONSENSUS marks a candidate confirmed by two detectors. */
public enum DetectorSource {
    PATTERN,
    NER,
    TRANSFORMER,
    GENERATIVE,
    CONSENSUS
}
