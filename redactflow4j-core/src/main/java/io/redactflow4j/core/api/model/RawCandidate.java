/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/**
 * Unvalidated span as emitted by a detector. Offsets may be out of bounds;
 * the pipeline checks them against the text before anything else.
 */
public record RawCandidate(int start, int end, String rawType, double score, DetectorSource source) {}
