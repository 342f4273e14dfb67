/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import java.util.Objects;

/**
 * A validated span [start,end) with its canonical type. The covered text is never stored,
 * only sliced from the source text on demand.
 */
public record EntityCandidate(
        int start, int end, CanonicalType type, String rawType, double score, DetectorSource source) {

    public EntityCandidate {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("invalid span [" + start + "," + end + ")");
        }
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
        rawType = rawType == null ? "" : rawType;
        score = Math.max(0.0, Math.min(1.0, score));
    }

    public int length() {
        return end - start;
    }

    public String text(String source) {
        return source.substring(start, end);
    }

    public boolean fitsIn(String text) {
        return end <= text.length();
    }

    /** Number of characters shared with {@code other}, 0 when disjoint. */
    public int overlap(EntityCandidate other) {
        return Math.max(0, Math.min(end, other.end) - Math.max(start, other.start));
    }

    /** True when the spans overlap or are directly adjacent. */
    public boolean touches(EntityCandidate other) {
        return start <= other.end && other.start <= end;
    }

    public boolean contains(EntityCandidate other) {
        return start <= other.start && other.end <= end;
    }

    public EntityCandidate withSpan(int newStart, int newEnd) {
        return new EntityCandidate(newStart, newEnd, type, rawType, score, source);
    }

    public String describe() {
        return type + "[" + start + "," + end + ")";
    }
}
