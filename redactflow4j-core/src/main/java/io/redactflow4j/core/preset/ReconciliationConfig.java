/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.preset;

import io.redactflow4j.core.api.model.CanonicalType;
import io.redactflow4j.core.api.model.DetectorSource;
import io.redactflow4j.core.filter.AllowList;
import io.redactflow4j.core.normalize.TypeMapping;
import java.util.*;
import lombok.Builder;

/**
 * Immutable per-pipeline configuration. Start from {@link #defaults()} and adjust with
 * {@code toBuilder()}.
 *
 * @param typeMapping          vocabulary per detector source
 * @param overlapThreshold     consensus: overlap must reach this share of the shorter span
 * @param lengthTolerance      recovery: allowed relative length deviation of a window match
 * @param strict               dual-detection mode: keep only candidates two detectors agree on
 * @param typePriority         merge: earlier types win cross-type containment
 * @param noiseContentRatio    noise filter: minimum share of non-space, non-punctuation chars
 * @param primarySources       consensus side A; every other source is side B
 * @param consensusExemptTypes types that bypass consensus in strict mode
 * @param anchorLength         recovery: chars taken from each generated context as anchor
 * @param minSimilarity        recovery: minimum similarity of a one-anchor window match
 * @param generativeBaseScore  recovery: score of an exact generative match
 * @param searchWindow         recovery: max distance an anchor may lie ahead of the cursor
 * @param maxSpanByType        recovery: per-type upper bound of a window match
 * @param defaultMaxSpan       recovery: bound for types not in {@code maxSpanByType}
 * @param allowList            terms never redacted
 */
@Builder(toBuilder = true)
public record ReconciliationConfig(
        TypeMapping typeMapping,
        double overlapThreshold,
        double lengthTolerance,
        boolean strict,
        List<CanonicalType> typePriority,
        double noiseContentRatio,
        Set<DetectorSource> primarySources,
        Set<CanonicalType> consensusExemptTypes,
        int anchorLength,
        double minSimilarity,
        double generativeBaseScore,
        int searchWindow,
        Map<CanonicalType, Integer> maxSpanByType,
        int defaultMaxSpan,
        AllowList allowList) {

    public ReconciliationConfig {
        Objects.requireNonNull(typeMapping, "typeMapping");
        if (!(overlapThreshold > 0.0 && overlapThreshold <= 1.0)) {
            throw new IllegalArgumentException("overlapThreshold must be in (0,1]: " + overlapThreshold);
        }
        if (!(lengthTolerance >= 0.0 && lengthTolerance < 1.0)) {
            throw new IllegalArgumentException("lengthTolerance must be in [0,1): " + lengthTolerance);
        }
        if (!(noiseContentRatio >= 0.0 && noiseContentRatio <= 1.0)) {
            throw new IllegalArgumentException("noiseContentRatio must be in [0,1]: " + noiseContentRatio);
        }
        if (!(minSimilarity >= 0.0 && minSimilarity <= 1.0)) {
            throw new IllegalArgumentException("minSimilarity must be in [0,1]: " + minSimilarity);
        }
        if (anchorLength < 1) throw new IllegalArgumentException("anchorLength must be >= 1");
        if (searchWindow < 1) throw new IllegalArgumentException("searchWindow must be >= 1");
        if (defaultMaxSpan < 1) throw new IllegalArgumentException("defaultMaxSpan must be >= 1");
        generativeBaseScore = Math.max(0.0, Math.min(1.0, generativeBaseScore));
        typePriority = typePriority == null ? defaultPriority() : List.copyOf(typePriority);
        primarySources = primarySources == null || primarySources.isEmpty()
                ? Set.of(DetectorSource.PATTERN)
                : Collections.unmodifiableSet(EnumSet.copyOf(primarySources));
        consensusExemptTypes = consensusExemptTypes == null || consensusExemptTypes.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(consensusExemptTypes));
        maxSpanByType = maxSpanByType == null ? Map.of() : Map.copyOf(maxSpanByType);
        allowList = allowList == null ? AllowList.empty() : allowList;
    }

    public static ReconciliationConfig defaults() {
        return ReconciliationConfig.builder()
                .typeMapping(TypeMapping.defaults())
                .overlapThreshold(0.5)
                .lengthTolerance(0.3)
                .strict(false)
                .typePriority(defaultPriority())
                .noiseContentRatio(0.5)
                .primarySources(EnumSet.of(DetectorSource.PATTERN))
                .consensusExemptTypes(Set.of())
                .anchorLength(8)
                .minSimilarity(0.6)
                .generativeBaseScore(0.85)
                .searchWindow(700)
                .maxSpanByType(defaultMaxSpans())
                .defaultMaxSpan(120)
                .allowList(AllowList.empty())
                .build();
    }

    /** Structured pattern types outrank generic name/location types. */
    public static List<CanonicalType> defaultPriority() {
        return List.of(
                CanonicalType.EMAIL,
                CanonicalType.PHONE,
                CanonicalType.ZIP_CODE,
                CanonicalType.CUSTOMER_ID,
                CanonicalType.DATE_OF_BIRTH,
                CanonicalType.LOCATION,
                CanonicalType.PERSON,
                CanonicalType.ORGANIZATION,
                CanonicalType.AGE,
                CanonicalType.GENDER,
                CanonicalType.UNKNOWN);
    }

    public static Map<CanonicalType, Integer> defaultMaxSpans() {
        Map<CanonicalType, Integer> m = new EnumMap<>(CanonicalType.class);
        m.put(CanonicalType.LOCATION, 200);
        m.put(CanonicalType.PERSON, 40);
        m.put(CanonicalType.ORGANIZATION, 80);
        m.put(CanonicalType.CUSTOMER_ID, 40);
        m.put(CanonicalType.EMAIL, 80);
        m.put(CanonicalType.PHONE, 40);
        m.put(CanonicalType.ZIP_CODE, 20);
        m.put(CanonicalType.DATE_OF_BIRTH, 30);
        return m;
    }

    public int maxSpanFor(CanonicalType type) {
        return maxSpanByType.getOrDefault(type, defaultMaxSpan);
    }

    /** Lower is stronger; types missing from the list rank last. */
    public int priorityOf(CanonicalType type) {
        int i = typePriority.indexOf(type);
        return i < 0 ? typePriority.size() : i;
    }
}
