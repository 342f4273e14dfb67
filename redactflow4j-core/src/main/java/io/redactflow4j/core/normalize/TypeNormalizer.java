/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import io.redactflow4j.core.api.model.CanonicalType;
import io.redactflow4j.core.api.model.DetectorSource;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Total mapping from raw detector labels to {@link CanonicalType}.
 * Unknown labels resolve to {@link CanonicalType#UNKNOWN} and are logged, never rejected.
 */
public final class TypeNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TypeNormalizer.class);

    private final TypeMapping mapping;

    public TypeNormalizer(TypeMapping mapping) {
        this.mapping = Objects.requireNonNull(mapping, "mapping");
    }

    public CanonicalType normalize(String rawLabel, DetectorSource source) {
        return normalize(rawLabel, mapping.vocabularyFor(source));
    }

    public CanonicalType normalize(String rawLabel, LabelVocabulary vocabulary) {
        Optional<CanonicalType> resolved = resolve(rawLabel, vocabulary);
        if (resolved.isPresent()) return resolved.get();
        log.warn("Unmapped label '{}' in vocabulary '{}', using UNKNOWN", rawLabel, vocabulary.name());
        return CanonicalType.UNKNOWN;
    }

    /** Like {@link #normalize} but empty instead of UNKNOWN, and silent. */
    public Optional<CanonicalType> resolve(String rawLabel, LabelVocabulary vocabulary) {
        if (rawLabel == null || rawLabel.isBlank()) return Optional.empty();
        Optional<CanonicalType> hit = vocabulary.lookup(rawLabel);
        if (hit.isPresent()) return hit;
        String bare = stripBio(rawLabel);
        if (!bare.equals(rawLabel)) {
            hit = vocabulary.lookup(bare);
            if (hit.isPresent()) return hit;
        }
        return CanonicalType.byName(bare).filter(CanonicalType::isKnown);
    }

    public TypeMapping mapping() {
        return mapping;
    }

    /** "B-PER" → "PER", "I-LOC" → "LOC"; anything else unchanged. */
    public static String stripBio(String label) {
        String l = label.trim();
        if (l.length() > 2 && (l.startsWith("B-") || l.startsWith("I-"))) return l.substring(2);
        return l;
    }

    public static boolean isBegin(String label) {
        return label != null && label.trim().startsWith("B-");
    }

    public static boolean isInside(String label) {
        return label != null && label.trim().startsWith("I-");
    }

    public static boolean isOutside(String label) {
        return label == null || label.isBlank() || "O".equals(label.trim());
    }
}
