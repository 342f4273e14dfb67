/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import io.redactflow4j.core.api.model.CanonicalType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One detector's label table (raw label → canonical type).
 *
 * @param name  vocabulary id used in logs and configuration
 * @param table raw labels as the detector emits them; must not be empty
 */
public record LabelVocabulary(String name, Map<String, CanonicalType> table) {

    public LabelVocabulary {
        Objects.requireNonNull(name, "name");
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("label table for vocabulary '" + name + "' must not be empty");
        }
        table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
    }

    public static LabelVocabulary of(String name, Map<String, CanonicalType> table) {
        return new LabelVocabulary(name, table);
    }

    /** Union of several vocabularies; later entries win on conflicting labels. */
    public static LabelVocabulary merge(String name, LabelVocabulary... parts) {
        Map<String, CanonicalType> all = new LinkedHashMap<>();
        for (LabelVocabulary p : parts) all.putAll(p.table());
        return new LabelVocabulary(name, all);
    }

    public LabelVocabulary with(Map<String, CanonicalType> extra) {
        if (extra == null || extra.isEmpty()) return this;
        Map<String, CanonicalType> all = new LinkedHashMap<>(table);
        all.putAll(extra);
        return new LabelVocabulary(name, all);
    }

    /** Exact lookup first, then case-insensitive. */
    public Optional<CanonicalType> lookup(String label) {
        if (label == null) return Optional.empty();
        CanonicalType exact = table.get(label);
        if (exact != null) return Optional.of(exact);
        String key = fold(label);
        for (Map.Entry<String, CanonicalType> e : table.entrySet()) {
            if (fold(e.getKey()).equals(key)) return Optional.of(e.getValue());
        }
        return Optional.empty();
    }

    private static String fold(String label) {
        return label.trim().toUpperCase(Locale.ROOT);
    }
}
