/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

import io.redactflow4j.core.api.model.CanonicalType;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/** Mask strings per canonical type, with a fallback. */
public record MaskConfig(String defaultMask, Map<CanonicalType, String> byType) {
    public static final String DEFAULT_MASK = "****";

    public MaskConfig {
        defaultMask = defaultMask == null ? DEFAULT_MASK : defaultMask;
        byType = byType == null || byType.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(byType));
    }

    public static MaskConfig defaults() {
        return new MaskConfig(DEFAULT_MASK, Map.of());
    }

    /** Type-named placeholders such as {@code <PERSON>}. */
    public static MaskConfig typeTags() {
        Map<CanonicalType, String> m = new EnumMap<>(CanonicalType.class);
        for (CanonicalType t : CanonicalType.values()) m.put(t, "<" + t.name() + ">");
        return new MaskConfig(DEFAULT_MASK, m);
    }

    public String maskFor(CanonicalType type) {
        return byType.getOrDefault(Objects.requireNonNull(type, "type"), defaultMask);
    }
}
