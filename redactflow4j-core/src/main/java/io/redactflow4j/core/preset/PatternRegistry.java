/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.preset;

import io.redactflow4j.core.detect.RegexDetector;
import io.redactflow4j.core.detect.SpanDetector;
import java.util.*;

/**
 * Builds the pattern detectors for the enabled {@link PatternType}s, in enum order so that the
 * detector list (and therefore the pipeline input) is deterministic.
 */
public final class PatternRegistry {

    /** Default enabled patterns (user may override in configuration). */
    public static EnumSet<PatternType> defaultTypes() {
        return EnumSet.of(
                PatternType.PHONE_JP,
                PatternType.EMAIL,
                PatternType.ZIP_CODE_JP,
                PatternType.DATE_OF_BIRTH,
                PatternType.AGE_JP,
                PatternType.GENDER_JP);
    }

    /**
     * @param types enabled types; null or empty means {@link #defaultTypes()}
     * @return immutable list of detectors
     */
    public List<SpanDetector> build(Collection<PatternType> types) {
        EnumSet<PatternType> enabled =
                (types == null || types.isEmpty()) ? defaultTypes() : EnumSet.copyOf(types);
        List<SpanDetector> out = new ArrayList<>(enabled.size());
        for (PatternType t : enabled) {
            out.add(new RegexDetector(
                    "pattern:" + t.name().toLowerCase(Locale.ROOT), t.regexes(), t.rawType(), t.score(), t.contextWords()));
        }
        return List.copyOf(out);
    }
}
