/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import java.util.Locale;
import java.util.Optional;

/** Closed taxonomy every detector label is normalized to before candidates are compared. */
public enum CanonicalType {
    PERSON,
    LOCATION,
    ORGANIZATION,
    PHONE,
    EMAIL,
    ZIP_CODE,
    DATE_OF_BIRTH,
    AGE,
    GENDER,
    CUSTOMER_ID,
    UNKNOWN;

    /** Exact, case-insensitive lookup by enum name; empty for anything else. */
    public static Optional<CanonicalType> byName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String key = name.trim().toUpperCase(Locale.ROOT);
        for (CanonicalType t : values()) {
            if (t.name().equals(key)) return Optional.of(t);
        }
        return Optional.empty();
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
