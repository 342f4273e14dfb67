/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import io.redactflow4j.core.api.model.CanonicalType;
import io.redactflow4j.core.api.model.DetectorSource;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Binds every detector source to the vocabulary its labels come from.
 * Sources without an explicit binding use {@code fallback}.
 */
public record TypeMapping(Map<DetectorSource, LabelVocabulary> bySource, LabelVocabulary fallback) {

    public TypeMapping {
        Objects.requireNonNull(fallback, "fallback");
        Map<DetectorSource, LabelVocabulary> copy = new EnumMap<>(DetectorSource.class);
        if (bySource != null) copy.putAll(bySource);
        bySource = Collections.unmodifiableMap(copy);
    }

    public static TypeMapping defaults() {
        LabelVocabulary models = LabelVocabulary.merge(
                "models", BuiltInVocabularies.CONLL, BuiltInVocabularies.JA_NER, BuiltInVocabularies.PRESIDIO);
        Map<DetectorSource, LabelVocabulary> m = new EnumMap<>(DetectorSource.class);
        m.put(DetectorSource.PATTERN, BuiltInVocabularies.PRESIDIO);
        m.put(DetectorSource.NER, models);
        m.put(DetectorSource.TRANSFORMER, models);
        m.put(DetectorSource.GENERATIVE, BuiltInVocabularies.PII_MASKER);
        return new TypeMapping(m, BuiltInVocabularies.PRESIDIO);
    }

    public LabelVocabulary vocabularyFor(DetectorSource source) {
        return bySource.getOrDefault(source, fallback);
    }

    /** Copy with extra labels added to one source's vocabulary. */
    public TypeMapping withLabels(DetectorSource source, Map<String, CanonicalType> extra) {
        Map<DetectorSource, LabelVocabulary> m = new EnumMap<>(DetectorSource.class);
        m.putAll(bySource);
        m.put(source, vocabularyFor(source).with(extra));
        return new TypeMapping(m, fallback);
    }
}
