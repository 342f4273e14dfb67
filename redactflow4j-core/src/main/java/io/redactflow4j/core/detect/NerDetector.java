/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.model.DetectorSource;
import io.redactflow4j.core.api.model.RawCandidate;
import io.redactflow4j.core.normalize.LabelVocabulary;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Token-classification detector. Decodes per-token labels into spans and keeps those whose mean
 * score reaches {@code minConfidence}.
 */
public final class NerDetector extends ModelBackedDetector<TokenClassifier> implements SpanDetector {
    public static final double DEFAULT_MIN_CONFIDENCE = 0.8;

    private final DetectorSource source;
    private final LabelVocabulary vocabulary;
    private final BioSpanDecoder decoder;
    private final double minConfidence;

    public NerDetector(
            String name,
            DetectorSource source,
            Supplier<? extends TokenClassifier> loader,
            LabelVocabulary vocabulary,
            BioSpanDecoder decoder,
            double minConfidence) {
        super(name, loader);
        this.source = Objects.requireNonNull(source, "source");
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        if (minConfidence < 0 || minConfidence > 1)
            throw new IllegalArgumentException("minConfidence must be in [0,1]: " + minConfidence);
        this.minConfidence = minConfidence;
    }

    @Override
    public DetectorSource source() {
        return source;
    }

    @Override
    public List<RawCandidate> detect(String text) {
        if (text == null || text.isEmpty()) return List.of();
        return decoder.decode(model().classify(text), vocabulary, source).stream()
                .filter(c -> c.score() >= minConfidence)
                .filter(c -> c.end() <= text.length())
                .toList();
    }
}
