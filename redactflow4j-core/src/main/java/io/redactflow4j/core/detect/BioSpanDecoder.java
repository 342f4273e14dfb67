/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.model.CanonicalType;
import io.redactflow4j.core.api.model.DetectorSource;
import io.redactflow4j.core.api.model.RawCandidate;
import io.redactflow4j.core.api.model.TokenLabel;
import io.redactflow4j.core.normalize.LabelVocabulary;
import io.redactflow4j.core.normalize.TypeNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks per-token labels (BIO-prefixed or plain) and emits one candidate per entity.
 *
 * <p>State is either OUTSIDE or INSIDE(type). Orphan {@code I-} tokens are dropped, a type change
 * inside an entity closes it, and a new {@code B-} (or a different plain label) starts the next
 * one. Labels that are unmapped, or mapped to {@link CanonicalType#UNKNOWN}, close the current
 * entity like {@code O}. The raw type of an emitted candidate is the BIO-stripped label of its first
 * token.
 */
public final class BioSpanDecoder {

    private final TypeNormalizer normalizer;

    public BioSpanDecoder(TypeNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public List<RawCandidate> decode(List<TokenLabel> tokens, LabelVocabulary vocabulary, DetectorSource source) {
        if (tokens == null || tokens.isEmpty()) return List.of();
        List<RawCandidate> out = new ArrayList<>();
        Entity current = null;

        for (TokenLabel t : tokens) {
            if (t == null || t.isSpecial()) continue;
            String label = t.label();
            Optional<CanonicalType> type = TypeNormalizer.isOutside(label)
                    ? Optional.empty()
                    : normalizer.resolve(label, vocabulary).filter(CanonicalType::isKnown);

            if (type.isEmpty()) {
                if (current != null) out.add(current.emit(source));
                current = null;
                continue;
            }
            boolean inside = TypeNormalizer.isInside(label);
            boolean begin = TypeNormalizer.isBegin(label);

            if (current == null) {
                if (inside) continue; // orphan continuation
                current = new Entity(t, type.get(), TypeNormalizer.stripBio(label));
                continue;
            }
            if (type.get() == current.type && !begin) {
                current.extend(t);
            } else if (inside) {
                out.add(current.emit(source));
                current = null;
            } else {
                out.add(current.emit(source));
                current = new Entity(t, type.get(), TypeNormalizer.stripBio(label));
            }
        }
        if (current != null) out.add(current.emit(source));
        return List.copyOf(out);
    }

    private static final class Entity {
        private final CanonicalType type;
        private final String rawType;
        private final int start;
        private int end;
        private double scoreSum;
        private int tokens;

        Entity(TokenLabel first, CanonicalType type, String rawType) {
            this.type = type;
            this.rawType = rawType;
            this.start = first.start();
            this.end = first.end();
            this.scoreSum = first.score();
            this.tokens = 1;
        }

        void extend(TokenLabel t) {
            end = Math.max(end, t.end());
            scoreSum += t.score();
            tokens++;
        }

        RawCandidate emit(DetectorSource source) {
            return new RawCandidate(start, end, rawType, scoreSum / tokens, source);
        }
    }
}
