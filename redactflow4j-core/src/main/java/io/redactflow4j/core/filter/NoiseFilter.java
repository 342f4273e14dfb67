/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.filter;

import io.redactflow4j.core.api.model.Discard;
import io.redactflow4j.core.api.model.DiscardReason;
import io.redactflow4j.core.api.model.EntityCandidate;
import java.util.ArrayList;
import java.util.List;

/**
 * Drops spans that cannot be an entity: no letter, digit or ideograph at all, or mostly
 * whitespace, punctuation and symbols (e.g. {@code "~\n\n"} tagged PERSON).
 */
public final class NoiseFilter {
    private final double minContentRatio;

    public NoiseFilter(double minContentRatio) {
        this.minContentRatio = minContentRatio;
    }

    public List<EntityCandidate> filter(String text, List<EntityCandidate> candidates, List<Discard> discards) {
        List<EntityCandidate> out = new ArrayList<>(candidates.size());
        for (EntityCandidate c : candidates) {
            if (isNoise(c.text(text))) {
                discards.add(Discard.of(c, DiscardReason.NOISE_CONTENT, ""));
            } else {
                out.add(c);
            }
        }
        return out;
    }

    public boolean isNoise(String snippet) {
        if (snippet == null || snippet.isEmpty()) return true;
        int total = 0;
        int words = 0;
        int content = 0;
        for (int i = 0; i < snippet.length(); ) {
            int cp = snippet.codePointAt(i);
            i += Character.charCount(cp);
            total++;
            if (Character.isLetterOrDigit(cp) || Character.isIdeographic(cp)) words++;
            if (!Character.isWhitespace(cp) && !Character.isSpaceChar(cp) && !isPunctuationOrSymbol(cp)) content++;
        }
        return words < 1 || content < minContentRatio * total;
    }

    private static boolean isPunctuationOrSymbol(int cp) {
        switch (Character.getType(cp)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
            case Character.MATH_SYMBOL:
            case Character.CURRENCY_SYMBOL:
            case Character.MODIFIER_SYMBOL:
            case Character.OTHER_SYMBOL:
            case Character.CONTROL:
                return true;
            default:
                return false;
        }
    }
}
