/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.filter;

import static org.assertj.core.api.Assertions.assertThat;

import io.redactflow4j.core.api.model.*;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class NoiseFilterTest {

    private final NoiseFilter filter = new NoiseFilter(0.5);

    @Test
    void dropsSymbolOnlySpanTaggedAsPerson() {
        String text = "~\n\n";
        List<Discard> discards = new ArrayList<>();
        var c = new EntityCandidate(0, 3, CanonicalType.PERSON, "<name>", 0.85, DetectorSource.GENERATIVE);

        assertThat(filter.filter(text, List.of(c), discards)).isEmpty();
        assertThat(discards).singleElement().satisfies(d -> {
            assertThat(d.reason()).isEqualTo(DiscardReason.NOISE_CONTENT);
            assertThat(d.stage()).isEqualTo(DiscardStage.NOISE_REJECT);
        });
    }

    @ParameterizedTest
    @ValueSource(strings = {"~\n\n", "   ", "---", "()", "・・・", "a - - - - -"})
    void noise(String snippet) {
        assertThat(filter.isNoise(snippet)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"John Smith", "山田太郎", "03-1234-5678", "〒150-0002", "john@x.com", "A."})
    void content(String snippet) {
        assertThat(filter.isNoise(snippet)).isFalse();
    }
}
