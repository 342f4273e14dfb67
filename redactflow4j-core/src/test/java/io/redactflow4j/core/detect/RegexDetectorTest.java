/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.redactflow4j.core.api.model.DetectorSource;
import io.redactflow4j.core.api.model.RawCandidate;
import java.util.List;
import org.junit.jupiter.api.Test;

class RegexDetectorTest {

    private final RegexDetector phone = new RegexDetector(
            "phone", List.of("0\\d{1,4}-\\d{1,4}-\\d{4}", "0\\d{2}-\\d{4}-\\d{4}"), "PHONE_NUMBER_JP", 0.5, List.of("電話"));

    @Test
    void reportsEachRangeOnce() {
        List<RawCandidate> out = phone.detect("03-1234-5678 と 090-1234-5678");

        assertThat(out).extracting(RawCandidate::start).containsExactly(0, 15);
        assertThat(out).allMatch(c -> c.source() == DetectorSource.PATTERN && c.rawType().equals("PHONE_NUMBER_JP"));
    }

    @Test
    void contextWordBoostsScore() {
        List<RawCandidate> out = phone.detect("電話: 03-1234-5678、 ずっと後ろの方に書いてある番号 03-9999-0000");

        assertThat(out).hasSize(2);
        assertThat(out.get(0).score()).isCloseTo(0.85, within(1e-9));
        assertThat(out.get(1).score()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void emptyInput() {
        assertThat(phone.detect("")).isEmpty();
        assertThat(phone.detect(null)).isEmpty();
    }

    @Test
    void requiresPattern() {
        assertThatThrownBy(() -> new RegexDetector("x", List.of(), "X", 0.5, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
