/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.merge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.redactflow4j.core.api.model.*;
import io.redactflow4j.core.preset.ReconciliationConfig;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CandidateMergerTest {

    private final CandidateMerger merger = new CandidateMerger(ReconciliationConfig.defaults());

    private static EntityCandidate c(int s, int e, CanonicalType t, double score, DetectorSource src) {
        return new EntityCandidate(s, e, t, t.name(), score, src);
    }

    @Nested
    @DisplayName("same type")
    class SameType {

        @Test
        @DisplayName("overlapping spans collapse into their union with the max score")
        void overlapping() {
            var a = c(0, 6, CanonicalType.PERSON, 0.6, DetectorSource.NER);
            var b = c(4, 10, CanonicalType.PERSON, 0.9, DetectorSource.TRANSFORMER);

            List<EntityCandidate> out = merger.merge(List.of(a, b), 20, new ArrayList<>());

            assertThat(out).singleElement().satisfies(x -> {
                assertThat(x.start()).isZero();
                assertThat(x.end()).isEqualTo(10);
                assertThat(x.score()).isEqualTo(0.9);
                assertThat(x.source()).isEqualTo(DetectorSource.TRANSFORMER);
            });
        }

        @Test
        @DisplayName("adjacent spans are merged, separated ones are kept apart")
        void adjacency() {
            var a = c(0, 3, CanonicalType.LOCATION, 0.8, DetectorSource.NER);
            var b = c(3, 6, CanonicalType.LOCATION, 0.8, DetectorSource.NER);
            var d = c(8, 12, CanonicalType.LOCATION, 0.8, DetectorSource.NER);

            List<EntityCandidate> out = merger.merge(List.of(d, b, a), 20, new ArrayList<>());

            assertThat(out).extracting(EntityCandidate::start, EntityCandidate::end)
                    .containsExactly(
                            tuple(0, 6), tuple(8, 12));
        }

        @Test
        @DisplayName("no two candidates of one type overlap afterwards")
        void noSameTypeOverlap() {
            List<EntityCandidate> in = List.of(
                    c(0, 5, CanonicalType.PERSON, 0.5, DetectorSource.NER),
                    c(2, 8, CanonicalType.PERSON, 0.7, DetectorSource.PATTERN),
                    c(7, 9, CanonicalType.PERSON, 0.4, DetectorSource.GENERATIVE),
                    c(1, 3, CanonicalType.PERSON, 0.9, DetectorSource.NER),
                    c(20, 25, CanonicalType.PERSON, 0.9, DetectorSource.NER));

            List<EntityCandidate> out = merger.merge(in, 30, new ArrayList<>());

            for (EntityCandidate x : out) {
                for (EntityCandidate y : out) {
                    if (x != y && x.type() == y.type()) assertThat(x.overlap(y)).isZero();
                }
            }
            assertThat(out).hasSize(2);
        }
    }

    @Nested
    @DisplayName("cross type")
    class CrossType {

        @Test
        @DisplayName("contained lower-priority candidate is dropped")
        void containedDropped() {
            List<Discard> discards = new ArrayList<>();
            var phone = c(5, 20, CanonicalType.PHONE, 0.7, DetectorSource.PATTERN);
            var person = c(8, 12, CanonicalType.PERSON, 0.9, DetectorSource.NER);

            List<EntityCandidate> out = merger.merge(List.of(person, phone), 30, discards);

            assertThat(out).containsExactly(phone);
            assertThat(discards).singleElement().satisfies(d -> {
                assertThat(d.reason()).isEqualTo(DiscardReason.CONTAINED_BY_HIGHER_PRIORITY);
                assertThat(d.stage()).isEqualTo(DiscardStage.MERGE_DROP);
            });
        }

        @Test
        @DisplayName("lower-priority container does not drop what it contains")
        void weakerContainerKeepsBoth() {
            var org = c(0, 20, CanonicalType.ORGANIZATION, 0.8, DetectorSource.NER);
            var email = c(5, 15, CanonicalType.EMAIL, 0.9, DetectorSource.PATTERN);

            assertThat(merger.merge(List.of(org, email), 30, new ArrayList<>())).containsExactly(org, email);
        }

        @Test
        @DisplayName("partial overlaps of different types are both kept")
        void partialOverlap() {
            var loc = c(0, 10, CanonicalType.LOCATION, 0.8, DetectorSource.NER);
            var zip = c(8, 16, CanonicalType.ZIP_CODE, 0.6, DetectorSource.PATTERN);

            assertThat(merger.merge(List.of(loc, zip), 20, new ArrayList<>())).hasSize(2);
        }
    }

    @Test
    @DisplayName("merging its own output changes nothing")
    void idempotent() {
        List<EntityCandidate> in = List.of(
                c(0, 5, CanonicalType.PERSON, 0.5, DetectorSource.NER),
                c(3, 9, CanonicalType.PERSON, 0.5, DetectorSource.PATTERN),
                c(5, 20, CanonicalType.PHONE, 0.7, DetectorSource.PATTERN),
                c(12, 14, CanonicalType.AGE, 0.9, DetectorSource.NER),
                c(22, 30, CanonicalType.EMAIL, 0.9, DetectorSource.PATTERN),
                c(22, 30, CanonicalType.LOCATION, 0.9, DetectorSource.NER));

        List<EntityCandidate> once = merger.merge(in, 40, new ArrayList<>());
        List<Discard> second = new ArrayList<>();
        List<EntityCandidate> twice = merger.merge(once, 40, second);

        assertThat(twice).isEqualTo(once);
        assertThat(second).isEmpty();
    }

    @Test
    @DisplayName("candidates past the end of the text are dropped")
    void outOfBounds() {
        List<Discard> discards = new ArrayList<>();
        var ok = c(0, 4, CanonicalType.PERSON, 0.9, DetectorSource.NER);
        var past = c(2, 12, CanonicalType.EMAIL, 0.9, DetectorSource.PATTERN);

        assertThat(merger.merge(List.of(ok, past), 10, discards)).containsExactly(ok);
        assertThat(discards).singleElement().extracting(Discard::reason).isEqualTo(DiscardReason.OUT_OF_BOUNDS);
    }

    @Nested
    @DisplayName("inside an envelope")
    class Envelope {

        @Test
        @DisplayName("an envelope span of higher priority drops what it contains")
        void envelopeContainer() {
            var envelope = List.of(c(0, 10, CanonicalType.PHONE, 0.7, DetectorSource.PATTERN));
            var person = c(2, 4, CanonicalType.PERSON, 0.9, DetectorSource.CONSENSUS);
            List<Discard> discards = new ArrayList<>();

            List<EntityCandidate> out = merger.merge(List.of(person), 16, discards, envelope);

            assertThat(out).isEmpty();
            assertThat(discards).singleElement().satisfies(d -> {
                assertThat(d.reason()).isEqualTo(DiscardReason.CONTAINED_BY_HIGHER_PRIORITY);
                assertThat(d.detail()).contains("PHONE[0,10)");
            });
        }

        @Test
        @DisplayName("same-type spans sharing one envelope span are joined")
        void joinedWithinEnvelope() {
            var envelope = List.of(c(0, 8, CanonicalType.PERSON, 0.9, DetectorSource.NER));
            var a = c(0, 3, CanonicalType.PERSON, 0.9, DetectorSource.CONSENSUS);
            var b = c(5, 8, CanonicalType.PERSON, 0.8, DetectorSource.CONSENSUS);

            List<EntityCandidate> out = merger.merge(List.of(a, b), 16, new ArrayList<>(), envelope);

            assertThat(out).extracting(EntityCandidate::start, EntityCandidate::end).containsExactly(tuple(0, 8));
        }

        @Test
        @DisplayName("coalesce unions same-type spans and leaves containment alone")
        void coalesce() {
            var phone = c(0, 10, CanonicalType.PHONE, 0.7, DetectorSource.PATTERN);
            var a = c(2, 4, CanonicalType.PERSON, 0.9, DetectorSource.NER);
            var b = c(3, 6, CanonicalType.PERSON, 0.8, DetectorSource.PATTERN);

            List<EntityCandidate> out = merger.coalesce(List.of(a, b, phone), 16);

            assertThat(out).extracting(EntityCandidate::type, EntityCandidate::start, EntityCandidate::end)
                    .containsExactly(tuple(CanonicalType.PHONE, 0, 10), tuple(CanonicalType.PERSON, 2, 6));
        }
    }
}
