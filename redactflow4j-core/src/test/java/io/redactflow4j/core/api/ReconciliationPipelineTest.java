/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

import io.redactflow4j.core.api.model.*;
import io.redactflow4j.core.filter.AllowList;
import io.redactflow4j.core.preset.ReconciliationConfig;
import io.redactflow4j.core.report.DiscardSink;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReconciliationPipelineTest {

    private static final String CONTACT = "Contact John Smith, john@x.com";

    @Mock
    private DiscardSink sink;

    private static DetectorOutputs contactOutputs() {
        return DetectorOutputs.of(List.of(
                new RawCandidate(20, 30, "EMAIL_ADDRESS", 0.9, DetectorSource.PATTERN),
                new RawCandidate(8, 18, "B-PER", 0.85, DetectorSource.NER)));
    }

    @Nested
    @DisplayName("non-strict")
    class NonStrict {

        private final ReconciliationPipeline pipeline = new ReconciliationPipeline(ReconciliationConfig.defaults());

        @Test
        @DisplayName("disjoint candidates pass unchanged, sorted by start")
        void scenarioContact() {
            ReconciliationResult r = pipeline.reconcile(CONTACT, contactOutputs());

            assertThat(r.candidates())
                    .extracting(EntityCandidate::type, EntityCandidate::start, EntityCandidate::end)
                    .containsExactly(tuple(CanonicalType.PERSON, 8, 18), tuple(CanonicalType.EMAIL, 20, 30));
            assertThat(r.candidates().get(0).text(CONTACT)).isEqualTo("John Smith");
            assertThat(r.candidates().get(1).text(CONTACT)).isEqualTo("john@x.com");
            assertThat(r.discards()).isEmpty();
        }

        @Test
        @DisplayName("generative tags are recovered and merged with span detectors")
        void generativeMerged() {
            var outputs = contactOutputs().withGenerativeTags(List.of(
                    GenerativeTag.of("John Smith", "<name>"), GenerativeTag.of("john@x.com", "<mail-address>")));

            ReconciliationResult r = pipeline.reconcile(CONTACT, outputs);

            assertThat(r.candidates()).hasSize(2);
            assertThat(r.candidates()).extracting(EntityCandidate::score).containsExactly(0.85, 0.9);
        }

        @Test
        @DisplayName("malformed offsets become NO_MATCH discards")
        void outOfBounds() {
            var outputs = DetectorOutputs.of(List.of(
                    new RawCandidate(25, 40, "EMAIL_ADDRESS", 0.9, DetectorSource.PATTERN),
                    new RawCandidate(-1, 3, "PER", 0.9, DetectorSource.NER),
                    new RawCandidate(5, 5, "PER", 0.9, DetectorSource.NER)));

            ReconciliationResult r = pipeline.reconcile(CONTACT, outputs);

            assertThat(r.candidates()).isEmpty();
            assertThat(r.discards()).extracting(Discard::reason).containsOnly(DiscardReason.NO_MATCH).hasSize(3);
        }

        @Test
        @DisplayName("unmapped labels pass through as UNKNOWN and are reported")
        void unknownLabel() {
            var outputs = DetectorOutputs.of(List.of(new RawCandidate(8, 18, "HERO", 0.9, DetectorSource.NER)));

            ReconciliationResult r = pipeline.reconcile(CONTACT, outputs);

            assertThat(r.candidates()).singleElement().extracting(EntityCandidate::type).isEqualTo(CanonicalType.UNKNOWN);
            assertThat(r.discards()).singleElement().extracting(Discard::stage).isEqualTo(DiscardStage.MAPPING_UNKNOWN);
        }

        @Test
        @DisplayName("noise tagged by a detector is removed")
        void noise() {
            var outputs = DetectorOutputs.of(List.of(new RawCandidate(0, 3, "<name>", 0.9, DetectorSource.GENERATIVE)));

            ReconciliationResult r = pipeline.reconcile("~\n\n", outputs);

            assertThat(r.candidates()).isEmpty();
            assertThat(r.discards()).singleElement().extracting(Discard::reason).isEqualTo(DiscardReason.NOISE_CONTENT);
        }

        @Test
        @DisplayName("empty text or no outputs yields an empty result")
        void empty() {
            assertThat(pipeline.reconcile("", contactOutputs()).candidates()).isEmpty();
            assertThat(pipeline.reconcile(CONTACT, null).candidates()).isEmpty();
            assertThat(pipeline.reconcile(CONTACT, DetectorOutputs.empty()).discards()).isEmpty();
        }

        @Test
        @DisplayName("null text is a programming error")
        void nullText() {
            assertThatThrownBy(() -> pipeline.reconcile(null, DetectorOutputs.empty()))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("text");
        }
    }

    @Nested
    @DisplayName("strict")
    class Strict {

        private final ReconciliationConfig strict = ReconciliationConfig.defaults().toBuilder().strict(true).build();

        @Test
        @DisplayName("keeps only confirmed entities")
        void confirmedOnly() {
            var outputs = DetectorOutputs.of(List.of(
                    new RawCandidate(0, 4, "PERSON", 0.6, DetectorSource.PATTERN),
                    new RawCandidate(0, 4, "JP_PERSON", 0.9, DetectorSource.NER),
                    new RawCandidate(5, 9, "LOC", 0.9, DetectorSource.NER)));

            ReconciliationResult r = new ReconciliationPipeline(strict).reconcile("山田太郎 東京都港区", outputs);

            assertThat(r.candidates()).singleElement().satisfies(c -> {
                assertThat(c.source()).isEqualTo(DetectorSource.CONSENSUS);
                assertThat(c.score()).isEqualTo(0.9);
            });
            assertThat(r.consensus()).hasSize(1);
            assertThat(r.discards()).extracting(Discard::reason).containsExactly(DiscardReason.NO_COUNTERPART);
        }

        @Test
        @DisplayName("never yields more than non-strict mode")
        void strictIsSubset() {
            var outputs = contactOutputs().withGenerativeTags(List.of(GenerativeTag.of("john@x.com", "<mail-address>")));

            int lenient = new ReconciliationPipeline(ReconciliationConfig.defaults()).reconcile(CONTACT, outputs).candidates().size();
            int strictCount = new ReconciliationPipeline(strict).reconcile(CONTACT, outputs).candidates().size();

            assertThat(strictCount).isLessThanOrEqualTo(lenient);
            assertThat(strictCount).isEqualTo(1);
        }

        @Test
        @DisplayName("a rejected container still drops the confirmed spans inside it")
        void rejectedContainerStillContains() {
            String text = "abcdefghijklmnop";
            var outputs = DetectorOutputs.of(List.of(
                    new RawCandidate(0, 10, "PHONE_NUMBER", 0.7, DetectorSource.PATTERN),
                    new RawCandidate(2, 4, "PERSON", 0.9, DetectorSource.PATTERN),
                    new RawCandidate(2, 4, "PER", 0.9, DetectorSource.NER),
                    new RawCandidate(6, 8, "PERSON", 0.9, DetectorSource.PATTERN),
                    new RawCandidate(6, 8, "PER", 0.9, DetectorSource.NER)));

            int lenient = new ReconciliationPipeline(ReconciliationConfig.defaults()).reconcile(text, outputs).candidates().size();
            ReconciliationResult r = new ReconciliationPipeline(strict).reconcile(text, outputs);

            assertThat(lenient).isEqualTo(1);
            assertThat(r.candidates()).isEmpty();
            assertThat(r.consensus()).hasSize(2);
            assertThat(r.discards()).filteredOn(d -> d.reason() == DiscardReason.CONTAINED_BY_HIGHER_PRIORITY).hasSize(2);
        }

        @Test
        @DisplayName("confirmed spans bridged by an unconfirmed one come out as one entity")
        void bridgedSpansJoined() {
            String text = "abcdefghijklmnop";
            var outputs = DetectorOutputs.of(List.of(
                    new RawCandidate(0, 3, "PERSON", 0.9, DetectorSource.PATTERN),
                    new RawCandidate(0, 3, "PER", 0.9, DetectorSource.NER),
                    new RawCandidate(5, 8, "PERSON", 0.9, DetectorSource.PATTERN),
                    new RawCandidate(5, 8, "PER", 0.9, DetectorSource.NER),
                    new RawCandidate(2, 6, "PER", 0.9, DetectorSource.NER)));

            int lenient = new ReconciliationPipeline(ReconciliationConfig.defaults()).reconcile(text, outputs).candidates().size();
            ReconciliationResult r = new ReconciliationPipeline(strict).reconcile(text, outputs);

            assertThat(lenient).isEqualTo(1);
            assertThat(r.candidates())
                    .extracting(EntityCandidate::start, EntityCandidate::end)
                    .containsExactly(tuple(0, 8));
            assertThat(r.discards()).extracting(Discard::reason).containsExactly(DiscardReason.INSUFFICIENT_OVERLAP);
        }

        @Test
        @DisplayName("a confirmed span inside a noisy envelope is dropped as noise")
        void noisyEnvelope() {
            String text = "a~~~~~~~";
            var outputs = DetectorOutputs.of(List.of(
                    new RawCandidate(0, 1, "PERSON", 0.9, DetectorSource.PATTERN),
                    new RawCandidate(0, 1, "PER", 0.95, DetectorSource.NER),
                    new RawCandidate(0, 8, "PER", 0.5, DetectorSource.NER)));

            int lenient = new ReconciliationPipeline(ReconciliationConfig.defaults()).reconcile(text, outputs).candidates().size();
            ReconciliationResult r = new ReconciliationPipeline(strict).reconcile(text, outputs);

            assertThat(lenient).isZero();
            assertThat(r.candidates()).isEmpty();
            assertThat(r.discards()).extracting(Discard::reason).contains(DiscardReason.NOISE_CONTENT);
        }
    }

    @Test
    @DisplayName("allow-listed terms are not reported")
    void allowList() {
        var cfg = ReconciliationConfig.defaults().toBuilder().allowList(AllowList.of(List.of("john smith"))).build();

        ReconciliationResult r = new ReconciliationPipeline(cfg).reconcile(CONTACT, contactOutputs());

        assertThat(r.candidates()).extracting(EntityCandidate::type).containsExactly(CanonicalType.EMAIL);
    }

    @Test
    @DisplayName("a failing sink does not affect the result")
    void sinkFailureIsolated() {
        doThrow(new IllegalStateException("boom")).when(sink).report(anyList());
        var outputs = DetectorOutputs.of(List.of(new RawCandidate(8, 18, "HERO", 0.9, DetectorSource.NER)));

        ReconciliationResult r = new ReconciliationPipeline(ReconciliationConfig.defaults(), sink).reconcile(CONTACT, outputs);

        assertThat(r.candidates()).hasSize(1);
        verify(sink).report(anyList());
    }

    @Test
    @DisplayName("the sink is not called when nothing was discarded")
    void sinkQuietWithoutDiscards() {
        new ReconciliationPipeline(ReconciliationConfig.defaults(), sink).reconcile(CONTACT, contactOutputs());
        verifyNoInteractions(sink);
    }

    @Test
    @DisplayName("every emitted span lies inside the text")
    void boundsInvariant() {
        var outputs = new DetectorOutputs(
                List.of(
                        new RawCandidate(0, 7, "ORG", 0.5, DetectorSource.NER),
                        new RawCandidate(8, 31, "PER", 0.9, DetectorSource.NER),
                        new RawCandidate(19, 30, "EMAIL_ADDRESS", 0.9, DetectorSource.PATTERN)),
                List.of(new GenerativeTag("", "<name>", "Contact ", ","), GenerativeTag.of("x.com", "<mail-address>")));

        ReconciliationResult r = new ReconciliationPipeline(ReconciliationConfig.defaults()).reconcile(CONTACT, outputs);

        assertThat(r.candidates()).isNotEmpty().allSatisfy(c -> {
            assertThat(c.start()).isGreaterThanOrEqualTo(0);
            assertThat(c.end()).isGreaterThan(c.start()).isLessThanOrEqualTo(CONTACT.length());
        });
    }
}
