/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api;

import io.redactflow4j.core.api.model.*;
import io.redactflow4j.core.consensus.ConsensusEngine;
import io.redactflow4j.core.consensus.ConsensusResult;
import io.redactflow4j.core.filter.AllowListFilter;
import io.redactflow4j.core.filter.NoiseFilter;
import io.redactflow4j.core.merge.CandidateMerger;
import io.redactflow4j.core.normalize.TypeNormalizer;
import io.redactflow4j.core.preset.ReconciliationConfig;
import io.redactflow4j.core.recover.RecoveryResult;
import io.redactflow4j.core.recover.SpanRecoveryEngine;
import io.redactflow4j.core.report.DiscardSink;
import io.redactflow4j.core.report.NoopSink;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw outputs of all detectors into one non-overlapping, offset-exact candidate list:
 * normalize → recover (generative) → consensus (strict only) → merge → noise/allow-list filter.
 *
 * <p>Stateless and thread-safe; every call is a pure function of its arguments. Per-request
 * problems never throw: they end up as {@link Discard}s in the result and in the sink.
 */
public final class ReconciliationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationPipeline.class);

    private final ReconciliationConfig config;
    private final DiscardSink sink;
    private final TypeNormalizer normalizer;
    private final SpanRecoveryEngine recovery;
    private final ConsensusEngine consensus;
    private final CandidateMerger merger;
    private final NoiseFilter noiseFilter;
    private final AllowListFilter allowListFilter;

    public ReconciliationPipeline(ReconciliationConfig config, DiscardSink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = sink == null ? new NoopSink() : sink;
        this.normalizer = new TypeNormalizer(config.typeMapping());
        this.recovery = new SpanRecoveryEngine(config, normalizer);
        this.consensus = new ConsensusEngine(config);
        this.merger = new CandidateMerger(config);
        this.noiseFilter = new NoiseFilter(config.noiseContentRatio());
        this.allowListFilter = new AllowListFilter(config.allowList());
    }

    public ReconciliationPipeline(ReconciliationConfig config) {
        this(config, new NoopSink());
    }

    public ReconciliationResult reconcile(String text, DetectorOutputs outputs) {
        Objects.requireNonNull(text, "text");
        DetectorOutputs in = outputs == null ? DetectorOutputs.empty() : outputs;
        if (text.isEmpty()) return ReconciliationResult.empty();

        List<Discard> discards = new ArrayList<>();
        List<EntityCandidate> candidates = normalize(text, in.candidates(), discards);

        RecoveryResult recovered = recovery.recover(text, in.generativeTags());
        candidates.addAll(recovered.candidates());
        discards.addAll(recovered.discards());

        List<ConsensusRecord> records = List.of();
        List<EntityCandidate> envelope = List.of();
        if (config.strict()) {
            envelope = merger.coalesce(candidates, text.length());
            ConsensusResult cr = consensus.reconcile(candidates, discards);
            candidates = new ArrayList<>(cr.candidates());
            records = cr.records();
        }

        List<EntityCandidate> merged = merger.merge(candidates, text.length(), discards, envelope);
        List<EntityCandidate> clean = noiseFilter.filter(text, merged, discards);
        clean = allowListFilter.filter(text, clean, discards);
        if (!envelope.isEmpty()) clean = confine(text, clean, envelope, discards);

        publish(discards);
        return new ReconciliationResult(clean, discards, records);
    }

    private List<EntityCandidate> normalize(String text, List<RawCandidate> raw, List<Discard> discards) {
        List<EntityCandidate> out = new ArrayList<>(raw.size());
        for (RawCandidate r : raw) {
            DetectorSource source = r.source() == null ? DetectorSource.PATTERN : r.source();
            if (r.start() < 0 || r.end() <= r.start() || r.end() > text.length()) {
                discards.add(new Discard(
                        "[" + r.start() + "," + r.end() + ")", DiscardReason.NO_MATCH, source, "offset outside text"));
                continue;
            }
            CanonicalType type = normalizer.normalize(r.rawType(), source);
            if (!type.isKnown()) {
                discards.add(new Discard(r.rawType(), DiscardReason.UNKNOWN_LABEL, source, "passed through as UNKNOWN"));
            }
            out.add(new EntityCandidate(r.start(), r.end(), type, r.rawType(), r.score(), source));
        }
        return out;
    }

    /**
     * A strict candidate whose envelope span would itself be filtered in non-strict mode goes the
     * same way, so strict mode never reports more entities.
     */
    private List<EntityCandidate> confine(
            String text, List<EntityCandidate> candidates, List<EntityCandidate> envelope, List<Discard> discards) {
        List<EntityCandidate> out = new ArrayList<>(candidates.size());
        for (EntityCandidate c : candidates) {
            Optional<EntityCandidate> outer = CandidateMerger.envelopeOf(c, envelope);
            if (outer.isPresent() && noiseFilter.isNoise(outer.get().text(text))) {
                discards.add(Discard.of(c, DiscardReason.NOISE_CONTENT, "within " + outer.get().describe()));
            } else if (outer.isPresent() && config.allowList().allows(outer.get().text(text))) {
                discards.add(Discard.of(c, DiscardReason.ALLOW_LISTED, "within " + outer.get().describe()));
            } else {
                out.add(c);
            }
        }
        return out;
    }

    private void publish(List<Discard> discards) {
        if (discards.isEmpty()) return;
        try {
            sink.report(List.copyOf(discards));
        } catch (RuntimeException e) {
            log.warn("Discard sink failed, ignoring: {}", e.toString());
        }
    }

    public ReconciliationConfig config() {
        return config;
    }

    public TypeNormalizer normalizer() {
        return normalizer;
    }
}
