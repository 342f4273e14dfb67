/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.consensus;

import io.redactflow4j.core.api.model.*;
import io.redactflow4j.core.preset.ReconciliationConfig;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dual-detection check: a candidate from a primary source survives only if a candidate from
 * another source has the same canonical type and overlaps at least
 * {@code overlapThreshold * min(len)} characters. Overlap with a different type never counts.
 *
 * <p>Each agreeing pair becomes one {@link DetectorSource#CONSENSUS} candidate spanning the
 * union of both, scored with the higher of the two scores. Everything else is dropped unless its
 * type is exempt.
 */
public final class ConsensusEngine {
    private static final Logger log = LoggerFactory.getLogger(ConsensusEngine.class);

    private static final Comparator<EntityCandidate> BY_POSITION =
            Comparator.comparingInt(EntityCandidate::start).thenComparingInt(EntityCandidate::end);

    private final ReconciliationConfig config;

    public ConsensusEngine(ReconciliationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ConsensusResult reconcile(List<EntityCandidate> candidates, List<Discard> discards) {
        if (candidates == null || candidates.isEmpty()) return new ConsensusResult(List.of(), List.of());

        List<EntityCandidate> primary = new ArrayList<>();
        List<EntityCandidate> secondary = new ArrayList<>();
        List<EntityCandidate> out = new ArrayList<>();
        for (EntityCandidate c : candidates) {
            if (config.consensusExemptTypes().contains(c.type())) {
                out.add(c);
            } else if (config.primarySources().contains(c.source())) {
                primary.add(c);
            } else {
                secondary.add(c);
            }
        }
        primary.sort(BY_POSITION);
        secondary.sort(BY_POSITION);

        List<ConsensusRecord> records = new ArrayList<>();
        Set<EntityCandidate> used = new HashSet<>();
        for (EntityCandidate a : primary) {
            Optional<EntityCandidate> match = bestAgreement(a, secondary);
            if (match.isPresent()) {
                EntityCandidate b = match.get();
                used.add(b);
                ConsensusRecord r = ConsensusRecord.of(a, b);
                records.add(r);
                out.add(r.toCandidate());
                log.debug("Consensus {} ({}) + {} ({})", a.describe(), a.source(), b.describe(), b.source());
            } else {
                DiscardReason reason = rejection(a, secondary);
                discards.add(Discard.of(a, reason, "primary"));
            }
        }
        for (EntityCandidate b : secondary) {
            if (!used.contains(b)) {
                DiscardReason reason = primary.isEmpty() ? DiscardReason.NO_COUNTERPART : rejection(b, primary);
                discards.add(Discard.of(b, reason, "secondary"));
            }
        }
        out.sort(BY_POSITION);
        return new ConsensusResult(out, records);
    }

    public boolean agrees(EntityCandidate a, EntityCandidate b) {
        return a.type() == b.type() && a.type().isKnown() && sufficientOverlap(a, b);
    }

    private boolean sufficientOverlap(EntityCandidate a, EntityCandidate b) {
        int overlap = a.overlap(b);
        return overlap > 0 && overlap >= config.overlapThreshold() * Math.min(a.length(), b.length());
    }

    /** Highest score first, then larger overlap, then earlier start. */
    private Optional<EntityCandidate> bestAgreement(EntityCandidate a, List<EntityCandidate> others) {
        Comparator<EntityCandidate> rank = Comparator.comparingDouble(EntityCandidate::score)
                .reversed()
                .thenComparing(Comparator.comparingInt(a::overlap).reversed())
                .thenComparingInt(EntityCandidate::start);
        return others.stream().filter(b -> agrees(a, b)).min(rank);
    }

    private DiscardReason rejection(EntityCandidate c, List<EntityCandidate> others) {
        boolean typeMismatch = false;
        boolean shortOverlap = false;
        for (EntityCandidate o : others) {
            if (c.overlap(o) == 0) continue;
            if (o.type() != c.type() || !c.type().isKnown()) {
                if (sufficientOverlap(c, o)) typeMismatch = true;
            } else {
                shortOverlap = true;
            }
        }
        if (typeMismatch) return DiscardReason.TYPE_MISMATCH;
        if (shortOverlap) return DiscardReason.INSUFFICIENT_OVERLAP;
        return DiscardReason.NO_COUNTERPART;
    }
}
