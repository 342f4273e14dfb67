/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.merge;

import io.redactflow4j.core.api.model.*;
import io.redactflow4j.core.preset.ReconciliationConfig;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses overlapping or adjacent candidates of the same canonical type and resolves cross-type
 * containment by type priority. Cross-type partial overlaps are kept as they are.
 *
 * <p>Only candidates with {@code 0 <= start < end <= textLength} leave this class. Running it on
 * its own output returns the same list.
 */
public final class CandidateMerger {
    private static final Logger log = LoggerFactory.getLogger(CandidateMerger.class);

    // start asc, score desc; longer span and type order only to keep the result deterministic
    private static final Comparator<EntityCandidate> ORDER = Comparator.comparingInt(EntityCandidate::start)
            .thenComparing(Comparator.comparingDouble(EntityCandidate::score).reversed())
            .thenComparing(Comparator.comparingInt(EntityCandidate::end).reversed())
            .thenComparing(EntityCandidate::type);

    private final ReconciliationConfig config;

    public CandidateMerger(ReconciliationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public List<EntityCandidate> merge(List<EntityCandidate> candidates, int textLength, List<Discard> discards) {
        return merge(candidates, textLength, discards, List.of());
    }

    /**
     * Merges {@code candidates} inside an {@code envelope}: the {@link #coalesce coalesced} spans
     * of a wider candidate set the result was selected from. Envelope spans count as containers, and
     * candidates of one type inside the same envelope span are joined even when they do not touch,
     * so the result never has more entries than merging the wider set directly.
     */
    public List<EntityCandidate> merge(
            List<EntityCandidate> candidates, int textLength, List<Discard> discards, List<EntityCandidate> envelope) {
        if (candidates == null || candidates.isEmpty()) return List.of();
        List<EntityCandidate> outer = envelope == null ? List.of() : envelope;

        List<EntityCandidate> all = inBounds(candidates, textLength, discards);
        List<EntityCandidate> accepted = joinSameType(all, outer);

        List<EntityCandidate> containers = new ArrayList<>(accepted.size() + outer.size());
        containers.addAll(accepted);
        containers.addAll(outer);
        List<EntityCandidate> out = new ArrayList<>(accepted.size());
        for (EntityCandidate c : accepted) {
            Optional<EntityCandidate> container = strongerContainer(c, containers);
            if (container.isPresent()) {
                discards.add(Discard.of(
                        c, DiscardReason.CONTAINED_BY_HIGHER_PRIORITY, "by " + container.get().describe()));
            } else {
                out.add(c);
            }
        }
        out.sort(ORDER);
        return List.copyOf(out);
    }

    /** Same-type union only: no containment, nothing reported. */
    public List<EntityCandidate> coalesce(List<EntityCandidate> candidates, int textLength) {
        if (candidates == null || candidates.isEmpty()) return List.of();
        List<EntityCandidate> out = joinSameType(inBounds(candidates, textLength, new ArrayList<>()), List.of());
        out.sort(ORDER);
        return List.copyOf(out);
    }

    /** The envelope span of the same type that holds {@code c}, if any. */
    public static Optional<EntityCandidate> envelopeOf(EntityCandidate c, List<EntityCandidate> envelope) {
        for (EntityCandidate e : envelope) {
            if (e.type() == c.type() && e.contains(c)) return Optional.of(e);
        }
        return Optional.empty();
    }

    private static List<EntityCandidate> inBounds(
            List<EntityCandidate> candidates, int textLength, List<Discard> discards) {
        List<EntityCandidate> all = new ArrayList<>(candidates.size());
        for (EntityCandidate c : candidates) {
            if (c == null) continue;
            if (c.end() > textLength) {
                discards.add(Discard.of(c, DiscardReason.OUT_OF_BOUNDS, "textLength=" + textLength));
                continue;
            }
            all.add(c);
        }
        all.sort(ORDER);
        return all;
    }

    private static List<EntityCandidate> joinSameType(List<EntityCandidate> sorted, List<EntityCandidate> envelope) {
        List<EntityCandidate> accepted = new ArrayList<>();
        Map<CanonicalType, Integer> lastOfType = new EnumMap<>(CanonicalType.class);
        for (EntityCandidate c : sorted) {
            Integer idx = lastOfType.get(c.type());
            if (idx != null && joinable(accepted.get(idx), c, envelope)) {
                EntityCandidate last = accepted.get(idx);
                EntityCandidate merged = union(last, c);
                accepted.set(idx, merged);
                if (!merged.equals(last)) log.debug("Merged {} into {}", c.describe(), merged.describe());
            } else {
                lastOfType.put(c.type(), accepted.size());
                accepted.add(c);
            }
        }
        return accepted;
    }

    private static boolean joinable(EntityCandidate last, EntityCandidate next, List<EntityCandidate> envelope) {
        if (last.touches(next)) return true;
        Optional<EntityCandidate> e = envelopeOf(last, envelope);
        return e.isPresent() && e.get().contains(next);
    }

    /** Union span, max score; raw type and source follow the higher-scoring side. */
    private static EntityCandidate union(EntityCandidate kept, EntityCandidate next) {
        EntityCandidate lead = next.score() > kept.score() ? next : kept;
        return new EntityCandidate(
                Math.min(kept.start(), next.start()),
                Math.max(kept.end(), next.end()),
                kept.type(),
                lead.rawType(),
                Math.max(kept.score(), next.score()),
                lead.source());
    }
}
