/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

import io.redactflow4j.core.api.model.CanonicalType;
import io.redactflow4j.core.api.model.DetectorSource;
import io.redactflow4j.core.api.model.EntityCandidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Renders final candidates into masked text, left to right. */
public final class Redactor {
    private final MaskConfig masks;

    public Redactor(MaskConfig masks) {
        this.masks = Objects.requireNonNull(masks, "masks");
    }

    public String apply(String text, List<EntityCandidate> candidates) {
        return applyDetailed(text, candidates).redacted();
    }

    public Result applyDetailed(String text, List<EntityCandidate> candidates) {
        if (text == null || text.isEmpty() || candidates == null || candidates.isEmpty())
            return new Result(text, List.of());

        List<EntityCandidate> all = new ArrayList<>();
        for (EntityCandidate c : candidates) if (c.fitsIn(text)) all.add(c);
        if (all.isEmpty()) return new Result(text, List.of());

        // leftover cross-type overlaps: earliest start wins, longer first
        all.sort(Comparator.comparingInt(EntityCandidate::start)
                .thenComparing(Comparator.comparingInt(EntityCandidate::end).reversed()));
        List<EntityCandidate> merged = new ArrayList<>();
        for (EntityCandidate c : all) {
            if (merged.isEmpty()) {
                merged.add(c);
                continue;
            }
            EntityCandidate last = merged.get(merged.size() - 1);
            if (c.start() < last.end()) {
                if (c.end() > last.end()) merged.set(merged.size() - 1, last.withSpan(last.start(), c.end()));
            } else {
                merged.add(c);
            }
        }

        StringBuilder out = new StringBuilder(text.length() + 16);
        int pos = 0;
        List<Finding> findings = new ArrayList<>(merged.size());
        for (EntityCandidate c : merged) {
            if (c.start() > pos) out.append(text, pos, c.start());
            out.append(masks.maskFor(c.type()));
            findings.add(new Finding(c.type(), c.start(), c.end(), c.source()));
            pos = c.end();
        }
        if (pos < text.length()) out.append(text, pos, text.length());

        return new Result(out.toString(), List.copyOf(findings));
    }

    public record Finding(CanonicalType type, int start, int end, DetectorSource source) {}

    public record Result(String redacted, List<Finding> findings) {}
}
