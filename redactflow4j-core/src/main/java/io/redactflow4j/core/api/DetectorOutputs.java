/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api;

import io.redactflow4j.core.api.model.GenerativeTag;
import io.redactflow4j.core.api.model.RawCandidate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything the detectors produced for one text: offset-carrying candidates of all span
 * detectors, and the ordered tag sequence of the generative detector.
 */
public record DetectorOutputs(List<RawCandidate> candidates, List<GenerativeTag> generativeTags) {

    public DetectorOutputs {
        candidates = candidates == null ? List.of() : List.copyOf(candidates.stream().filter(Objects::nonNull).toList());
        generativeTags = generativeTags == null ? List.of() : List.copyOf(generativeTags.stream().filter(Objects::nonNull).toList());
    }

    public static DetectorOutputs empty() {
        return new DetectorOutputs(List.of(), List.of());
    }

    public static DetectorOutputs of(List<RawCandidate> candidates) {
        return new DetectorOutputs(candidates, List.of());
    }

    @SafeVarargs
    public static DetectorOutputs combine(List<RawCandidate>... perDetector) {
        List<RawCandidate> all = new ArrayList<>();
        for (List<RawCandidate> l : perDetector) if (l != null) all.addAll(l);
        return new DetectorOutputs(all, List.of());
    }

    public DetectorOutputs withGenerativeTags(List<GenerativeTag> tags) {
        return new DetectorOutputs(candidates, tags);
    }
}
