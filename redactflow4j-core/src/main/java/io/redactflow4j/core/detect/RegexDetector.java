/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.model.DetectorSource;
import io.redactflow4j.core.api.model.RawCandidate;
import java.util.*;
import java.util.regex.*;

/**
 * Reports every match of one or more patterns under a single raw label. A match preceded by one of
 * the context words (within {@link #CONTEXT_WINDOW} chars) gets {@link #CONTEXT_BOOST} added to its
 * score.
 */
public final class RegexDetector implements SpanDetector {
    public static final int CONTEXT_WINDOW = 20;
    public static final double CONTEXT_BOOST = 0.35;

    private final String name;
    private final List<Pattern> patterns;
    private final String rawType;
    private final double score;
    private final List<String> contextWords;

    public RegexDetector(String name, List<String> regexes, String rawType, double score, List<String> contextWords) {
        this.name = Objects.requireNonNull(name, "name");
        this.rawType = Objects.requireNonNull(rawType, "rawType");
        if (regexes == null || regexes.isEmpty()) throw new IllegalArgumentException("No pattern for " + name);
        List<Pattern> compiled = new ArrayList<>(regexes.size());
        for (String r : regexes) compiled.add(Pattern.compile(r));
        this.patterns = List.copyOf(compiled);
        this.score = score;
        this.contextWords = contextWords == null ? List.of() : List.copyOf(contextWords);
    }

    public RegexDetector(String name, String regex, String rawType, double score) {
        this(name, List.of(regex), rawType, score, List.of());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DetectorSource source() {
        return DetectorSource.PATTERN;
    }

    @Override
    public List<RawCandidate> detect(String input) {
        if (input == null || input.isEmpty()) return List.of();
        // several patterns may hit the same range; keep the first
        Set<Long> seen = new HashSet<>();
        List<RawCandidate> out = new ArrayList<>();
        for (Pattern p : patterns) {
            Matcher m = p.matcher(input);
            while (m.find()) {
                if (m.end() <= m.start()) continue;
                long key = ((long) m.start() << 32) | m.end();
                if (!seen.add(key)) continue;
                out.add(new RawCandidate(m.start(), m.end(), rawType, scoreAt(input, m.start()), DetectorSource.PATTERN));
            }
        }
        out.sort(Comparator.comparingInt(RawCandidate::start).thenComparingInt(RawCandidate::end));
        return List.copyOf(out);
    }

    private double scoreAt(String input, int start) {
        if (contextWords.isEmpty()) return score;
        String window = input.substring(Math.max(0, start - CONTEXT_WINDOW), start);
        for (String w : contextWords) {
            if (window.contains(w)) return Math.min(1.0, score + CONTEXT_BOOST);
        }
        return score;
    }
}
