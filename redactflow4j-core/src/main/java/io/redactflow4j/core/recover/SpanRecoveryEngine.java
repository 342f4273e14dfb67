/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.recover;

import io.redactflow4j.core.api.model.*;
import io.redactflow4j.core.normalize.LabelVocabulary;
import io.redactflow4j.core.normalize.NormalizedText;
import io.redactflow4j.core.normalize.TypeNormalizer;
import io.redactflow4j.core.preset.ReconciliationConfig;
import java.util.*;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns the tagged values of a generative model back onto offsets of the original text.
 *
 * <p>Tags are processed in generation order against a consumption cursor that only moves
 * forward. For each tag the engine tries, in order:
 * <ol>
 *   <li>an exact match of the tagged value at or after the cursor;</li>
 *   <li>the same search on folded text (width, case, whitespace and punctuation removed),
 *       mapped back to original offsets;</li>
 *   <li>a window bounded by the generated left/right context located in the text.</li>
 * </ol>
 * A window match is accepted only when it is unique and its length lies within the configured
 * tolerance of the tagged value. Anything uncertain is discarded with a reason instead of
 * guessed.
 */
public final class SpanRecoveryEngine {
    private static final Logger log = LoggerFactory.getLogger(SpanRecoveryEngine.class);
    private static final double EPS = 1e-9;

    private final ReconciliationConfig config;
    private final TypeNormalizer normalizer;
    private final LabelVocabulary vocabulary;
    private final LevenshteinDistance levenshtein = LevenshteinDistance.getDefaultInstance();

    public SpanRecoveryEngine(ReconciliationConfig config, TypeNormalizer normalizer) {
        this.config = Objects.requireNonNull(config, "config");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.vocabulary = config.typeMapping().vocabularyFor(DetectorSource.GENERATIVE);
    }

    public RecoveryResult recover(String text, List<GenerativeTag> tags) {
        Objects.requireNonNull(text, "text");
        if (tags == null || tags.isEmpty()) return RecoveryResult.empty();

        List<EntityCandidate> recovered = new ArrayList<>();
        List<RecoveryOutcome> outcomes = new ArrayList<>(tags.size());
        List<Discard> discards = new ArrayList<>();
        int cursor = 0;

        for (GenerativeTag tag : tags) {
            if (tag == null) continue;
            CanonicalType type = normalizer.resolve(tag.rawTag(), vocabulary).orElse(CanonicalType.UNKNOWN);
            Attempt a = type.isKnown() ? locate(text, tag, type, cursor) : Attempt.fail(DiscardReason.TAG_UNRECOGNIZED);

            if (a.reason() != null) {
                outcomes.add(RecoveryOutcome.discarded(tag, a.reason()));
                discards.add(new Discard(
                        tag.taggedValue(), a.reason(), DetectorSource.GENERATIVE, "tag=" + tag.rawTag()));
                log.debug("Discarded {} '{}': {}", tag.rawTag(), tag.taggedValue(), a.reason());
                continue;
            }
            double score = config.generativeBaseScore() * a.quality();
            recovered.add(new EntityCandidate(
                    a.start(), a.end(), type, tag.rawTag(), score, DetectorSource.GENERATIVE));
            outcomes.add(RecoveryOutcome.recovered(tag, a.start(), a.end()));
            cursor = a.end();
        }
        return new RecoveryResult(recovered, outcomes, discards);
    }

    private Attempt locate(String text, GenerativeTag tag, CanonicalType type, int cursor) {
        if (tag.hasValue()) {
            String value = tag.taggedValue().strip();
            Span hit = findExact(text, value, cursor);
            if (hit == null) hit = findNormalized(text, value, cursor);
            if (hit != null) return Attempt.ok(hit.start(), hit.end(), 1.0);
        }
        return anchored(text, tag, type, cursor);
    }

    // ---- stage 1 & 2 ----

    private static Span findExact(String text, String needle, int from) {
        if (needle.isEmpty() || from >= text.length()) return null;
        int i = text.indexOf(needle, from);
        return i < 0 ? null : new Span(i, i + needle.length());
    }

    private static Span findNormalized(String text, String needle, int from) {
        String n = NormalizedText.normalize(needle);
        if (n.isEmpty() || from >= text.length()) return null;
        NormalizedText region = NormalizedText.of(text, from, text.length());
        int i = region.indexOf(n);
        if (i < 0) return null;
        return new Span(region.originStart(i), region.originEnd(i + n.length()));
    }

    private static Span findAnchor(String text, String anchor, int from) {
        Span s = findExact(text, anchor, from);
        return s != null ? s : findNormalized(text, anchor, from);
    }

    // ---- stage 3 ----

    private Attempt anchored(String text, GenerativeTag tag, CanonicalType type, int cursor) {
        String left = tail(tag.leftContext(), config.anchorLength());
        String right = head(tag.rightContext(), config.anchorLength());
        if (left.isEmpty() && right.isEmpty()) return Attempt.fail(DiscardReason.ANCHOR_MISSING);

        Span l = left.isEmpty() ? null : within(findAnchor(text, left, cursor), cursor);
        int rightFrom = l != null ? l.end() : cursor;
        Span r = right.isEmpty() ? null : within(findAnchor(text, right, rightFrom), rightFrom);
        if (l == null && r == null) return Attempt.fail(DiscardReason.ANCHOR_MISSING);

        // an empty left context means the tag directly follows the consumed region
        Integer lower = l != null ? Integer.valueOf(l.end()) : left.isEmpty() ? Integer.valueOf(cursor) : null;
        Integer upper = r != null ? Integer.valueOf(r.start()) : null;

        if (lower != null && upper != null) return between(text, tag, type, lower, upper);
        if (!tag.hasValue()) return Attempt.fail(DiscardReason.ANCHOR_MISSING);
        return lower != null ? afterAnchor(text, tag, type, lower) : beforeAnchor(text, tag, type, upper, cursor);
    }

    private Span within(Span anchor, int from) {
        if (anchor == null) return null;
        return anchor.start() - from > config.searchWindow() ? null : anchor;
    }

    /** Both sides bounded: the trimmed window is the only candidate. */
    private Attempt between(String text, GenerativeTag tag, CanonicalType type, int lower, int upper) {
        if (upper <= lower) return Attempt.fail(DiscardReason.NO_MATCH);
        Span w = trim(text, lower, upper);
        if (w == null) return Attempt.fail(DiscardReason.NO_MATCH);
        int len = w.length();
        if (len > config.maxSpanFor(type)) return Attempt.fail(DiscardReason.LENGTH_MISMATCH);
        if (!tag.hasValue()) return Attempt.ok(w.start(), w.end(), 1.0);

        String value = tag.taggedValue().strip();
        if (!withinTolerance(len, value.length())) return Attempt.fail(DiscardReason.LENGTH_MISMATCH);
        double sim = similarity(value, text.substring(w.start(), w.end()));
        return Attempt.ok(w.start(), w.end(), Math.max(0.5, sim));
    }

    private Attempt afterAnchor(String text, GenerativeTag tag, CanonicalType type, int lower) {
        int start = skipForward(text, lower, text.length());
        int limit = Math.min(text.length(), start + config.searchWindow());
        List<Span> spans = new ArrayList<>();
        String value = tag.taggedValue().strip();
        for (int len = minLength(value.length()); len <= maxLength(value.length()); len++) {
            if (start + len > limit) break;
            Span s = trim(text, start, start + len);
            if (s != null && !spans.contains(s)) spans.add(s);
        }
        return best(text, value, type, spans);
    }

    private Attempt beforeAnchor(String text, GenerativeTag tag, CanonicalType type, int upper, int cursor) {
        int end = skipBackward(text, cursor, upper);
        List<Span> spans = new ArrayList<>();
        String value = tag.taggedValue().strip();
        for (int len = minLength(value.length()); len <= maxLength(value.length()); len++) {
            if (end - len < cursor) break;
            Span s = trim(text, end - len, end);
            if (s != null && !spans.contains(s)) spans.add(s);
        }
        return best(text, value, type, spans);
    }

    /** Unique best window by similarity; ties are ambiguous. */
    private Attempt best(String text, String value, CanonicalType type, List<Span> spans) {
        if (spans.isEmpty()) return Attempt.fail(DiscardReason.NO_MATCH);
        double bestSim = -1;
        List<Span> top = new ArrayList<>();
        boolean anyInTolerance = false;
        for (Span s : spans) {
            if (!withinTolerance(s.length(), value.length()) || s.length() > config.maxSpanFor(type)) continue;
            anyInTolerance = true;
            double sim = similarity(value, text.substring(s.start(), s.end()));
            if (sim > bestSim + EPS) {
                bestSim = sim;
                top.clear();
                top.add(s);
            } else if (Math.abs(sim - bestSim) <= EPS) {
                top.add(s);
            }
        }
        if (!anyInTolerance) return Attempt.fail(DiscardReason.LENGTH_MISMATCH);
        if (bestSim + EPS < config.minSimilarity()) return Attempt.fail(DiscardReason.NO_MATCH);
        if (top.size() > 1) return Attempt.fail(DiscardReason.AMBIGUOUS_MATCH);
        Span s = top.get(0);
        return Attempt.ok(s.start(), s.end(), bestSim);
    }

    // ---- helpers ----

    double similarity(String a, String b) {
        String x = NormalizedText.normalize(a);
        String y = NormalizedText.normalize(b);
        int max = Math.max(x.length(), y.length());
        if (max == 0) return 0.0;
        return 1.0 - (double) levenshtein.apply(x, y) / max;
    }

    private boolean withinTolerance(int len, int valueLen) {
        double tol = config.lengthTolerance();
        return len + EPS >= valueLen * (1 - tol) && len - EPS <= valueLen * (1 + tol);
    }

    private int minLength(int valueLen) {
        return Math.max(1, (int) Math.ceil(valueLen * (1 - config.lengthTolerance()) - EPS));
    }

    private int maxLength(int valueLen) {
        return Math.max(1, (int) Math.floor(valueLen * (1 + config.lengthTolerance()) + EPS));
    }

    private static Span trim(String text, int start, int end) {
        int s = skipForward(text, start, end);
        int e = skipBackward(text, s, end);
        return e > s ? new Span(s, e) : null;
    }

    private static int skipForward(String text, int from, int to) {
        int i = from;
        while (i < to && NormalizedText.isSeparator(text.charAt(i))) i++;
        return i;
    }

    private static int skipBackward(String text, int floor, int to) {
        int i = to;
        while (i > floor && NormalizedText.isSeparator(text.charAt(i - 1))) i--;
        return i;
    }

    private static String tail(String context, int n) {
        String s = context.strip();
        return s.length() <= n ? s : s.substring(s.length() - n);
    }

    private static String head(String context, int n) {
        String s = context.strip();
        return s.length() <= n ? s : s.substring(0, n);
    }

    private record Span(int start, int end) {
        int length() {
            return end - start;
        }
    }

    private record Attempt(int start, int end, double quality, DiscardReason reason) {
        static Attempt ok(int start, int end, double quality) {
            return new Attempt(start, end, quality, null);
        }

        static Attempt fail(DiscardReason reason) {
            return new Attempt(-1, -1, 0.0, reason);
        }
    }
}
