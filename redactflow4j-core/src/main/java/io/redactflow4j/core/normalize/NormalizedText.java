/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;

/**
 * Folded view of a text region (NFKC, lower case, whitespace and punctuation removed) that
 * remembers, for every folded char, the original offsets it came from.
 */
public final class NormalizedText {
    private final String value;
    private final int[] originStart;
    private final int[] originEnd;

    private NormalizedText(String value, int[] originStart, int[] originEnd) {
        this.value = value;
        this.originStart = originStart;
        this.originEnd = originEnd;
    }

    public static NormalizedText of(String text, int from, int to) {
        StringBuilder sb = new StringBuilder(Math.max(0, to - from));
        int[] starts = new int[Math.max(16, to - from)];
        int[] ends = new int[starts.length];
        int n = 0;
        int i = from;
        while (i < to) {
            int cp = text.codePointAt(i);
            int next = i + Character.charCount(cp);
            String folded = fold(cp);
            for (int k = 0; k < folded.length(); k++) {
                char c = folded.charAt(k);
                if (isSeparator(c)) continue;
                if (n == starts.length) {
                    starts = Arrays.copyOf(starts, n * 2);
                    ends = Arrays.copyOf(ends, n * 2);
                }
                sb.append(c);
                starts[n] = i;
                ends[n] = next;
                n++;
            }
            i = next;
        }
        return new NormalizedText(sb.toString(), Arrays.copyOf(starts, n), Arrays.copyOf(ends, n));
    }

    public static String normalize(String s) {
        return s == null ? "" : of(s, 0, s.length()).value;
    }

    public String value() {
        return value;
    }

    public int indexOf(String normalizedNeedle) {
        return normalizedNeedle.isEmpty() ? -1 : value.indexOf(normalizedNeedle);
    }

    /** Original offset of folded char {@code i}. */
    public int originStart(int i) {
        return originStart[i];
    }

    /** Original exclusive end offset for the folded range ending (exclusive) at {@code i}. */
    public int originEnd(int iExclusive) {
        return originEnd[iExclusive - 1];
    }

    public static boolean isSeparator(int c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || isPunctuation(c);
    }

    public static boolean isPunctuation(int c) {
        switch (Character.getType(c)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
                return true;
            default:
                return false;
        }
    }

    private static String fold(int cp) {
        return Normalizer.normalize(new String(Character.toChars(cp)), Normalizer.Form.NFKC)
                .toLowerCase(Locale.ROOT);
    }
}
