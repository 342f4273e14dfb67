/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.recover;

import io.redactflow4j.core.api.model.GenerativeTag;
import io.redactflow4j.core.normalize.BuiltInVocabularies;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits the rewritten text of a generative masking model into {@link GenerativeTag}s.
 *
 * <p>Understands {@code <tag>value</tag>} as well as bare {@code <tag>} (the value replaced by
 * the tag). The literal text around each tag becomes its left/right context. Unknown tag names
 * stay literal text.
 */
public final class GenerativeOutputParser {
    /** Line break placeholder the model is prompted with. */
    public static final String LINE_BREAK = "<LB>";

    private final Pattern tagPattern;

    public GenerativeOutputParser(Collection<String> tagNames) {
        Set<String> names = new LinkedHashSet<>();
        for (String t : tagNames) {
            String n = t.strip();
            if (n.startsWith("<") && n.endsWith(">")) n = n.substring(1, n.length() - 1);
            if (!n.isEmpty()) names.add(n);
        }
        if (names.isEmpty()) throw new IllegalArgumentException("at least one tag name is required");
        String alt = names.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        this.tagPattern = Pattern.compile("<(" + alt + ")>(?:([^<]*)</\\1>)?");
    }

    /** Parser for the tag set of {@link BuiltInVocabularies#PII_MASKER}. */
    public static GenerativeOutputParser defaults() {
        return new GenerativeOutputParser(BuiltInVocabularies.PII_MASKER.table().keySet());
    }

    public List<GenerativeTag> parse(String generated) {
        if (generated == null || generated.isEmpty()) return List.of();
        String out = generated.replace(LINE_BREAK, "\n");

        List<int[]> bounds = new ArrayList<>();
        List<String[]> found = new ArrayList<>();
        Matcher m = tagPattern.matcher(out);
        while (m.find()) {
            bounds.add(new int[] {m.start(), m.end()});
            String value = m.group(2) == null ? "" : m.group(2);
            found.add(new String[] {value, "<" + m.group(1) + ">"});
        }

        List<GenerativeTag> tags = new ArrayList<>(found.size());
        for (int i = 0; i < found.size(); i++) {
            int leftFrom = i == 0 ? 0 : bounds.get(i - 1)[1];
            int rightTo = i + 1 < bounds.size() ? bounds.get(i + 1)[0] : out.length();
            String left = out.substring(leftFrom, bounds.get(i)[0]);
            String right = out.substring(bounds.get(i)[1], rightTo);
            tags.add(new GenerativeTag(found.get(i)[0], found.get(i)[1], left, right));
        }
        return List.copyOf(tags);
    }
}
