/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.filter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Terms that must never be redacted (product names, company's own address, ...).
 *
 * @param terms      stored as given
 * @param normalized stored lower-cased with spaces removed
 */
public record AllowList(Set<String> terms, Set<String> normalized) {
    private static final Pattern ALIAS = Pattern.compile("/alias\\[([^\\]]+)]");
    private static final Pattern JS = Pattern.compile("/js\\[([^\\]]+)]");
    private static final Pattern SUFFIX = Pattern.compile("/(?:alias|js)\\[");

    public AllowList {
        terms = Set.copyOf(terms);
        normalized = Set.copyOf(normalized);
    }

    public static AllowList empty() {
        return new AllowList(Set.of(), Set.of());
    }

    public static AllowList of(Collection<String> in) {
        Set<String> t = new LinkedHashSet<>();
        Set<String> n = new HashSet<>();
        if (in != null) {
            for (String s : in) {
                if (s == null || s.isBlank()) continue;
                t.add(s.strip());
                n.add(normalizeTerm(s));
            }
        }
        return new AllowList(t, n);
    }

    public AllowList plus(Collection<String> more) {
        List<String> all = new ArrayList<>(terms);
        if (more != null) all.addAll(more);
        return of(all);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public boolean allows(String text) {
        if (text == null || terms.isEmpty()) return false;
        return terms.contains(text.strip()) || normalized.contains(normalizeTerm(text));
    }

    public static String normalizeTerm(String s) {
        return s.toLowerCase(Locale.ROOT).strip().replace(" ", "").replace("\u3000", "");
    }

    /**
     * Reads a dictionary file: one term per line, optionally {@code term/alias[a|b]} or
     * {@code term/js[x]}; blank lines and {@code #} comments are skipped. A missing file yields
     * no terms.
     */
    public static List<String> readDictionary(Path path) {
        if (path == null || !Files.exists(path)) return List.of();
        try {
            return parseDictionary(Files.readAllLines(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read allow-list dictionary " + path, e);
        }
    }

    public static List<String> parseDictionary(List<String> lines) {
        Set<String> out = new LinkedHashSet<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String main = SUFFIX.split(line, 2)[0].strip();
            if (!main.isEmpty()) out.add(main);
            addGroup(ALIAS.matcher(line), out);
            addGroup(JS.matcher(line), out);
        }
        return List.copyOf(out);
    }

    private static void addGroup(Matcher m, Set<String> out) {
        if (!m.find()) return;
        for (String a : m.group(1).split("\\|")) {
            if (!a.isBlank()) out.add(a.strip());
        }
    }
}
