/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.filter;

import static org.assertj.core.api.Assertions.assertThat;

import io.redactflow4j.core.api.model.*;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AllowListTest {

    @Test
    @DisplayName("matches ignoring case and inner spaces")
    void allows() {
        AllowList list = AllowList.of(List.of("Acme Corp", "東京 タワー"));

        assertThat(list.allows("acme corp")).isTrue();
        assertThat(list.allows("AcmeCorp")).isTrue();
        assertThat(list.allows("東京タワー")).isTrue();
        assertThat(list.allows("Acme")).isFalse();
        assertThat(AllowList.empty().allows("anything")).isFalse();
    }

    @Test
    @DisplayName("parses aliases, reading hints and comments")
    void parsesDictionary() {
        List<String> terms = AllowList.parseDictionary(List.of(
                "# company names",
                "",
                "Acme/alias[ACME|アクメ]",
                "渋谷/js[しぶや]",
                "  Plain  "));

        assertThat(terms).containsExactly("Acme", "ACME", "アクメ", "渋谷", "しぶや", "Plain");
    }

    @Test
    @DisplayName("reads a dictionary file; a missing file yields nothing")
    void readsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("allow.txt");
        Files.write(file, List.of("Acme", "# skip", "Globex/alias[GLX]"), StandardCharsets.UTF_8);

        assertThat(AllowList.readDictionary(file)).containsExactly("Acme", "Globex", "GLX");
        assertThat(AllowList.readDictionary(dir.resolve("missing.txt"))).isEmpty();
    }

    @Test
    @DisplayName("filter drops allow-listed candidates")
    void filter() {
        String text = "Acme hired Bob";
        List<Discard> discards = new ArrayList<>();
        var acme = new EntityCandidate(0, 4, CanonicalType.ORGANIZATION, "ORG", 0.9, DetectorSource.NER);
        var bob = new EntityCandidate(11, 14, CanonicalType.PERSON, "PER", 0.9, DetectorSource.NER);

        var out = new AllowListFilter(AllowList.of(List.of("ACME"))).filter(text, List.of(acme, bob), discards);

        assertThat(out).containsExactly(bob);
        assertThat(discards).singleElement().satisfies(d -> {
            assertThat(d.reason()).isEqualTo(DiscardReason.ALLOW_LISTED);
            assertThat(d.stage()).isEqualTo(DiscardStage.ALLOW_LIST);
        });
    }
}
