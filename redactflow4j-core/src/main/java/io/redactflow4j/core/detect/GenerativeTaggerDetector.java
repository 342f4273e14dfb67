/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.model.GenerativeTag;
import io.redactflow4j.core.recover.GenerativeOutputParser;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/** Generative detector: rewrites the text with a model and parses the inline tags back out. */
public final class GenerativeTaggerDetector extends ModelBackedDetector<TextGenerator> implements GenerativeDetector {

    private final GenerativeOutputParser parser;

    public GenerativeTaggerDetector(String name, Supplier<? extends TextGenerator> loader, GenerativeOutputParser parser) {
        super(name, loader);
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public List<GenerativeTag> tag(String text) {
        if (text == null || text.isBlank()) return List.of();
        String generated = model().generate(text);
        if (generated == null || generated.isEmpty()) return List.of();
        return parser.parse(generated);
    }
}
