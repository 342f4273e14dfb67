/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/**
 * One tagged value from a generative model, in generation order. {@code taggedValue} is empty
 * when the model replaced the value by a bare tag. The contexts are the literal generated text
 * right before and after the tag and serve as alignment anchors.
 */
public record GenerativeTag(String taggedValue, String rawTag, String leftContext, String rightContext) {

    public GenerativeTag {
        taggedValue = taggedValue == null ? "" : taggedValue;
        rawTag = rawTag == null ? "" : rawTag;
        leftContext = leftContext == null ? "" : leftContext;
        rightContext = rightContext == null ? "" : rightContext;
    }

    public static GenerativeTag of(String taggedValue, String rawTag) {
        return new GenerativeTag(taggedValue, rawTag, "", "");
    }

    public boolean hasValue() {
        return !taggedValue.isBlank();
    }
}
